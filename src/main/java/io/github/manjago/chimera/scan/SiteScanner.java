package io.github.manjago.chimera.scan;

import io.github.manjago.chimera.operator.MatchContext;
import io.github.manjago.chimera.operator.Operator;
import io.github.manjago.chimera.syntax.CollectionNode;
import io.github.manjago.chimera.syntax.Cursor;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.LocationNotFoundException;
import io.github.manjago.chimera.syntax.Node;
import io.github.manjago.chimera.syntax.QuotedNode;
import io.github.manjago.chimera.syntax.Segment;
import io.github.manjago.chimera.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Walks forms depth-first and tests every unquoted node against every
 * operator.
 * <p>
 * Output order is tree order, then operator declaration order. Scanning is
 * pure, so forms are scanned in parallel and concatenated in input order
 * before ordinals are assigned.
 */
public final class SiteScanner {

    private static final Logger log = LoggerFactory.getLogger(SiteScanner.class);

    /** Calls whose arguments are data or dead code */
    private static final Set<String> LITERAL_CALLS = Set.of("quote", "comment");

    private final List<Operator> operators;

    public SiteScanner(List<Operator> operators) {
        this.operators = List.copyOf(operators);
    }

    /**
     * Scan forms in order; ordinals run across the whole result.
     */
    public List<MutationSite> scan(List<Form> forms) {
        List<List<MutationSite>> perForm = forms.parallelStream()
                .map(this::scanForm)
                .toList();

        List<MutationSite> result = new ArrayList<>();
        for (List<MutationSite> sites : perForm) {
            for (MutationSite site : sites) {
                result.add(site.withOrdinal(result.size()));
            }
        }
        log.debug("Scanned {} forms: {} sites", forms.size(), result.size());
        return result;
    }

    /**
     * Sites of one form, numbered from zero.
     */
    public List<MutationSite> scanForm(Form form) {
        List<MutationSite> sites = new ArrayList<>();
        visit(form, Cursor.root(form.root()), 0, sites);
        return sites;
    }

    private void visit(Form form, Cursor cursor, int quoteDepth, List<MutationSite> out) {
        Node node = cursor.node();

        if (node instanceof CollectionNode c && c.headSymbol().filter(LITERAL_CALLS::contains).isPresent()) {
            return;
        }
        if (quoteDepth == 0) {
            match(form, cursor, out);
        }

        List<Node> children = node.children();
        if (children.isEmpty()) {
            return;
        }
        int childDepth = node instanceof QuotedNode q ? q.style().nextDepth(quoteDepth) : quoteDepth;
        List<Segment> segments = SyntaxTree.childSegments(node);
        for (int i = 0; i < children.size(); i++) {
            if (SyntaxTree.isShadowed(segments, i)) {
                log.warn("Skipping ambiguous location {}/{} in {}: digest shared with an earlier sibling",
                        cursor.coordinate(), segments.get(i), form.id());
                continue;
            }
            visit(form, cursor.child(i, segments.get(i)), childDepth, out);
        }
    }

    private void match(Form form, Cursor cursor, List<MutationSite> out) {
        MatchContext context = MatchContext.of(cursor);
        for (Operator op : operators) {
            if (!op.matches(context)) {
                continue;
            }
            String replacement = op.generate(context);
            String original = cursor.node().text();
            if (replacement.equals(original)) {
                continue;
            }
            out.add(new MutationSite(form.id(), cursor.coordinate(), op.id(), replacement,
                    form.file(), cursor.node().line(), original, out.size(), context.isCallHead()));
        }
    }

    /**
     * Rebuild the match context of a site from the form it was scanned from.
     */
    public static MatchContext contextOf(Form form, MutationSite site) throws LocationNotFoundException {
        return MatchContext.of(SyntaxTree.locate(form.root(), site.coordinate()));
    }
}
