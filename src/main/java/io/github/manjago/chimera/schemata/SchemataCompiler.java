package io.github.manjago.chimera.schemata;

import io.github.manjago.chimera.operator.MatchContext;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.syntax.CollectionNode;
import io.github.manjago.chimera.syntax.Coordinate;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.LocationNotFoundException;
import io.github.manjago.chimera.syntax.Node;
import io.github.manjago.chimera.syntax.SourceFile;
import io.github.manjago.chimera.syntax.SyntaxParseException;
import io.github.manjago.chimera.syntax.SyntaxParser;
import io.github.manjago.chimera.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Embeds many mutants of one file into a single rewrite.
 * <p>
 * Every targeted expression becomes
 * {@code (case <selector> id1 branch1 id2 branch2 ... original)}, so the
 * compiled file behaves as the original until a mutant id is selected. The
 * target of a call-head site is the whole call, since a macro or special form
 * in head position cannot be wrapped. Targets nested inside another target of
 * the same batch are deferred to a later batch.
 */
public final class SchemataCompiler {

    private static final Logger log = LoggerFactory.getLogger(SchemataCompiler.class);

    public static final String DEFAULT_SELECTOR = "(chimera.runtime/active-mutant)";

    /** Parents whose arguments are rewritten or must stay literal, so a case wrapper breaks them */
    private static final Set<String> OPAQUE_PARENTS = Set.of(
            "->", "->>", "some->", "some->>", "cond->", "cond->>", "as->", "doto", "..",
            "case", "ns", "letfn");

    /** Forms whose direct children are names, signatures and method bodies rather than expressions */
    private static final Set<String> DEFINITION_BODIES = Set.of(
            "defrecord", "deftype", "definterface", "defprotocol", "reify", "proxy",
            "extend-type", "extend-protocol");

    /** Clauses that {@code try} recognises only by their literal head */
    private static final Set<String> TRY_CLAUSES = Set.of("catch", "finally");

    private final String selector;

    public SchemataCompiler(String selector) {
        this.selector = selector;
    }

    public SchemataCompiler() {
        this(DEFAULT_SELECTOR);
    }

    public String getSelector() {
        return selector;
    }

    // ========== Planning ==========

    /**
     * Split sites into batches of at most {@code batchSize} mutants per file.
     * Sites that cannot be wrapped are returned as fallback, to be applied one
     * at a time.
     *
     * @param forms forms the sites were scanned from, by id
     */
    public Plan plan(List<MutationSite> sites, int batchSize, Map<String, Form> forms) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
        }
        Map<Path, List<MutationSite>> byFile = new LinkedHashMap<>();
        List<MutationSite> fallback = new ArrayList<>();
        for (MutationSite site : sites) {
            if (isWrappable(site, forms)) {
                byFile.computeIfAbsent(site.file(), k -> new ArrayList<>()).add(site);
            } else {
                fallback.add(site);
            }
        }

        List<SchemaBatch> batches = new ArrayList<>();
        for (Map.Entry<Path, List<MutationSite>> entry : byFile.entrySet()) {
            List<MutationSite> pending = entry.getValue();
            while (!pending.isEmpty()) {
                List<MutationSite> batch = new ArrayList<>();
                List<MutationSite> deferred = new ArrayList<>();
                for (MutationSite site : pending) {
                    if (batch.size() >= batchSize || nestsWithAny(site, batch)) {
                        deferred.add(site);
                    } else {
                        batch.add(site);
                    }
                }
                batches.add(new SchemaBatch(entry.getKey(), batch));
                pending = deferred;
            }
        }
        log.debug("Schemata plan: {} batches, {} sites applied individually", batches.size(), fallback.size());
        return new Plan(batches, fallback);
    }

    /**
     * True if the site's target can be replaced by a case expression: it must
     * sit in an evaluated position whose parent does not inspect its
     * arguments' syntax.
     */
    boolean isWrappable(MutationSite site, Map<String, Form> forms) {
        Form form = forms.get(site.formId());
        if (site.file() == null || form == null) {
            return false;
        }
        Coordinate target = site.target();
        if (target.isRoot()) {
            return true;
        }
        try {
            Node parent = SyntaxTree.decode(form.root(), target.parent());
            Node node = SyntaxTree.decode(form.root(), target);
            return isExpressionSlot(node, parent);
        } catch (LocationNotFoundException e) {
            log.warn("Site {} does not resolve: {}", site.id(), e.getMessage());
            return false;
        }
    }

    private static boolean isExpressionSlot(Node node, Node parent) {
        if (!(parent instanceof CollectionNode c)) {
            return true;
        }
        String head = c.headSymbol().orElse(null);
        if (head == null) {
            return true;
        }
        if (OPAQUE_PARENTS.contains(head) || DEFINITION_BODIES.contains(head)) {
            return false;
        }
        int ordinal = indexOf(parent, node);
        if (MatchContext.isDocstring(node, parent, ordinal)) {
            return false;
        }
        if (head.startsWith("def") && ordinal == 1) {
            return false;
        }
        if (head.equals("try") && node instanceof CollectionNode clause
                && clause.headSymbol().filter(TRY_CLAUSES::contains).isPresent()) {
            return false;
        }
        // exception class and binding of (catch Class e ...)
        return !(head.equals("catch") && ordinal <= 2);
    }

    private static int indexOf(Node parent, Node child) {
        List<Node> children = parent.children();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    private static boolean nestsWithAny(MutationSite site, List<MutationSite> batch) {
        Coordinate target = site.target();
        for (MutationSite other : batch) {
            if (!other.formId().equals(site.formId())) {
                continue;
            }
            Coordinate otherTarget = other.target();
            if (!otherTarget.equals(target) && (otherTarget.isPrefixOf(target) || target.isPrefixOf(otherTarget))) {
                return true;
            }
        }
        return false;
    }

    // ========== Compilation ==========

    /**
     * Rewrite {@code originalText} so that every site of the batch is selectable.
     * Mutant ids are the sites' scan ordinals.
     */
    public SchemaBundle compile(SchemaBatch batch, String originalText)
            throws SyntaxParseException, LocationNotFoundException {
        SourceFile source = SyntaxParser.parse(batch.file(), originalText);

        Map<String, Map<Coordinate, List<MutationSite>>> byForm = new LinkedHashMap<>();
        Map<Integer, MutationSite> mutants = new LinkedHashMap<>();
        for (MutationSite site : batch.sites()) {
            byForm.computeIfAbsent(site.formId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(site.target(), k -> new ArrayList<>())
                    .add(site);
            mutants.put(site.ordinal(), site);
        }

        for (Map.Entry<String, Map<Coordinate, List<MutationSite>>> formEntry : byForm.entrySet()) {
            Form form = source.form(formEntry.getKey()).orElseThrow(() -> new LocationNotFoundException(
                    Coordinate.ROOT, "form " + formEntry.getKey() + " not in " + batch.file()));

            IdentityHashMap<Node, Node> replacements = new IdentityHashMap<>();
            for (Map.Entry<Coordinate, List<MutationSite>> targetEntry : formEntry.getValue().entrySet()) {
                Node target = SyntaxTree.decode(form.root(), targetEntry.getKey());
                replacements.put(target, SyntaxParser.parseNode(caseText(form, target, targetEntry.getValue())));
            }
            source = source.withRoot(form.index(), SyntaxTree.replaceAll(form.root(), replacements));
        }

        return new SchemaBundle(batch.file(), originalText, source.render(), mutants);
    }

    private String caseText(Form form, Node target, List<MutationSite> sites) throws LocationNotFoundException {
        StringBuilder sb = new StringBuilder("(case ").append(selector);
        for (MutationSite site : sites) {
            Node node = SyntaxTree.decode(form.root(), site.coordinate());
            if (!node.text().equals(site.original())) {
                throw new LocationNotFoundException(site.coordinate(), "node of " + site.id() + " changed");
            }
            sb.append(' ').append(site.ordinal()).append(' ').append(branch(target, site));
        }
        return sb.append(' ').append(target.text()).append(')').toString();
    }

    private static String branch(Node target, MutationSite site) {
        if (!site.callHead()) {
            return site.replacement();
        }
        CollectionNode call = (CollectionNode) target;
        Node head = call.children().get(0);
        try {
            Node newHead = SyntaxParser.parseNode(site.replacement()).withPrefix(head.prefix());
            return call.withChild(0, newHead).text();
        } catch (SyntaxParseException e) {
            throw new IllegalArgumentException("Replacement is not a single form: " + site.replacement(), e);
        }
    }

    /**
     * @param fallback sites to apply individually
     */
    public record Plan(List<SchemaBatch> batches, List<MutationSite> fallback) {
    }
}
