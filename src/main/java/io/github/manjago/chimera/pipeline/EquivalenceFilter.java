package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.operator.EquivalenceRule;
import io.github.manjago.chimera.operator.MatchContext;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.LocationNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drops sites whose operator's equivalence rule fires on the site's
 * immediate syntactic context. Runtime-only equivalences are not detected.
 */
public final class EquivalenceFilter {

    private static final Logger log = LoggerFactory.getLogger(EquivalenceFilter.class);

    private final OperatorCatalog catalog;

    public EquivalenceFilter(OperatorCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @param forms forms the sites were scanned from, by id
     */
    public Result apply(List<MutationSite> sites, Map<String, Form> forms) {
        List<MutationSite> retained = new ArrayList<>(sites.size());
        List<EquivalentSite> equivalent = new ArrayList<>();

        for (MutationSite site : sites) {
            EquivalenceRule rule = catalog.get(site.operatorId()).equivalence();
            if (rule == null) {
                retained.add(site);
                continue;
            }
            if (rule.holds(context(site, forms))) {
                log.debug("Provably equivalent: {} ({})", site.id(), rule.reason());
                equivalent.add(new EquivalentSite(site, rule.reason()));
            } else {
                retained.add(site);
            }
        }
        return new Result(retained, equivalent);
    }

    private static MatchContext context(MutationSite site, Map<String, Form> forms) {
        Form form = forms.get(site.formId());
        if (form == null) {
            throw new IllegalArgumentException("Site from unknown form: " + site.id());
        }
        try {
            return SiteScanner.contextOf(form, site);
        } catch (LocationNotFoundException e) {
            throw new IllegalStateException("Site does not resolve in the snapshot it was scanned from: " + site.id(), e);
        }
    }

    public record Result(List<MutationSite> retained, List<EquivalentSite> equivalent) {
    }
}
