package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.operator.MatchContext;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.LocationNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups sites and picks one representative per group.
 * <p>
 * The representative is the member with the highest operator hardness; ties
 * go to the earliest site in scan order. A killed representative is reported
 * for weaker members that never ran: clustering trades precision for speed.
 */
public final class ClusterSelector {

    private static final Logger log = LoggerFactory.getLogger(ClusterSelector.class);

    private final ClusterKey key;
    private final int prefixDepth;
    private final OperatorCatalog catalog;

    public ClusterSelector(ClusterKey key, int prefixDepth, OperatorCatalog catalog) {
        if (prefixDepth < 0) {
            throw new IllegalArgumentException("prefixDepth must be non-negative: " + prefixDepth);
        }
        this.key = key;
        this.prefixDepth = prefixDepth;
        this.catalog = catalog;
    }

    /**
     * Clusters in order of their first member.
     *
     * @param forms forms the sites were scanned from, by id (needed for parent shape keys)
     */
    public List<Cluster> select(List<MutationSite> sites, Map<String, Form> forms) {
        Map<String, List<MutationSite>> groups = new LinkedHashMap<>();
        for (MutationSite site : sites) {
            groups.computeIfAbsent(keyOf(site, forms), k -> new ArrayList<>()).add(site);
        }

        Comparator<MutationSite> strongestFirst = Comparator
                .comparingInt((MutationSite s) -> catalog.get(s.operatorId()).hardness()).reversed()
                .thenComparingInt(MutationSite::ordinal);

        List<Cluster> clusters = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<MutationSite>> group : groups.entrySet()) {
            List<MutationSite> members = group.getValue();
            MutationSite representative = members.stream().min(strongestFirst).orElseThrow();
            clusters.add(new Cluster(group.getKey(), members, representative));
        }
        log.debug("Clustered {} sites into {} clusters by {}", sites.size(), clusters.size(), key);
        return clusters;
    }

    String keyOf(MutationSite site, Map<String, Form> forms) {
        return switch (key) {
            case NONE -> site.id();
            case OPERATOR -> site.operatorId();
            case FORM_COORDINATE_PREFIX -> site.file() + "|" + site.formId() + "|" + site.coordinate().prefix(prefixDepth);
            case CATEGORY_PARENT_SHAPE -> catalog.get(site.operatorId()).category() + "|" + parentShape(site, forms);
        };
    }

    private static String parentShape(MutationSite site, Map<String, Form> forms) {
        Form form = forms.get(site.formId());
        if (form == null) {
            throw new IllegalArgumentException("Site from unknown form: " + site.id());
        }
        MatchContext context;
        try {
            context = SiteScanner.contextOf(form, site);
        } catch (LocationNotFoundException e) {
            throw new IllegalStateException("Site does not resolve in the snapshot it was scanned from: " + site.id(), e);
        }
        if (context.parent() == null) {
            return "root";
        }
        return context.parent().kind() + ":" + context.parentHead().orElse("-");
    }
}
