package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.operator.Operator;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.syntax.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shrinks an operator set to its dominance-minimal subset.
 * <p>
 * An operator is dropped when it lies in the transitive dominated set of
 * another selected operator. The result is ordered by catalog declaration
 * order, so reduction is deterministic and idempotent.
 */
public final class SubsumptionReducer {

    private static final Logger log = LoggerFactory.getLogger(SubsumptionReducer.class);

    private final OperatorCatalog catalog;

    public SubsumptionReducer(OperatorCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Dominance-minimal subset of {@code candidates}.
     */
    public Set<String> reduce(Collection<String> candidates) {
        Set<String> selected = new HashSet<>(candidates);
        Set<String> result = new LinkedHashSet<>();
        for (Operator op : catalog.operators()) {
            if (selected.contains(op.id()) && dominator(op.id(), selected).isEmpty()) {
                result.add(op.id());
            }
        }
        return result;
    }

    /**
     * Reduce sites expression by expression: at each targeted expression only
     * the sites of non-dominated operators are kept.
     */
    public Result apply(List<MutationSite> sites) {
        Map<String, List<MutationSite>> byTarget = new LinkedHashMap<>();
        for (MutationSite site : sites) {
            byTarget.computeIfAbsent(targetKey(site.formId(), site.target()), k -> new ArrayList<>()).add(site);
        }

        Set<MutationSite> dropped = new HashSet<>();
        List<SubsumedSite> subsumed = new ArrayList<>();
        for (List<MutationSite> group : byTarget.values()) {
            Set<String> present = new HashSet<>();
            for (MutationSite site : group) {
                present.add(site.operatorId());
            }
            for (MutationSite site : group) {
                Optional<String> dominator = dominator(site.operatorId(), present);
                if (dominator.isPresent()) {
                    dropped.add(site);
                    subsumed.add(new SubsumedSite(site, dominator.get()));
                }
            }
        }

        List<MutationSite> retained = sites.stream().filter(s -> !dropped.contains(s)).toList();
        if (!subsumed.isEmpty()) {
            log.debug("Subsumption dropped {} of {} sites", subsumed.size(), sites.size());
        }
        return new Result(retained, subsumed);
    }

    /**
     * First operator of {@code selected} (declaration order) that dominates {@code id}.
     */
    private Optional<String> dominator(String id, Set<String> selected) {
        for (Operator op : catalog.operators()) {
            if (!op.id().equals(id) && selected.contains(op.id()) && catalog.dominatedBy(op.id()).contains(id)) {
                return Optional.of(op.id());
            }
        }
        return Optional.empty();
    }

    private static String targetKey(String formId, Coordinate target) {
        return formId + "@" + target;
    }

    public record Result(List<MutationSite> retained, List<SubsumedSite> subsumed) {
    }
}
