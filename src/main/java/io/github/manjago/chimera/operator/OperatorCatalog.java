package io.github.manjago.chimera.operator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, validated set of operators.
 * <p>
 * Construction checks that ids are unique, that every dominance edge points
 * to an operator of the same family and that each family's dominance graph is
 * acyclic. Transitive dominated sets and presets are computed once.
 */
public final class OperatorCatalog {

    private static final Logger log = LoggerFactory.getLogger(OperatorCatalog.class);

    private static final OperatorCatalog BUILTIN = new OperatorCatalog(BuiltinOperators.all());

    private final List<Operator> operators;
    private final Map<String, Operator> byId;
    private final Map<String, Set<String>> dominatedClosure;
    private final Set<String> dominatedAnywhere;
    private final Map<Preset, List<Operator>> presets;

    public OperatorCatalog(List<Operator> operators) {
        this.operators = List.copyOf(operators);
        this.byId = indexById(this.operators);
        validateEdges();
        validateAcyclic();
        this.dominatedClosure = computeClosure();
        this.dominatedAnywhere = new HashSet<>();
        for (Operator op : this.operators) {
            dominatedAnywhere.addAll(op.dominates());
        }
        this.presets = computePresets();
        log.debug("Operator catalog: {} operators in {} families", this.operators.size(), families().size());
    }

    /**
     * Catalog of the built-in operators.
     */
    public static OperatorCatalog builtin() {
        return BUILTIN;
    }

    /** All operators in declaration order */
    public List<Operator> operators() {
        return operators;
    }

    public Optional<Operator> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Operator get(String id) {
        Operator op = byId.get(id);
        if (op == null) {
            throw new IllegalArgumentException("Unknown operator: " + id);
        }
        return op;
    }

    public List<Operator> preset(Preset preset) {
        return presets.get(preset);
    }

    /**
     * Position of an operator in declaration order; used to order sites that
     * share a node.
     */
    public int declarationIndex(String id) {
        return operators.indexOf(get(id));
    }

    public Set<String> families() {
        Set<String> families = new LinkedHashSet<>();
        for (Operator op : operators) {
            families.add(op.family());
        }
        return families;
    }

    public List<Operator> family(String family) {
        return operators.stream().filter(op -> op.family().equals(family)).toList();
    }

    /**
     * Every operator transitively dominated by {@code id}.
     */
    public Set<String> dominatedBy(String id) {
        Set<String> closure = dominatedClosure.get(id);
        if (closure == null) {
            throw new IllegalArgumentException("Unknown operator: " + id);
        }
        return closure;
    }

    /**
     * True if some operator of the catalog dominates {@code id}.
     */
    public boolean isDominated(String id) {
        return dominatedAnywhere.contains(id);
    }

    // ========== Construction ==========

    private static Map<String, Operator> indexById(List<Operator> operators) {
        Map<String, Operator> index = new LinkedHashMap<>();
        for (Operator op : operators) {
            if (index.put(op.id(), op) != null) {
                throw new IllegalStateException("Duplicate operator id: " + op.id());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private void validateEdges() {
        for (Operator op : operators) {
            for (String target : op.dominates()) {
                Operator dominated = byId.get(target);
                if (dominated == null) {
                    throw new IllegalStateException(op.id() + " dominates unknown operator " + target);
                }
                if (!dominated.family().equals(op.family())) {
                    throw new IllegalStateException(String.format(
                            "Dominance edge %s -> %s crosses families (%s, %s)",
                            op.id(), target, op.family(), dominated.family()));
                }
            }
        }
    }

    private void validateAcyclic() {
        Map<String, Integer> state = new HashMap<>();  // 1 = on stack, 2 = done
        for (Operator op : operators) {
            visit(op.id(), state, new ArrayList<>());
        }
    }

    private void visit(String id, Map<String, Integer> state, List<String> path) {
        Integer mark = state.get(id);
        if (mark != null && mark == 2) {
            return;
        }
        path.add(id);
        if (mark != null) {
            throw new IllegalStateException("Dominance cycle in family "
                    + byId.get(id).family() + ": " + String.join(" -> ", path));
        }
        state.put(id, 1);
        for (String next : byId.get(id).dominates()) {
            visit(next, state, path);
        }
        state.put(id, 2);
        path.remove(path.size() - 1);
    }

    private Map<String, Set<String>> computeClosure() {
        Map<String, Set<String>> closure = new HashMap<>();
        for (Operator op : operators) {
            closureOf(op.id(), closure);
        }
        return Collections.unmodifiableMap(closure);
    }

    private Set<String> closureOf(String id, Map<String, Set<String>> memo) {
        Set<String> known = memo.get(id);
        if (known != null) {
            return known;
        }
        Set<String> result = new HashSet<>();
        for (String next : byId.get(id).dominates()) {
            result.add(next);
            result.addAll(closureOf(next, memo));
        }
        Set<String> frozen = Set.copyOf(result);
        memo.put(id, frozen);
        return frozen;
    }

    private Map<Preset, List<Operator>> computePresets() {
        Map<Preset, List<Operator>> result = new EnumMap<>(Preset.class);
        result.put(Preset.MINIMAL, operators.stream()
                .filter(op -> !dominatedAnywhere.contains(op.id()) && op.hardness() >= 3)
                .toList());
        result.put(Preset.STANDARD, operators.stream()
                .filter(op -> op.category() != OperatorCategory.CONSTANT
                        && op.category() != OperatorCategory.REMOVAL)
                .toList());
        result.put(Preset.THOROUGH, operators);
        return Collections.unmodifiableMap(result);
    }
}
