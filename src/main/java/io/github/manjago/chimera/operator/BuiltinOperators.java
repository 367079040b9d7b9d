package io.github.manjago.chimera.operator;

import io.github.manjago.chimera.syntax.CollectionNode;
import io.github.manjago.chimera.syntax.Delimiter;
import io.github.manjago.chimera.syntax.Node;
import io.github.manjago.chimera.syntax.Token;
import io.github.manjago.chimera.syntax.TokenType;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The built-in operator set, in declaration order.
 * <p>
 * Relational dominance edges follow the relational-operator subsumption
 * hierarchy: for {@code a < b} the mutants {@code <=}, {@code not=} and
 * {@code false} are each killed only by a subset of the tests that kill the
 * others ({@code >}, {@code >=}, {@code =}, {@code true}).
 */
final class BuiltinOperators {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+N?");

    // ========== Equivalence rules ==========

    static final EquivalenceRule MULTIPLY_DIVIDE_BY_ONE = new EquivalenceRule(
            "multiply/divide by one", ctx -> trailingArgumentsAre(ctx, 1));

    static final EquivalenceRule ADD_SUBTRACT_ZERO = new EquivalenceRule(
            "add/subtract zero", ctx -> trailingArgumentsAre(ctx, 0));

    static final EquivalenceRule SINGLE_ARGUMENT_LOGIC = new EquivalenceRule(
            "and/or of a single argument", ctx -> ctx.callArguments().size() == 1);

    static final EquivalenceRule SINGLE_ARGUMENT_EXTREMUM = new EquivalenceRule(
            "max/min of a single argument", ctx -> ctx.callArguments().size() == 1);

    static final EquivalenceRule DOCSTRING = new EquivalenceRule(
            "docstring", MatchContext::isDocstring);

    static final EquivalenceRule SINGLETON_COLLECTION = new EquivalenceRule(
            "first/last of a vector literal with at most one element", BuiltinOperators::isSingletonVectorArgument);

    // ========== Relational symbols ==========

    private static final Map<String, String> RELATIONAL = new LinkedHashMap<>();

    static {
        RELATIONAL.put("lt", "<");
        RELATIONAL.put("lte", "<=");
        RELATIONAL.put("gt", ">");
        RELATIONAL.put("gte", ">=");
        RELATIONAL.put("eq", "=");
        RELATIONAL.put("ne", "not=");
        RELATIONAL.put("true", "true");
        RELATIONAL.put("false", "false");
    }

    private BuiltinOperators() {}

    static List<Operator> all() {
        List<Operator> ops = new ArrayList<>();
        arithmetic(ops);
        relational(ops);
        logical(ops);
        constants(ops);
        collections(ops);
        removal(ops);
        return ops;
    }

    // ========== Arithmetic ==========

    private static void arithmetic(List<Operator> ops) {
        String family = "arithmetic";
        ops.add(headSwap("add-to-sub", OperatorCategory.ARITHMETIC, family, 4, "+", "-", ADD_SUBTRACT_ZERO));
        ops.add(headSwap("sub-to-add", OperatorCategory.ARITHMETIC, family, 4, "-", "+", ADD_SUBTRACT_ZERO));
        ops.add(headSwap("mul-to-div", OperatorCategory.ARITHMETIC, family, 4, "*", "/", MULTIPLY_DIVIDE_BY_ONE));
        ops.add(headSwap("div-to-mul", OperatorCategory.ARITHMETIC, family, 4, "/", "*", MULTIPLY_DIVIDE_BY_ONE));
        ops.add(headSwap("inc-to-dec", OperatorCategory.ARITHMETIC, family, 4, "inc", "dec", null));
        ops.add(headSwap("dec-to-inc", OperatorCategory.ARITHMETIC, family, 4, "dec", "inc", null));
        ops.add(headSwap("quot-to-rem", OperatorCategory.ARITHMETIC, family, 4, "quot", "rem", null));
        ops.add(headSwap("max-to-min", OperatorCategory.ARITHMETIC, family, 4, "max", "min", SINGLE_ARGUMENT_EXTREMUM));
        ops.add(headSwap("min-to-max", OperatorCategory.ARITHMETIC, family, 4, "min", "max", SINGLE_ARGUMENT_EXTREMUM));
    }

    // ========== Relational ==========

    private static void relational(List<Operator> ops) {
        relationalFamily(ops, "lt", Map.of(
                "lte", Set.of("eq", "true", "gte"),
                "ne", Set.of("gt", "true", "gte"),
                "false", Set.of("gt", "eq", "gte")));
        relationalFamily(ops, "lte", Map.of(
                "lt", Set.of("ne", "false", "gt"),
                "eq", Set.of("gte", "false", "gt"),
                "true", Set.of("gte", "ne", "gt")));
        relationalFamily(ops, "gt", Map.of(
                "gte", Set.of("eq", "true", "lte"),
                "ne", Set.of("lt", "true", "lte"),
                "false", Set.of("lt", "eq", "lte")));
        relationalFamily(ops, "gte", Map.of(
                "gt", Set.of("ne", "false", "lt"),
                "eq", Set.of("lte", "false", "lt"),
                "true", Set.of("lte", "ne", "lt")));

        ops.add(headSwap("eq-to-ne", OperatorCategory.RELATIONAL, "equality", 5, "=", "not=", null));
        ops.add(headSwap("ne-to-eq", OperatorCategory.RELATIONAL, "equality", 5, "not=", "=", null));
    }

    /**
     * One family per relational symbol: every other relational symbol, plus
     * whole-call replacement by true and false.
     *
     * @param edges sufficient target → targets it dominates
     */
    private static void relationalFamily(List<Operator> ops, String source, Map<String, Set<String>> edges) {
        String symbol = RELATIONAL.get(source);
        String family = "relational:" + symbol;

        for (Map.Entry<String, String> target : RELATIONAL.entrySet()) {
            String targetName = target.getKey();
            if (targetName.equals(source)) {
                continue;
            }
            String id = source + "-to-" + targetName;
            Set<String> dominates = edges.getOrDefault(targetName, Set.of()).stream()
                    .map(d -> source + "-to-" + d)
                    .collect(Collectors.toSet());
            int hardness = edges.containsKey(targetName) ? 6 : 3;

            if (targetName.equals("true") || targetName.equals("false")) {
                ops.add(new Operator(id, OperatorCategory.RELATIONAL, family, hardness,
                        ctx -> ctx.isCall(symbol),
                        ctx -> target.getValue(),
                        null, dominates,
                        "(" + symbol + " ...) -> " + target.getValue()));
            } else {
                ops.add(new Operator(id, OperatorCategory.RELATIONAL, family, hardness,
                        ctx -> ctx.isCallHead(symbol),
                        ctx -> target.getValue(),
                        null, dominates,
                        "(" + symbol + " ...) -> (" + target.getValue() + " ...)"));
            }
        }
    }

    // ========== Logical ==========

    private static void logical(List<Operator> ops) {
        String family = "logical";
        ops.add(headSwap("and-to-or", OperatorCategory.LOGICAL, family, 5, "and", "or", SINGLE_ARGUMENT_LOGIC));
        ops.add(headSwap("or-to-and", OperatorCategory.LOGICAL, family, 5, "or", "and", SINGLE_ARGUMENT_LOGIC));
        ops.add(headSwap("if-to-if-not", OperatorCategory.LOGICAL, family, 5, "if", "if-not", null));
        ops.add(headSwap("if-not-to-if", OperatorCategory.LOGICAL, family, 5, "if-not", "if", null));
        ops.add(headSwap("when-to-when-not", OperatorCategory.LOGICAL, family, 5, "when", "when-not", null));
        ops.add(headSwap("when-not-to-when", OperatorCategory.LOGICAL, family, 5, "when-not", "when", null));

        ops.add(new Operator("remove-not", OperatorCategory.LOGICAL, family, 5,
                ctx -> ctx.isCall("not") && ctx.callArguments().size() == 1,
                ctx -> ctx.callArguments().get(0).text(),
                null, Set.of(), "(not x) -> x"));

        ops.add(new Operator("true-to-false", OperatorCategory.LOGICAL, family, 3,
                ctx -> ctx.isLiteral("true"), ctx -> "false",
                null, Set.of(), "true -> false"));
        ops.add(new Operator("false-to-true", OperatorCategory.LOGICAL, family, 3,
                ctx -> ctx.isLiteral("false"), ctx -> "true",
                null, Set.of(), "false -> true"));
    }

    // ========== Constants ==========

    private static void constants(List<Operator> ops) {
        String family = "constant";
        ops.add(new Operator("number-increment", OperatorCategory.CONSTANT, family, 2,
                ctx -> isInteger(ctx.node()) && !MatchContext.isNumber(ctx.node(), 0),
                ctx -> incremented(((Token) ctx.node()).value()),
                null, Set.of(), "n -> n+1"));
        ops.add(new Operator("zero-to-one", OperatorCategory.CONSTANT, family, 2,
                ctx -> isInteger(ctx.node()) && MatchContext.isNumber(ctx.node(), 0),
                ctx -> "1",
                null, Set.of(), "0 -> 1"));
        ops.add(new Operator("one-to-zero", OperatorCategory.CONSTANT, family, 2,
                ctx -> isInteger(ctx.node()) && MatchContext.isNumber(ctx.node(), 1),
                ctx -> "0",
                null, Set.of(), "1 -> 0"));
        ops.add(new Operator("string-to-empty", OperatorCategory.CONSTANT, family, 2,
                ctx -> ctx.node() instanceof Token t && t.type() == TokenType.STRING && t.value().length() > 2,
                ctx -> "\"\"",
                DOCSTRING, Set.of(), "\"text\" -> \"\""));
    }

    // ========== Collections ==========

    private static void collections(List<Operator> ops) {
        String family = "collection";
        ops.add(headSwap("first-to-last", OperatorCategory.COLLECTION, family, 4, "first", "last", SINGLETON_COLLECTION));
        ops.add(headSwap("last-to-first", OperatorCategory.COLLECTION, family, 4, "last", "first", SINGLETON_COLLECTION));
        ops.add(headSwap("empty-to-seq", OperatorCategory.COLLECTION, family, 4, "empty?", "seq", null));
        ops.add(headSwap("nil-to-some", OperatorCategory.COLLECTION, family, 4, "nil?", "some?", null));
        ops.add(headSwap("some-to-nil", OperatorCategory.COLLECTION, family, 4, "some?", "nil?", null));
        ops.add(headSwap("filter-to-remove", OperatorCategory.COLLECTION, family, 4, "filter", "remove", null));
        ops.add(headSwap("remove-to-filter", OperatorCategory.COLLECTION, family, 4, "remove", "filter", null));
    }

    // ========== Removal ==========

    private static void removal(List<Operator> ops) {
        ops.add(new Operator("call-to-nil", OperatorCategory.REMOVAL, "removal", 5,
                ctx -> ctx.callHead().isPresent()
                        && ctx.ordinal() >= 1
                        && ctx.parentHead().isPresent()
                        && !ctx.parentHead().get().equals("ns"),
                ctx -> "nil",
                null, Set.of(), "(f ...) -> nil"));
    }

    // ========== Helpers ==========

    private static Operator headSwap(String id, OperatorCategory category, String family, int hardness,
                                     String from, String to, @Nullable EquivalenceRule equivalence) {
        return new Operator(id, category, family, hardness,
                ctx -> ctx.isCallHead(from),
                ctx -> to,
                equivalence, Set.of(),
                "(" + from + " ...) -> (" + to + " ...)");
    }

    private static boolean trailingArgumentsAre(MatchContext ctx, int value) {
        List<Node> args = ctx.callArguments();
        if (args.size() < 2) {
            return false;
        }
        return args.subList(1, args.size()).stream().allMatch(a -> MatchContext.isNumber(a, value));
    }

    private static boolean isSingletonVectorArgument(MatchContext ctx) {
        List<Node> args = ctx.callArguments();
        return args.size() == 1
                && args.get(0) instanceof CollectionNode c
                && c.delimiter() == Delimiter.VECTOR
                && c.children().size() <= 1;
    }

    private static boolean isInteger(Node node) {
        return node instanceof Token t && t.type() == TokenType.NUMBER && INTEGER.matcher(t.value()).matches();
    }

    private static String incremented(String text) {
        boolean bigint = text.endsWith("N");
        String digits = bigint ? text.substring(0, text.length() - 1) : text;
        if (digits.startsWith("+")) {
            digits = digits.substring(1);
        }
        String next = new BigInteger(digits).add(BigInteger.ONE).toString();
        return bigint ? next + "N" : next;
    }
}
