package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.operator.Operator;
import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.syntax.SyntaxParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SubsumptionReducer.
 */
class SubsumptionReducerTest {

    private final OperatorCatalog catalog = OperatorCatalog.builtin();
    private final SubsumptionReducer reducer = new SubsumptionReducer(catalog);

    @Test
    @DisplayName("Relational family reduces to its sufficient set")
    void testReduceFamily() {
        List<String> family = catalog.family("relational:<").stream().map(Operator::id).toList();

        Set<String> reduced = reducer.reduce(family);

        assertEquals(List.of("lt-to-lte", "lt-to-ne", "lt-to-false"), List.copyOf(reduced));
    }

    @Test
    @DisplayName("Reduction is idempotent and minimal")
    void testIdempotentAndMinimal() {
        List<String> all = catalog.operators().stream().map(Operator::id).toList();

        Set<String> once = reducer.reduce(all);
        Set<String> twice = reducer.reduce(once);

        assertEquals(once, twice);
        for (String a : once) {
            for (String b : once) {
                assertFalse(catalog.dominatedBy(a).contains(b), a + " dominates " + b);
            }
        }
    }

    @Test
    @DisplayName("Operators without their dominator present are kept")
    void testNoDominatorPresent() {
        assertEquals(Set.of("lt-to-gt", "lt-to-eq"), reducer.reduce(List.of("lt-to-eq", "lt-to-gt")));
    }

    @Test
    @DisplayName("Sites are reduced per targeted expression")
    void testApplyPerExpression() throws Exception {
        List<MutationSite> sites = new SiteScanner(catalog.preset(Preset.THOROUGH))
                .scan(SyntaxParser.parse("(defn f [a b] (< a b))").forms());

        SubsumptionReducer.Result result = reducer.apply(sites);

        List<String> retained = result.retained().stream().map(MutationSite::operatorId).toList();
        assertEquals(List.of("call-to-nil", "lt-to-false", "lt-to-lte", "lt-to-ne"),
                retained.stream().sorted().toList());
        assertEquals(4, result.subsumed().size());
        for (SubsumedSite s : result.subsumed()) {
            assertTrue(catalog.dominatedBy(s.dominatorId()).contains(s.site().operatorId()));
        }
        assertTrue(reducer.apply(result.retained()).subsumed().isEmpty());
    }

    @Test
    @DisplayName("Dominance does not cross expressions")
    void testSeparateExpressions() throws Exception {
        List<MutationSite> sites = new SiteScanner(List.of(catalog.get("lt-to-gt"), catalog.get("lt-to-ne")))
                .scan(SyntaxParser.parse("(defn f [a b] (and (< a b) (< b a)))").forms());
        List<MutationSite> onlyGtOnSecond = sites.stream()
                .filter(s -> !(s.operatorId().equals("lt-to-ne") && s.coordinate().toString().startsWith("3/2")))
                .toList();

        SubsumptionReducer.Result result = reducer.apply(onlyGtOnSecond);

        assertEquals(2, result.retained().size());
        assertEquals(1, result.subsumed().size());
        assertEquals("3/1/0", result.subsumed().get(0).site().coordinate().toString());
    }
}
