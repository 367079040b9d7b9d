package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.scan.SiteScanner;
import io.github.manjago.chimera.syntax.Coordinate;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.SyntaxParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EquivalenceFilter.
 */
class EquivalenceFilterTest {

    private final OperatorCatalog catalog = OperatorCatalog.builtin();
    private final EquivalenceFilter filter = new EquivalenceFilter(catalog);

    private static Map<String, Form> byId(List<Form> forms) {
        return forms.stream().collect(Collectors.toMap(Form::id, Function.identity()));
    }

    @Test
    @DisplayName("Multiplying by one never reaches execution")
    void testMultiplyByOne() throws Exception {
        List<Form> forms = SyntaxParser.parse("(defn scale [x] (* x 1))").forms();
        List<MutationSite> sites = new SiteScanner(catalog.preset(Preset.STANDARD)).scan(forms);

        EquivalenceFilter.Result result = filter.apply(sites, byId(forms));

        assertEquals(1, result.equivalent().size());
        assertEquals("mul-to-div", result.equivalent().get(0).site().operatorId());
        assertEquals("multiply/divide by one", result.equivalent().get(0).reason());
        assertTrue(result.retained().stream().noneMatch(s -> s.operatorId().equals("mul-to-div")));
    }

    @Test
    @DisplayName("Sites without a firing rule are kept in order")
    void testRetained() throws Exception {
        List<Form> forms = SyntaxParser.parse("(defn f [x y] (and (* x 2) (max x y)))").forms();
        List<MutationSite> sites = new SiteScanner(catalog.preset(Preset.STANDARD)).scan(forms);

        EquivalenceFilter.Result result = filter.apply(sites, byId(forms));

        assertTrue(result.equivalent().isEmpty());
        assertEquals(sites, result.retained());
    }

    @Test
    @DisplayName("Unknown forms and stale coordinates are errors")
    void testUnresolvable() throws Exception {
        List<Form> forms = SyntaxParser.parse("(defn scale [x] (* x 1))").forms();
        MutationSite stale = new MutationSite("user/scale", Coordinate.parse("9/0"), "mul-to-div", "/",
                null, 1, "*", 0, true);
        MutationSite foreign = new MutationSite("other/f", Coordinate.parse("3/0"), "mul-to-div", "/",
                null, 1, "*", 0, true);

        assertThrows(IllegalStateException.class, () -> filter.apply(List.of(stale), byId(forms)));
        assertThrows(IllegalArgumentException.class, () -> filter.apply(List.of(foreign), byId(forms)));
    }

    @Test
    @DisplayName("Emptying a docstring is equivalent, emptying a string value is not")
    void testDocstring() throws Exception {
        List<Form> forms = SyntaxParser.parse("""
                (defn greet "Greets someone." [who] (str "hello " who))
                (def motto "doc for motto" "be kind")
                (def plain "value")
                (defprotocol Named "Things with names." (label [this]))
                """).forms();
        List<MutationSite> sites = new SiteScanner(catalog.preset(Preset.THOROUGH)).scan(forms).stream()
                .filter(s -> s.operatorId().equals("string-to-empty"))
                .toList();
        assertEquals(6, sites.size());

        EquivalenceFilter.Result result = filter.apply(sites, byId(forms));

        assertEquals(List.of("\"Greets someone.\"", "\"doc for motto\"", "\"Things with names.\""),
                result.equivalent().stream().map(e -> e.site().original()).toList());
        assertTrue(result.equivalent().stream().allMatch(e -> e.reason().equals("docstring")));
        assertEquals(List.of("\"hello \"", "\"be kind\"", "\"value\""),
                result.retained().stream().map(MutationSite::original).toList());
    }
}
