package io.github.manjago.chimera.scan;

import io.github.manjago.chimera.operator.OperatorCatalog;
import io.github.manjago.chimera.operator.Preset;
import io.github.manjago.chimera.syntax.Coordinate;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.SyntaxParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SiteScanner.
 */
class SiteScannerTest {

    private final OperatorCatalog catalog = OperatorCatalog.builtin();

    private List<MutationSite> scan(Preset preset, String source) throws Exception {
        List<Form> forms = SyntaxParser.parse(Path.of("demo.clj"), source).forms();
        return new SiteScanner(catalog.preset(preset)).scan(forms);
    }

    private static List<String> describe(List<MutationSite> sites) {
        return sites.stream().map(s -> s.coordinate() + ":" + s.operatorId()).toList();
    }

    @Test
    @DisplayName("Sites come in tree order, then operator declaration order")
    void testOrder() throws Exception {
        List<MutationSite> sites = scan(Preset.THOROUGH, "(defn f [x] (+ x 1))");

        assertEquals(List.of("3:call-to-nil", "3/0:add-to-sub", "3/2:number-increment", "3/2:one-to-zero"),
                describe(sites));
        for (int i = 0; i < sites.size(); i++) {
            assertEquals(i, sites.get(i).ordinal());
        }
    }

    @Test
    @DisplayName("Sites carry everything needed to apply them later")
    void testSiteFields() throws Exception {
        MutationSite site = scan(Preset.STANDARD, "(defn f [x]\n  (+ x 1))").get(0);

        assertEquals("demo/f", site.formId());
        assertEquals(Coordinate.parse("3/0"), site.coordinate());
        assertEquals("+", site.original());
        assertEquals("-", site.replacement());
        assertEquals(2, site.line());
        assertTrue(site.callHead());
        assertEquals(Coordinate.parse("3"), site.target());
        assertEquals(Path.of("demo.clj"), site.file());
        assertEquals("demo/f@3/0:add-to-sub", site.id());
    }

    @Test
    @DisplayName("Quoted data is never mutated")
    void testQuoteSkipped() throws Exception {
        assertTrue(scan(Preset.THOROUGH, "(def q '(+ 1 (inc 2)))").isEmpty());
        assertTrue(scan(Preset.THOROUGH, "(def q (quote (+ 1 2)))").isEmpty());
    }

    @Test
    @DisplayName("Unquoted parts of a syntax quote are mutated")
    void testUnquoteScanned() throws Exception {
        List<MutationSite> sites = scan(Preset.STANDARD, "(defmacro m [x] `(+ ~(inc x) 1))");

        assertEquals(List.of("3/0/1/0/0:inc-to-dec"), describe(sites));
    }

    @Test
    @DisplayName("Comment blocks are skipped")
    void testCommentSkipped() throws Exception {
        assertTrue(scan(Preset.THOROUGH, "(comment (+ 1 2) (inc 3))").isEmpty());
    }

    @Test
    @DisplayName("Ordinals run across forms in input order")
    void testOrdinalsAcrossForms() throws Exception {
        List<MutationSite> sites = scan(Preset.STANDARD, """
                (defn a [x] (inc x))
                (defn b [x] (dec x))
                (defn c [x] (< x 0))
                """);

        assertEquals("demo/a", sites.get(0).formId());
        assertEquals("demo/b", sites.get(1).formId());
        assertEquals("demo/c", sites.get(2).formId());
        for (int i = 0; i < sites.size(); i++) {
            assertEquals(i, sites.get(i).ordinal());
        }
    }

    @Test
    @DisplayName("Every site resolves back to its context")
    void testContextOf() throws Exception {
        Form form = SyntaxParser.parse("(defn f [a b] (if (< a b) a b))").forms().get(0);
        SiteScanner scanner = new SiteScanner(catalog.preset(Preset.THOROUGH));

        for (MutationSite site : scanner.scanForm(form)) {
            assertEquals(site.original(), SiteScanner.contextOf(form, site).node().text());
            assertNotEquals(site.original(), site.replacement());
        }
    }

    @Test
    @DisplayName("Map values are scanned through digest coordinates")
    void testMapValues() throws Exception {
        List<MutationSite> sites = scan(Preset.STANDARD, "(def config {:retries (inc base)})");

        assertEquals(1, sites.size());
        assertTrue(sites.get(0).coordinate().parent().last().isDigest());
    }
}
