package io.github.manjago.chimera.coverage;

import io.github.manjago.chimera.scan.MutationSite;

import java.util.Set;
import java.util.TreeSet;

/**
 * Picks the tests to run against a mutation site.
 * <p>
 * The site's form is translated into the oracle's id space through the
 * {@link FormLocator}; sites without a file use their own form id. Both the
 * mutated node and the expression it rewrites are looked up, since a call
 * head is reported through its call.
 */
public final class TestSelector {

    private final CoverageIndex index;
    private final FormLocator locator;

    public TestSelector(CoverageIndex index, FormLocator locator) {
        this.index = index;
        this.locator = locator;
    }

    public Set<String> testsFor(MutationSite site) {
        String formId = site.file() == null
                ? site.formId()
                : locator.resolve(site.file(), site.line()).orElse(null);
        if (formId == null) {
            return Set.of();
        }
        Set<String> tests = new TreeSet<>(index.testsFor(formId, site.coordinate()));
        if (site.callHead()) {
            tests.addAll(index.testsFor(formId, site.target()));
        }
        return tests;
    }

    public CoverageIndex getIndex() {
        return index;
    }
}
