package io.github.manjago.chimera.exec;

import io.github.manjago.chimera.scan.MutationSite;
import org.jetbrains.annotations.Nullable;

/**
 * Final verdict of one executed or propagated site.
 *
 * @param representativeId id of the site whose execution produced the verdict,
 *                         or null when the site ran itself
 * @param durationMs       wall time of the site's test phase (0 when propagated)
 */
public record SiteResult(
    MutationSite site,
    Verdict verdict,
    @Nullable String killingTest,
    String detail,
    @Nullable String representativeId,
    long durationMs
) {

    public static SiteResult of(MutationSite site, ExecutionResult result, long durationMs) {
        return new SiteResult(site, result.verdict(), result.killingTest(), result.detail(), null, durationMs);
    }

    /**
     * The representative's verdict reported for a cluster member that never ran.
     */
    public SiteResult propagateTo(MutationSite member) {
        return new SiteResult(member, verdict, killingTest, detail, site.id(), 0);
    }

    public boolean isPropagated() {
        return representativeId != null;
    }
}
