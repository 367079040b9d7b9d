package io.github.manjago.chimera.engine;

import io.github.manjago.chimera.exec.SiteResult;
import io.github.manjago.chimera.exec.Verdict;
import io.github.manjago.chimera.pipeline.EquivalentSite;
import io.github.manjago.chimera.pipeline.SubsumedSite;

import java.util.List;

/**
 * Outcome of one engine run.
 *
 * @param results         executed, propagated and reused results
 * @param equivalent      sites excluded as provably equivalent
 * @param subsumed        sites never scheduled because of dominance
 * @param changedForms    forms rescanned in this run
 * @param unchangedForms  forms whose previous results were reused
 * @param removedForms    forms that disappeared since the previous run
 * @param scannedSites    candidate sites produced by the scanner
 * @param clusters        clusters formed from the remaining sites
 * @param reusedResults   results taken over from the previous run
 * @param recoveredFiles  files restored from backups of an interrupted run
 */
public record RunReport(
    List<SiteResult> results,
    List<EquivalentSite> equivalent,
    List<SubsumedSite> subsumed,
    int changedForms,
    int unchangedForms,
    int removedForms,
    int scannedSites,
    int clusters,
    int reusedResults,
    int recoveredFiles,
    long durationMs
) {

    public RunReport {
        results = List.copyOf(results);
        equivalent = List.copyOf(equivalent);
        subsumed = List.copyOf(subsumed);
    }

    public long count(Verdict verdict) {
        return results.stream().filter(r -> r.verdict() == verdict).count();
    }

    /**
     * killed / (killed + survived); 1.0 when nothing entered the denominator.
     */
    public double score() {
        long killed = count(Verdict.KILLED);
        long survived = count(Verdict.SURVIVED);
        return killed + survived == 0 ? 1.0 : (double) killed / (killed + survived);
    }

    public List<SiteResult> survivors() {
        return results.stream().filter(r -> r.verdict() == Verdict.SURVIVED).toList();
    }

    @Override
    public String toString() {
        return String.format("""
            === Mutation Run ===
            Forms:            %,d changed, %,d unchanged, %,d removed
            Sites:            %,d scanned, %,d equivalent, %,d subsumed
            Clusters:         %,d
            Results:          %,d (%,d reused)
              Killed:         %,d
              Survived:       %,d
              No coverage:    %,d
              Timeout:        %,d
              Error:          %,d
            Score:            %.1f%%
            Duration:         %,d ms
            """,
            changedForms, unchangedForms, removedForms,
            scannedSites, equivalent.size(), subsumed.size(),
            clusters,
            results.size(), reusedResults,
            count(Verdict.KILLED),
            count(Verdict.SURVIVED),
            count(Verdict.NO_COVERAGE),
            count(Verdict.TIMEOUT),
            count(Verdict.ERROR),
            score() * 100,
            durationMs
        );
    }
}
