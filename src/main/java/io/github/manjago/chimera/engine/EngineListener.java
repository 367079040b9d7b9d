package io.github.manjago.chimera.engine;

import io.github.manjago.chimera.exec.SiteResult;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.schemata.SchemaBundle;

import java.util.Set;

/**
 * Listener for engine run events.
 * 
 * Implement this interface to report progress, for example on a console or
 * in a build tool.
 */
public interface EngineListener {

    /**
     * Called before a site's covering tests run.
     *
     * @param site  the site (a cluster representative)
     * @param tests tests selected for it; empty for no-coverage sites
     */
    default void onSiteStarted(MutationSite site, Set<String> tests) {}

    /**
     * Called for every executed or propagated result.
     */
    default void onVerdict(SiteResult result) {}

    /**
     * Called when a schemata batch has been compiled, before it is loaded.
     */
    default void onBatchCompiled(SchemaBundle bundle) {}

    /**
     * Called after each executed representative.
     *
     * @param done  representatives finished so far
     * @param total representatives scheduled in this run
     */
    default void onProgress(int done, int total) {}

    /**
     * Called once the run has been persisted.
     */
    default void onRunFinished(RunReport report) {}

    /**
     * No-op listener that does nothing.
     */
    EngineListener NOOP = new EngineListener() {};
}
