package io.github.manjago.chimera.schemata;

import io.github.manjago.chimera.exec.ReloadService;
import io.github.manjago.chimera.mutate.MutationApplier;
import io.github.manjago.chimera.mutate.MutationApplyException;
import io.github.manjago.chimera.mutate.MutationHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;

/**
 * One compiled batch loaded into the running process.
 * <p>
 * Opening writes the compiled file and reloads it once. The active mutant
 * lives here and nowhere else; closing clears the switch, restores the
 * original file and reloads it once more.
 */
public final class SchemaSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchemaSession.class);

    private final SchemaBundle bundle;
    private final MutationHandle handle;
    private final ReloadService reload;
    private final MutantSwitch mutantSwitch;
    private Integer active;

    private SchemaSession(SchemaBundle bundle, MutationHandle handle, ReloadService reload, MutantSwitch mutantSwitch) {
        this.bundle = bundle;
        this.handle = handle;
        this.reload = reload;
        this.mutantSwitch = mutantSwitch;
    }

    /**
     * @throws MutationApplyException if the compiled file cannot be written or reloaded;
     *                                the original file is restored first
     */
    public static SchemaSession open(SchemaBundle bundle, MutationApplier applier, ReloadService reload,
                                     MutantSwitch mutantSwitch) throws MutationApplyException {
        mutantSwitch.clear();
        MutationHandle handle = applier.applyText(bundle.file(), bundle.originalText(), bundle.compiledText());
        boolean loaded;
        try {
            loaded = reload.reload(List.of(bundle.file()));
        } catch (RuntimeException e) {
            handle.close();
            throw new MutationApplyException("Reload of compiled schemata failed for " + bundle.file(), e);
        }
        if (!loaded) {
            handle.close();
            if (!reload.reload(List.of(bundle.file()))) {
                log.warn("Reload of restored {} failed", bundle.file());
            }
            throw new MutationApplyException("Reload of compiled schemata failed for " + bundle.file());
        }
        log.debug("Schemata session opened for {} with {} mutants", bundle.file(), bundle.mutants().size());
        return new SchemaSession(bundle, handle, reload, mutantSwitch);
    }

    public SchemaBundle getBundle() {
        return bundle;
    }

    /**
     * Make one embedded mutant live.
     */
    public void activate(int mutantId) {
        if (!bundle.mutants().containsKey(mutantId)) {
            throw new IllegalArgumentException("Mutant " + mutantId + " is not part of this bundle");
        }
        mutantSwitch.select(mutantId);
        active = mutantId;
    }

    public OptionalInt activeMutant() {
        return active == null ? OptionalInt.empty() : OptionalInt.of(active);
    }

    @Override
    public void close() {
        try {
            mutantSwitch.clear();
            active = null;
        } finally {
            handle.close();
            if (!reload.reload(List.of(bundle.file()))) {
                log.warn("Final reload of {} failed", bundle.file());
            }
        }
    }
}
