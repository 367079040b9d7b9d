package io.github.manjago.chimera.exec;

import java.nio.file.Path;
import java.util.Collection;

/**
 * Replaces in-process definitions for the given files and their dependents.
 */
@FunctionalInterface
public interface ReloadService {

    /**
     * @return false if the reload failed
     */
    boolean reload(Collection<Path> files);

    ReloadService NOOP = files -> true;
}
