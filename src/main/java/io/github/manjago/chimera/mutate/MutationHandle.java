package io.github.manjago.chimera.mutate;

import java.nio.file.Path;

/**
 * An outstanding edit of one file. Closing the handle reverts the edit;
 * closing it again does nothing.
 */
public final class MutationHandle implements AutoCloseable {

    private final MutationApplier applier;
    private final Path file;
    private final byte[] originalBytes;
    private final String originalHash;
    private final Path backup;
    private boolean reverted;

    MutationHandle(MutationApplier applier, Path file, byte[] originalBytes, String originalHash, Path backup) {
        this.applier = applier;
        this.file = file;
        this.originalBytes = originalBytes;
        this.originalHash = originalHash;
        this.backup = backup;
    }

    public Path getFile() {
        return file;
    }

    /** SHA-256 of the file before the edit */
    public String getOriginalHash() {
        return originalHash;
    }

    byte[] originalBytes() {
        return originalBytes;
    }

    Path backup() {
        return backup;
    }

    public synchronized boolean isReverted() {
        return reverted;
    }

    /**
     * Restore the original bytes.
     *
     * @throws RevertFailureException if the file cannot be restored byte for byte
     */
    public synchronized void revert() {
        if (reverted) {
            return;
        }
        applier.revert(this);
        reverted = true;
    }

    @Override
    public void close() {
        revert();
    }
}
