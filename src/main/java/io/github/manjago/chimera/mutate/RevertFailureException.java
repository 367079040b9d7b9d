package io.github.manjago.chimera.mutate;

import java.nio.file.Path;

/**
 * A mutated file could not be restored to its original content. Fatal for
 * the whole run: every later verdict would be measured against the wrong code.
 */
public class RevertFailureException extends RuntimeException {

    private final Path file;

    public RevertFailureException(Path file, String message, Throwable cause) {
        super("Failed to restore " + file + ": " + message, cause);
        this.file = file;
    }

    public RevertFailureException(Path file, String message) {
        super("Failed to restore " + file + ": " + message);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
