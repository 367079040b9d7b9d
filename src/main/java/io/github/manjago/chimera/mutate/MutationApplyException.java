package io.github.manjago.chimera.mutate;

/**
 * A mutation could not be applied. No file was left modified.
 */
public class MutationApplyException extends Exception {

    public MutationApplyException(String message) {
        super(message);
    }

    public MutationApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
