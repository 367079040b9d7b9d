package io.github.manjago.chimera.persistence;

import java.io.IOException;

/**
 * The state file is unreadable, corrupt or of an unsupported version.
 */
public class StateStoreException extends IOException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
