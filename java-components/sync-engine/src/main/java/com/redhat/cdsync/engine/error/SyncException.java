package com.redhat.cdsync.engine.error;

/**
 * Base of the error taxonomy shared by the store, renderer, reconciler and pipeline trigger.
 */
public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
