package com.redhat.cdsync.engine.error;

/**
 * Rendering failed. Nothing from the snapshot may be applied.
 */
public class RenderException extends SyncException {

    public enum Reason {
        NOT_FOUND,
        PARSE_ERROR,
        PATCH_CONFLICT
    }

    private final Reason reason;

    public RenderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RenderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.RENDER;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}
