package com.redhat.cdsync.engine.error;

public enum ErrorKind {
    NOT_FOUND("NotFound", false),
    VALIDATION("ValidationError", false),
    CONFLICT("ConflictError", true),
    RENDER("RenderError", false),
    TRANSIENT_IO("TransientIOError", true),
    FATAL("Fatal", false);

    private final String displayName;
    private final boolean retryable;

    ErrorKind(String displayName, boolean retryable) {
        this.displayName = displayName;
        this.retryable = retryable;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Conflicts and transient IO failures are retried locally, everything else is surfaced as-is.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
