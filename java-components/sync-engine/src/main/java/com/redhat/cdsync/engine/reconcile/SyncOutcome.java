package com.redhat.cdsync.engine.reconcile;

public enum SyncOutcome {
    APPLIED("Applied"),
    UNCHANGED("Unchanged"),
    /**
     * Dry run, nothing was written.
     */
    PLANNED("Planned"),
    FAILED("Failed"),
    /**
     * Not attempted because an earlier step failed or the pass was cancelled.
     */
    SKIPPED("Skipped");

    private final String displayName;

    SyncOutcome(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
