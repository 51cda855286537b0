package com.redhat.cdsync.engine.reconcile;

public enum SyncAction {
    CREATE("Create"),
    UPDATE("Update"),
    NONE("None"),
    PRUNE("Prune"),
    /**
     * The object is no longer declared but pruning is disabled.
     */
    ORPHAN("Orphan");

    private final String displayName;

    SyncAction(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
