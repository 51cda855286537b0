package com.redhat.cdsync.engine.reconcile;

/**
 * @param prune delete owned objects that are no longer declared
 * @param dryRun compute and report the diff without writing
 */
public record SyncOptions(boolean prune, boolean dryRun) {

    public static final SyncOptions DEFAULT = new SyncOptions(false, false);
}
