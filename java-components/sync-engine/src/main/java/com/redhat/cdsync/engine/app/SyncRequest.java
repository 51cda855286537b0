package com.redhat.cdsync.engine.app;

import com.redhat.cdsync.engine.reconcile.SyncOptions;

/**
 * A queued request for a sync pass.
 *
 * @param generation the request generation; a pass is superseded once a newer generation is issued
 * @param revision the source revision to sync, or null to use the latest known one
 * @param explicit requested by an operator rather than by an event
 */
record SyncRequest(Trigger trigger, long generation, String revision, SyncOptions options, boolean explicit) {

    enum Trigger {
        /**
         * New desired state: a source change, an image update or an operator request. Issues a new generation.
         */
        SYNC,
        /**
         * A live object drifted from the applied state.
         */
        SELF_HEAL,
        /**
         * A live object changed while the application was progressing, health needs another look.
         */
        REFRESH
    }
}
