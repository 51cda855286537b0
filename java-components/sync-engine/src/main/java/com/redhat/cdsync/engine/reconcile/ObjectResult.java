package com.redhat.cdsync.engine.reconcile;

import com.redhat.cdsync.engine.store.ObjectKey;

/**
 * What a pass did to one object.
 *
 * @param attempts the number of write attempts, zero if nothing was written
 */
public record ObjectResult(ObjectKey key, SyncAction action, SyncOutcome outcome, Health health, int attempts,
        String message) {

    ObjectResult withHealth(Health health) {
        return new ObjectResult(key, action, outcome, health, attempts, message);
    }
}
