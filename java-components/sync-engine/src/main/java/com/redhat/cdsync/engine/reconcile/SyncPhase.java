package com.redhat.cdsync.engine.reconcile;

import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;

/**
 * States of one sync pass. A pass starts in {@link #IDLE}, and a failed pass must go back to {@link #IDLE} before
 * the next one.
 */
public enum SyncPhase {
    IDLE(ModelConstants.PHASE_IDLE),
    DIFFING(ModelConstants.PHASE_DIFFING),
    APPLYING(ModelConstants.PHASE_APPLYING),
    CONFLICT_RETRY(ModelConstants.PHASE_CONFLICT_RETRY),
    SETTLED(ModelConstants.PHASE_SETTLED),
    FAILED(ModelConstants.PHASE_FAILED);

    private final String displayName;

    SyncPhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean canTransitionTo(SyncPhase next) {
        if (next == FAILED) {
            return this != FAILED;
        }
        switch (this) {
            case IDLE:
                return next == DIFFING;
            case DIFFING:
                return next == APPLYING;
            case APPLYING:
                return next == CONFLICT_RETRY || next == SETTLED;
            case CONFLICT_RETRY:
                return next == APPLYING;
            case SETTLED:
                return next == IDLE;
            case FAILED:
                return next == IDLE;
            default:
                return false;
        }
    }

    public static SyncPhase fromDisplayName(String name) {
        for (var i : values()) {
            if (i.displayName.equals(name)) {
                return i;
            }
        }
        return IDLE;
    }
}
