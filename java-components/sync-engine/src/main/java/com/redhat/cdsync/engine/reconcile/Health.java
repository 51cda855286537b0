package com.redhat.cdsync.engine.reconcile;

import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;

/**
 * Health of an object or application, ordered from best to worst except for {@link #UNKNOWN}.
 */
public enum Health {
    HEALTHY(ModelConstants.HEALTH_HEALTHY),
    PROGRESSING(ModelConstants.HEALTH_PROGRESSING),
    DEGRADED(ModelConstants.HEALTH_DEGRADED),
    UNKNOWN(ModelConstants.HEALTH_UNKNOWN);

    private final String displayName;

    Health(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Health worst(Health other) {
        if (this == UNKNOWN) {
            return other;
        }
        if (other == UNKNOWN) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }

    public static Health fromDisplayName(String name) {
        for (var i : values()) {
            if (i.displayName.equals(name)) {
                return i;
            }
        }
        return UNKNOWN;
    }
}
