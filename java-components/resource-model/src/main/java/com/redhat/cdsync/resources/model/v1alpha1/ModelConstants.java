package com.redhat.cdsync.resources.model.v1alpha1;

public class ModelConstants {
    public static final String GROUP = "cdsync.redhat.com";
    public static final String VERSION = "v1alpha1";
    public static final String API_VERSION = GROUP + "/" + VERSION;

    public static final String APPLICATION_KIND = "Application";

    /**
     * Label carried by every live object that an application owns.
     */
    public static final String APP_INSTANCE_LABEL = "app.kubernetes.io/instance";
    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "cdsync";

    public static final String APPLIED_HASH = GROUP + "/applied-hash";

    /**
     * Label on pipeline runs started on behalf of an application.
     */
    public static final String PIPELINE_APPLICATION_LABEL = GROUP + "/application";

    public static final String DEFAULT_TARGET_REVISION = "HEAD";

    public static final String HEALTH_HEALTHY = "Healthy";
    public static final String HEALTH_PROGRESSING = "Progressing";
    public static final String HEALTH_DEGRADED = "Degraded";
    public static final String HEALTH_UNKNOWN = "Unknown";

    public static final String PHASE_IDLE = "Idle";
    public static final String PHASE_DIFFING = "Diffing";
    public static final String PHASE_APPLYING = "Applying";
    public static final String PHASE_CONFLICT_RETRY = "ConflictRetry";
    public static final String PHASE_SETTLED = "Settled";
    public static final String PHASE_FAILED = "Failed";

}
