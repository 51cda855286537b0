package com.redhat.cdsync.engine.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.redhat.cdsync.engine.store.ResourceObject;

/**
 * Derives the health of a live object from its status. Kinds without a notion of readiness are healthy once they
 * exist.
 */
public final class HealthAssessor {

    private HealthAssessor() {
    }

    public static Health assess(ResourceObject live) {
        if (live == null) {
            return Health.PROGRESSING;
        }
        switch (live.kind()) {
            case "Deployment":
            case "StatefulSet":
            case "ReplicaSet":
                return replicated(live);
            case "DaemonSet":
                return daemonSet(live);
            case "Pod":
                return pod(live);
            case "Job":
                return job(live);
            case "PersistentVolumeClaim":
                return claim(live);
            default:
                return Health.HEALTHY;
        }
    }

    private static Health replicated(ResourceObject live) {
        JsonNode status = live.at("/status");
        if (conditionReason(status, "Progressing").equals("ProgressDeadlineExceeded")) {
            return Health.DEGRADED;
        }
        if (!observedCurrentGeneration(live)) {
            return Health.PROGRESSING;
        }
        int desired = live.at("/spec/replicas").asInt(1);
        if (status.path("readyReplicas").asInt(0) < desired) {
            return Health.PROGRESSING;
        }
        if (status.has("updatedReplicas") && status.path("updatedReplicas").asInt(0) < desired) {
            return Health.PROGRESSING;
        }
        return Health.HEALTHY;
    }

    private static Health daemonSet(ResourceObject live) {
        JsonNode status = live.at("/status");
        if (!observedCurrentGeneration(live) || !status.has("desiredNumberScheduled")) {
            return Health.PROGRESSING;
        }
        return status.path("numberReady").asInt(0) < status.path("desiredNumberScheduled").asInt(0)
                ? Health.PROGRESSING
                : Health.HEALTHY;
    }

    private static Health pod(ResourceObject live) {
        JsonNode status = live.at("/status");
        switch (status.path("phase").asText("")) {
            case "Succeeded":
                return Health.HEALTHY;
            case "Failed":
                return Health.DEGRADED;
            case "Running":
                return hasCondition(status, "Ready", "True") ? Health.HEALTHY : Health.PROGRESSING;
            default:
                return Health.PROGRESSING;
        }
    }

    private static Health job(ResourceObject live) {
        JsonNode status = live.at("/status");
        if (hasCondition(status, "Failed", "True")) {
            return Health.DEGRADED;
        }
        if (hasCondition(status, "Complete", "True")) {
            return Health.HEALTHY;
        }
        return Health.PROGRESSING;
    }

    private static Health claim(ResourceObject live) {
        switch (live.at("/status/phase").asText("")) {
            case "Bound":
                return Health.HEALTHY;
            case "Lost":
                return Health.DEGRADED;
            default:
                return Health.PROGRESSING;
        }
    }

    private static boolean observedCurrentGeneration(ResourceObject live) {
        JsonNode observed = live.at("/status/observedGeneration");
        JsonNode generation = live.at("/metadata/generation");
        if (observed.isMissingNode() || generation.isMissingNode()) {
            return true;
        }
        return observed.asLong() >= generation.asLong();
    }

    private static boolean hasCondition(JsonNode status, String type, String value) {
        for (var i : status.path("conditions")) {
            if (type.equals(i.path("type").asText()) && value.equals(i.path("status").asText())) {
                return true;
            }
        }
        return false;
    }

    private static String conditionReason(JsonNode status, String type) {
        for (var i : status.path("conditions")) {
            if (type.equals(i.path("type").asText())) {
                return i.path("reason").asText("");
            }
        }
        return "";
    }
}
