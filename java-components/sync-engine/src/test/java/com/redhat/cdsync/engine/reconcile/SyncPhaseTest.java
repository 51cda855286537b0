package com.redhat.cdsync.engine.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.store.ResourceObject;

class SyncPhaseTest {

    @Test
    void transitions() {
        assertTrue(SyncPhase.IDLE.canTransitionTo(SyncPhase.DIFFING));
        assertTrue(SyncPhase.APPLYING.canTransitionTo(SyncPhase.CONFLICT_RETRY));
        assertTrue(SyncPhase.CONFLICT_RETRY.canTransitionTo(SyncPhase.APPLYING));
        assertTrue(SyncPhase.DIFFING.canTransitionTo(SyncPhase.FAILED));
        assertTrue(SyncPhase.FAILED.canTransitionTo(SyncPhase.IDLE));
        assertFalse(SyncPhase.IDLE.canTransitionTo(SyncPhase.APPLYING));
        assertFalse(SyncPhase.CONFLICT_RETRY.canTransitionTo(SyncPhase.SETTLED));
        assertFalse(SyncPhase.FAILED.canTransitionTo(SyncPhase.FAILED));
        assertEquals(SyncPhase.CONFLICT_RETRY, SyncPhase.fromDisplayName("ConflictRetry"));
    }

    @Test
    void retryDelaysDoubleUpToCap() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(200), Duration.ofSeconds(1));
        assertEquals(Duration.ofMillis(200), policy.delay(1));
        assertEquals(Duration.ofMillis(800), policy.delay(3));
        assertEquals(Duration.ofSeconds(1), policy.delay(4));
    }

    @Test
    void healthOrdering() {
        assertEquals(Health.DEGRADED, Health.PROGRESSING.worst(Health.DEGRADED));
        assertEquals(Health.PROGRESSING, Health.HEALTHY.worst(Health.PROGRESSING));
        assertEquals(Health.HEALTHY, Health.UNKNOWN.worst(Health.HEALTHY));
    }

    @Test
    void workloadHealth() {
        assertEquals(Health.PROGRESSING, HealthAssessor.assess(ResourceObject.parse("""
                apiVersion: apps/v1
                kind: Deployment
                metadata:
                  name: web
                  generation: 3
                spec:
                  replicas: 2
                status:
                  observedGeneration: 2
                  readyReplicas: 2
                """)));
        assertEquals(Health.DEGRADED, HealthAssessor.assess(ResourceObject.parse("""
                apiVersion: apps/v1
                kind: Deployment
                metadata:
                  name: web
                status:
                  conditions:
                  - type: Progressing
                    status: "False"
                    reason: ProgressDeadlineExceeded
                """)));
        assertEquals(Health.HEALTHY, HealthAssessor.assess(ResourceObject.parse("""
                apiVersion: apps/v1
                kind: DaemonSet
                metadata:
                  name: agent
                status:
                  desiredNumberScheduled: 3
                  numberReady: 3
                """)));
        assertEquals(Health.DEGRADED, HealthAssessor.assess(ResourceObject.parse("""
                apiVersion: batch/v1
                kind: Job
                metadata:
                  name: migrate
                status:
                  conditions:
                  - type: Failed
                    status: "True"
                """)));
        assertEquals(Health.PROGRESSING, HealthAssessor.assess(ResourceObject.parse("""
                apiVersion: v1
                kind: Pod
                metadata:
                  name: web
                status:
                  phase: Running
                """)));
        assertEquals(Health.HEALTHY, HealthAssessor.assess(ResourceObject.parse("""
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: settings
                """)));
    }
}
