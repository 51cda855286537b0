package com.redhat.cdsync.engine.reconcile;

import java.util.List;

import com.redhat.cdsync.engine.error.ErrorKind;
import com.redhat.cdsync.engine.error.SyncException;

/**
 * The outcome of one sync pass.
 *
 * @param phase the terminal phase, {@link SyncPhase#SETTLED} or {@link SyncPhase#FAILED}, or the phase at which a
 *        cancelled pass stopped
 * @param transitions every phase the pass went through, in order
 * @param errorKind the kind of the last error, null if the pass succeeded
 */
public record SyncResult(String application, String fingerprint, String revision, SyncPhase phase, Health health,
        List<ObjectResult> objects, List<SyncPhase> transitions, ErrorKind errorKind, String message, boolean dryRun,
        boolean cancelled) {

    public SyncResult {
        objects = List.copyOf(objects);
        transitions = List.copyOf(transitions);
    }

    /**
     * A pass that failed before reaching the live objects, for example because the source could not be rendered.
     * Health is Degraded once transient failures have exhausted their retries, Unknown otherwise.
     */
    public static SyncResult failed(String application, String fingerprint, String revision, SyncException e) {
        Health health = e.getKind() == ErrorKind.TRANSIENT_IO ? Health.DEGRADED : Health.UNKNOWN;
        return new SyncResult(application, fingerprint, revision, SyncPhase.FAILED, health, List.of(),
                List.of(SyncPhase.IDLE, SyncPhase.DIFFING, SyncPhase.FAILED), e.getKind(), e.getMessage(), false,
                false);
    }

    public boolean isSuccessful() {
        return !cancelled && phase == SyncPhase.SETTLED;
    }

    public long count(SyncAction action) {
        return objects.stream().filter(o -> o.action() == action).count();
    }
}
