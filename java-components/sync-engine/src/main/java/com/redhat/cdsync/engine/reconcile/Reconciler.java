package com.redhat.cdsync.engine.reconcile;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.ErrorKind;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.SyncException;
import com.redhat.cdsync.engine.error.ValidationException;
import com.redhat.cdsync.engine.render.ApplyOrder;
import com.redhat.cdsync.engine.render.DesiredStateSnapshot;
import com.redhat.cdsync.engine.store.KindRegistry;
import com.redhat.cdsync.engine.store.ObjectKey;
import com.redhat.cdsync.engine.store.ObjectStore;
import com.redhat.cdsync.engine.store.ResourceJson;
import com.redhat.cdsync.engine.store.ResourceObject;
import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;
import com.redhat.cdsync.resources.util.HashUtil;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Drives the live objects of an application towards a rendered snapshot.
 * <p>
 * A pass lists the owned live objects, diffs them against the snapshot, applies creates and updates in apply order,
 * prunes orphans in reverse order when asked to, and finally assesses health. Every write uses optimistic
 * concurrency; a conflict or transient failure re-reads and retries only the affected object. Render and validation
 * problems are detected before anything is written.
 * <p>
 * The reconciler holds no per application state and may be shared. Callers must not run two passes for the same
 * application at the same time.
 */
public class Reconciler {

    private static final Logger log = Logger.getLogger(Reconciler.class);

    private final ObjectStore store;
    private final KindRegistry kinds;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    private final Counter passesSettled;
    private final Counter passesFailed;
    private final Counter passesCancelled;
    private final Counter objectsWritten;
    private final Counter objectsPruned;
    private final Counter conflicts;
    private final Timer passDuration;

    public Reconciler(ObjectStore store, KindRegistry kinds, RetryPolicy retryPolicy, Sleeper sleeper,
            MeterRegistry registry) {
        this.store = store;
        this.kinds = kinds;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        passesSettled = registry.counter("cdsync_sync_passes", "result", "settled");
        passesFailed = registry.counter("cdsync_sync_passes", "result", "failed");
        passesCancelled = registry.counter("cdsync_sync_passes", "result", "cancelled");
        objectsWritten = registry.counter("cdsync_sync_objects_written");
        objectsPruned = registry.counter("cdsync_sync_objects_pruned");
        conflicts = registry.counter("cdsync_sync_retries");
        passDuration = registry.timer("cdsync_sync_duration");
    }

    /**
     * The labels every object owned by the application carries.
     */
    public static Map<String, String> ownerSelector(String application) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ModelConstants.APP_INSTANCE_LABEL, application);
        labels.put(ModelConstants.MANAGED_BY_LABEL, ModelConstants.MANAGED_BY_VALUE);
        return labels;
    }

    /**
     * Places the snapshot objects in the destination namespace, adds the ownership labels and records a hash of the
     * declared content, so fields removed from the source are detected even though live objects carry defaults.
     */
    public List<ResourceObject> prepare(String application, String namespace, DesiredStateSnapshot snapshot) {
        List<ResourceObject> result = new ArrayList<>();
        for (var i : snapshot.objects()) {
            result.add(prepare(application, namespace, i));
        }
        return result;
    }

    ResourceObject prepare(String application, String namespace, ResourceObject object) {
        ResourceObject result = object;
        boolean namespaced = kinds.isNamespaced(object.kind());
        if (namespaced && object.namespace().isEmpty() && namespace != null && !namespace.isEmpty()) {
            result = result.withNamespace(namespace);
        } else if (!namespaced && !object.namespace().isEmpty()) {
            result = result.withNamespace(null);
        }
        result = result.withLabels(ownerSelector(application));
        String hash = HashUtil.sha1(ResourceJson.canonicalString(ResourceJson.normalize(result.body())));
        result = result.withAnnotation(ModelConstants.APPLIED_HASH, hash);
        return ResourceObject.of(ResourceJson.canonical(result.body()));
    }

    /**
     * True when a live object no longer matches what was applied for it, or is gone.
     */
    public boolean isDrifted(ResourceObject desired, ResourceObject live) {
        if (live == null) {
            return true;
        }
        String hash = desired.annotations().get(ModelConstants.APPLIED_HASH);
        if (!Objects.equals(hash, live.annotations().get(ModelConstants.APPLIED_HASH))) {
            return true;
        }
        return !ResourceJson.isSubset(ResourceJson.normalize(desired.body()), ResourceJson.normalize(live.body()));
    }

    /**
     * Lists every live object the application owns, in apply order.
     */
    public List<ResourceObject> listOwned(String application) {
        Map<String, String> selector = ownerSelector(application);
        List<ResourceObject> result = new ArrayList<>();
        for (var kind : kinds.managedKinds()) {
            result.addAll(store.list(kind.kind(), null, selector));
        }
        result.sort(ApplyOrder.comparator(kinds));
        return result;
    }

    /**
     * Deletes every live object the application owns, in reverse apply order.
     *
     * @return the number of objects deleted
     */
    public int deleteOwned(String application) {
        List<ResourceObject> owned = listOwned(application);
        Collections.reverse(owned);
        int deleted = 0;
        for (var i : owned) {
            try {
                store.delete(i.kind(), i.namespace(), i.name(), null);
                deleted++;
                objectsPruned.increment();
            } catch (NotFoundException e) {
                log.debugf("%s was already deleted", i.key());
            }
        }
        log.infof("Deleted %d objects owned by application %s", deleted, application);
        return deleted;
    }

    /**
     * Runs an action, retrying transient IO failures with the same bounded backoff as object writes. Once the
     * attempts are exhausted the last failure is rethrown.
     */
    public <T> T retryTransient(String description, Supplier<T> action) {
        return retryTransient(description, action, () -> {
        });
    }

    private <T> T retryTransient(String description, Supplier<T> action, Runnable beforeRetry) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (SyncException e) {
                if (e.getKind() != ErrorKind.TRANSIENT_IO) {
                    throw e;
                }
                if (attempt >= retryPolicy.maxAttempts()) {
                    log.errorf("Giving up %s after %d attempts: %s", description, attempt, e.getMessage());
                    throw e;
                }
                conflicts.increment();
                Duration delay = retryPolicy.delay(attempt);
                log.debugf("Attempt %d %s failed (%s), retrying in %s", attempt, description, e.getMessage(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                beforeRetry.run();
            }
        }
    }

    /**
     * Runs one pass.
     *
     * @param namespace the destination namespace for objects that do not declare one
     * @param cancelled polled at every step boundary; once true the pass stops and its result must be discarded
     */
    public SyncResult sync(String application, String namespace, DesiredStateSnapshot snapshot, SyncOptions options,
            BooleanSupplier cancelled) {
        long start = System.nanoTime();
        Pass pass = new Pass(application, snapshot, options, cancelled);
        try {
            SyncResult result = run(pass, namespace);
            (result.isSuccessful() ? passesSettled : passesFailed).increment();
            return result;
        } catch (PassCancelledException e) {
            log.infof("Sync of %s at %s was superseded", application, snapshot.fingerprint());
            passesCancelled.increment();
            return pass.result(true);
        } finally {
            passDuration.record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private SyncResult run(Pass pass, String namespace) {
        String application = pass.application;
        try {
            pass.transition(SyncPhase.DIFFING);
            List<ResourceObject> desired = prepare(application, namespace, pass.snapshot);
            desired.sort(ApplyOrder.comparator(kinds));
            validate(desired);
            Map<ObjectKey, ResourceObject> live = new LinkedHashMap<>();
            for (var i : retryTransient("listing the objects of " + application, () -> listOwned(application),
                    pass::checkCancelled)) {
                live.put(i.key(), i);
            }
            pass.checkCancelled();

            pass.transition(SyncPhase.APPLYING);
            Set<ObjectKey> declared = new HashSet<>();
            for (var object : desired) {
                declared.add(object.key());
                ResourceObject current = live.get(object.key());
                pass.checkCancelled();
                pass.results.add(applyStep(pass, object, current));
            }

            List<ResourceObject> orphans = new ArrayList<>();
            for (var i : live.values()) {
                if (!declared.contains(i.key())) {
                    orphans.add(i);
                }
            }
            Collections.reverse(orphans);
            for (var orphan : orphans) {
                pass.checkCancelled();
                pass.results.add(pruneStep(pass, orphan));
            }

            if (!pass.options.dryRun()) {
                assessHealth(pass, live);
            }
            pass.transition(pass.failed ? SyncPhase.FAILED : SyncPhase.SETTLED);
            SyncResult result = pass.result(false);
            log.infof("Sync of %s at %s finished: phase %s, health %s, %d created, %d updated, %d pruned%s",
                    application, pass.snapshot.fingerprint(), result.phase().getDisplayName(),
                    result.health().getDisplayName(), result.count(SyncAction.CREATE), result.count(SyncAction.UPDATE),
                    result.count(SyncAction.PRUNE), pass.options.dryRun() ? " (dry run)" : "");
            return result;
        } catch (SyncException e) {
            if (e.getKind() == ErrorKind.FATAL) {
                log.errorf(e, "Sync of %s failed", application);
            } else {
                log.errorf("Sync of %s failed: %s", application, e.getMessage());
            }
            pass.recordError(e);
            pass.transition(SyncPhase.FAILED);
            return pass.result(false);
        }
    }

    private void validate(List<ResourceObject> desired) {
        for (var i : desired) {
            Optional<KindRegistry.KindInfo> info = kinds.find(i.kind());
            if (info.isPresent() && !info.get().managed()) {
                throw new ValidationException(i.key() + " is of a kind that cannot be synced");
            }
            if (kinds.isNamespaced(i.kind()) && i.namespace().isEmpty()) {
                throw new ValidationException(
                        i.key() + " has no namespace and the application has no destination namespace");
            }
        }
    }

    private ObjectResult applyStep(Pass pass, ResourceObject desired, ResourceObject live) {
        if (live != null && !isDrifted(desired, live)) {
            return new ObjectResult(desired.key(), SyncAction.NONE, SyncOutcome.UNCHANGED, Health.UNKNOWN, 0, "");
        }
        SyncAction action = live == null ? SyncAction.CREATE : SyncAction.UPDATE;
        String describe = live == null ? "create"
                : Diffs.describe(ResourceJson.normalize(desired.body()), ResourceJson.normalize(live.body()));
        if (pass.options.dryRun()) {
            return new ObjectResult(desired.key(), action, SyncOutcome.PLANNED, Health.UNKNOWN, 0, describe);
        }
        String expected = live == null ? null : live.resourceVersion();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                if (attempt > 1) {
                    Optional<ResourceObject> fresh = store.find(desired.kind(), desired.namespace(), desired.name());
                    if (fresh.isPresent()) {
                        String owner = fresh.get().labels().get(ModelConstants.APP_INSTANCE_LABEL);
                        if (owner != null && !owner.equals(pass.application)) {
                            ConflictException e = new ConflictException(
                                    desired.key() + " is owned by application " + owner);
                            pass.recordError(e);
                            return new ObjectResult(desired.key(), action, SyncOutcome.FAILED, Health.DEGRADED,
                                    attempt - 1, e.getMessage());
                        }
                        if (!isDrifted(desired, fresh.get())) {
                            return new ObjectResult(desired.key(), action, SyncOutcome.APPLIED, Health.UNKNOWN,
                                    attempt - 1, describe);
                        }
                    }
                    expected = fresh.map(ResourceObject::resourceVersion).orElse(null);
                }
                store.apply(desired, expected);
                objectsWritten.increment();
                log.debugf("Applied %s (%s) on attempt %d", desired.key(), action.getDisplayName(), attempt);
                return new ObjectResult(desired.key(), action, SyncOutcome.APPLIED, Health.UNKNOWN, attempt, describe);
            } catch (SyncException e) {
                ObjectResult failed = handleFailure(pass, desired.key(), action, attempt, e);
                if (failed != null) {
                    return failed;
                }
            }
        }
    }

    private ObjectResult pruneStep(Pass pass, ResourceObject orphan) {
        if (!pass.options.prune()) {
            pass.blockedOrphans++;
            return new ObjectResult(orphan.key(), SyncAction.ORPHAN, SyncOutcome.SKIPPED, Health.UNKNOWN, 0,
                    "no longer declared, pruning is disabled");
        }
        if (pass.options.dryRun()) {
            return new ObjectResult(orphan.key(), SyncAction.PRUNE, SyncOutcome.PLANNED, Health.UNKNOWN, 0, "delete");
        }
        String expected = orphan.resourceVersion();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                if (attempt > 1) {
                    Optional<ResourceObject> fresh = store.find(orphan.kind(), orphan.namespace(), orphan.name());
                    if (fresh.isEmpty()) {
                        return new ObjectResult(orphan.key(), SyncAction.PRUNE, SyncOutcome.APPLIED, Health.UNKNOWN,
                                attempt - 1, "already deleted");
                    }
                    if (!pass.application.equals(fresh.get().labels().get(ModelConstants.APP_INSTANCE_LABEL))) {
                        return new ObjectResult(orphan.key(), SyncAction.PRUNE, SyncOutcome.UNCHANGED, Health.UNKNOWN,
                                attempt - 1, "no longer owned");
                    }
                    expected = fresh.get().resourceVersion();
                }
                store.delete(orphan.kind(), orphan.namespace(), orphan.name(), expected);
                objectsPruned.increment();
                log.debugf("Pruned %s", orphan.key());
                return new ObjectResult(orphan.key(), SyncAction.PRUNE, SyncOutcome.APPLIED, Health.UNKNOWN, attempt,
                        "deleted");
            } catch (NotFoundException e) {
                return new ObjectResult(orphan.key(), SyncAction.PRUNE, SyncOutcome.APPLIED, Health.UNKNOWN, attempt,
                        "already deleted");
            } catch (SyncException e) {
                ObjectResult failed = handleFailure(pass, orphan.key(), SyncAction.PRUNE, attempt, e);
                if (failed != null) {
                    return failed;
                }
            }
        }
    }

    /**
     * Fatal errors abort the pass. Other errors fail the object once they are not retryable or the attempts are
     * exhausted, otherwise this waits for the next attempt and returns null.
     */
    private ObjectResult handleFailure(Pass pass, ObjectKey key, SyncAction action, int attempt, SyncException e) {
        if (e.getKind() == ErrorKind.FATAL) {
            throw e;
        }
        if (!e.getKind().isRetryable()) {
            pass.recordError(e);
            return new ObjectResult(key, action, SyncOutcome.FAILED, Health.DEGRADED, attempt, e.getMessage());
        }
        if (attempt >= retryPolicy.maxAttempts()) {
            pass.recordError(e);
            log.errorf("Giving up on %s after %d attempts: %s", key, attempt, e.getMessage());
            return new ObjectResult(key, action, SyncOutcome.FAILED, Health.DEGRADED, attempt,
                    "retries exhausted after " + attempt + " attempts: " + e.getMessage());
        }
        conflicts.increment();
        Duration delay = retryPolicy.delay(attempt);
        log.debugf("Attempt %d for %s failed (%s), retrying in %s", attempt, key, e.getMessage(), delay);
        pass.transition(SyncPhase.CONFLICT_RETRY);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PassCancelledException();
        }
        pass.checkCancelled();
        pass.transition(SyncPhase.APPLYING);
        return null;
    }

    private void assessHealth(Pass pass, Map<ObjectKey, ResourceObject> listed) {
        List<ObjectResult> assessed = new ArrayList<>();
        for (var i : pass.results) {
            if (i.outcome() == SyncOutcome.FAILED || i.action() == SyncAction.PRUNE || i.action() == SyncAction.ORPHAN) {
                assessed.add(i);
                continue;
            }
            ResourceObject live = listed.get(i.key());
            if (i.outcome() == SyncOutcome.APPLIED) {
                try {
                    live = store.find(i.key().kind(), i.key().namespace(), i.key().name()).orElse(null);
                } catch (SyncException e) {
                    log.debugf("Unable to read %s for health assessment: %s", i.key(), e.getMessage());
                    assessed.add(i.withHealth(Health.UNKNOWN));
                    continue;
                }
            }
            assessed.add(i.withHealth(HealthAssessor.assess(live)));
        }
        pass.results.clear();
        pass.results.addAll(assessed);
    }

    private static final class PassCancelledException extends RuntimeException {
        PassCancelledException() {
            super(null, null, false, false);
        }
    }

    private static final class Pass {
        final String application;
        final DesiredStateSnapshot snapshot;
        final SyncOptions options;
        final BooleanSupplier cancelled;
        final List<ObjectResult> results = new ArrayList<>();
        final List<SyncPhase> transitions = new ArrayList<>();
        SyncPhase phase = SyncPhase.IDLE;
        boolean failed;
        int blockedOrphans;
        ErrorKind errorKind;
        String message;

        Pass(String application, DesiredStateSnapshot snapshot, SyncOptions options, BooleanSupplier cancelled) {
            this.application = application;
            this.snapshot = snapshot;
            this.options = options;
            this.cancelled = cancelled;
            transitions.add(phase);
        }

        void transition(SyncPhase next) {
            if (!phase.canTransitionTo(next)) {
                throw new IllegalStateException("invalid sync transition " + phase + " -> " + next);
            }
            phase = next;
            transitions.add(next);
        }

        void checkCancelled() {
            if (cancelled.getAsBoolean()) {
                throw new PassCancelledException();
            }
        }

        void recordError(SyncException e) {
            failed = true;
            errorKind = e.getKind();
            message = e.getMessage();
        }

        Health health() {
            if (failed) {
                return results.isEmpty() && errorKind != ErrorKind.TRANSIENT_IO ? Health.UNKNOWN : Health.DEGRADED;
            }
            if (options.dryRun()) {
                return Health.UNKNOWN;
            }
            Health result = Health.HEALTHY;
            for (var i : results) {
                result = result.worst(i.health());
            }
            if (blockedOrphans > 0) {
                result = result.worst(Health.PROGRESSING);
            }
            return result;
        }

        SyncResult result(boolean wasCancelled) {
            String resultMessage = message;
            if (resultMessage == null && blockedOrphans > 0) {
                resultMessage = blockedOrphans + " objects are no longer declared but pruning is disabled";
            }
            return new SyncResult(application, snapshot.fingerprint(), snapshot.revision(), phase, health(), results,
                    transitions, errorKind, resultMessage == null ? "" : resultMessage, options.dryRun(),
                    wasCancelled);
        }
    }
}
