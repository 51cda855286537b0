package com.redhat.cdsync.engine.app;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import com.redhat.cdsync.engine.error.ErrorKind;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.SyncException;
import com.redhat.cdsync.engine.reconcile.Health;
import com.redhat.cdsync.engine.reconcile.HealthAssessor;
import com.redhat.cdsync.engine.reconcile.ObjectResult;
import com.redhat.cdsync.engine.reconcile.Reconciler;
import com.redhat.cdsync.engine.reconcile.SyncOptions;
import com.redhat.cdsync.engine.reconcile.SyncOutcome;
import com.redhat.cdsync.engine.reconcile.SyncResult;
import com.redhat.cdsync.engine.render.DesiredStateSnapshot;
import com.redhat.cdsync.engine.render.ManifestRenderer;
import com.redhat.cdsync.engine.source.Backoff;
import com.redhat.cdsync.engine.source.RevisionChange;
import com.redhat.cdsync.engine.source.SourceRepository;
import com.redhat.cdsync.engine.source.SourceWatcher;
import com.redhat.cdsync.engine.store.KindRegistry;
import com.redhat.cdsync.engine.store.ObjectKey;
import com.redhat.cdsync.engine.store.ObjectStore;
import com.redhat.cdsync.engine.store.ResourceObject;
import com.redhat.cdsync.engine.store.WatchEvent;
import com.redhat.cdsync.engine.store.WatchStream;
import com.redhat.cdsync.resources.model.v1alpha1.Application;
import com.redhat.cdsync.resources.model.v1alpha1.ApplicationStatus;
import com.redhat.cdsync.resources.model.v1alpha1.ImageOverride;
import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;
import com.redhat.cdsync.resources.model.v1alpha1.ResourceStatus;
import com.redhat.cdsync.resources.model.v1alpha1.SyncHistory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Runs the sync passes of every application.
 * <p>
 * Each application has its own worker: a slot holding the newest pending sync, a bounded queue of drift and health
 * events, both drained by one task at a time on the shared executor, and a lock held for the duration of a pass, so
 * passes of one application never overlap while different applications sync concurrently. A full event queue drops
 * its oldest event, never a pending sync. Every request for new desired state issues a new generation; a running
 * pass whose generation has been superseded, or whose application has been deleted, stops at its next step boundary
 * and its status is not written.
 * <p>
 * Watches on live objects are reopened with backoff whenever the server ends them, until the controller is closed.
 */
public class ApplicationController implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ApplicationController.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 16;
    public static final int DEFAULT_HISTORY_LIMIT = 10;

    private final ApplicationRepository applications;
    private final ObjectStore store;
    private final KindRegistry kinds;
    private final SourceRepository source;
    private final ManifestRenderer renderer;
    private final Reconciler reconciler;
    private final SourceWatcher watcher;
    private final Executor executor;
    private final Clock clock;
    private final int queueCapacity;
    private final int historyLimit;

    private final Map<String, AppWorker> workers = new ConcurrentHashMap<>();
    private final Set<String> watchedKinds = ConcurrentHashMap.newKeySet();
    private final List<WatchStream> watches = new CopyOnWriteArrayList<>();
    private final Counter droppedEvents;
    private volatile ExecutorService watchExecutor;
    private volatile Backoff watchBackoff = new Backoff(Duration.ofSeconds(1), Duration.ofMinutes(1));
    private volatile boolean closed;

    public ApplicationController(ApplicationRepository applications, ObjectStore store, KindRegistry kinds,
            SourceRepository source, ManifestRenderer renderer, Reconciler reconciler, SourceWatcher watcher,
            Executor executor, Clock clock, int queueCapacity, int historyLimit, MeterRegistry registry) {
        this.applications = applications;
        this.store = store;
        this.kinds = kinds;
        this.source = source;
        this.renderer = renderer;
        this.reconciler = reconciler;
        this.watcher = watcher;
        this.executor = executor;
        this.clock = clock;
        this.queueCapacity = queueCapacity;
        this.historyLimit = historyLimit;
        this.droppedEvents = registry.counter("cdsync_events_dropped");
        watcher.addListener(this::onRevisionChange);
    }

    /**
     * Registers every stored application with the source watcher, so revisions already synced are not reported
     * again.
     */
    public void trackAll() {
        for (var i : applications.list()) {
            track(i);
        }
    }

    public Application createApplication(Application application) {
        Application created = applications.create(application);
        track(created);
        return created;
    }

    /**
     * Deletes an application. Any pass in progress is cancelled first.
     *
     * @param cascade also delete every live object the application owns
     * @return the number of live objects deleted
     */
    public int deleteApplication(String name, boolean cascade) {
        applications.get(name);
        AppWorker worker = worker(name);
        worker.deleted = true;
        watcher.untrack(name);
        worker.lock.lock();
        try {
            applications.delete(name);
            int deleted = cascade ? reconciler.deleteOwned(name) : 0;
            workers.remove(name, worker);
            return deleted;
        } finally {
            worker.lock.unlock();
        }
    }

    /**
     * Runs a pass on the calling thread, after any pass in progress for the application. An explicit sync supersedes
     * queued and running passes unless it is a dry run, and resumes an application stopped by a fatal error.
     *
     * @throws NotFoundException if the application does not exist
     */
    public SyncResult syncNow(String name, SyncOptions options) {
        Application application = applications.get(name);
        AppWorker worker = worker(name);
        long generation = options.dryRun() ? worker.generation.get() : worker.generation.incrementAndGet();
        SyncOptions effective = new SyncOptions(options.prune() || application.getSpec().getSyncPolicy().isPrune(),
                options.dryRun());
        return runPass(worker, new SyncRequest(SyncRequest.Trigger.SYNC, generation, null, effective, true));
    }

    /**
     * Queues a pass for an automated application whose source moved.
     */
    public void onRevisionChange(RevisionChange change) {
        Optional<Application> application = applications.find(change.application());
        if (application.isEmpty()) {
            watcher.untrack(change.application());
            return;
        }
        if (!application.get().getSpec().getSyncPolicy().isAutomated()) {
            log.infof("Application %s has a new revision %s, automated sync is disabled", change.application(),
                    change.revision());
            return;
        }
        requestSync(application.get(), change.revision());
    }

    /**
     * Reacts to a change of a live object outside a pass. Drift from the applied state of an application with self
     * heal enabled queues a corrective pass; any change to an object of a progressing application queues a health
     * refresh.
     */
    public void onLiveObjectEvent(WatchEvent event) {
        ResourceObject object = event.object();
        String owner = object.labels().get(ModelConstants.APP_INSTANCE_LABEL);
        if (owner == null || !ModelConstants.MANAGED_BY_VALUE.equals(object.labels().get(ModelConstants.MANAGED_BY_LABEL))) {
            return;
        }
        AppWorker worker = workers.get(owner);
        if (worker == null || worker.deleted) {
            return;
        }
        ResourceObject desired = worker.desired.get(object.key());
        boolean drifted = desired != null
                && (event.type() == WatchEvent.Type.DELETED || reconciler.isDrifted(desired, object));
        Application application = worker.application;
        if (drifted && application != null && application.getSpec().getSyncPolicy().isAutomated()
                && application.getSpec().getSyncPolicy().isSelfHeal()) {
            log.infof("%s of application %s drifted from the applied state", object.key(), owner);
            enqueue(worker, new SyncRequest(SyncRequest.Trigger.SELF_HEAL, worker.generation.get(), null,
                    options(application), false));
        } else if (worker.lastHealth == Health.PROGRESSING) {
            enqueue(worker, new SyncRequest(SyncRequest.Trigger.REFRESH, worker.generation.get(), null,
                    SyncOptions.DEFAULT, false));
        }
    }

    /**
     * Points every image override that names the repository at the new digest, and queues a sync for automated
     * applications.
     *
     * @return the names of the applications that were updated
     */
    public List<String> onImagePublished(String repository, String tag, String digest) {
        List<String> updated = new ArrayList<>();
        for (var application : applications.list()) {
            boolean changed = false;
            for (ImageOverride image : application.getSpec().getSource().getImages()) {
                String target = image.getNewName() == null ? image.getName() : image.getNewName();
                if (target.equals(repository) && !digest.equals(image.getDigest())) {
                    image.setNewTag(tag);
                    image.setDigest(digest);
                    changed = true;
                }
            }
            if (!changed) {
                continue;
            }
            Application saved = applications.update(application);
            updated.add(saved.getMetadata().getName());
            log.infof("Application %s now uses %s@%s", saved.getMetadata().getName(), repository, digest);
            if (saved.getSpec().getSyncPolicy().isAutomated()) {
                requestSync(saved, null);
            }
        }
        return updated;
    }

    /**
     * Opens a watch on every managed kind. Kinds learned from later renders are watched as they appear.
     */
    public synchronized void startWatching() {
        if (watchExecutor != null) {
            return;
        }
        watchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cdsync-watch");
            t.setDaemon(true);
            return t;
        });
        for (var i : kinds.managedKinds()) {
            watch(i.kind());
        }
    }

    /**
     * The number of requests waiting for the application, the pending sync included.
     */
    public int queuedEvents(String name) {
        AppWorker worker = workers.get(name);
        if (worker == null) {
            return 0;
        }
        return worker.queue.size() + (worker.pendingSync.get() == null ? 0 : 1);
    }

    void watchBackoff(Backoff backoff) {
        this.watchBackoff = backoff;
    }

    @Override
    public void close() {
        closed = true;
        for (var i : watches) {
            i.close();
        }
        watches.clear();
        if (watchExecutor != null) {
            watchExecutor.shutdownNow();
        }
    }

    private void watch(String kind) {
        ExecutorService exec = watchExecutor;
        if (exec == null || closed || !watchedKinds.add(kind)) {
            return;
        }
        exec.execute(() -> {
            try {
                int failures = 0;
                while (!closed) {
                    boolean received = false;
                    WatchStream stream = null;
                    try {
                        stream = store.watch(kind, null);
                        watches.add(stream);
                        log.debugf("Watching %s", kind);
                        while (!closed && stream.hasNext()) {
                            onLiveObjectEvent(stream.next());
                            received = true;
                        }
                    } catch (RuntimeException e) {
                        log.errorf(e, "Watch on %s failed", kind);
                    } finally {
                        if (stream != null) {
                            watches.remove(stream);
                            stream.close();
                        }
                    }
                    if (closed || Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    failures = received ? 1 : failures + 1;
                    Duration delay = watchBackoff.delay(failures);
                    log.warnf("Watch on %s ended, reopening in %s", kind, delay);
                    Thread.sleep(delay.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                watchedKinds.remove(kind);
            }
        });
    }

    private void track(Application application) {
        String name = application.getMetadata().getName();
        AppWorker worker = worker(name);
        worker.application = application;
        var src = application.getSpec().getSource();
        watcher.track(name, src.getRepoURL(), src.getTargetRevision(), application.getStatus().getLastSyncedRevision());
    }

    private void requestSync(Application application, String revision) {
        AppWorker worker = worker(application.getMetadata().getName());
        worker.application = application;
        enqueue(worker, new SyncRequest(SyncRequest.Trigger.SYNC, worker.generation.incrementAndGet(), revision,
                options(application), false));
    }

    private AppWorker worker(String name) {
        return workers.computeIfAbsent(name, n -> new AppWorker(n, queueCapacity));
    }

    private void enqueue(AppWorker worker, SyncRequest request) {
        if (request.trigger() == SyncRequest.Trigger.SYNC) {
            SyncRequest replaced = worker.pendingSync.getAndSet(request);
            if (replaced != null) {
                log.debugf("Sync of %s at generation %d replaced a pending one", worker.name, request.generation());
            }
        } else {
            SyncRequest evicted = worker.queue.offer(request);
            if (evicted != null) {
                droppedEvents.increment();
                log.debugf("Event queue of %s is full, dropped a %s request", worker.name, evicted.trigger());
            }
        }
        if (worker.scheduled.compareAndSet(false, true)) {
            executor.execute(() -> drain(worker));
        }
    }

    private void drain(AppWorker worker) {
        while (true) {
            SyncRequest request = worker.pendingSync.getAndSet(null);
            if (request == null) {
                request = worker.queue.poll();
            }
            if (request == null) {
                worker.scheduled.set(false);
                if (!worker.hasPending() || !worker.scheduled.compareAndSet(false, true)) {
                    return;
                }
                continue;
            }
            try {
                process(worker, request);
            } catch (SyncException e) {
                log.errorf("Unable to process %s request for %s: %s", request.trigger(), worker.name, e.getMessage());
            } catch (RuntimeException e) {
                log.errorf(e, "Unexpected failure processing %s request for %s", request.trigger(), worker.name);
            }
        }
    }

    private void process(AppWorker worker, SyncRequest request) {
        if (worker.deleted) {
            return;
        }
        if (request.generation() < worker.generation.get()) {
            log.debugf("Skipping superseded %s request for %s", request.trigger(), worker.name);
            return;
        }
        if (request.trigger() == SyncRequest.Trigger.REFRESH && worker.hasPending()) {
            //whatever comes next assesses health as well
            return;
        }
        if (request.trigger() == SyncRequest.Trigger.SELF_HEAL && (worker.pendingSync.get() != null
                || worker.queue.anyMatch(r -> r.trigger() == SyncRequest.Trigger.SELF_HEAL))) {
            return;
        }
        if (worker.fatalStopped && !request.explicit()) {
            log.debugf("Application %s is stopped after a fatal error, waiting for an explicit sync", worker.name);
            return;
        }
        if (request.trigger() == SyncRequest.Trigger.REFRESH) {
            refreshHealth(worker);
        } else {
            runPass(worker, request);
        }
    }

    private SyncResult runPass(AppWorker worker, SyncRequest request) {
        worker.lock.lock();
        try {
            Application application = applications.get(worker.name);
            worker.application = application;
            if (request.explicit()) {
                worker.fatalStopped = false;
            }
            var src = application.getSpec().getSource();
            String revision = request.revision();
            String fingerprint = "";
            SyncResult result;
            try {
                if (revision == null && request.trigger() == SyncRequest.Trigger.SELF_HEAL) {
                    revision = application.getStatus().getLastSyncedRevision();
                }
                if (revision == null) {
                    revision = reconciler.retryTransient("resolving " + src.getRepoURL(),
                            () -> source.resolve(src.getRepoURL(), src.getTargetRevision()));
                }
                fingerprint = ManifestRenderer.fingerprint(revision, src.getImages());
                String resolved = revision;
                DesiredStateSnapshot snapshot = reconciler.retryTransient("rendering " + worker.name,
                        () -> renderer.render(src.getRepoURL(), resolved, src.getPath(), src.getImages()));
                String namespace = application.getSpec().getDestination().getNamespace();
                if (!request.options().dryRun()) {
                    Map<ObjectKey, ResourceObject> desired = new ConcurrentHashMap<>();
                    for (var i : reconciler.prepare(worker.name, namespace, snapshot)) {
                        desired.put(i.key(), i);
                        watch(i.kind());
                    }
                    worker.desired = desired;
                }
                result = reconciler.sync(worker.name, namespace, snapshot, request.options(),
                        () -> worker.deleted || worker.generation.get() > request.generation());
            } catch (SyncException e) {
                log.errorf("Unable to render %s at %s: %s", worker.name, revision, e.getMessage());
                result = SyncResult.failed(worker.name, fingerprint, revision, e);
            }
            if (result.errorKind() == ErrorKind.FATAL) {
                worker.fatalStopped = true;
            } else if (result.errorKind() == ErrorKind.TRANSIENT_IO && !request.explicit()
                    && request.trigger() == SyncRequest.Trigger.SYNC) {
                watcher.rewind(worker.name);
            }
            if (result.cancelled() || result.dryRun()) {
                return result;
            }
            worker.lastHealth = result.health();
            writeStatus(request, result);
            return result;
        } finally {
            worker.lock.unlock();
        }
    }

    /**
     * Re-assesses the health of the applied objects without writing them.
     */
    private void refreshHealth(AppWorker worker) {
        worker.lock.lock();
        try {
            Health health = Health.HEALTHY;
            Map<ObjectKey, Health> assessed = new HashMap<>();
            for (var key : worker.desired.keySet()) {
                Health h = HealthAssessor.assess(store.find(key.kind(), key.namespace(), key.name()).orElse(null));
                assessed.put(key, h);
                health = health.worst(h);
            }
            Health result = health;
            worker.lastHealth = result;
            applications.updateStatus(worker.name, status -> {
                if (!ModelConstants.HEALTH_PROGRESSING.equals(status.getHealth())) {
                    return;
                }
                status.setHealth(result.getDisplayName());
                for (var i : status.getResources()) {
                    Health h = assessed.get(ObjectKey.of(i.getKind(), i.getNamespace(), i.getName()));
                    if (h != null) {
                        i.setHealth(h.getDisplayName());
                    }
                }
                status.setReconciledAt(clock.instant().toString());
            });
            log.debugf("Refreshed health of %s: %s", worker.name, result.getDisplayName());
        } finally {
            worker.lock.unlock();
        }
    }

    private void writeStatus(SyncRequest request, SyncResult result) {
        String now = clock.instant().toString();
        boolean wrote = result.objects().stream().anyMatch(o -> o.outcome() == SyncOutcome.APPLIED);
        applications.updateStatus(result.application(), status -> {
            status.setPhase(result.phase().getDisplayName());
            status.setHealth(result.health().getDisplayName());
            status.setLastAttemptedFingerprint(result.fingerprint());
            status.setLastAttemptedRevision(result.revision());
            if (result.isSuccessful()) {
                status.setLastSyncedFingerprint(result.fingerprint());
                status.setLastSyncedRevision(result.revision());
            }
            status.setSyncGeneration(request.generation());
            status.setErrorKind(result.errorKind() == null ? null : result.errorKind().getDisplayName());
            status.setMessage(result.message());
            status.setReconciledAt(now);
            status.setResources(resources(result));
            if (request.trigger() == SyncRequest.Trigger.SYNC || wrote) {
                appendHistory(status, result, now);
            }
        });
    }

    private void appendHistory(ApplicationStatus status, SyncResult result, String now) {
        List<SyncHistory> history = new ArrayList<>(status.getHistory());
        history.add(new SyncHistory()
                .setFingerprint(result.fingerprint())
                .setRevision(result.revision())
                .setPhase(result.phase().getDisplayName())
                .setHealth(result.health().getDisplayName())
                .setFinishedAt(now));
        while (history.size() > historyLimit) {
            history.remove(0);
        }
        status.setHistory(history);
    }

    private static List<ResourceStatus> resources(SyncResult result) {
        List<ResourceStatus> resources = new ArrayList<>();
        for (ObjectResult i : result.objects()) {
            resources.add(new ResourceStatus()
                    .setKind(i.key().kind())
                    .setNamespace(i.key().namespace().isEmpty() ? null : i.key().namespace())
                    .setName(i.key().name())
                    .setAction(i.action().getDisplayName())
                    .setOutcome(i.outcome().getDisplayName())
                    .setHealth(i.health().getDisplayName())
                    .setAttempts(i.attempts())
                    .setMessage(i.message().isEmpty() ? null : i.message()));
        }
        return resources;
    }

    private static SyncOptions options(Application application) {
        return new SyncOptions(application.getSpec().getSyncPolicy().isPrune(), false);
    }

    private static final class AppWorker {
        final String name;
        final ReentrantLock lock = new ReentrantLock();
        final BoundedEventQueue<SyncRequest> queue;
        final AtomicLong generation = new AtomicLong();
        final AtomicReference<SyncRequest> pendingSync = new AtomicReference<>();
        final AtomicBoolean scheduled = new AtomicBoolean();
        volatile boolean deleted;
        volatile boolean fatalStopped;
        volatile Application application;
        volatile Health lastHealth = Health.UNKNOWN;
        volatile Map<ObjectKey, ResourceObject> desired = Map.of();

        AppWorker(String name, int capacity) {
            this.name = name;
            this.queue = new BoundedEventQueue<>(capacity);
        }

        boolean hasPending() {
            return pendingSync.get() != null || !queue.isEmpty();
        }
    }
}
