package com.redhat.cdsync.engine.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

import com.redhat.cdsync.engine.error.ErrorKind;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.SyncException;
import com.redhat.cdsync.engine.error.ValidationException;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Submits build-and-push runs and follows them to completion.
 * <p>
 * The run history is append only: a record is replaced exactly once, when its run reaches a terminal outcome, and
 * never again. Succeeded runs publish their digest to the image registry and to the completion listeners.
 */
public class PipelineTrigger {

    private static final Logger log = Logger.getLogger(PipelineTrigger.class);

    private final PipelineEngine engine;
    private final ImageRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Duration pollInterval;
    private final Clock clock;
    private final MeterRegistry meters;
    private final Map<String, PipelineRunRecord> runs = new LinkedHashMap<>();
    private final List<Consumer<PipelineRunRecord>> listeners = new CopyOnWriteArrayList<>();

    public PipelineTrigger(PipelineEngine engine, ImageRegistry registry, ScheduledExecutorService scheduler,
            Duration pollInterval, Clock clock, MeterRegistry meters) {
        this.engine = engine;
        this.registry = registry;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.meters = meters;
    }

    /**
     * Called once for every run that reaches a terminal outcome.
     */
    public void addCompletionListener(Consumer<PipelineRunRecord> listener) {
        listeners.add(listener);
    }

    public PipelineRunRecord submit(String sourceRef, String imageTag) {
        return submit(null, sourceRef, imageTag);
    }

    /**
     * @param imageTag a full image reference, {@code repository[:tag]}
     * @throws ValidationException if either argument is malformed
     */
    public PipelineRunRecord submit(String application, String sourceRef, String imageTag) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new ValidationException("a source reference is required");
        }
        ImageReference image = ImageReference.parse(imageTag);
        String runId = engine.start(application, sourceRef, image.toString());
        PipelineRunRecord record = new PipelineRunRecord(runId, application, sourceRef, image.toString(),
                PipelineOutcome.PENDING, null, null, clock.instant(), null);
        synchronized (this) {
            runs.put(runId, record);
        }
        meters.counter("cdsync_pipeline_runs_submitted").increment();
        return record;
    }

    /**
     * The latest known state of a run, asking the engine for runs submitted elsewhere.
     *
     * @throws NotFoundException if neither this trigger nor the engine know the run
     */
    public PipelineRunRecord get(String runId) {
        synchronized (this) {
            PipelineRunRecord known = runs.get(runId);
            if (known != null && known.isTerminal()) {
                return known;
            }
        }
        return refresh(runId);
    }

    public synchronized List<PipelineRunRecord> history() {
        return List.copyOf(runs.values());
    }

    /**
     * The most recently submitted run for an application.
     */
    public synchronized Optional<PipelineRunRecord> latestFor(String application) {
        List<PipelineRunRecord> all = new ArrayList<>(runs.values());
        for (int i = all.size() - 1; i >= 0; --i) {
            if (application.equals(all.get(i).application())) {
                return Optional.of(all.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Polls the run until it is terminal or the timeout elapses. A timeout completes the stage with the pending
     * record unchanged; engine errors other than transient ones complete it exceptionally.
     */
    public CompletionStage<PipelineRunRecord> awaitAsync(String runId, Duration timeout) {
        CompletableFuture<PipelineRunRecord> result = new CompletableFuture<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                PipelineRunRecord current = get(runId);
                if (current.isTerminal() || System.nanoTime() - deadline >= 0) {
                    result.complete(current);
                }
            } catch (SyncException e) {
                if (e.getKind() != ErrorKind.TRANSIENT_IO) {
                    result.completeExceptionally(e);
                } else if (System.nanoTime() - deadline >= 0) {
                    result.completeExceptionally(e);
                } else {
                    log.debugf("Unable to read pipeline run %s, will retry: %s", runId, e.getMessage());
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, 0, Math.max(1, pollInterval.toMillis()), TimeUnit.MILLISECONDS);
        result.whenComplete((r, t) -> task.cancel(false));
        return result;
    }

    /**
     * Blocking form of {@link #awaitAsync(String, Duration)}.
     */
    public PipelineRunRecord await(String runId, Duration timeout) {
        try {
            return awaitAsync(runId, timeout).toCompletableFuture().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private PipelineRunRecord refresh(String runId) {
        PipelineRunRecord observed = engine.find(runId).orElse(null);
        PipelineRunRecord completed = null;
        PipelineRunRecord result;
        synchronized (this) {
            PipelineRunRecord known = runs.get(runId);
            if (observed == null) {
                if (known == null) {
                    throw new NotFoundException("pipeline run " + runId + " not found");
                }
                return known;
            }
            if (known != null && known.isTerminal()) {
                return known;
            }
            PipelineRunRecord base = known != null ? known : observed;
            if (!observed.isTerminal()) {
                result = base;
            } else {
                PipelineOutcome outcome = observed.outcome();
                String message = observed.message();
                if (outcome == PipelineOutcome.SUCCEEDED && (observed.digest() == null || observed.digest().isEmpty())) {
                    outcome = PipelineOutcome.FAILED;
                    message = "pipeline succeeded without reporting an image digest";
                }
                result = base.complete(outcome, outcome == PipelineOutcome.SUCCEEDED ? observed.digest() : null,
                        message, observed.completedAt() == null ? clock.instant() : observed.completedAt());
                completed = result;
            }
            runs.put(runId, result);
        }
        if (completed != null) {
            onCompleted(completed);
        }
        return result;
    }

    private void onCompleted(PipelineRunRecord record) {
        meters.counter("cdsync_pipeline_runs", "outcome", record.outcome().getDisplayName()).increment();
        if (record.outcome() == PipelineOutcome.SUCCEEDED) {
            registry.record(record.repository(), record.tag(), record.digest());
            log.infof("Pipeline run %s pushed %s@%s", record.runId(), record.imageTag(), record.digest());
        } else {
            log.errorf("Pipeline run %s failed: %s", record.runId(), record.message());
        }
        for (var i : listeners) {
            try {
                i.accept(record);
            } catch (RuntimeException e) {
                log.errorf(e, "Completion listener failed for pipeline run %s", record.runId());
            }
        }
    }
}
