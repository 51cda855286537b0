package com.redhat.cdsync.engine.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.ValidationException;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class PipelineTriggerTest {

    FakePipelineEngine engine;
    InMemoryImageRegistry registry;
    ScheduledExecutorService scheduler;
    SimpleMeterRegistry meters;
    PipelineTrigger trigger;
    List<PipelineRunRecord> completed;

    @BeforeEach
    void setup() {
        engine = new FakePipelineEngine();
        registry = new InMemoryImageRegistry();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        meters = new SimpleMeterRegistry();
        trigger = new PipelineTrigger(engine, registry, scheduler, Duration.ofMillis(10),
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC), meters);
        completed = new ArrayList<>();
        trigger.addCompletionListener(completed::add);
    }

    @AfterEach
    void close() throws Exception {
        scheduler.shutdownNow();
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void submitStartsPendingRun() {
        PipelineRunRecord run = trigger.submit("shop", "refs/heads/main", "quay.io/acme/web");
        assertThat(run.outcome()).isEqualTo(PipelineOutcome.PENDING);
        assertThat(run.imageTag()).isEqualTo("quay.io/acme/web:latest");
        assertThat(run.repository()).isEqualTo("quay.io/acme/web");
        assertThat(run.submittedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(trigger.history()).containsExactly(run);
        assertThat(trigger.latestFor("shop")).contains(run);
        assertThat(trigger.latestFor("blog")).isEmpty();
    }

    @Test
    void submitValidatesInput() {
        assertThatThrownBy(() -> trigger.submit(" ", "quay.io/acme/web:1.0")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> trigger.submit("main", "quay.io/acme/web@sha256:abcd"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> trigger.submit("main", "")).isInstanceOf(ValidationException.class);
        assertThat(engine.runs).isEmpty();
    }

    @Test
    void succeededRunRecordsDigest() {
        PipelineRunRecord run = trigger.submit("main", "localhost:5000/web:1.2");
        assertThat(run.repository()).isEqualTo("localhost:5000/web");
        assertThat(run.tag()).isEqualTo("1.2");
        engine.finish(run.runId(), PipelineOutcome.SUCCEEDED, "sha256:abcd", "done");

        PipelineRunRecord finished = trigger.await(run.runId(), Duration.ofSeconds(5));
        assertThat(finished.outcome()).isEqualTo(PipelineOutcome.SUCCEEDED);
        assertThat(finished.digest()).isEqualTo("sha256:abcd");
        assertThat(finished.submittedAt()).isEqualTo(run.submittedAt());
        assertThat(registry.digest("localhost:5000/web", "1.2")).contains("sha256:abcd");
        assertThat(completed).containsExactly(finished);
        assertThat(meters.counter("cdsync_pipeline_runs", "outcome", "Succeeded").count()).isEqualTo(1.0);
    }

    @Test
    void terminalRecordsNeverChange() {
        PipelineRunRecord run = trigger.submit("main", "quay.io/acme/web:1.0");
        engine.finish(run.runId(), PipelineOutcome.FAILED, null, "build failed");
        PipelineRunRecord failed = trigger.get(run.runId());
        assertThat(failed.outcome()).isEqualTo(PipelineOutcome.FAILED);
        assertThat(failed.message()).isEqualTo("build failed");

        engine.finish(run.runId(), PipelineOutcome.SUCCEEDED, "sha256:abcd", "rerun");
        int finds = engine.finds();
        assertThat(trigger.get(run.runId())).isEqualTo(failed);
        assertThat(trigger.await(run.runId(), Duration.ofSeconds(1))).isEqualTo(failed);
        assertThat(engine.finds()).isEqualTo(finds);
        assertThat(completed).hasSize(1);
        assertThat(registry.digest("quay.io/acme/web", "1.0")).isEmpty();
    }

    @Test
    void successWithoutDigestFails() {
        PipelineRunRecord run = trigger.submit("main", "quay.io/acme/web:1.0");
        engine.finish(run.runId(), PipelineOutcome.SUCCEEDED, null, "done");
        PipelineRunRecord result = trigger.get(run.runId());
        assertThat(result.outcome()).isEqualTo(PipelineOutcome.FAILED);
        assertThat(result.digest()).isNull();
    }

    @Test
    void timeoutReturnsPendingRecord() {
        PipelineRunRecord run = trigger.submit("main", "quay.io/acme/web:1.0");
        PipelineRunRecord result = trigger.await(run.runId(), Duration.ofMillis(50));
        assertThat(result).isEqualTo(run);
        assertThat(completed).isEmpty();
    }

    @Test
    void awaitCompletesWhenRunFinishes() throws Exception {
        PipelineRunRecord run = trigger.submit("main", "quay.io/acme/web:1.0");
        var stage = trigger.awaitAsync(run.runId(), Duration.ofSeconds(10)).toCompletableFuture();
        Thread.sleep(50);
        assertThat(stage).isNotDone();
        engine.finish(run.runId(), PipelineOutcome.SUCCEEDED, "sha256:abcd", "done");
        assertThat(stage.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(PipelineOutcome.SUCCEEDED);
    }

    @Test
    void runsStartedElsewhereAreLookedUp() {
        String id = engine.start(null, "main", "quay.io/acme/web:2.0");
        engine.finish(id, PipelineOutcome.SUCCEEDED, "sha256:ffff", "done");
        assertThat(trigger.get(id).digest()).isEqualTo("sha256:ffff");
        assertThatThrownBy(() -> trigger.get("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> trigger.await("missing", Duration.ofSeconds(1)))
                .isInstanceOf(NotFoundException.class);
    }
}
