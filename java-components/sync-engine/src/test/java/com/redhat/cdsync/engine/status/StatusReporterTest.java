package com.redhat.cdsync.engine.status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.app.ApplicationRepository;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.pipeline.InMemoryImageRegistry;
import com.redhat.cdsync.engine.pipeline.PipelineEngine;
import com.redhat.cdsync.engine.pipeline.PipelineRunRecord;
import com.redhat.cdsync.engine.pipeline.PipelineTrigger;
import com.redhat.cdsync.engine.store.InMemoryObjectStore;
import com.redhat.cdsync.engine.store.KindRegistry;
import com.redhat.cdsync.resources.model.v1alpha1.Application;
import com.redhat.cdsync.resources.model.v1alpha1.ImageOverride;
import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class StatusReporterTest {

    ScheduledExecutorService scheduler;
    ApplicationRepository applications;
    PipelineTrigger pipelines;
    StatusReporter reporter;
    int runs;
    boolean deletedAfterListing;

    @BeforeEach
    void setup() {
        KindRegistry kinds = KindRegistry.defaults();
        applications = new ApplicationRepository(new InMemoryObjectStore(kinds), kinds, "cdsync");
        scheduler = Executors.newSingleThreadScheduledExecutor();
        PipelineEngine engine = new PipelineEngine() {
            @Override
            public String start(String application, String sourceRef, String imageTag) {
                return "run-" + (++runs);
            }

            @Override
            public Optional<PipelineRunRecord> find(String runId) {
                return Optional.empty();
            }
        };
        pipelines = new PipelineTrigger(engine, new InMemoryImageRegistry(), scheduler, Duration.ofSeconds(1),
                Clock.systemUTC(), new SimpleMeterRegistry());
        reporter = new StatusReporter(applications, pipelines);
    }

    @AfterEach
    void close() {
        scheduler.shutdownNow();
    }

    void create(String name, String image) {
        Application application = new Application();
        application.setMetadata(new ObjectMetaBuilder().withName(name).build());
        application.getSpec().getSource().setRepoURL("https://git.example.com/deploy.git").setPath("apps/" + name);
        application.getSpec().getDestination().setNamespace(name + "-prod");
        if (image != null) {
            application.getSpec().getSource().getImages().add(new ImageOverride(image, null, null, null));
        }
        applications.create(application);
    }

    @Test
    void reportsNewApplication() {
        create("shop", null);
        ApplicationStatusReport report = reporter.getStatus("shop");
        assertThat(report.repoURL()).isEqualTo("https://git.example.com/deploy.git");
        assertThat(report.path()).isEqualTo("apps/shop");
        assertThat(report.targetRevision()).isEqualTo("HEAD");
        assertThat(report.destinationNamespace()).isEqualTo("shop-prod");
        assertThat(report.status().getPhase()).isEqualTo(ModelConstants.PHASE_IDLE);
        assertThat(report.status().getHealth()).isEqualTo(ModelConstants.HEALTH_UNKNOWN);
        assertThat(report.latestPipelineRun()).isNull();
    }

    @Test
    void includesLatestBuild() {
        create("shop", null);
        create("blog", "quay.io/acme/blog");
        pipelines.submit("shop", "main", "quay.io/acme/shop:1");
        PipelineRunRecord second = pipelines.submit("shop", "main", "quay.io/acme/shop:2");
        PipelineRunRecord blog = pipelines.submit("v3", "quay.io/acme/blog:3");

        assertThat(reporter.getStatus("shop").latestPipelineRun()).isEqualTo(second);
        assertThat(reporter.getStatus("blog").latestPipelineRun()).isEqualTo(blog);
        assertThat(reporter.getAll()).extracting(ApplicationStatusReport::application)
                .containsExactlyInAnyOrder("shop", "blog");
    }

    @Test
    void listingDoesNotLookApplicationsUpAgain() {
        KindRegistry kinds = KindRegistry.defaults();
        applications = new ApplicationRepository(new InMemoryObjectStore(kinds), kinds, "cdsync") {
            @Override
            public Application get(String name) {
                if (deletedAfterListing) {
                    throw new NotFoundException("application " + name + " was deleted");
                }
                return super.get(name);
            }
        };
        reporter = new StatusReporter(applications, pipelines);
        create("shop", null);
        create("blog", null);
        deletedAfterListing = true;

        assertThat(reporter.getAll()).extracting(ApplicationStatusReport::destinationNamespace)
                .containsExactlyInAnyOrder("shop-prod", "blog-prod");
    }

    @Test
    void unknownApplication() {
        assertThatThrownBy(() -> reporter.getStatus("missing")).isInstanceOf(NotFoundException.class);
    }
}
