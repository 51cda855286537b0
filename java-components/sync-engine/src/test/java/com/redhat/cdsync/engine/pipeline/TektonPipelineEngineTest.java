package com.redhat.cdsync.engine.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;

import io.fabric8.knative.internal.pkg.apis.Condition;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.tekton.client.TektonClient;
import io.fabric8.tekton.pipeline.v1.ParamValue;
import io.fabric8.tekton.pipeline.v1.PipelineRun;
import io.fabric8.tekton.pipeline.v1.PipelineRunBuilder;
import io.fabric8.tekton.pipeline.v1.PipelineRunResult;
import io.fabric8.tekton.pipeline.v1.PipelineRunStatus;

@EnableKubernetesMockClient(crud = true)
class TektonPipelineEngineTest {

    KubernetesClient client;

    TektonClient tekton;
    TektonPipelineEngine engine;

    @BeforeEach
    void setup() {
        tekton = client.adapt(TektonClient.class);
        engine = new TektonPipelineEngine(tekton, "builds", "build-and-push");
    }

    @Test
    void startCreatesPipelineRun() {
        String id = engine.start("shop", "refs/heads/main", "quay.io/acme/web:1.0");
        assertThat(id).startsWith("build-and-push-");

        PipelineRun run = tekton.v1().pipelineRuns().inNamespace("builds").withName(id).get();
        assertThat(run.getSpec().getPipelineRef().getName()).isEqualTo("build-and-push");
        assertThat(run.getSpec().getParams()).extracting(p -> p.getName() + "=" + p.getValue().getStringVal())
                .containsExactly("SOURCE_REF=refs/heads/main", "IMAGE_TAG=quay.io/acme/web:1.0");
        assertThat(run.getMetadata().getLabels()).containsEntry(ModelConstants.PIPELINE_APPLICATION_LABEL, "shop");

        PipelineRunRecord record = engine.find(id).orElseThrow();
        assertThat(record.outcome()).isEqualTo(PipelineOutcome.PENDING);
        assertThat(record.application()).isEqualTo("shop");
        assertThat(record.sourceRef()).isEqualTo("refs/heads/main");
        assertThat(record.imageTag()).isEqualTo("quay.io/acme/web:1.0");
        assertThat(engine.find("unknown")).isEmpty();
    }

    @Test
    void succeededConditionCarriesDigest() {
        PipelineRun run = run("True", "sha256:abcd");
        PipelineRunRecord record = TektonPipelineEngine.toRecord(run);
        assertThat(record.outcome()).isEqualTo(PipelineOutcome.SUCCEEDED);
        assertThat(record.digest()).isEqualTo("sha256:abcd");
        assertThat(record.completedAt()).hasToString("2024-05-01T10:05:00Z");
        assertThat(record.application()).isNull();
    }

    @Test
    void failedAndRunningConditions() {
        PipelineRunRecord failed = TektonPipelineEngine.toRecord(run("False", "sha256:abcd"));
        assertThat(failed.outcome()).isEqualTo(PipelineOutcome.FAILED);
        assertThat(failed.digest()).isNull();
        assertThat(failed.message()).isEqualTo("finished");

        PipelineRunRecord running = TektonPipelineEngine.toRecord(run("Unknown", null));
        assertThat(running.outcome()).isEqualTo(PipelineOutcome.PENDING);
        assertThat(running.completedAt()).isNull();
    }

    PipelineRun run(String succeeded, String digest) {
        PipelineRun run = new PipelineRunBuilder()
                .withNewMetadata().withName("build-1").withLabels(Map.of()).endMetadata()
                .withNewSpec().withNewPipelineRef().withName("build-and-push").endPipelineRef().endSpec()
                .build();
        Condition condition = new Condition();
        condition.setType("Succeeded");
        condition.setStatus(succeeded);
        condition.setMessage("finished");
        PipelineRunStatus status = new PipelineRunStatus();
        status.setConditions(List.of(condition));
        if (digest != null) {
            status.setResults(List.of(new PipelineRunResult("IMAGE_DIGEST", new ParamValue(digest))));
        }
        status.setCompletionTime("2024-05-01T10:05:00Z");
        run.setStatus(status);
        return run;
    }
}
