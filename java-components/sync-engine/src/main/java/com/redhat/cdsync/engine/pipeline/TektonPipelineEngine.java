package com.redhat.cdsync.engine.pipeline;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.lang3.RandomStringUtils;
import org.jboss.logging.Logger;

import com.redhat.cdsync.engine.store.KubernetesErrors;
import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.tekton.client.TektonClient;
import io.fabric8.tekton.pipeline.v1.Param;
import io.fabric8.tekton.pipeline.v1.ParamBuilder;
import io.fabric8.tekton.pipeline.v1.PipelineRun;
import io.fabric8.tekton.pipeline.v1.PipelineRunBuilder;

/**
 * Runs the build-and-push pipeline as Tekton {@code PipelineRun} objects. The pipeline receives {@code SOURCE_REF}
 * and {@code IMAGE_TAG} parameters and must report the pushed digest in its {@code IMAGE_DIGEST} result.
 */
public class TektonPipelineEngine implements PipelineEngine {

    private static final Logger log = Logger.getLogger(TektonPipelineEngine.class);

    public static final String SOURCE_REF = "SOURCE_REF";
    public static final String IMAGE_TAG = "IMAGE_TAG";
    public static final String IMAGE_DIGEST = "IMAGE_DIGEST";
    static final String SUCCEEDED = "Succeeded";

    private final TektonClient client;
    private final String namespace;
    private final String pipelineName;

    public TektonPipelineEngine(TektonClient client, String namespace, String pipelineName) {
        this.client = client;
        this.namespace = namespace;
        this.pipelineName = pipelineName;
    }

    @Override
    public String start(String application, String sourceRef, String imageTag) {
        String name = pipelineName + "-" + RandomStringUtils.randomAlphanumeric(5).toLowerCase(Locale.ROOT);
        PipelineRun run = new PipelineRunBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .addToLabels(ModelConstants.MANAGED_BY_LABEL, ModelConstants.MANAGED_BY_VALUE)
                .endMetadata()
                .withNewSpec()
                .withNewPipelineRef().withName(pipelineName).endPipelineRef()
                .addToParams(param(SOURCE_REF, sourceRef), param(IMAGE_TAG, imageTag))
                .endSpec()
                .build();
        if (application != null) {
            run.getMetadata().getLabels().put(ModelConstants.PIPELINE_APPLICATION_LABEL, application);
        }
        try {
            PipelineRun created = client.v1().pipelineRuns().inNamespace(namespace).resource(run).create();
            log.infof("Started pipeline run %s for %s -> %s", created.getMetadata().getName(), sourceRef, imageTag);
            return created.getMetadata().getName();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.translate("create pipeline run " + name, e);
        }
    }

    @Override
    public Optional<PipelineRunRecord> find(String runId) {
        try {
            PipelineRun run = client.v1().pipelineRuns().inNamespace(namespace).withName(runId).get();
            return Optional.ofNullable(run).map(TektonPipelineEngine::toRecord);
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.translate("read pipeline run " + runId, e);
        }
    }

    /**
     * Maps a run onto a record: the {@code Succeeded} condition gives the outcome, {@code Unknown} or no condition
     * means the run is still pending.
     */
    public static PipelineRunRecord toRecord(PipelineRun run) {
        var labels = run.getMetadata().getLabels();
        String application = labels == null ? null : labels.get(ModelConstants.PIPELINE_APPLICATION_LABEL);
        String sourceRef = null;
        String imageTag = null;
        if (run.getSpec() != null && run.getSpec().getParams() != null) {
            for (Param i : run.getSpec().getParams()) {
                String value = i.getValue() == null ? null : i.getValue().getStringVal();
                if (SOURCE_REF.equals(i.getName())) {
                    sourceRef = value;
                } else if (IMAGE_TAG.equals(i.getName())) {
                    imageTag = value;
                }
            }
        }
        Instant submittedAt = instant(run.getMetadata().getCreationTimestamp());
        PipelineOutcome outcome = PipelineOutcome.PENDING;
        String message = null;
        String digest = null;
        Instant completedAt = null;
        var status = run.getStatus();
        if (status != null) {
            if (status.getConditions() != null) {
                for (var i : status.getConditions()) {
                    if (Objects.equals(SUCCEEDED, i.getType())) {
                        message = i.getMessage();
                        if ("true".equalsIgnoreCase(i.getStatus())) {
                            outcome = PipelineOutcome.SUCCEEDED;
                        } else if ("false".equalsIgnoreCase(i.getStatus())) {
                            outcome = PipelineOutcome.FAILED;
                        }
                    }
                }
            }
            if (status.getResults() != null) {
                for (var i : status.getResults()) {
                    if (IMAGE_DIGEST.equals(i.getName()) && i.getValue() != null) {
                        digest = i.getValue().getStringVal();
                    }
                }
            }
            if (outcome.isTerminal()) {
                completedAt = instant(status.getCompletionTime());
            }
        }
        if (outcome != PipelineOutcome.SUCCEEDED) {
            digest = null;
        }
        return new PipelineRunRecord(run.getMetadata().getName(), application, sourceRef, imageTag, outcome, digest,
                message, submittedAt, completedAt);
    }

    private static Param param(String name, String value) {
        return new ParamBuilder().withName(name).withNewValue(value).build();
    }

    private static Instant instant(String timestamp) {
        return timestamp == null || timestamp.isEmpty() ? null : Instant.parse(timestamp);
    }
}
