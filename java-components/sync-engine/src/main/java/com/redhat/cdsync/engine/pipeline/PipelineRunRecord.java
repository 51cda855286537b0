package com.redhat.cdsync.engine.pipeline;

import java.time.Instant;

/**
 * One build-and-push run. Records in a terminal outcome never change.
 *
 * @param application the application the run was started for, or null
 * @param imageTag the full image reference the run pushes, {@code repository:tag}
 * @param digest the pushed image digest, only set when the run succeeded
 * @param completedAt null while pending
 */
public record PipelineRunRecord(String runId, String application, String sourceRef, String imageTag,
        PipelineOutcome outcome, String digest, String message, Instant submittedAt, Instant completedAt) {

    public boolean isTerminal() {
        return outcome.isTerminal();
    }

    /**
     * The image repository, {@code imageTag} without the tag.
     */
    public String repository() {
        return ImageReference.parse(imageTag).repository();
    }

    public String tag() {
        return ImageReference.parse(imageTag).tag();
    }

    PipelineRunRecord complete(PipelineOutcome outcome, String digest, String message, Instant completedAt) {
        return new PipelineRunRecord(runId, application, sourceRef, imageTag, outcome, digest, message, submittedAt,
                completedAt);
    }
}
