package com.redhat.cdsync.engine.pipeline;

import java.util.Optional;

/**
 * The external system that builds and pushes images.
 */
public interface PipelineEngine {

    /**
     * Starts a run.
     *
     * @param application the application the run is for, or null
     * @return the id of the new run
     */
    String start(String application, String sourceRef, String imageTag);

    /**
     * The current state of a run, or empty if the engine does not know it.
     */
    Optional<PipelineRunRecord> find(String runId);
}
