package com.redhat.cdsync.engine.status;

import com.redhat.cdsync.engine.pipeline.PipelineRunRecord;
import com.redhat.cdsync.resources.model.v1alpha1.ApplicationStatus;

/**
 * @param latestPipelineRun the most recent build for the application, or null
 */
public record ApplicationStatusReport(String application, String repoURL, String path, String targetRevision,
        String destinationNamespace, boolean automated, ApplicationStatus status,
        PipelineRunRecord latestPipelineRun) {
}
