package com.redhat.cdsync.cli;

import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redhat.cdsync.engine.pipeline.PipelineRunRecord;
import com.redhat.cdsync.engine.status.ApplicationStatusReport;
import com.redhat.cdsync.engine.status.StatusReporter;
import com.redhat.cdsync.resources.model.v1alpha1.ApplicationStatus;
import com.redhat.cdsync.resources.model.v1alpha1.ResourceStatus;

import picocli.CommandLine;

@CommandLine.Command(name = "get-status", mixinStandardHelpOptions = true, description = "Shows the sync and health status of an application")
public class GetStatusCommand implements Callable<Integer> {

    @Inject
    StatusReporter statusReporter;

    @Inject
    ObjectMapper mapper;

    @CommandLine.Parameters(index = "0", description = "Application name")
    String application;

    @CommandLine.Option(names = "--json", description = "Print the status as JSON")
    boolean json;

    @Override
    public Integer call() throws JsonProcessingException {
        ApplicationStatusReport report = statusReporter.getStatus(application);
        if (json) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            return ExitCodes.SUCCESS;
        }
        ApplicationStatus status = report.status();
        System.out.println("Application:      " + report.application());
        System.out.println("Source:           " + report.repoURL() + " " + report.path() + "@" + report.targetRevision());
        System.out.println("Destination:      " + report.destinationNamespace());
        System.out.println("Automated:        " + report.automated());
        System.out.println("Phase:            " + status.getPhase());
        System.out.println("Health:           " + status.getHealth());
        System.out.println("Synced revision:  " + orNone(status.getLastSyncedRevision()));
        System.out.println("Reconciled at:    " + orNone(status.getReconciledAt()));
        if (status.getErrorKind() != null) {
            System.out.println("Error:            " + status.getErrorKind() + ": " + status.getMessage());
        }
        PipelineRunRecord run = report.latestPipelineRun();
        if (run != null) {
            System.out.println("Latest pipeline:  " + run.runId() + " " + run.imageTag() + " "
                    + run.outcome().getDisplayName());
        }
        if (!status.getResources().isEmpty()) {
            System.out.println();
            int longest = 0;
            for (ResourceStatus i : status.getResources()) {
                longest = Math.max(longest, describe(i).length());
            }
            for (ResourceStatus i : status.getResources()) {
                String name = describe(i);
                System.out.print(name);
                for (var c = 0; c < (longest - name.length()); ++c) {
                    System.out.print(" ");
                }
                System.out.print("   ");
                System.out.print(i.getOutcome());
                System.out.print("   ");
                System.out.println(i.getHealth());
            }
        }
        return ExitCodes.SUCCESS;
    }

    private static String describe(ResourceStatus resource) {
        if (resource.getNamespace() == null || resource.getNamespace().isEmpty()) {
            return resource.getKind() + "/" + resource.getName();
        }
        return resource.getKind() + "/" + resource.getNamespace() + "/" + resource.getName();
    }

    private static String orNone(String value) {
        return value == null ? "<none>" : value;
    }
}
