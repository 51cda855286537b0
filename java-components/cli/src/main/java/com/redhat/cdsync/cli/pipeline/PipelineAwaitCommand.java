package com.redhat.cdsync.cli.pipeline;

import java.time.Duration;
import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import com.redhat.cdsync.cli.DurationOptionConverter;
import com.redhat.cdsync.cli.ExitCodes;
import com.redhat.cdsync.engine.pipeline.PipelineOutcome;
import com.redhat.cdsync.engine.pipeline.PipelineRunRecord;
import com.redhat.cdsync.engine.pipeline.PipelineTrigger;

import picocli.CommandLine;

/**
 * Waits for a run to finish. A run still pending when the timeout elapses is reported as such and can be awaited
 * again.
 */
@CommandLine.Command(name = "await", mixinStandardHelpOptions = true, description = "Waits for a pipeline run to finish")
public class PipelineAwaitCommand implements Callable<Integer> {

    @Inject
    PipelineTrigger trigger;

    @CommandLine.Parameters(index = "0", description = "Pipeline run id")
    String runId;

    @CommandLine.Option(names = "--timeout", description = "How long to wait, for example 30s or 10m", defaultValue = "10m", converter = DurationOptionConverter.class)
    Duration timeout;

    @Override
    public Integer call() {
        PipelineRunRecord run = trigger.await(runId, timeout);
        switch (run.outcome()) {
            case SUCCEEDED:
                System.out.println(run.runId() + " " + PipelineOutcome.SUCCEEDED.getDisplayName() + " " + run.imageTag()
                        + "@" + run.digest());
                return ExitCodes.SUCCESS;
            case FAILED:
                System.out.println(run.runId() + " " + PipelineOutcome.FAILED.getDisplayName() + ": " + run.message());
                return ExitCodes.SYNC_FAILURE;
            default:
                System.out.println(run.runId() + " still " + run.outcome().getDisplayName() + " after " + timeout);
                return ExitCodes.SYNC_FAILURE;
        }
    }
}
