package com.redhat.cdsync.cli.pipeline;

import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import com.redhat.cdsync.cli.ExitCodes;
import com.redhat.cdsync.engine.pipeline.PipelineRunRecord;
import com.redhat.cdsync.engine.pipeline.PipelineTrigger;

import picocli.CommandLine;

@CommandLine.Command(name = "submit", mixinStandardHelpOptions = true, description = "Starts a build-and-push pipeline run")
public class PipelineSubmitCommand implements Callable<Integer> {

    @Inject
    PipelineTrigger trigger;

    @CommandLine.Option(names = "--source-ref", description = "Branch, tag or commit to build", required = true)
    String sourceRef;

    @CommandLine.Option(names = "--image-tag", description = "Image to push, REPOSITORY[:TAG]", required = true)
    String imageTag;

    @CommandLine.Option(names = "--application", description = "Application the run builds for")
    String application;

    @Override
    public Integer call() {
        PipelineRunRecord run = trigger.submit(application, sourceRef, imageTag);
        System.out.println(run.runId());
        return ExitCodes.SUCCESS;
    }
}
