package com.redhat.cdsync.cli;

import com.redhat.cdsync.cli.pipeline.PipelineCommand;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@CommandLine.Command(name = "cdsync", mixinStandardHelpOptions = true, subcommands = {
        CreateApplicationCommand.class,
        SyncCommand.class,
        GetStatusCommand.class,
        DeleteApplicationCommand.class,
        PipelineCommand.class
})
@TopCommand
public class MainCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        System.out.println(spec.commandLine().getUsageMessage());
    }
}
