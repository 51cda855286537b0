package com.redhat.cdsync.cli.pipeline;

import picocli.CommandLine;

@CommandLine.Command(name = "pipeline", subcommands = {
        PipelineSubmitCommand.class, PipelineAwaitCommand.class }, mixinStandardHelpOptions = true)
public class PipelineCommand {
}
