package com.redhat.cdsync.cli;

import java.io.PrintWriter;

import jakarta.inject.Inject;

import com.redhat.cdsync.engine.error.SyncException;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import picocli.CommandLine;

@QuarkusMain
public class Main implements QuarkusApplication {

    @Inject
    CommandLine.IFactory factory;

    @Override
    public int run(String... args) throws Exception {
        return commandLine(factory).execute(args);
    }

    /**
     * The command tree with the exit code mapping applied. Bad arguments exit with {@link ExitCodes#USER_ERROR}
     * rather than picocli's default.
     */
    public static CommandLine commandLine(CommandLine.IFactory factory) {
        CommandLine cmd = new CommandLine(MainCommand.class, factory);
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            PrintWriter err = failed.getErr();
            err.println(ex.getMessage());
            failed.usage(err);
            return ExitCodes.USER_ERROR;
        });
        cmd.setExecutionExceptionHandler((ex, failed, parseResult) -> {
            PrintWriter err = failed.getErr();
            if (ex instanceof SyncException) {
                SyncException e = (SyncException) ex;
                err.println(e.getKind().getDisplayName() + ": " + e.getMessage());
                return ExitCodes.forError(e);
            }
            err.println("Error: " + ex.getMessage());
            ex.printStackTrace(err);
            return ExitCodes.SYNC_FAILURE;
        });
        return cmd;
    }
}
