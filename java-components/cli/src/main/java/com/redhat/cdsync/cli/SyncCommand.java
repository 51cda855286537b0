package com.redhat.cdsync.cli;

import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import com.redhat.cdsync.engine.app.ApplicationController;
import com.redhat.cdsync.engine.reconcile.ObjectResult;
import com.redhat.cdsync.engine.reconcile.SyncOptions;
import com.redhat.cdsync.engine.reconcile.SyncResult;

import picocli.CommandLine;

@CommandLine.Command(name = "sync", mixinStandardHelpOptions = true, description = "Syncs an application with its source now")
public class SyncCommand implements Callable<Integer> {

    @Inject
    ApplicationController controller;

    @CommandLine.Parameters(index = "0", description = "Application name")
    String application;

    @CommandLine.Option(names = "--prune", description = "Delete owned objects that are no longer declared")
    boolean prune;

    @CommandLine.Option(names = "--dry-run", description = "Show what would change without writing anything")
    boolean dryRun;

    @Override
    public Integer call() {
        SyncResult result = controller.syncNow(application, new SyncOptions(prune, dryRun));
        for (ObjectResult i : result.objects()) {
            System.out.print(i.key());
            System.out.print("   ");
            System.out.print(i.action().getDisplayName());
            System.out.print("   ");
            System.out.print(i.outcome().getDisplayName());
            if (i.message() != null && !i.message().isEmpty()) {
                System.out.print("   ");
                System.out.print(i.message());
            }
            System.out.println();
        }
        System.out.println((dryRun ? "Dry run " : "Sync ") + result.phase().getDisplayName() + " at revision "
                + result.revision() + ", health " + result.health().getDisplayName());
        if (result.cancelled()) {
            System.out.println("Sync cancelled by a newer request");
            return ExitCodes.SYNC_FAILURE;
        }
        if (!result.isSuccessful()) {
            String kind = result.errorKind() == null ? "Error" : result.errorKind().getDisplayName();
            System.out.println(kind + ": " + result.message());
            return ExitCodes.SYNC_FAILURE;
        }
        return ExitCodes.SUCCESS;
    }
}
