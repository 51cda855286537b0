package com.redhat.cdsync.cli;

import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import com.redhat.cdsync.engine.app.ApplicationController;

import picocli.CommandLine;

@CommandLine.Command(name = "delete-application", mixinStandardHelpOptions = true, description = "Deletes an application")
public class DeleteApplicationCommand implements Callable<Integer> {

    @Inject
    ApplicationController controller;

    @CommandLine.Parameters(index = "0", description = "Application name")
    String application;

    @CommandLine.Option(names = "--cascade", description = "Also delete the live objects the application owns")
    boolean cascade;

    @Override
    public Integer call() {
        int deleted = controller.deleteApplication(application, cascade);
        if (cascade) {
            System.out.println("Application " + application + " deleted with " + deleted + " owned objects");
        } else {
            System.out.println("Application " + application + " deleted, owned objects were kept");
        }
        return ExitCodes.SUCCESS;
    }
}
