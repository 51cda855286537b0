package com.redhat.cdsync.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import com.redhat.cdsync.engine.app.ApplicationController;
import com.redhat.cdsync.resources.model.v1alpha1.Application;
import com.redhat.cdsync.resources.model.v1alpha1.ApplicationSpec;
import com.redhat.cdsync.resources.model.v1alpha1.ImageOverride;
import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import picocli.CommandLine;

@CommandLine.Command(name = "create-application", mixinStandardHelpOptions = true, description = "Creates an application")
public class CreateApplicationCommand implements Callable<Integer> {

    @Inject
    ApplicationController controller;

    @CommandLine.Parameters(index = "0", description = "Application name")
    String name;

    @CommandLine.Option(names = "--repo", description = "Repository URL or local directory", required = true)
    String repo;

    @CommandLine.Option(names = "--path", description = "Directory of the manifests inside the repository", required = true)
    String path;

    @CommandLine.Option(names = "--revision", description = "Branch, tag or commit to follow", defaultValue = ModelConstants.DEFAULT_TARGET_REVISION)
    String revision;

    @CommandLine.Option(names = "--dest-namespace", description = "Namespace the manifests are applied to", required = true)
    String destNamespace;

    @CommandLine.Option(names = "--automated", description = "Sync new revisions without an explicit request")
    boolean automated;

    @CommandLine.Option(names = "--self-heal", description = "Revert drift in live objects")
    boolean selfHeal;

    @CommandLine.Option(names = "--prune", description = "Delete owned objects that are no longer declared")
    boolean prune;

    @CommandLine.Option(names = "--image", description = "Image to rewrite, NAME or NAME=NEW_NAME. Pipeline runs pushing to the image update it.")
    List<String> images = new ArrayList<>();

    @Override
    public Integer call() {
        ApplicationSpec spec = new ApplicationSpec();
        spec.getSource()
                .setRepoURL(repo)
                .setPath(path)
                .setTargetRevision(revision);
        for (var i : images) {
            spec.getSource().getImages().add(imageOverride(i));
        }
        spec.getDestination().setNamespace(destNamespace);
        spec.getSyncPolicy()
                .setAutomated(automated)
                .setSelfHeal(selfHeal)
                .setPrune(prune);

        Application application = new Application();
        application.setMetadata(new ObjectMetaBuilder().withName(name).build());
        application.setSpec(spec);
        controller.createApplication(application);
        System.out.println("Application " + name + " created");
        return ExitCodes.SUCCESS;
    }

    static ImageOverride imageOverride(String value) {
        int index = value.indexOf('=');
        if (index < 0) {
            return new ImageOverride().setName(value);
        }
        return new ImageOverride().setName(value.substring(0, index)).setNewName(value.substring(index + 1));
    }
}
