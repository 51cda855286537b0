package com.redhat.cdsync.engine.status;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.redhat.cdsync.engine.app.ApplicationRepository;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.pipeline.PipelineRunRecord;
import com.redhat.cdsync.engine.pipeline.PipelineTrigger;
import com.redhat.cdsync.resources.model.v1alpha1.Application;

/**
 * Read only view combining an application's sync status with its latest build.
 */
public class StatusReporter {

    private final ApplicationRepository applications;
    private final PipelineTrigger pipelines;

    public StatusReporter(ApplicationRepository applications, PipelineTrigger pipelines) {
        this.applications = applications;
        this.pipelines = pipelines;
    }

    /**
     * @throws NotFoundException if the application does not exist
     */
    public ApplicationStatusReport getStatus(String name) {
        return report(applications.get(name));
    }

    /**
     * Reports every application of one listing, so applications deleted meanwhile are simply left out.
     */
    public List<ApplicationStatusReport> getAll() {
        return applications.list().stream().map(this::report).toList();
    }

    private ApplicationStatusReport report(Application application) {
        var spec = application.getSpec();
        return new ApplicationStatusReport(application.getMetadata().getName(), spec.getSource().getRepoURL(),
                spec.getSource().getPath(), spec.getSource().getTargetRevision(), spec.getDestination().getNamespace(),
                spec.getSyncPolicy().isAutomated(), application.getStatus(), latestRun(application).orElse(null));
    }

    /**
     * Runs started for the application win; otherwise the newest run that pushed one of its overridden images.
     */
    Optional<PipelineRunRecord> latestRun(Application application) {
        Optional<PipelineRunRecord> direct = pipelines.latestFor(application.getMetadata().getName());
        if (direct.isPresent()) {
            return direct;
        }
        Set<String> repositories = new HashSet<>();
        for (var i : application.getSpec().getSource().getImages()) {
            repositories.add(i.getNewName() == null ? i.getName() : i.getNewName());
        }
        List<PipelineRunRecord> history = pipelines.history();
        for (int i = history.size() - 1; i >= 0; --i) {
            if (repositories.contains(history.get(i).repository())) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }
}
