package com.redhat.cdsync.controller;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import com.redhat.cdsync.engine.app.ApplicationRepository;
import com.redhat.cdsync.engine.error.SyncException;

/**
 * Ready once the applications can be listed from the object store.
 */
@Readiness
@ApplicationScoped
public class ObjectStoreHealthCheck implements HealthCheck {

    final ApplicationRepository applications;

    public ObjectStoreHealthCheck(ApplicationRepository applications) {
        this.applications = applications;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            int count = applications.list().size();
            return HealthCheckResponse.named("Object store")
                    .up()
                    .withData("namespace", applications.getNamespace())
                    .withData("applications", count)
                    .build();
        } catch (SyncException e) {
            return HealthCheckResponse.named("Object store")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
