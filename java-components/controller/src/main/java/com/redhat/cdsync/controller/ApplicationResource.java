package com.redhat.cdsync.controller;

import java.util.List;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import com.redhat.cdsync.engine.status.ApplicationStatusReport;
import com.redhat.cdsync.engine.status.StatusReporter;

import io.smallrye.common.annotation.Blocking;

/**
 * Read-only view of application status. Changes go through the CLI or the object store.
 */
@Path("/api/applications")
@Produces(MediaType.APPLICATION_JSON)
@Blocking
public class ApplicationResource {

    final StatusReporter statusReporter;

    public ApplicationResource(StatusReporter statusReporter) {
        this.statusReporter = statusReporter;
    }

    @GET
    public List<ApplicationStatusReport> list() {
        return statusReporter.getAll();
    }

    @GET
    @Path("{name}/status")
    public ApplicationStatusReport status(@PathParam("name") String name) {
        return statusReporter.getStatus(name);
    }
}
