package com.redhat.cdsync.resources.model.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApplicationSpec {

    private ApplicationSource source = new ApplicationSource();
    private ApplicationDestination destination = new ApplicationDestination();
    private SyncPolicy syncPolicy = new SyncPolicy();

    public ApplicationSource getSource() {
        return source;
    }

    public ApplicationSpec setSource(ApplicationSource source) {
        this.source = source;
        return this;
    }

    public ApplicationDestination getDestination() {
        return destination;
    }

    public ApplicationSpec setDestination(ApplicationDestination destination) {
        this.destination = destination;
        return this;
    }

    public SyncPolicy getSyncPolicy() {
        return syncPolicy;
    }

    public ApplicationSpec setSyncPolicy(SyncPolicy syncPolicy) {
        this.syncPolicy = syncPolicy;
        return this;
    }
}
