package com.redhat.cdsync.resources.model.v1alpha1;

public class ApplicationDestination {

    private String namespace;

    public String getNamespace() {
        return namespace;
    }

    public ApplicationDestination setNamespace(String namespace) {
        this.namespace = namespace;
        return this;
    }
}
