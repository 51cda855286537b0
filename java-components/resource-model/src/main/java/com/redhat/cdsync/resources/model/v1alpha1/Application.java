package com.redhat.cdsync.resources.model.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A tracked mapping from a path in a deployment repository to a destination namespace.
 */
@Group(ModelConstants.GROUP)
@Version(ModelConstants.VERSION)
@JsonInclude(Include.NON_NULL)
public class Application extends CustomResource<ApplicationSpec, ApplicationStatus>
        implements Namespaced {

    @Override
    protected ApplicationSpec initSpec() {
        return new ApplicationSpec();
    }

    @Override
    protected ApplicationStatus initStatus() {
        return new ApplicationStatus();
    }
}
