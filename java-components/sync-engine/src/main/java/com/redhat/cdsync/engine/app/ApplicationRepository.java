package com.redhat.cdsync.engine.app;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.ValidationException;
import com.redhat.cdsync.engine.source.SourceTree;
import com.redhat.cdsync.engine.store.KindRegistry;
import com.redhat.cdsync.engine.store.ObjectStore;
import com.redhat.cdsync.engine.store.ResourceJson;
import com.redhat.cdsync.engine.store.ResourceObject;
import com.redhat.cdsync.resources.model.v1alpha1.Application;
import com.redhat.cdsync.resources.model.v1alpha1.ApplicationStatus;
import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;
import com.redhat.cdsync.resources.util.ResourceNameUtils;

/**
 * Persists {@link Application} records in the object store itself, next to the objects they own.
 */
public class ApplicationRepository {

    private static final Logger log = Logger.getLogger(ApplicationRepository.class);

    static final int STATUS_WRITE_ATTEMPTS = 5;

    private final ObjectStore store;
    private final String namespace;

    public ApplicationRepository(ObjectStore store, KindRegistry kinds, String namespace) {
        this.store = store;
        this.namespace = namespace;
        kinds.registerInternal(ModelConstants.APPLICATION_KIND, ModelConstants.API_VERSION);
    }

    public String getNamespace() {
        return namespace;
    }

    public Optional<Application> find(String name) {
        return store.find(ModelConstants.APPLICATION_KIND, namespace, name).map(ApplicationRepository::fromObject);
    }

    public Application get(String name) {
        return find(name).orElseThrow(() -> new NotFoundException("application " + name + " not found"));
    }

    public List<Application> list() {
        List<Application> result = new ArrayList<>();
        for (var i : store.list(ModelConstants.APPLICATION_KIND, namespace, Map.of())) {
            result.add(fromObject(i));
        }
        return result;
    }

    /**
     * @throws ValidationException if the application is malformed
     * @throws ConflictException if an application with the same name exists
     */
    public Application create(Application application) {
        validate(application);
        String name = application.getMetadata().getName();
        if (find(name).isPresent()) {
            throw new ConflictException("application " + name + " already exists");
        }
        application.getMetadata().setNamespace(namespace);
        application.getMetadata().setResourceVersion(null);
        application.setStatus(null);
        ResourceObject object = toObject(application);
        store.apply(object, null);
        store.updateStatus(object.withStatus(ResourceJson.MAPPER.valueToTree(new ApplicationStatus())), null);
        log.infof("Created application %s tracking %s", name, application.getSpec().getSource().getRepoURL());
        return get(name);
    }

    /**
     * Replaces the spec, using the resource version of the passed application for optimistic concurrency.
     */
    public Application update(Application application) {
        validate(application);
        store.apply(toObject(application).withStatus(null), application.getMetadata().getResourceVersion());
        return get(application.getMetadata().getName());
    }

    /**
     * Applies a mutation to the latest status, re-reading and retrying on conflicts.
     */
    public Application updateStatus(String name, Consumer<ApplicationStatus> mutation) {
        ConflictException last = null;
        for (int i = 0; i < STATUS_WRITE_ATTEMPTS; ++i) {
            Application current = get(name);
            ApplicationStatus status = current.getStatus() == null ? new ApplicationStatus() : current.getStatus();
            mutation.accept(status);
            JsonNode statusNode = ResourceJson.MAPPER.valueToTree(status);
            try {
                store.updateStatus(toObject(current).withStatus(statusNode), current.getMetadata().getResourceVersion());
                return get(name);
            } catch (ConflictException e) {
                log.debugf("Conflict writing status of %s, retrying", name);
                last = e;
            }
        }
        throw last;
    }

    public void delete(String name) {
        store.delete(ModelConstants.APPLICATION_KIND, namespace, name, null);
        log.infof("Deleted application %s", name);
    }

    static void validate(Application application) {
        if (application.getMetadata() == null || !ResourceNameUtils.isValidNamespace(application.getMetadata().getName())) {
            throw new ValidationException("application name must be a lower case DNS label of at most 63 characters");
        }
        var source = application.getSpec().getSource();
        if (source.getRepoURL() == null || source.getRepoURL().isBlank()) {
            throw new ValidationException("application " + application.getMetadata().getName() + " needs a repository URL");
        }
        if (SourceTree.normalize(source.getPath()) == null) {
            throw new ValidationException("path " + source.getPath() + " is outside the repository");
        }
        if (source.getTargetRevision() == null || source.getTargetRevision().isBlank()) {
            source.setTargetRevision(ModelConstants.DEFAULT_TARGET_REVISION);
        }
        for (var i : source.getImages()) {
            if (i.getName() == null || i.getName().isBlank()) {
                throw new ValidationException("image overrides need a name");
            }
        }
        String destination = application.getSpec().getDestination().getNamespace();
        if (destination == null || !ResourceNameUtils.isValidNamespace(destination)) {
            throw new ValidationException("destination namespace '" + destination + "' is not a valid namespace");
        }
    }

    static ResourceObject toObject(Application application) {
        ObjectNode node = ResourceJson.MAPPER.valueToTree(application);
        node.put("apiVersion", ModelConstants.API_VERSION);
        node.put("kind", ModelConstants.APPLICATION_KIND);
        return ResourceObject.of(node);
    }

    static Application fromObject(ResourceObject object) {
        Application application = ResourceJson.MAPPER.convertValue(object.body(), Application.class);
        if (application.getStatus() == null) {
            application.setStatus(new ApplicationStatus());
        }
        return application;
    }
}
