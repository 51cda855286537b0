package com.redhat.cdsync.engine.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.ValidationException;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

/**
 * Object store backed by a cluster API server. Objects are handled as generic resources so any registered kind can
 * be synced without a typed model.
 */
public class KubernetesObjectStore implements ObjectStore {

    private static final Logger log = Logger.getLogger(KubernetesObjectStore.class);

    private final KubernetesClient client;
    private final KindRegistry kinds;

    public KubernetesObjectStore(KubernetesClient client, KindRegistry kinds) {
        this.client = client;
        this.kinds = kinds;
    }

    @Override
    public Optional<ResourceObject> find(String kind, String namespace, String name) {
        try {
            Resource<GenericKubernetesResource> resource = kinds.isNamespaced(kind)
                    ? resources(kind).inNamespace(namespace).withName(name)
                    : resources(kind).withName(name);
            GenericKubernetesResource found = resource.get();
            return found == null ? Optional.empty() : Optional.of(toObject(found));
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                return Optional.empty();
            }
            throw KubernetesErrors.translate("get " + ObjectKey.of(kind, namespace, name), e);
        }
    }

    @Override
    public List<ResourceObject> list(String kind, String namespace, Map<String, String> labelSelector) {
        try {
            GenericKubernetesResourceList items;
            Map<String, String> labels = labelSelector == null ? Map.of() : labelSelector;
            if (kinds.isNamespaced(kind) && namespace != null) {
                items = resources(kind).inNamespace(namespace).withLabels(labels).list();
            } else if (kinds.isNamespaced(kind)) {
                items = resources(kind).inAnyNamespace().withLabels(labels).list();
            } else {
                items = resources(kind).withLabels(labels).list();
            }
            List<ResourceObject> result = new ArrayList<>();
            for (var i : items.getItems()) {
                result.add(toObject(i));
            }
            result.sort(Comparator.comparing(o -> o.key().toString()));
            return result;
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                //the kind is not served by this cluster, so nothing can exist
                log.debugf("Kind %s is not available, treating list as empty", kind);
                return List.of();
            }
            throw KubernetesErrors.translate("list " + kind, e);
        }
    }

    @Override
    public String apply(ResourceObject object, String expectedVersion) {
        ResourceObject candidate = scoped(object);
        Optional<ResourceObject> existing = find(candidate.kind(), candidate.namespace(), candidate.name());
        try {
            if (existing.isEmpty()) {
                if (expectedVersion != null) {
                    throw new ConflictException(candidate.key() + " no longer exists, expected version " + expectedVersion);
                }
                GenericKubernetesResource created = resource(candidate.withResourceVersion(null)).create();
                log.debugf("Created %s at version %s", candidate.key(), created.getMetadata().getResourceVersion());
                return created.getMetadata().getResourceVersion();
            }
            ResourceObject live = existing.get();
            if (unchanged(candidate, live)) {
                return live.resourceVersion();
            }
            if (!Objects.equals(expectedVersion, live.resourceVersion())) {
                throw new ConflictException(candidate.key() + " is at version " + live.resourceVersion() + ", expected "
                        + expectedVersion);
            }
            GenericKubernetesResource updated = resource(candidate.withResourceVersion(expectedVersion)).update();
            log.debugf("Updated %s to version %s", candidate.key(), updated.getMetadata().getResourceVersion());
            return updated.getMetadata().getResourceVersion();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.translate("apply " + candidate.key(), e);
        }
    }

    @Override
    public String updateStatus(ResourceObject object, String expectedVersion) {
        ResourceObject candidate = scoped(object);
        ResourceObject live = find(candidate.kind(), candidate.namespace(), candidate.name())
                .orElseThrow(() -> new NotFoundException(candidate.key() + " not found"));
        if (expectedVersion != null && !expectedVersion.equals(live.resourceVersion())) {
            throw new ConflictException(candidate.key() + " is at version " + live.resourceVersion() + ", expected "
                    + expectedVersion);
        }
        try {
            GenericKubernetesResource updated = resource(candidate.withResourceVersion(live.resourceVersion()))
                    .updateStatus();
            return updated.getMetadata().getResourceVersion();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.translate("update status of " + candidate.key(), e);
        }
    }

    @Override
    public void delete(String kind, String namespace, String name, String expectedVersion) {
        ResourceObject live = find(kind, namespace, name)
                .orElseThrow(() -> new NotFoundException(ObjectKey.of(kind, namespace, name) + " not found"));
        if (expectedVersion != null && !expectedVersion.equals(live.resourceVersion())) {
            throw new ConflictException(live.key() + " is at version " + live.resourceVersion() + ", expected "
                    + expectedVersion);
        }
        try {
            var deleted = resource(live).delete();
            if (deleted.isEmpty()) {
                throw new NotFoundException(live.key() + " not found");
            }
            log.debugf("Deleted %s", live.key());
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.translate("delete " + live.key(), e);
        }
    }

    @Override
    public WatchStream watch(String kind, String namespace) {
        Watch[] holder = new Watch[1];
        QueueWatchStream stream = new QueueWatchStream(() -> {
            if (holder[0] != null) {
                holder[0].close();
            }
        });
        Watcher<GenericKubernetesResource> watcher = new Watcher<>() {
            @Override
            public void eventReceived(Action action, GenericKubernetesResource resource) {
                WatchEvent.Type type;
                switch (action) {
                    case ADDED:
                        type = WatchEvent.Type.ADDED;
                        break;
                    case MODIFIED:
                        type = WatchEvent.Type.MODIFIED;
                        break;
                    case DELETED:
                        type = WatchEvent.Type.DELETED;
                        break;
                    default:
                        return;
                }
                try {
                    stream.publish(new WatchEvent(type, toObject(resource)));
                } catch (ValidationException e) {
                    log.errorf(e, "Ignoring malformed %s event for kind %s", action, kind);
                }
            }

            @Override
            public void onClose(WatcherException cause) {
                if (cause != null) {
                    log.errorf(cause, "Watch on %s closed unexpectedly", kind);
                }
                stream.end();
            }
        };
        try {
            if (kinds.isNamespaced(kind) && namespace != null) {
                holder[0] = resources(kind).inNamespace(namespace).watch(watcher);
            } else if (kinds.isNamespaced(kind)) {
                holder[0] = resources(kind).inAnyNamespace().watch(watcher);
            } else {
                holder[0] = resources(kind).watch(watcher);
            }
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.translate("watch " + kind, e);
        }
        return stream;
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> resources(
            String kind) {
        return resources(kind, kinds.apiVersion(kind));
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> resources(
            String kind, String apiVersion) {
        int slash = apiVersion.indexOf('/');
        String group = slash < 0 ? "" : apiVersion.substring(0, slash);
        String version = apiVersion.substring(slash + 1);
        ResourceDefinitionContext context = new ResourceDefinitionContext.Builder()
                .withGroup(group)
                .withVersion(version)
                .withKind(kind)
                .withPlural(KindRegistry.plural(kind))
                .withNamespaced(kinds.isNamespaced(kind))
                .build();
        return client.genericKubernetesResources(context);
    }

    private Resource<GenericKubernetesResource> resource(ResourceObject object) {
        GenericKubernetesResource resource = ResourceJson.MAPPER.convertValue(object.body(),
                GenericKubernetesResource.class);
        if (kinds.isNamespaced(object.kind())) {
            return resources(object.kind(), object.apiVersion()).inNamespace(object.namespace()).resource(resource);
        }
        return resources(object.kind(), object.apiVersion()).resource(resource);
    }

    private ResourceObject scoped(ResourceObject object) {
        if (!kinds.isNamespaced(object.kind())) {
            return object.namespace().isEmpty() ? object : object.withNamespace(null);
        }
        if (object.namespace().isEmpty()) {
            throw new ValidationException(object.key() + " must have a namespace");
        }
        return object;
    }

    /**
     * The server adds defaults to what it stores, so a payload counts as unchanged when it is contained in the live
     * object.
     */
    private static boolean unchanged(ResourceObject desired, ResourceObject live) {
        ObjectNode expected = ResourceJson.normalize(desired.body());
        ObjectNode actual = ResourceJson.normalize(live.body());
        return ResourceJson.isSubset(expected, actual);
    }

    static ResourceObject toObject(GenericKubernetesResource resource) {
        JsonNode node = ResourceJson.MAPPER.valueToTree(resource);
        return ResourceObject.of(node);
    }
}
