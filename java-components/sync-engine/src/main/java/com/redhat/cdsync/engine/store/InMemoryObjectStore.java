package com.redhat.cdsync.engine.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.ValidationException;

/**
 * A self contained store that behaves like the cluster API: monotonically increasing resource versions, optimistic
 * concurrency, server populated metadata and change streams. Used for local runs and dry runs.
 */
public class InMemoryObjectStore implements ObjectStore {

    private static final Logger log = Logger.getLogger(InMemoryObjectStore.class);

    private final KindRegistry kinds;
    private final Clock clock;
    private final Map<ObjectKey, ResourceObject> objects = new HashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private long version;

    public InMemoryObjectStore(KindRegistry kinds) {
        this(kinds, Clock.systemUTC());
    }

    public InMemoryObjectStore(KindRegistry kinds, Clock clock) {
        this.kinds = kinds;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<ResourceObject> find(String kind, String namespace, String name) {
        return Optional.ofNullable(objects.get(key(kind, namespace, name)));
    }

    @Override
    public synchronized List<ResourceObject> list(String kind, String namespace, Map<String, String> labelSelector) {
        boolean namespaced = kinds.isNamespaced(kind);
        List<ResourceObject> result = new ArrayList<>();
        for (var i : objects.values()) {
            if (!i.kind().equals(kind)) {
                continue;
            }
            if (namespaced && namespace != null && !namespace.equals(i.namespace())) {
                continue;
            }
            if (matches(i, labelSelector)) {
                result.add(i);
            }
        }
        result.sort(Comparator.comparing(o -> o.key().toString()));
        return result;
    }

    @Override
    public synchronized String apply(ResourceObject object, String expectedVersion) {
        ResourceObject candidate = scoped(object);
        ResourceObject existing = objects.get(candidate.key());
        ObjectNode body = candidate.body();
        body.remove("status");
        ObjectNode metadata = (ObjectNode) body.get("metadata");
        WatchEvent.Type type;
        if (existing == null) {
            if (expectedVersion != null) {
                throw new ConflictException(candidate.key() + " no longer exists, expected version " + expectedVersion);
            }
            metadata.put("uid", UUID.randomUUID().toString());
            metadata.put("creationTimestamp", clock.instant().toString());
            metadata.put("generation", 1);
            type = WatchEvent.Type.ADDED;
        } else {
            if (ResourceJson.semanticallyEqual(body, existing.body())) {
                return existing.resourceVersion();
            }
            if (!Objects.equals(expectedVersion, existing.resourceVersion())) {
                throw new ConflictException(candidate.key() + " is at version " + existing.resourceVersion()
                        + ", expected " + expectedVersion);
            }
            metadata.put("uid", existing.at("/metadata/uid").asText());
            metadata.put("creationTimestamp", existing.at("/metadata/creationTimestamp").asText());
            metadata.put("generation", existing.at("/metadata/generation").asLong(0) + 1);
            JsonNode status = existing.at("/status");
            if (!status.isMissingNode()) {
                body.set("status", status);
            }
            type = WatchEvent.Type.MODIFIED;
        }
        metadata.put("resourceVersion", Long.toString(++version));
        ResourceObject stored = ResourceObject.of(body);
        objects.put(stored.key(), stored);
        log.debugf("%s %s at version %s", type, stored.key(), stored.resourceVersion());
        publish(new WatchEvent(type, stored));
        return stored.resourceVersion();
    }

    @Override
    public synchronized String updateStatus(ResourceObject object, String expectedVersion) {
        ResourceObject candidate = scoped(object);
        ResourceObject existing = objects.get(candidate.key());
        if (existing == null) {
            throw new NotFoundException(candidate.key() + " not found");
        }
        JsonNode status = candidate.at("/status");
        if (ResourceJson.canonicalString(status).equals(ResourceJson.canonicalString(existing.at("/status")))) {
            return existing.resourceVersion();
        }
        if (expectedVersion != null && !expectedVersion.equals(existing.resourceVersion())) {
            throw new ConflictException(candidate.key() + " is at version " + existing.resourceVersion()
                    + ", expected " + expectedVersion);
        }
        ResourceObject stored = existing.withStatus(status.isMissingNode() ? null : status)
                .withResourceVersion(Long.toString(++version));
        objects.put(stored.key(), stored);
        publish(new WatchEvent(WatchEvent.Type.MODIFIED, stored));
        return stored.resourceVersion();
    }

    @Override
    public synchronized void delete(String kind, String namespace, String name, String expectedVersion) {
        ObjectKey key = key(kind, namespace, name);
        ResourceObject existing = objects.get(key);
        if (existing == null) {
            throw new NotFoundException(key + " not found");
        }
        if (expectedVersion != null && !expectedVersion.equals(existing.resourceVersion())) {
            throw new ConflictException(key + " is at version " + existing.resourceVersion() + ", expected "
                    + expectedVersion);
        }
        objects.remove(key);
        version++;
        log.debugf("DELETED %s", key);
        publish(new WatchEvent(WatchEvent.Type.DELETED, existing));
    }

    @Override
    public WatchStream watch(String kind, String namespace) {
        Subscription[] holder = new Subscription[1];
        QueueWatchStream stream = new QueueWatchStream(() -> subscriptions.remove(holder[0]));
        holder[0] = new Subscription(kind, namespace, stream);
        subscriptions.add(holder[0]);
        return stream;
    }

    /**
     * Ends every open watch the way a server does when a watch expires. Callers have to watch again.
     */
    public void expireWatches() {
        for (var i : subscriptions) {
            subscriptions.remove(i);
            i.stream().end();
        }
    }

    public int openWatches() {
        return subscriptions.size();
    }

    public synchronized int size() {
        return objects.size();
    }

    private void publish(WatchEvent event) {
        for (var i : subscriptions) {
            if (i.kind().equals(event.object().kind())
                    && (i.namespace() == null || i.namespace().equals(event.object().namespace()))) {
                i.stream().publish(event);
            }
        }
    }

    private ObjectKey key(String kind, String namespace, String name) {
        return ObjectKey.of(kind, kinds.isNamespaced(kind) ? namespace : null, name);
    }

    private ResourceObject scoped(ResourceObject object) {
        boolean namespaced = kinds.isNamespaced(object.kind());
        if (!namespaced) {
            return object.namespace().isEmpty() ? object : object.withNamespace(null);
        }
        if (object.namespace().isEmpty()) {
            throw new ValidationException(object.key() + " must have a namespace");
        }
        return object;
    }

    private static boolean matches(ResourceObject object, Map<String, String> selector) {
        if (selector == null || selector.isEmpty()) {
            return true;
        }
        Map<String, String> labels = object.labels();
        for (var e : selector.entrySet()) {
            if (!e.getValue().equals(labels.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private record Subscription(String kind, String namespace, QueueWatchStream stream) {
    }
}
