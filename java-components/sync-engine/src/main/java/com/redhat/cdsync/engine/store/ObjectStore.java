package com.redhat.cdsync.engine.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.ValidationException;

/**
 * Declarative object store with optimistic concurrency, modelled on a cluster resource API.
 * <p>
 * Implementations are shared between all application tasks and must be thread safe. Every method may also throw
 * {@link com.redhat.cdsync.engine.error.TransientIOException} or {@link com.redhat.cdsync.engine.error.FatalException}
 * when the backing system is unreachable or refuses access.
 */
public interface ObjectStore {

    Optional<ResourceObject> find(String kind, String namespace, String name);

    /**
     * @throws NotFoundException if the object does not exist
     */
    default ResourceObject get(String kind, String namespace, String name) {
        return find(kind, namespace, name)
                .orElseThrow(() -> new NotFoundException(ObjectKey.of(kind, namespace, name) + " not found"));
    }

    /**
     * @param namespace the namespace to list, or null for all namespaces
     * @param labelSelector labels every returned object must carry
     */
    List<ResourceObject> list(String kind, String namespace, Map<String, String> labelSelector);

    /**
     * Creates or updates an object. Applying a payload equal to the stored one is a no-op that returns the current
     * version, whatever {@code expectedVersion} is.
     *
     * @param expectedVersion the version the caller last read, or null to create
     * @return the version of the stored object
     * @throws ConflictException if the stored version differs from {@code expectedVersion}; the caller must re-read
     * @throws ValidationException if the object is rejected
     */
    String apply(ResourceObject object, String expectedVersion);

    /**
     * Replaces the status of an existing object, leaving the rest untouched.
     */
    String updateStatus(ResourceObject object, String expectedVersion);

    /**
     * @param expectedVersion the version the caller last read, or null to delete unconditionally
     * @throws NotFoundException if the object does not exist
     * @throws ConflictException if the stored version differs from {@code expectedVersion}
     */
    void delete(String kind, String namespace, String name, String expectedVersion);

    /**
     * Opens a change stream for one kind.
     *
     * @param namespace the namespace to watch, or null for all namespaces
     */
    WatchStream watch(String kind, String namespace);
}
