package com.redhat.cdsync.engine.render;

import java.util.List;
import java.util.Optional;

import com.redhat.cdsync.engine.store.ObjectKey;
import com.redhat.cdsync.engine.store.ResourceObject;

/**
 * The rendered desired state of an application at one source revision, in apply order.
 *
 * @param fingerprint identifies the inputs of the render, equal fingerprints render identical objects
 * @param revision the resolved source revision
 */
public record DesiredStateSnapshot(String fingerprint, String revision, List<ResourceObject> objects) {

    public DesiredStateSnapshot {
        objects = List.copyOf(objects);
    }

    public Optional<ResourceObject> find(ObjectKey key) {
        for (var i : objects) {
            if (i.key().equals(key)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }
}
