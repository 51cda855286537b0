package com.redhat.cdsync.engine.reconcile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.redhat.cdsync.engine.error.SyncException;
import com.redhat.cdsync.engine.store.ObjectStore;
import com.redhat.cdsync.engine.store.ResourceObject;
import com.redhat.cdsync.engine.store.WatchStream;

/**
 * Delegates to another store, failing queued reads and writes first. Successful writes are recorded in order.
 */
class FlakyObjectStore implements ObjectStore {

    final ObjectStore delegate;
    final Deque<SyncException> applyFailures = new ArrayDeque<>();
    final Deque<SyncException> deleteFailures = new ArrayDeque<>();
    final Deque<SyncException> listFailures = new ArrayDeque<>();
    final List<String> applied = new ArrayList<>();
    int applyCalls;

    FlakyObjectStore(ObjectStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<ResourceObject> find(String kind, String namespace, String name) {
        return delegate.find(kind, namespace, name);
    }

    @Override
    public List<ResourceObject> list(String kind, String namespace, Map<String, String> labelSelector) {
        SyncException failure = listFailures.poll();
        if (failure != null) {
            throw failure;
        }
        return delegate.list(kind, namespace, labelSelector);
    }

    @Override
    public String apply(ResourceObject object, String expectedVersion) {
        applyCalls++;
        SyncException failure = applyFailures.poll();
        if (failure != null) {
            throw failure;
        }
        String version = delegate.apply(object, expectedVersion);
        applied.add(object.kind() + "/" + object.name());
        return version;
    }

    @Override
    public String updateStatus(ResourceObject object, String expectedVersion) {
        return delegate.updateStatus(object, expectedVersion);
    }

    @Override
    public void delete(String kind, String namespace, String name, String expectedVersion) {
        SyncException failure = deleteFailures.poll();
        if (failure != null) {
            throw failure;
        }
        delegate.delete(kind, namespace, name, expectedVersion);
    }

    @Override
    public WatchStream watch(String kind, String namespace) {
        return delegate.watch(kind, namespace);
    }
}
