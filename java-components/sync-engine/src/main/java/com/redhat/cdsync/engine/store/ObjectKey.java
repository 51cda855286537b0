package com.redhat.cdsync.engine.store;

/**
 * Identity of an object in the store. Cluster scoped objects use an empty namespace.
 */
public record ObjectKey(String kind, String namespace, String name) {

    public ObjectKey {
        namespace = namespace == null ? "" : namespace;
    }

    public static ObjectKey of(String kind, String namespace, String name) {
        return new ObjectKey(kind, namespace, name);
    }

    public boolean isClusterScoped() {
        return namespace.isEmpty();
    }

    @Override
    public String toString() {
        return namespace.isEmpty() ? kind + "/" + name : kind + "/" + namespace + "/" + name;
    }
}
