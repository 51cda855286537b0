package com.redhat.cdsync.engine.store;

public record WatchEvent(Type type, ResourceObject object) {

    public enum Type {
        ADDED,
        MODIFIED,
        DELETED
    }
}
