package com.redhat.cdsync.engine.render;

import java.util.Comparator;

import com.redhat.cdsync.engine.store.KindRegistry;
import com.redhat.cdsync.engine.store.ResourceObject;

/**
 * Orders objects so that dependencies are created first: namespaces, RBAC, configuration, workloads, network
 * exposure, then everything else. Within a tier the registry order is used for known kinds, then kind, namespace and
 * name.
 */
public final class ApplyOrder {

    private ApplyOrder() {
    }

    public static Comparator<ResourceObject> comparator(KindRegistry kinds) {
        return Comparator.<ResourceObject, KindRegistry.Tier> comparing(o -> kinds.tier(o.kind()))
                .thenComparingInt(o -> kinds.tier(o.kind()) == KindRegistry.Tier.OTHER ? 0 : kinds.order(o.kind()))
                .thenComparing(ResourceObject::kind)
                .thenComparing(ResourceObject::namespace)
                .thenComparing(ResourceObject::name);
    }
}
