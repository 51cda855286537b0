package com.redhat.cdsync.engine.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.redhat.cdsync.engine.error.ValidationException;

/**
 * Maps kinds onto their API version, scope and apply tier.
 */
public class KindRegistry {

    /**
     * Apply tiers, in the order objects are created. Pruning runs in the reverse order.
     */
    public enum Tier {
        NAMESPACE,
        RBAC,
        CONFIG,
        WORKLOAD,
        NETWORK,
        OTHER
    }

    public record KindInfo(String kind, String apiVersion, boolean namespaced, Tier tier, int order, boolean managed) {
    }

    private final Map<String, KindInfo> kinds = new ConcurrentHashMap<>();
    private final AtomicInteger order = new AtomicInteger();

    public static KindRegistry defaults() {
        KindRegistry registry = new KindRegistry();
        registry.register("Namespace", "v1", false, Tier.NAMESPACE);
        registry.register("ServiceAccount", "v1", true, Tier.RBAC);
        registry.register("Role", "rbac.authorization.k8s.io/v1", true, Tier.RBAC);
        registry.register("ClusterRole", "rbac.authorization.k8s.io/v1", false, Tier.RBAC);
        registry.register("RoleBinding", "rbac.authorization.k8s.io/v1", true, Tier.RBAC);
        registry.register("ClusterRoleBinding", "rbac.authorization.k8s.io/v1", false, Tier.RBAC);
        registry.register("ConfigMap", "v1", true, Tier.CONFIG);
        registry.register("Secret", "v1", true, Tier.CONFIG);
        registry.register("PersistentVolumeClaim", "v1", true, Tier.CONFIG);
        registry.register("Deployment", "apps/v1", true, Tier.WORKLOAD);
        registry.register("StatefulSet", "apps/v1", true, Tier.WORKLOAD);
        registry.register("DaemonSet", "apps/v1", true, Tier.WORKLOAD);
        registry.register("ReplicaSet", "apps/v1", true, Tier.WORKLOAD);
        registry.register("Job", "batch/v1", true, Tier.WORKLOAD);
        registry.register("CronJob", "batch/v1", true, Tier.WORKLOAD);
        registry.register("Pod", "v1", true, Tier.WORKLOAD);
        registry.register("Service", "v1", true, Tier.NETWORK);
        registry.register("Ingress", "networking.k8s.io/v1", true, Tier.NETWORK);
        registry.register("Route", "route.openshift.io/v1", true, Tier.NETWORK);
        registry.register("NetworkPolicy", "networking.k8s.io/v1", true, Tier.NETWORK);
        return registry;
    }

    public KindInfo register(String kind, String apiVersion, boolean namespaced, Tier tier) {
        KindInfo info = new KindInfo(kind, apiVersion, namespaced, tier, order.getAndIncrement(), true);
        kinds.put(kind, info);
        return info;
    }

    /**
     * Registers a kind that is stored alongside managed objects but never owned by an application, such as the
     * application records themselves.
     */
    public KindInfo registerInternal(String kind, String apiVersion) {
        KindInfo info = new KindInfo(kind, apiVersion, true, Tier.OTHER, order.getAndIncrement(), false);
        kinds.put(kind, info);
        return info;
    }

    /**
     * Parses {@code Kind=group/version} entries, optionally suffixed with {@code :cluster} for cluster scoped kinds.
     */
    public void registerAll(Collection<String> entries) {
        for (var entry : entries) {
            int eq = entry.indexOf('=');
            if (eq <= 0 || eq == entry.length() - 1) {
                throw new ValidationException("invalid kind mapping '" + entry + "', expected Kind=group/version");
            }
            String kind = entry.substring(0, eq).trim();
            String apiVersion = entry.substring(eq + 1).trim();
            boolean namespaced = true;
            if (apiVersion.endsWith(":cluster")) {
                namespaced = false;
                apiVersion = apiVersion.substring(0, apiVersion.length() - ":cluster".length());
            }
            register(kind, apiVersion, namespaced, Tier.OTHER);
        }
    }

    /**
     * Records a kind seen in a rendered manifest, so later list and prune calls include it. Unknown kinds are
     * assumed to be namespaced.
     */
    public KindInfo learn(ResourceObject object) {
        return kinds.computeIfAbsent(object.kind(),
                k -> new KindInfo(k, object.apiVersion(), true, Tier.OTHER, order.getAndIncrement(), true));
    }

    /**
     * The lower case plural used in resource paths, e.g. {@code NetworkPolicy -> networkpolicies}.
     */
    public static String plural(String kind) {
        String lower = kind.toLowerCase(Locale.ROOT);
        if (lower.endsWith("y") && !lower.endsWith("ay") && !lower.endsWith("ey")) {
            return lower.substring(0, lower.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("ch") || lower.endsWith("sh")) {
            return lower + "es";
        }
        return lower + "s";
    }

    public Optional<KindInfo> find(String kind) {
        return Optional.ofNullable(kinds.get(kind));
    }

    public String apiVersion(String kind) {
        return find(kind).map(KindInfo::apiVersion)
                .orElseThrow(() -> new ValidationException("unknown kind " + kind));
    }

    public boolean isNamespaced(String kind) {
        return find(kind).map(KindInfo::namespaced).orElse(true);
    }

    public Tier tier(String kind) {
        return find(kind).map(KindInfo::tier).orElse(Tier.OTHER);
    }

    public int order(String kind) {
        return find(kind).map(KindInfo::order).orElse(Integer.MAX_VALUE);
    }

    /**
     * Kinds an application may own, in apply order.
     */
    public List<KindInfo> managedKinds() {
        List<KindInfo> result = new ArrayList<>();
        for (var i : kinds.values()) {
            if (i.managed()) {
                result.add(i);
            }
        }
        result.sort(Comparator.comparing(KindInfo::tier).thenComparingInt(KindInfo::order));
        return result;
    }
}
