package com.redhat.cdsync.engine.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.error.ValidationException;

class KindRegistryTest {

    @Test
    void managedKindsFollowApplyTiers() {
        KindRegistry registry = KindRegistry.defaults();
        registry.registerInternal("Application", "cdsync.redhat.com/v1alpha1");
        List<String> kinds = registry.managedKinds().stream().map(KindRegistry.KindInfo::kind).toList();
        assertThat(kinds.get(0)).isEqualTo("Namespace");
        assertThat(kinds.indexOf("ServiceAccount")).isLessThan(kinds.indexOf("ConfigMap"));
        assertThat(kinds.indexOf("ConfigMap")).isLessThan(kinds.indexOf("Deployment"));
        assertThat(kinds.indexOf("Deployment")).isLessThan(kinds.indexOf("Service"));
        assertThat(kinds).doesNotContain("Application");
    }

    @Test
    void extraKinds() {
        KindRegistry registry = KindRegistry.defaults();
        registry.registerAll(List.of("Widget=example.com/v1", "ClusterWidget=example.com/v1:cluster"));
        assertThat(registry.apiVersion("Widget")).isEqualTo("example.com/v1");
        assertThat(registry.isNamespaced("ClusterWidget")).isFalse();
        assertThat(registry.tier("Widget")).isEqualTo(KindRegistry.Tier.OTHER);
        assertThatThrownBy(() -> registry.registerAll(List.of("Broken"))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> registry.apiVersion("Unknown")).isInstanceOf(ValidationException.class);
    }

    @Test
    void plurals() {
        assertThat(KindRegistry.plural("Deployment")).isEqualTo("deployments");
        assertThat(KindRegistry.plural("Ingress")).isEqualTo("ingresses");
        assertThat(KindRegistry.plural("NetworkPolicy")).isEqualTo("networkpolicies");
        assertThat(KindRegistry.plural("Gateway")).isEqualTo("gateways");
    }
}
