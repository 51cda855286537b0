package com.redhat.cdsync.engine.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.ValidationException;

class InMemoryObjectStoreTest {

    InMemoryObjectStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryObjectStore(KindRegistry.defaults());
    }

    static ResourceObject configMap(String name, String value) {
        return ResourceObject.parse("""
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: %s
                  namespace: demo
                  labels:
                    app: web
                data:
                  key: "%s"
                """.formatted(name, value));
    }

    @Test
    void createThenGet() {
        String version = store.apply(configMap("settings", "a"), null);
        ResourceObject stored = store.get("ConfigMap", "demo", "settings");
        assertThat(stored.resourceVersion()).isEqualTo(version);
        assertThat(stored.at("/metadata/uid").asText()).isNotEmpty();
        assertThat(stored.at("/data/key").asText()).isEqualTo("a");
    }

    @Test
    void unchangedApplyIsNoOp() {
        String version = store.apply(configMap("settings", "a"), null);
        assertThat(store.apply(configMap("settings", "a"), null)).isEqualTo(version);
        assertThat(store.apply(configMap("settings", "a"), "42")).isEqualTo(version);
    }

    @Test
    void staleVersionConflicts() {
        String first = store.apply(configMap("settings", "a"), null);
        String second = store.apply(configMap("settings", "b"), first);
        assertThat(second).isNotEqualTo(first);
        assertThatThrownBy(() -> store.apply(configMap("settings", "c"), first)).isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.apply(configMap("settings", "c"), null)).isInstanceOf(ConflictException.class);
        assertThat(store.get("ConfigMap", "demo", "settings").at("/data/key").asText()).isEqualTo("b");
    }

    @Test
    void updatePreservesStatusAndBumpsGeneration() {
        String version = store.apply(configMap("settings", "a"), null);
        ResourceObject stored = store.get("ConfigMap", "demo", "settings");
        version = store.updateStatus(stored.withStatus(ResourceJson.MAPPER.createObjectNode().put("ready", true)),
                version);
        store.apply(configMap("settings", "b"), version);
        ResourceObject updated = store.get("ConfigMap", "demo", "settings");
        assertThat(updated.at("/status/ready").asBoolean()).isTrue();
        assertThat(updated.at("/metadata/generation").asLong()).isEqualTo(2);
        assertThat(updated.at("/metadata/uid")).isEqualTo(stored.at("/metadata/uid"));
    }

    @Test
    void deleteChecksVersion() {
        String version = store.apply(configMap("settings", "a"), null);
        assertThatThrownBy(() -> store.delete("ConfigMap", "demo", "settings", "0")).isInstanceOf(ConflictException.class);
        store.delete("ConfigMap", "demo", "settings", version);
        assertThat(store.find("ConfigMap", "demo", "settings")).isEmpty();
        assertThatThrownBy(() -> store.delete("ConfigMap", "demo", "settings", null))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.get("ConfigMap", "demo", "settings")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void namespacedKindRequiresNamespace() {
        assertThatThrownBy(() -> store.apply(configMap("settings", "a").withNamespace(null), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void clusterScopedKindIgnoresNamespace() {
        store.apply(ResourceObject.parse("apiVersion: v1\nkind: Namespace\nmetadata:\n  name: demo\n  namespace: x\n"),
                null);
        assertThat(store.find("Namespace", null, "demo")).isPresent();
        assertThat(store.find("Namespace", "other", "demo")).isPresent();
    }

    @Test
    void listFiltersByNamespaceAndLabels() {
        store.apply(configMap("b", "1"), null);
        store.apply(configMap("a", "1"), null);
        store.apply(configMap("c", "1").withLabels(Map.of("app", "other")), null);
        store.apply(configMap("d", "1").withNamespace("elsewhere"), null);
        assertThat(store.list("ConfigMap", "demo", Map.of("app", "web")))
                .extracting(ResourceObject::name)
                .containsExactly("a", "b");
        assertThat(store.list("ConfigMap", null, Map.of())).hasSize(4);
        assertThat(store.list("Secret", null, Map.of())).isEmpty();
    }

    @Test
    void watchReceivesChanges() throws Exception {
        try (WatchStream stream = store.watch("ConfigMap", "demo")) {
            String version = store.apply(configMap("settings", "a"), null);
            store.apply(configMap("settings", "b"), version);
            store.apply(configMap("other", "a").withNamespace("elsewhere"), null);
            store.delete("ConfigMap", "demo", "settings", null);

            assertThat(stream.next().type()).isEqualTo(WatchEvent.Type.ADDED);
            WatchEvent modified = stream.next();
            assertThat(modified.type()).isEqualTo(WatchEvent.Type.MODIFIED);
            assertThat(modified.object().at("/data/key").asText()).isEqualTo("b");
            assertThat(stream.next().type()).isEqualTo(WatchEvent.Type.DELETED);
            assertThat(stream.poll(Duration.ofMillis(10))).isEqualTo(Optional.empty());
        }
    }

    @Test
    void closedWatchEnds() {
        WatchStream stream = store.watch("ConfigMap", null);
        stream.close();
        store.apply(configMap("settings", "a"), null);
        assertThat(stream.isClosed()).isTrue();
        assertThat(stream.hasNext()).isFalse();
    }
}
