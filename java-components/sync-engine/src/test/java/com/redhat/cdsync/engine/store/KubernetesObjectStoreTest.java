package com.redhat.cdsync.engine.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.error.ConflictException;
import com.redhat.cdsync.engine.error.NotFoundException;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;

@EnableKubernetesMockClient(crud = true)
class KubernetesObjectStoreTest {

    KubernetesClient client;

    KubernetesObjectStore store;

    @BeforeEach
    void setup() {
        store = new KubernetesObjectStore(client, KindRegistry.defaults());
    }

    @Test
    void applyCreatesAndUpdates() {
        String first = store.apply(InMemoryObjectStoreTest.configMap("settings", "a"), null);
        ConfigMap created = client.configMaps().inNamespace("demo").withName("settings").get();
        assertThat(created.getData()).containsEntry("key", "a");
        assertThat(created.getMetadata().getLabels()).containsEntry("app", "web");

        String second = store.apply(InMemoryObjectStoreTest.configMap("settings", "b"), first);
        assertThat(second).isNotEqualTo(first);
        assertThat(client.configMaps().inNamespace("demo").withName("settings").get().getData())
                .containsEntry("key", "b");
    }

    @Test
    void unchangedApplyKeepsVersion() {
        String first = store.apply(InMemoryObjectStoreTest.configMap("settings", "a"), null);
        assertThat(store.apply(InMemoryObjectStoreTest.configMap("settings", "a"), null)).isEqualTo(first);
    }

    @Test
    void staleVersionConflicts() {
        String first = store.apply(InMemoryObjectStoreTest.configMap("settings", "a"), null);
        store.apply(InMemoryObjectStoreTest.configMap("settings", "b"), first);
        assertThatThrownBy(() -> store.apply(InMemoryObjectStoreTest.configMap("settings", "c"), first))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void listAndDelete() {
        store.apply(InMemoryObjectStoreTest.configMap("one", "a"), null);
        store.apply(InMemoryObjectStoreTest.configMap("two", "a"), null);
        assertThat(store.list("ConfigMap", "demo", Map.of("app", "web")))
                .extracting(ResourceObject::name)
                .containsExactly("one", "two");

        store.delete("ConfigMap", "demo", "one", null);
        assertThat(store.find("ConfigMap", "demo", "one")).isEmpty();
        assertThatThrownBy(() -> store.delete("ConfigMap", "demo", "one", null)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.get("ConfigMap", "demo", "one")).isInstanceOf(NotFoundException.class);
    }
}
