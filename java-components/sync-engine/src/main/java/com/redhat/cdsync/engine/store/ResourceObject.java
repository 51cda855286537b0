package com.redhat.cdsync.engine.store;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redhat.cdsync.engine.error.ValidationException;
import com.redhat.cdsync.resources.util.ResourceNameUtils;

/**
 * An immutable, typed view over one declarative object. The JSON body is copied on the way in and on the way
 * out, so instances can be shared freely between tasks.
 */
public final class ResourceObject {

    private final ObjectNode body;
    private final ObjectKey key;

    private ResourceObject(ObjectNode body) {
        this.body = body;
        this.key = ObjectKey.of(text(body, "kind"), text(body.get("metadata"), "namespace"),
                text(body.get("metadata"), "name"));
    }

    /**
     * @throws ValidationException if the node is not a well formed object
     */
    public static ResourceObject of(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("object must be a mapping, got " + (node == null ? "nothing" : node.getNodeType()));
        }
        if (!node.path("apiVersion").isTextual() || node.path("apiVersion").asText().isEmpty()) {
            throw new ValidationException("object is missing apiVersion");
        }
        if (!node.path("kind").isTextual() || node.path("kind").asText().isEmpty()) {
            throw new ValidationException("object is missing kind");
        }
        JsonNode metadata = node.get("metadata");
        if (metadata == null || !metadata.isObject()) {
            throw new ValidationException(node.get("kind").asText() + " is missing metadata");
        }
        String name = text(metadata, "name");
        if (!ResourceNameUtils.isValidName(name)) {
            throw new ValidationException(node.get("kind").asText() + " has invalid name '" + name + "'");
        }
        String namespace = text(metadata, "namespace");
        if (namespace != null && !ResourceNameUtils.isValidNamespace(namespace)) {
            throw new ValidationException(node.get("kind").asText() + "/" + name + " has invalid namespace '" + namespace
                    + "'");
        }
        return new ResourceObject(((ObjectNode) node).deepCopy());
    }

    public static ResourceObject parse(String yaml) {
        try {
            return of(ResourceJson.YAML_MAPPER.readTree(yaml));
        } catch (IOException e) {
            throw new ValidationException("unable to parse object: " + e.getMessage(), e);
        }
    }

    public ObjectKey key() {
        return key;
    }

    public String apiVersion() {
        return body.get("apiVersion").asText();
    }

    public String kind() {
        return key.kind();
    }

    public String name() {
        return key.name();
    }

    /**
     * @return the namespace, or an empty string for cluster scoped objects
     */
    public String namespace() {
        return key.namespace();
    }

    public String resourceVersion() {
        return text(body.get("metadata"), "resourceVersion");
    }

    public Map<String, String> labels() {
        return stringMap("labels");
    }

    public Map<String, String> annotations() {
        return stringMap("annotations");
    }

    /**
     * @param pointer a JSON pointer such as {@code /spec/replicas}
     * @return a copy of the node, or a missing node
     */
    public JsonNode at(String pointer) {
        return body.at(pointer).deepCopy();
    }

    public ObjectNode body() {
        return body.deepCopy();
    }

    public ResourceObject withNamespace(String namespace) {
        ObjectNode copy = body.deepCopy();
        ObjectNode metadata = (ObjectNode) copy.get("metadata");
        if (namespace == null || namespace.isEmpty()) {
            metadata.remove("namespace");
        } else {
            metadata.put("namespace", namespace);
        }
        return new ResourceObject(copy);
    }

    public ResourceObject withLabels(Map<String, String> labels) {
        ObjectNode copy = body.deepCopy();
        ObjectNode target = child((ObjectNode) copy.get("metadata"), "labels");
        labels.forEach(target::put);
        return new ResourceObject(copy);
    }

    public ResourceObject withAnnotation(String name, String value) {
        ObjectNode copy = body.deepCopy();
        child((ObjectNode) copy.get("metadata"), "annotations").put(name, value);
        return new ResourceObject(copy);
    }

    public ResourceObject withResourceVersion(String resourceVersion) {
        ObjectNode copy = body.deepCopy();
        ObjectNode metadata = (ObjectNode) copy.get("metadata");
        if (resourceVersion == null) {
            metadata.remove("resourceVersion");
        } else {
            metadata.put("resourceVersion", resourceVersion);
        }
        return new ResourceObject(copy);
    }

    public ResourceObject withStatus(JsonNode status) {
        ObjectNode copy = body.deepCopy();
        if (status == null || status.isNull()) {
            copy.remove("status");
        } else {
            copy.set("status", status.deepCopy());
        }
        return new ResourceObject(copy);
    }

    /**
     * The canonical JSON rendering, stable across runs for equal content.
     */
    public String toCanonicalJson() {
        return ResourceJson.canonicalString(body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return toCanonicalJson().equals(((ResourceObject) o).toCanonicalJson());
    }

    @Override
    public int hashCode() {
        return toCanonicalJson().hashCode();
    }

    @Override
    public String toString() {
        return key.toString();
    }

    private Map<String, String> stringMap(String field) {
        JsonNode node = body.path("metadata").path(field);
        if (!node.isObject()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> result.put(e.getKey(), e.getValue().asText()));
        return Collections.unmodifiableMap(result);
    }

    private static ObjectNode child(ObjectNode parent, String field) {
        JsonNode existing = parent.get(field);
        if (existing != null && existing.isObject()) {
            return (ObjectNode) existing;
        }
        return parent.putObject(field);
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
