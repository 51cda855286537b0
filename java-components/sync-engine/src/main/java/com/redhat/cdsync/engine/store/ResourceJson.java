package com.redhat.cdsync.engine.store;

import static com.fasterxml.jackson.dataformat.yaml.YAMLGenerator.Feature.MINIMIZE_QUOTES;
import static com.fasterxml.jackson.dataformat.yaml.YAMLGenerator.Feature.SPLIT_LINES;
import static com.fasterxml.jackson.dataformat.yaml.YAMLGenerator.Feature.WRITE_DOC_START_MARKER;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Shared Jackson mappers plus the canonical form and semantic comparison used for objects.
 */
public final class ResourceJson {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static final ObjectMapper YAML_MAPPER = new ObjectMapper(
            new YAMLFactory().disable(SPLIT_LINES).disable(WRITE_DOC_START_MARKER).enable(MINIMIZE_QUOTES))
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Metadata fields owned by the server, never part of the desired state.
     */
    static final Set<String> SERVER_METADATA = Set.of("resourceVersion", "uid", "creationTimestamp", "generation",
            "managedFields", "selfLink", "deletionTimestamp", "deletionGracePeriodSeconds");

    static final Set<String> SERVER_ANNOTATIONS = Set.of("kubectl.kubernetes.io/last-applied-configuration",
            "deployment.kubernetes.io/revision");

    private ResourceJson() {
    }

    /**
     * A deep copy with object fields sorted by name at every level.
     */
    public static JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                var e = it.next();
                sorted.put(e.getKey(), canonical(e.getValue()));
            }
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            sorted.forEach(result::set);
            return result;
        } else if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            for (var i : node) {
                result.add(canonical(i));
            }
            return result;
        }
        return node.deepCopy();
    }

    public static String canonicalString(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(canonical(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String toYaml(JsonNode node) {
        try {
            return YAML_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Strips status and server populated metadata, leaving only what a user declares.
     */
    public static ObjectNode normalize(ObjectNode body) {
        ObjectNode copy = body.deepCopy();
        copy.remove("status");
        JsonNode metadata = copy.get("metadata");
        if (metadata != null && metadata.isObject()) {
            ObjectNode meta = (ObjectNode) metadata;
            meta.remove(SERVER_METADATA);
            JsonNode annotations = meta.get("annotations");
            if (annotations != null && annotations.isObject()) {
                ((ObjectNode) annotations).remove(SERVER_ANNOTATIONS);
                if (annotations.isEmpty()) {
                    meta.remove("annotations");
                }
            }
            JsonNode labels = meta.get("labels");
            if (labels != null && labels.isObject() && labels.isEmpty()) {
                meta.remove("labels");
            }
        }
        return copy;
    }

    /**
     * True when every field declared in {@code expected} has the same value in {@code actual}. Fields only present
     * in {@code actual}, such as server side defaults, are ignored. Arrays must match element by element.
     */
    public static boolean isSubset(JsonNode expected, JsonNode actual) {
        if (expected == null || expected.isNull() || expected.isMissingNode()) {
            return actual == null || actual.isNull() || actual.isMissingNode();
        }
        if (actual == null || actual.isMissingNode()) {
            return false;
        }
        if (expected.isObject()) {
            if (!actual.isObject()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> it = expected.fields();
            while (it.hasNext()) {
                var e = it.next();
                if (!isSubset(e.getValue(), actual.get(e.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (expected.isArray()) {
            if (!actual.isArray() || actual.size() != expected.size()) {
                return false;
            }
            for (int i = 0; i < expected.size(); ++i) {
                if (!isSubset(expected.get(i), actual.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.equals(actual);
    }

    /**
     * Exact comparison of the user declared parts of two objects.
     */
    public static boolean semanticallyEqual(ObjectNode a, ObjectNode b) {
        return canonicalString(normalize(a)).equals(canonicalString(normalize(b)));
    }

    public static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
