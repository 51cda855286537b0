package com.redhat.cdsync.engine.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.redhat.cdsync.engine.error.RenderException;
import com.redhat.cdsync.resources.model.v1alpha1.ImageOverride;

/**
 * The subset of a kustomization file that is understood: {@code resources}, {@code patches} (also the legacy
 * {@code patchesStrategicMerge} list, applied as merge patches), {@code namespace}, {@code commonLabels} and
 * {@code images}.
 */
record Kustomization(List<String> resources, List<Patch> patches, String namespace, Map<String, String> commonLabels,
        List<ImageOverride> images) {

    /**
     * Either a file or an inline patch, with an optional explicit target.
     */
    record Patch(String path, String inline, String targetKind, String targetName, String targetNamespace) {
    }

    static Kustomization parse(String file, List<JsonNode> documents) {
        if (documents.size() != 1 || !documents.get(0).isObject()) {
            throw new RenderException(RenderException.Reason.PARSE_ERROR, file + " must contain a single mapping");
        }
        JsonNode root = documents.get(0);
        List<String> resources = new ArrayList<>();
        for (var i : array(root, "resources", file)) {
            if (!i.isTextual()) {
                throw new RenderException(RenderException.Reason.PARSE_ERROR, file + ": resources must be paths");
            }
            resources.add(i.asText());
        }
        List<Patch> patches = new ArrayList<>();
        for (var i : array(root, "patchesStrategicMerge", file)) {
            patches.add(new Patch(i.asText(), null, null, null, null));
        }
        for (var i : array(root, "patches", file)) {
            if (i.isTextual()) {
                patches.add(new Patch(i.asText(), null, null, null, null));
                continue;
            }
            String path = i.path("path").asText(null);
            String inline = i.path("patch").asText(null);
            if ((path == null) == (inline == null)) {
                throw new RenderException(RenderException.Reason.PARSE_ERROR,
                        file + ": each patch needs exactly one of path or patch");
            }
            JsonNode target = i.path("target");
            String targetKind = target.path("kind").asText(null);
            String targetName = target.path("name").asText(null);
            if ((targetKind == null) != (targetName == null)) {
                throw new RenderException(RenderException.Reason.PARSE_ERROR,
                        file + ": a patch target needs both kind and name");
            }
            patches.add(new Patch(path, inline, targetKind, targetName, target.path("namespace").asText(null)));
        }
        String namespace = root.path("namespace").asText(null);
        if (namespace != null && namespace.isEmpty()) {
            namespace = null;
        }
        List<ImageOverride> images = new ArrayList<>();
        for (var i : array(root, "images", file)) {
            String name = i.path("name").asText(null);
            if (name == null) {
                throw new RenderException(RenderException.Reason.PARSE_ERROR, file + ": image overrides need a name");
            }
            images.add(new ImageOverride(name, i.path("newName").asText(null), i.path("newTag").asText(null),
                    i.path("digest").asText(null)));
        }
        return new Kustomization(resources, patches, namespace, ManifestRenderer.stringMap(root.get("commonLabels")),
                images);
    }

    private static List<JsonNode> array(JsonNode root, String field, String file) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new RenderException(RenderException.Reason.PARSE_ERROR, file + ": " + field + " must be a list");
        }
        List<JsonNode> result = new ArrayList<>();
        node.forEach(result::add);
        return result;
    }
}
