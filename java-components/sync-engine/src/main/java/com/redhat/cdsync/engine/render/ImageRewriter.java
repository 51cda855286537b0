package com.redhat.cdsync.engine.render;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redhat.cdsync.resources.model.v1alpha1.ImageOverride;

/**
 * Rewrites container images inside pod specs, including pod templates and cron job templates.
 */
final class ImageRewriter {

    private static final List<String> POD_SPEC_PATHS = List.of(
            "/spec",
            "/spec/template/spec",
            "/spec/jobTemplate/spec/template/spec");

    private ImageRewriter() {
    }

    /**
     * @return true if any image was changed
     */
    static boolean rewrite(ObjectNode body, List<ImageOverride> overrides) {
        if (overrides.isEmpty()) {
            return false;
        }
        boolean changed = false;
        for (var path : POD_SPEC_PATHS) {
            JsonNode spec = body.at(path);
            if (!spec.isObject()) {
                continue;
            }
            for (var field : List.of("initContainers", "containers")) {
                JsonNode containers = spec.get(field);
                if (containers == null || !containers.isArray()) {
                    continue;
                }
                for (var container : containers) {
                    JsonNode image = container.get("image");
                    if (container.isObject() && image != null && image.isTextual()) {
                        String updated = apply(image.asText(), overrides);
                        if (!updated.equals(image.asText())) {
                            ((ObjectNode) container).put("image", updated);
                            changed = true;
                        }
                    }
                }
            }
        }
        return changed;
    }

    static String apply(String image, List<ImageOverride> overrides) {
        String result = image;
        for (var override : overrides) {
            result = applyOne(result, override);
        }
        return result;
    }

    private static String applyOne(String image, ImageOverride override) {
        String name = image;
        String suffix = "";
        int at = name.indexOf('@');
        if (at >= 0) {
            suffix = name.substring(at);
            name = name.substring(0, at);
        } else {
            int colon = name.lastIndexOf(':');
            if (colon > name.lastIndexOf('/')) {
                suffix = name.substring(colon);
                name = name.substring(0, colon);
            }
        }
        if (!name.equals(override.getName())) {
            return image;
        }
        String newName = override.getNewName() == null || override.getNewName().isEmpty() ? name
                : override.getNewName();
        if (override.getDigest() != null && !override.getDigest().isEmpty()) {
            suffix = "@" + override.getDigest();
        } else if (override.getNewTag() != null && !override.getNewTag().isEmpty()) {
            suffix = ":" + override.getNewTag();
        }
        return newName + suffix;
    }
}
