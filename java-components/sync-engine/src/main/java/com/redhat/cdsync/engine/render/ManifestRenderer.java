package com.redhat.cdsync.engine.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.RenderException;
import com.redhat.cdsync.engine.error.ValidationException;
import com.redhat.cdsync.engine.source.SourceRepository;
import com.redhat.cdsync.engine.source.SourceTree;
import com.redhat.cdsync.engine.store.KindRegistry;
import com.redhat.cdsync.engine.store.ObjectKey;
import com.redhat.cdsync.engine.store.ResourceJson;
import com.redhat.cdsync.engine.store.ResourceObject;
import com.redhat.cdsync.resources.model.v1alpha1.ImageOverride;
import com.redhat.cdsync.resources.util.HashUtil;

/**
 * Turns a directory of a source revision into an ordered, canonical set of objects.
 * <p>
 * A directory is either a plain manifest directory, where every {@code .yaml}, {@code .yml} and {@code .json} file
 * is loaded in lexical order, or a kustomization that names its resources and patches explicitly. Rendering is a
 * pure function of the revision, path and image overrides; it either produces every object or fails.
 */
public class ManifestRenderer {

    private static final Logger log = Logger.getLogger(ManifestRenderer.class);

    static final List<String> KUSTOMIZATION_FILES = List.of("kustomization.yaml", "kustomization.yml",
            "Kustomization");

    private final SourceRepository repository;
    private final KindRegistry kinds;

    public ManifestRenderer(SourceRepository repository, KindRegistry kinds) {
        this.repository = repository;
        this.kinds = kinds;
    }

    public DesiredStateSnapshot render(String repoURL, String revision, String path) {
        return render(repoURL, revision, path, List.of());
    }

    /**
     * @param revision a resolved revision, as returned by {@link SourceRepository#resolve(String, String)}
     * @throws RenderException if the path cannot be rendered
     */
    public DesiredStateSnapshot render(String repoURL, String revision, String path, List<ImageOverride> images) {
        SourceTree tree;
        try {
            tree = repository.tree(repoURL, revision);
        } catch (NotFoundException e) {
            throw new RenderException(RenderException.Reason.NOT_FOUND, e.getMessage(), e);
        }
        List<ResourceObject> objects = render(tree, path, images);
        log.debugf("Rendered %d objects from %s@%s/%s", objects.size(), repoURL, revision, path);
        return new DesiredStateSnapshot(fingerprint(revision, images), revision, objects);
    }

    /**
     * Renders a path of an open tree.
     */
    public List<ResourceObject> render(SourceTree tree, String path, List<ImageOverride> images) {
        String normalized = SourceTree.normalize(path);
        if (normalized == null) {
            throw new RenderException(RenderException.Reason.NOT_FOUND, "path " + path + " is outside the repository");
        }
        List<ResourceObject> objects = renderPath(tree, normalized, new LinkedHashSet<>());
        List<ResourceObject> result = new ArrayList<>();
        Set<ObjectKey> seen = new HashSet<>();
        for (var i : objects) {
            ObjectNode body = i.body();
            body.remove("status");
            ImageRewriter.rewrite(body, images == null ? List.of() : images);
            ResourceObject canonical = ResourceObject.of(ResourceJson.canonical(body));
            if (!seen.add(canonical.key())) {
                throw new RenderException(RenderException.Reason.PATCH_CONFLICT,
                        "object " + canonical.key() + " is declared more than once");
            }
            kinds.learn(canonical);
            result.add(canonical);
        }
        result.sort(ApplyOrder.comparator(kinds));
        return result;
    }

    /**
     * The revision itself when there are no overrides, otherwise a hash over the revision and the sorted overrides.
     */
    public static String fingerprint(String revision, List<ImageOverride> images) {
        if (images == null || images.isEmpty()) {
            return revision;
        }
        List<String> parts = new ArrayList<>();
        for (var i : images) {
            parts.add(i.getName() + "=" + nullToEmpty(i.getNewName()) + ":" + nullToEmpty(i.getNewTag()) + "@"
                    + nullToEmpty(i.getDigest()));
        }
        parts.sort(String::compareTo);
        return HashUtil.sha1(revision + "\n" + String.join("\n", parts));
    }

    private List<ResourceObject> renderPath(SourceTree tree, String path, Set<String> visiting) {
        if (tree.isDirectory(path)) {
            List<String> children = tree.list(path);
            for (var name : KUSTOMIZATION_FILES) {
                if (children.contains(name)) {
                    if (!visiting.add(path)) {
                        throw new RenderException(RenderException.Reason.PARSE_ERROR,
                                "kustomization " + display(path) + " includes itself via " + visiting);
                    }
                    try {
                        return renderKustomization(tree, path, SourceTree.join(path, name), visiting);
                    } finally {
                        visiting.remove(path);
                    }
                }
            }
            List<ResourceObject> result = new ArrayList<>();
            for (var name : children) {
                String child = SourceTree.join(path, name);
                if (isManifest(name) && !tree.isDirectory(child)) {
                    result.addAll(parseFile(tree, child));
                }
            }
            return result;
        }
        if (tree.read(path).isPresent()) {
            return parseFile(tree, path);
        }
        throw new RenderException(RenderException.Reason.NOT_FOUND,
                "path " + display(path) + " does not exist at " + tree.revision());
    }

    private List<ResourceObject> renderKustomization(SourceTree tree, String dir, String file, Set<String> visiting) {
        Kustomization kustomization = Kustomization.parse(file, readDocuments(tree, file));
        List<ResourceObject> objects = new ArrayList<>();
        for (var resource : kustomization.resources()) {
            String target = resolve(dir, resource, file);
            objects.addAll(renderPath(tree, target, visiting));
        }
        for (var patch : kustomization.patches()) {
            List<JsonNode> documents;
            String source;
            if (patch.path() != null) {
                source = resolve(dir, patch.path(), file);
                documents = readDocuments(tree, source);
            } else {
                source = file;
                documents = parseDocuments(source, patch.inline(), ResourceJson.YAML_MAPPER);
            }
            for (var document : documents) {
                objects = applyPatch(objects, document, patch, source);
            }
        }
        List<ResourceObject> result = new ArrayList<>();
        for (var i : objects) {
            ResourceObject updated = i;
            if (kustomization.namespace() != null && kinds.isNamespaced(i.kind())) {
                updated = updated.withNamespace(kustomization.namespace());
            }
            if (!kustomization.commonLabels().isEmpty()) {
                updated = withCommonLabels(updated, kustomization.commonLabels());
            }
            if (!kustomization.images().isEmpty()) {
                ObjectNode body = updated.body();
                if (ImageRewriter.rewrite(body, kustomization.images())) {
                    updated = ResourceObject.of(body);
                }
            }
            result.add(updated);
        }
        return result;
    }

    private List<ResourceObject> applyPatch(List<ResourceObject> objects, JsonNode document,
            Kustomization.Patch patch, String source) {
        if (!document.isObject()) {
            throw new RenderException(RenderException.Reason.PARSE_ERROR, "patch in " + source + " is not a mapping");
        }
        String kind = patch.targetKind() != null ? patch.targetKind() : document.path("kind").asText(null);
        String name = patch.targetName() != null ? patch.targetName() : document.path("metadata").path("name").asText(null);
        String namespace = patch.targetKind() != null ? patch.targetNamespace()
                : document.path("metadata").path("namespace").asText(null);
        if (kind == null || name == null) {
            throw new RenderException(RenderException.Reason.PARSE_ERROR,
                    "patch in " + source + " must identify its target by kind and name");
        }
        List<ResourceObject> result = new ArrayList<>(objects.size());
        boolean matched = false;
        for (var i : objects) {
            if (i.kind().equals(kind) && i.name().equals(name)
                    && (namespace == null || namespace.isEmpty() || namespace.equals(i.namespace()))) {
                matched = true;
                ObjectNode patchBody = ((ObjectNode) document).deepCopy();
                if (patch.targetKind() == null) {
                    patchBody.remove("apiVersion");
                }
                JsonNode merged = JsonMergePatch.apply(i.body(), patchBody);
                ResourceObject patched;
                try {
                    patched = ResourceObject.of(merged);
                } catch (ValidationException e) {
                    throw new RenderException(RenderException.Reason.PATCH_CONFLICT,
                            "patch in " + source + " produced an invalid " + i.key() + ": " + e.getMessage(), e);
                }
                if (!patched.key().equals(i.key())) {
                    throw new RenderException(RenderException.Reason.PATCH_CONFLICT,
                            "patch in " + source + " changes the identity of " + i.key() + " to " + patched.key());
                }
                result.add(patched);
            } else {
                result.add(i);
            }
        }
        if (!matched) {
            throw new RenderException(RenderException.Reason.PATCH_CONFLICT,
                    "patch in " + source + " targets " + kind + "/" + name + " which is not rendered");
        }
        return result;
    }

    private static ResourceObject withCommonLabels(ResourceObject object, Map<String, String> labels) {
        ObjectNode body = object.withLabels(labels).body();
        JsonNode template = body.at("/spec/template");
        if (template.isObject()) {
            ObjectNode templateNode = (ObjectNode) template;
            JsonNode metadata = templateNode.get("metadata");
            ObjectNode metadataNode = metadata != null && metadata.isObject() ? (ObjectNode) metadata
                    : templateNode.putObject("metadata");
            JsonNode existing = metadataNode.get("labels");
            ObjectNode labelNode = existing != null && existing.isObject() ? (ObjectNode) existing
                    : metadataNode.putObject("labels");
            labels.forEach(labelNode::put);
        }
        return ResourceObject.of(body);
    }

    private List<ResourceObject> parseFile(SourceTree tree, String file) {
        List<ResourceObject> result = new ArrayList<>();
        for (var document : readDocuments(tree, file)) {
            if (document.path("kind").asText().equals("List") && document.path("items").isArray()) {
                for (var item : document.get("items")) {
                    result.add(toObject(item, file));
                }
            } else {
                result.add(toObject(document, file));
            }
        }
        return result;
    }

    private static ResourceObject toObject(JsonNode document, String file) {
        try {
            return ResourceObject.of(document);
        } catch (ValidationException e) {
            throw new RenderException(RenderException.Reason.PARSE_ERROR, file + ": " + e.getMessage(), e);
        }
    }

    private static List<JsonNode> readDocuments(SourceTree tree, String file) {
        byte[] content = tree.read(file).orElseThrow(() -> new RenderException(RenderException.Reason.NOT_FOUND,
                "file " + file + " does not exist at " + tree.revision()));
        ObjectMapper mapper = file.endsWith(".json") ? ResourceJson.MAPPER : ResourceJson.YAML_MAPPER;
        return parseDocuments(file, new String(content, StandardCharsets.UTF_8), mapper);
    }

    static List<JsonNode> parseDocuments(String file, String content, ObjectMapper mapper) {
        List<JsonNode> result = new ArrayList<>();
        try (MappingIterator<JsonNode> it = mapper.readerFor(JsonNode.class).readValues(content)) {
            while (it.hasNextValue()) {
                JsonNode document = it.nextValue();
                if (document == null || document.isNull() || document.isMissingNode()
                        || (document.isObject() && document.isEmpty())) {
                    continue;
                }
                result.add(document);
            }
        } catch (IOException | RuntimeException e) {
            throw new RenderException(RenderException.Reason.PARSE_ERROR,
                    "unable to parse " + file + ": " + e.getMessage(), e);
        }
        return result;
    }

    private static String resolve(String dir, String relative, String declaredIn) {
        String resolved = SourceTree.normalize(SourceTree.join(dir, relative));
        if (resolved == null) {
            throw new RenderException(RenderException.Reason.NOT_FOUND,
                    declaredIn + " references " + relative + " outside the repository");
        }
        return resolved;
    }

    private static boolean isManifest(String name) {
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    private static String display(String path) {
        return path.isEmpty() ? "/" : path;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                var e = it.next();
                result.put(e.getKey(), e.getValue().asText());
            }
        }
        return result;
    }
}
