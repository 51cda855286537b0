package com.redhat.cdsync.engine.render;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import com.redhat.cdsync.engine.source.SourceTree;

/**
 * A source tree held in memory, keyed by file path.
 */
class MapSourceTree implements SourceTree {

    private final String revision;
    private final Map<String, String> files = new TreeMap<>();

    MapSourceTree(String revision) {
        this.revision = revision;
    }

    MapSourceTree file(String path, String content) {
        files.put(path, content);
        return this;
    }

    @Override
    public String revision() {
        return revision;
    }

    @Override
    public boolean isDirectory(String path) {
        String normalized = SourceTree.normalize(path);
        if (normalized == null) {
            return false;
        }
        if (normalized.isEmpty()) {
            return true;
        }
        return files.keySet().stream().anyMatch(f -> f.startsWith(normalized + "/"));
    }

    @Override
    public Optional<byte[]> read(String path) {
        String normalized = SourceTree.normalize(path);
        String content = normalized == null ? null : files.get(normalized);
        return Optional.ofNullable(content).map(c -> c.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public List<String> list(String directory) {
        String normalized = SourceTree.normalize(directory);
        if (normalized == null) {
            return List.of();
        }
        String prefix = normalized.isEmpty() ? "" : normalized + "/";
        TreeSet<String> names = new TreeSet<>();
        for (var f : files.keySet()) {
            if (f.startsWith(prefix)) {
                String rest = f.substring(prefix.length());
                int slash = rest.indexOf('/');
                names.add(slash < 0 ? rest : rest.substring(0, slash));
            }
        }
        return List.copyOf(names);
    }
}
