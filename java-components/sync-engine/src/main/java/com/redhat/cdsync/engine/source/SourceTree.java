package com.redhat.cdsync.engine.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A read only file tree at one revision. Paths are relative to the repository root and use {@code /} separators.
 */
public interface SourceTree {

    String revision();

    boolean isDirectory(String path);

    Optional<byte[]> read(String path);

    /**
     * @return the names of the direct children of a directory, sorted, or an empty list if it does not exist
     */
    List<String> list(String directory);

    /**
     * Normalizes a relative path, resolving {@code .} and {@code ..} segments.
     *
     * @return the normalized path, {@code ""} for the root, or null if the path escapes the root
     */
    static String normalize(String path) {
        if (path == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (var segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (parts.isEmpty()) {
                    return null;
                }
                parts.remove(parts.size() - 1);
            } else {
                parts.add(segment);
            }
        }
        return String.join("/", parts);
    }

    static String join(String directory, String name) {
        return directory.isEmpty() ? name : directory + "/" + name;
    }
}
