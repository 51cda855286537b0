package com.redhat.cdsync.engine.reconcile;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.redhat.cdsync.engine.store.ResourceJson;

/**
 * Human readable differences between a desired and a live object, for dry run reports.
 */
final class Diffs {

    static final int MAX_PATHS = 5;

    private Diffs() {
    }

    /**
     * Paths declared in {@code desired} whose value differs in {@code live}, in declaration order.
     */
    static List<String> changedPaths(JsonNode desired, JsonNode live) {
        List<String> result = new ArrayList<>();
        collect("", desired, live, result);
        return result;
    }

    static String describe(JsonNode desired, JsonNode live) {
        List<String> paths = changedPaths(desired, live);
        if (paths.isEmpty()) {
            return "fields removed";
        }
        if (paths.size() > MAX_PATHS) {
            return "changed " + String.join(", ", paths.subList(0, MAX_PATHS)) + " and " + (paths.size() - MAX_PATHS)
                    + " more";
        }
        return "changed " + String.join(", ", paths);
    }

    private static void collect(String prefix, JsonNode desired, JsonNode live, List<String> result) {
        if (desired.isObject() && live != null && live.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = desired.fields();
            while (it.hasNext()) {
                var e = it.next();
                String path = prefix.isEmpty() ? e.getKey() : prefix + "." + e.getKey();
                collect(path, e.getValue(), live.get(e.getKey()), result);
            }
            return;
        }
        if (!ResourceJson.isSubset(desired, live)) {
            result.add(prefix);
        }
    }
}
