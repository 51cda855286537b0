package com.redhat.cdsync.engine.pipeline;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryImageRegistry implements ImageRegistry {

    private final Map<ImageReference, String> digests = new ConcurrentHashMap<>();

    @Override
    public void record(String repository, String tag, String digest) {
        digests.put(new ImageReference(repository, tag), digest);
    }

    @Override
    public Optional<String> digest(String repository, String tag) {
        return Optional.ofNullable(digests.get(new ImageReference(repository, tag)));
    }
}
