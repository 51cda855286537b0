package com.redhat.cdsync.engine.pipeline;

import java.util.Optional;

/**
 * Content addressable view of pushed images, {@code (repository, tag) -> digest}.
 */
public interface ImageRegistry {

    void record(String repository, String tag, String digest);

    Optional<String> digest(String repository, String tag);
}
