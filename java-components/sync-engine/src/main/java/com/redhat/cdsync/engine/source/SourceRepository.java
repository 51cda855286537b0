package com.redhat.cdsync.engine.source;

/**
 * Read access to versioned deployment sources.
 */
public interface SourceRepository {

    /**
     * Resolves a branch, tag or commit id to an immutable revision.
     *
     * @throws com.redhat.cdsync.engine.error.NotFoundException if the repository or revision does not exist
     * @throws com.redhat.cdsync.engine.error.TransientIOException if the repository could not be reached
     */
    String resolve(String repoURL, String revision);

    /**
     * Opens the content of a previously resolved revision.
     */
    SourceTree tree(String repoURL, String resolvedRevision);
}
