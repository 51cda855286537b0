package com.redhat.cdsync.engine.source;

/**
 * A tracked application's source moved to a new revision.
 *
 * @param previousRevision the last revision seen, null on the first observation
 */
public record RevisionChange(String application, String repoURL, String targetRevision, String revision,
        String previousRevision) {
}
