package com.redhat.cdsync.engine.source;

/**
 * Sends local directories to {@link LocalDirectorySourceRepository} and everything else to git.
 */
public class RoutingSourceRepository implements SourceRepository, AutoCloseable {

    private final GitSourceRepository git;
    private final LocalDirectorySourceRepository local;

    public RoutingSourceRepository(GitSourceRepository git, LocalDirectorySourceRepository local) {
        this.git = git;
        this.local = local;
    }

    @Override
    public String resolve(String repoURL, String revision) {
        return select(repoURL).resolve(repoURL, revision);
    }

    @Override
    public SourceTree tree(String repoURL, String resolvedRevision) {
        return select(repoURL).tree(repoURL, resolvedRevision);
    }

    @Override
    public void close() {
        git.close();
    }

    private SourceRepository select(String repoURL) {
        return LocalDirectorySourceRepository.handles(repoURL) ? local : git;
    }
}
