package com.redhat.cdsync.engine.source;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.io.FileUtils;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.api.errors.TransportException;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.jboss.logging.Logger;

import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.TransientIOException;
import com.redhat.cdsync.resources.util.HashUtil;

/**
 * Git backed sources. Each repository URL gets one bare clone under the cache directory, which is fetched every time
 * a revision is resolved. Trees are read straight from the object database, nothing is checked out.
 */
public class GitSourceRepository implements SourceRepository, AutoCloseable {

    private static final Logger log = Logger.getLogger(GitSourceRepository.class);

    private static final List<RefSpec> REF_SPECS = List.of(
            new RefSpec("+refs/heads/*:refs/heads/*"),
            new RefSpec("+refs/tags/*:refs/tags/*"));

    private final Path cacheDir;
    private final CredentialsProvider credentials;
    private final Map<String, Git> clones = new ConcurrentHashMap<>();

    public GitSourceRepository(Path cacheDir, Optional<CredentialsProvider> credentials) {
        this.cacheDir = cacheDir;
        this.credentials = credentials.orElse(null);
    }

    @Override
    public String resolve(String repoURL, String revision) {
        Git git = clone(repoURL);
        synchronized (git) {
            try {
                git.fetch()
                        .setRemote("origin")
                        .setRefSpecs(REF_SPECS)
                        .setRemoveDeletedRefs(true)
                        .setCredentialsProvider(credentials)
                        .call();
                ObjectId id = git.getRepository().resolve(revision + "^{commit}");
                if (id == null) {
                    throw new NotFoundException("revision " + revision + " not found in " + repoURL);
                }
                return id.getName();
            } catch (InvalidRemoteException e) {
                throw new NotFoundException("repository " + repoURL + " not found", e);
            } catch (TransportException e) {
                throw new TransientIOException("unable to fetch " + repoURL + ": " + e.getMessage(), e);
            } catch (GitAPIException | IOException e) {
                throw new TransientIOException("failed to resolve " + revision + " in " + repoURL, e);
            }
        }
    }

    @Override
    public SourceTree tree(String repoURL, String resolvedRevision) {
        Repository repository = clone(repoURL).getRepository();
        try (RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(ObjectId.fromString(resolvedRevision));
            return new GitSourceTree(repository, resolvedRevision, commit.getTree());
        } catch (MissingObjectException | IllegalArgumentException e) {
            throw new NotFoundException("revision " + resolvedRevision + " not found in " + repoURL, e);
        } catch (IOException e) {
            throw new TransientIOException("failed to read " + resolvedRevision + " from " + repoURL, e);
        }
    }

    @Override
    public void close() {
        for (var i : clones.values()) {
            i.close();
        }
        clones.clear();
    }

    private Git clone(String repoURL) {
        return clones.computeIfAbsent(repoURL, url -> {
            File dir = cacheDir.resolve(HashUtil.sha1(url)).toFile();
            try {
                if (dir.exists()) {
                    try {
                        return Git.open(dir);
                    } catch (IOException e) {
                        log.errorf(e, "Discarding unreadable clone of %s at %s", url, dir);
                        FileUtils.deleteDirectory(dir);
                    }
                }
                Files.createDirectories(cacheDir);
                log.infof("Cloning %s into %s", url, dir);
                return Git.cloneRepository()
                        .setURI(url)
                        .setDirectory(dir)
                        .setBare(true)
                        .setCredentialsProvider(credentials)
                        .call();
            } catch (InvalidRemoteException e) {
                throw new NotFoundException("repository " + url + " not found", e);
            } catch (TransportException e) {
                FileUtils.deleteQuietly(dir);
                throw new TransientIOException("unable to clone " + url + ": " + e.getMessage(), e);
            } catch (GitAPIException | IOException e) {
                FileUtils.deleteQuietly(dir);
                throw new TransientIOException("failed to clone " + url, e);
            }
        });
    }

    static final class GitSourceTree implements SourceTree {

        private final Repository repository;
        private final String revision;
        private final RevTree tree;

        GitSourceTree(Repository repository, String revision, RevTree tree) {
            this.repository = repository;
            this.revision = revision;
            this.tree = tree;
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
            try (TreeWalk walk = TreeWalk.forPath(repository, normalized, tree)) {
                return walk != null && walk.getFileMode(0) == FileMode.TREE;
            } catch (IOException e) {
                throw new TransientIOException("failed to read " + normalized + " at " + revision, e);
            }
        }

        @Override
        public Optional<byte[]> read(String path) {
            String normalized = SourceTree.normalize(path);
            if (normalized == null || normalized.isEmpty()) {
                return Optional.empty();
            }
            try (TreeWalk walk = TreeWalk.forPath(repository, normalized, tree)) {
                if (walk == null || (walk.getFileMode(0).getObjectType() != Constants.OBJ_BLOB)) {
                    return Optional.empty();
                }
                return Optional.of(repository.open(walk.getObjectId(0), Constants.OBJ_BLOB).getBytes());
            } catch (IOException e) {
                throw new TransientIOException("failed to read " + normalized + " at " + revision, e);
            }
        }

        @Override
        public List<String> list(String directory) {
            String normalized = SourceTree.normalize(directory);
            if (normalized == null) {
                return List.of();
            }
            try {
                ObjectId dir;
                if (normalized.isEmpty()) {
                    dir = tree;
                } else {
                    try (TreeWalk walk = TreeWalk.forPath(repository, normalized, tree)) {
                        if (walk == null || walk.getFileMode(0) != FileMode.TREE) {
                            return List.of();
                        }
                        dir = walk.getObjectId(0);
                    }
                }
                List<String> names = new ArrayList<>();
                try (TreeWalk walk = new TreeWalk(repository)) {
                    walk.addTree(dir);
                    walk.setRecursive(false);
                    while (walk.next()) {
                        names.add(walk.getNameString());
                    }
                }
                Collections.sort(names);
                return names;
            } catch (IOException e) {
                throw new TransientIOException("failed to list " + normalized + " at " + revision, e);
            }
        }
    }
}
