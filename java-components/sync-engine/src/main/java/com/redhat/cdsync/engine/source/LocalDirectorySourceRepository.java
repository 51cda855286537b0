package com.redhat.cdsync.engine.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.redhat.cdsync.engine.error.NotFoundException;
import com.redhat.cdsync.engine.error.TransientIOException;
import com.redhat.cdsync.resources.util.HashUtil;

/**
 * Serves plain directories on the local file system, for development and tests. The revision of a directory is a
 * hash over its content, so any edit shows up as a new revision. The requested revision name is ignored.
 */
public class LocalDirectorySourceRepository implements SourceRepository {

    public static final String REVISION_PREFIX = "dir-";

    /**
     * True for {@code file:} URLs and absolute paths that point at a directory which is not a git checkout.
     */
    public static boolean handles(String repoURL) {
        Path dir = toPath(repoURL);
        return dir != null && Files.isDirectory(dir) && !Files.exists(dir.resolve(".git"));
    }

    @Override
    public String resolve(String repoURL, String revision) {
        Path dir = directory(repoURL);
        return REVISION_PREFIX + contentHash(dir);
    }

    @Override
    public SourceTree tree(String repoURL, String resolvedRevision) {
        Path dir = directory(repoURL);
        String current = REVISION_PREFIX + contentHash(dir);
        if (!current.equals(resolvedRevision)) {
            throw new NotFoundException("revision " + resolvedRevision + " of " + repoURL + " is no longer available");
        }
        return new DirectoryTree(dir, current);
    }

    private static Path directory(String repoURL) {
        Path dir = toPath(repoURL);
        if (dir == null || !Files.isDirectory(dir)) {
            throw new NotFoundException("directory " + repoURL + " not found");
        }
        return dir;
    }

    static Path toPath(String repoURL) {
        if (repoURL == null || repoURL.isEmpty()) {
            return null;
        }
        if (repoURL.startsWith("file:")) {
            return Paths.get(URI.create(repoURL));
        }
        Path path = Paths.get(repoURL);
        return path.isAbsolute() ? path : null;
    }

    private static String contentHash(Path dir) {
        MessageDigest digest = HashUtil.sha1Digest();
        try (Stream<Path> files = Files.walk(dir)) {
            List<Path> sorted = new ArrayList<>(files.filter(Files::isRegularFile).toList());
            sorted.sort((a, b) -> relative(dir, a).compareTo(relative(dir, b)));
            for (var file : sorted) {
                digest.update(relative(dir, file).getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
                digest.update(Files.readAllBytes(file));
                digest.update((byte) 0);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new TransientIOException("failed to read " + dir, e);
        }
        return HashUtil.toHex(digest.digest());
    }

    private static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    static final class DirectoryTree implements SourceTree {

        private final Path root;
        private final String revision;

        DirectoryTree(Path root, String revision) {
            this.root = root;
            this.revision = revision;
        }

        @Override
        public String revision() {
            return revision;
        }

        @Override
        public boolean isDirectory(String path) {
            Path resolved = resolve(path);
            return resolved != null && Files.isDirectory(resolved);
        }

        @Override
        public Optional<byte[]> read(String path) {
            Path resolved = resolve(path);
            if (resolved == null || !Files.isRegularFile(resolved)) {
                return Optional.empty();
            }
            try {
                return Optional.of(Files.readAllBytes(resolved));
            } catch (IOException e) {
                throw new TransientIOException("failed to read " + resolved, e);
            }
        }

        @Override
        public List<String> list(String directory) {
            Path resolved = resolve(directory);
            if (resolved == null || !Files.isDirectory(resolved)) {
                return List.of();
            }
            try (Stream<Path> children = Files.list(resolved)) {
                return children.map(p -> p.getFileName().toString()).sorted().toList();
            } catch (IOException e) {
                throw new TransientIOException("failed to list " + resolved, e);
            }
        }

        private Path resolve(String path) {
            String normalized = SourceTree.normalize(path);
            if (normalized == null) {
                return null;
            }
            return normalized.isEmpty() ? root : root.resolve(normalized);
        }
    }
}
