package com.redhat.cdsync.engine.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RoutingSourceRepositoryTest {

    @TempDir
    Path dir;

    @Test
    void routesByLocation() throws Exception {
        Path plain = Files.createDirectories(dir.resolve("plain"));
        Files.writeString(plain.resolve("a.yaml"), "a: 1\n");
        Path repo = Files.createDirectories(dir.resolve("repo"));
        String commit;
        try (Git git = Git.init().setDirectory(repo.toFile()).setInitialBranch("main").call()) {
            Files.writeString(repo.resolve("b.yaml"), "b: 1\n");
            git.add().addFilepattern(".").call();
            commit = git.commit().setMessage("initial").setSign(false).call().getName();
        }

        try (RoutingSourceRepository routing = new RoutingSourceRepository(
                new GitSourceRepository(dir.resolve("cache"), Optional.empty()), new LocalDirectorySourceRepository())) {
            assertThat(routing.resolve(plain.toString(), "HEAD"))
                    .startsWith(LocalDirectorySourceRepository.REVISION_PREFIX);
            assertThat(routing.resolve(repo.toString(), "main")).isEqualTo(commit);
            assertThat(routing.tree(repo.toString(), commit).list("")).containsExactly("b.yaml");
        }
    }
}
