package com.redhat.cdsync.engine.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.redhat.cdsync.engine.error.NotFoundException;

class GitSourceRepositoryTest {

    @TempDir
    Path temp;

    Git upstream;
    String url;
    GitSourceRepository repository;

    @BeforeEach
    void setup() throws Exception {
        Path work = temp.resolve("upstream");
        upstream = Git.init().setDirectory(work.toFile()).setInitialBranch("main").call();
        url = work.toAbsolutePath().toString();
        repository = new GitSourceRepository(temp.resolve("cache"), Optional.empty());
    }

    @AfterEach
    void close() {
        repository.close();
        upstream.close();
    }

    RevCommit commit(String path, String content) throws Exception {
        Path file = upstream.getRepository().getWorkTree().toPath().resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        upstream.add().addFilepattern(".").call();
        return upstream.commit().setMessage("update " + path).setSign(false).call();
    }

    @Test
    void resolvesBranchesTagsAndCommits() throws Exception {
        RevCommit first = commit("app/deploy.yaml", "a: 1\n");
        upstream.tag().setName("v1").setAnnotated(true).setMessage("v1").setSigned(false).call();
        RevCommit second = commit("app/deploy.yaml", "a: 2\n");

        assertThat(repository.resolve(url, "HEAD")).isEqualTo(second.getName());
        assertThat(repository.resolve(url, "main")).isEqualTo(second.getName());
        assertThat(repository.resolve(url, "v1")).isEqualTo(first.getName());
        assertThat(repository.resolve(url, first.getName())).isEqualTo(first.getName());
    }

    @Test
    void fetchesNewCommits() throws Exception {
        commit("a.yaml", "a: 1\n");
        String before = repository.resolve(url, "main");
        RevCommit next = commit("a.yaml", "a: 2\n");
        String after = repository.resolve(url, "main");
        assertThat(after).isNotEqualTo(before).isEqualTo(next.getName());
    }

    @Test
    void unknownRevision() throws Exception {
        commit("a.yaml", "a: 1\n");
        assertThatThrownBy(() -> repository.resolve(url, "no-such-branch")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void readsTreeAtCommit() throws Exception {
        RevCommit first = commit("app/base/deploy.yaml", "a: 1\n");
        commit("app/base/deploy.yaml", "a: 2\n");
        commit("app/service.yaml", "b: 1\n");
        repository.resolve(url, "main");

        SourceTree tree = repository.tree(url, first.getName());
        assertThat(tree.revision()).isEqualTo(first.getName());
        assertThat(tree.isDirectory("app")).isTrue();
        assertThat(tree.isDirectory("app/base/deploy.yaml")).isFalse();
        assertThat(tree.list("app")).containsExactly("base");
        assertThat(tree.read("app/base/deploy.yaml")).get()
                .extracting(b -> new String(b, StandardCharsets.UTF_8))
                .isEqualTo("a: 1\n");
        assertThat(tree.read("app/service.yaml")).isEmpty();
        assertThat(tree.read("../outside.yaml")).isEmpty();
    }
}
