package com.redhat.cdsync.engine.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.MutableClock;
import com.redhat.cdsync.engine.error.TransientIOException;

class SourceWatcherTest {

    static final String REPO = "https://git.example.com/deploy.git";

    final Map<String, String> heads = new HashMap<>();
    final AtomicInteger resolveCalls = new AtomicInteger();
    boolean failing;

    MutableClock clock;
    SourceWatcher watcher;
    List<RevisionChange> received;

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        SourceRepository repository = new SourceRepository() {
            @Override
            public String resolve(String repoURL, String revision) {
                resolveCalls.incrementAndGet();
                if (failing) {
                    throw new TransientIOException("connection refused");
                }
                return heads.get(revision);
            }

            @Override
            public SourceTree tree(String repoURL, String resolvedRevision) {
                throw new UnsupportedOperationException();
            }
        };
        watcher = new SourceWatcher(repository, Duration.ofMinutes(3),
                new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(5), () -> 1.0), clock);
        received = new ArrayList<>();
        watcher.addListener(received::add);
    }

    @Test
    void reportsEachRevisionOnce() {
        heads.put("main", "c1");
        watcher.track("web", REPO, "main", null);

        assertThat(watcher.pollDue()).extracting(RevisionChange::revision).containsExactly("c1");
        clock.advance(Duration.ofMinutes(3));
        assertThat(watcher.pollDue()).isEmpty();

        heads.put("main", "c2");
        clock.advance(Duration.ofMinutes(3));
        List<RevisionChange> changes = watcher.pollDue();
        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).previousRevision()).isEqualTo("c1");
        assertThat(received).extracting(RevisionChange::revision).containsExactly("c1", "c2");
        assertThat(watcher.lastSeen("web")).contains("c2");
    }

    @Test
    void notDueUntilInterval() {
        heads.put("main", "c1");
        watcher.track("web", REPO, "main", "c1");
        assertThat(watcher.pollDue()).isEmpty();
        heads.put("main", "c2");
        clock.advance(Duration.ofMinutes(1));
        assertThat(watcher.pollDue()).isEmpty();
        assertThat(resolveCalls).hasValue(1);
    }

    @Test
    void pushMakesRepositoryDue() {
        heads.put("main", "c1");
        watcher.track("web", REPO, "main", null);
        watcher.track("api", REPO, "main", null);
        watcher.track("other", "https://git.example.com/other", "main", null);
        watcher.pollDue();
        assertThat(resolveCalls).hasValue(2);

        heads.put("main", "c2");
        assertThat(watcher.notifyPush("https://git.example.com/deploy/")).isEqualTo(2);
        assertThat(watcher.pollDue()).extracting(RevisionChange::application).containsExactly("web", "api");
        assertThat(resolveCalls).hasValue(3);
    }

    @Test
    void failuresBackOffWithoutLosingRevisions() {
        heads.put("main", "c1");
        failing = true;
        watcher.track("web", REPO, "main", null);

        assertThat(watcher.pollDue()).isEmpty();
        assertThat(watcher.consecutiveFailures("web")).isEqualTo(1);
        clock.advance(Duration.ofSeconds(4));
        assertThat(watcher.pollDue()).isEmpty();
        assertThat(resolveCalls).hasValue(1);
        clock.advance(Duration.ofSeconds(1));
        watcher.pollDue();
        assertThat(watcher.consecutiveFailures("web")).isEqualTo(2);

        heads.put("main", "c2");
        failing = false;
        clock.advance(Duration.ofSeconds(10));
        assertThat(watcher.pollDue()).extracting(RevisionChange::revision).containsExactly("c2");
        assertThat(watcher.consecutiveFailures("web")).isZero();
    }

    @Test
    void untrackedApplicationsAreIgnored() {
        heads.put("main", "c1");
        watcher.track("web", REPO, "main", null);
        watcher.untrack("web");
        assertThat(watcher.pollDue()).isEmpty();
        assertThat(watcher.lastSeen("web")).isEmpty();
    }
}
