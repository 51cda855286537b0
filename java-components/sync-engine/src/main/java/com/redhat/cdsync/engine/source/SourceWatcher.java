package com.redhat.cdsync.engine.source;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

import com.redhat.cdsync.engine.error.SyncException;

/**
 * Tracks the source revision of every application and reports each change exactly once.
 * <p>
 * Repositories are polled on a fixed interval. A push notification makes every application on that repository due
 * immediately. Failed lookups back off exponentially per application; since every poll resolves the current head, a
 * revision pushed during a backoff period is still picked up by the next successful poll.
 */
public class SourceWatcher {

    private static final Logger log = Logger.getLogger(SourceWatcher.class);

    private final SourceRepository repository;
    private final Duration pollInterval;
    private final Backoff backoff;
    private final Clock clock;
    private final Map<String, Tracked> tracked = new LinkedHashMap<>();
    private final List<Consumer<RevisionChange>> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock pollLock = new ReentrantLock();

    public SourceWatcher(SourceRepository repository, Duration pollInterval, Backoff backoff, Clock clock) {
        this.repository = repository;
        this.pollInterval = pollInterval;
        this.backoff = backoff;
        this.clock = clock;
    }

    public void addListener(Consumer<RevisionChange> listener) {
        listeners.add(listener);
    }

    /**
     * Starts tracking an application, or updates its source. A changed source is due immediately.
     *
     * @param lastRevision the revision already processed, so it is not reported again after a restart
     */
    public synchronized void track(String application, String repoURL, String targetRevision, String lastRevision) {
        Tracked existing = tracked.get(application);
        if (existing != null && existing.repoURL.equals(repoURL) && existing.targetRevision.equals(targetRevision)) {
            return;
        }
        Tracked t = new Tracked(application, repoURL, targetRevision);
        t.lastSeen = lastRevision;
        t.nextPollAt = clock.instant();
        tracked.put(application, t);
        log.debugf("Tracking %s at %s@%s", application, repoURL, targetRevision);
    }

    public synchronized void untrack(String application) {
        tracked.remove(application);
    }

    /**
     * Forgets the revision last reported for an application, so the next poll reports the current head again. Used
     * when a sync could not complete for reasons unrelated to the revision itself.
     */
    public synchronized void rewind(String application) {
        Tracked t = tracked.get(application);
        if (t != null && t.lastSeen != null) {
            log.debugf("Revision %s of %s will be reported again", t.lastSeen, application);
            t.lastSeen = null;
        }
    }

    public synchronized Optional<String> lastSeen(String application) {
        Tracked t = tracked.get(application);
        return t == null ? Optional.empty() : Optional.ofNullable(t.lastSeen);
    }

    public synchronized int consecutiveFailures(String application) {
        Tracked t = tracked.get(application);
        return t == null ? 0 : t.failures;
    }

    /**
     * Marks every application on the repository as due. Backoff from earlier failures is overridden.
     *
     * @return the number of applications affected
     */
    public synchronized int notifyPush(String repoURL) {
        String normalized = normalizeURL(repoURL);
        int count = 0;
        Instant now = clock.instant();
        for (var t : tracked.values()) {
            if (normalizeURL(t.repoURL).equals(normalized)) {
                t.nextPollAt = now;
                count++;
            }
        }
        log.debugf("Push notification for %s matched %d applications", repoURL, count);
        return count;
    }

    /**
     * Resolves the head of every due application, at most once per repository and revision, and publishes the
     * changes. Returns immediately if another poll is in progress.
     */
    public List<RevisionChange> pollDue() {
        if (!pollLock.tryLock()) {
            return List.of();
        }
        try {
            Map<Source, List<Tracked>> due = new LinkedHashMap<>();
            synchronized (this) {
                Instant now = clock.instant();
                for (var t : tracked.values()) {
                    if (!t.nextPollAt.isAfter(now)) {
                        due.computeIfAbsent(new Source(t.repoURL, t.targetRevision), k -> new ArrayList<>()).add(t);
                    }
                }
            }
            Map<Source, Object> results = new HashMap<>();
            for (var source : due.keySet()) {
                try {
                    results.put(source, repository.resolve(source.repoURL(), source.revision()));
                } catch (SyncException e) {
                    results.put(source, e);
                }
            }
            List<RevisionChange> changes = new ArrayList<>();
            synchronized (this) {
                Instant now = clock.instant();
                for (var e : due.entrySet()) {
                    Object result = results.get(e.getKey());
                    for (var t : e.getValue()) {
                        if (tracked.get(t.application) != t) {
                            //untracked or changed while resolving
                            continue;
                        }
                        if (result instanceof SyncException) {
                            SyncException failure = (SyncException) result;
                            t.failures++;
                            Duration delay = backoff.delay(t.failures);
                            t.nextPollAt = now.plus(delay);
                            log.errorf("Failed to resolve %s@%s for %s (%s, attempt %d), retrying in %s",
                                    t.repoURL, t.targetRevision, t.application, failure.getMessage(), t.failures, delay);
                            continue;
                        }
                        String revision = (String) result;
                        t.failures = 0;
                        t.nextPollAt = now.plus(pollInterval);
                        if (!Objects.equals(revision, t.lastSeen)) {
                            changes.add(new RevisionChange(t.application, t.repoURL, t.targetRevision, revision,
                                    t.lastSeen));
                            t.lastSeen = revision;
                        }
                    }
                }
            }
            for (var change : changes) {
                log.infof("Application %s source changed to %s", change.application(), change.revision());
                for (var listener : listeners) {
                    try {
                        listener.accept(change);
                    } catch (RuntimeException e) {
                        log.errorf(e, "Revision listener failed for %s", change.application());
                    }
                }
            }
            return changes;
        } finally {
            pollLock.unlock();
        }
    }

    public static String normalizeURL(String repoURL) {
        String result = repoURL.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        if (result.endsWith(".git")) {
            result = result.substring(0, result.length() - 4);
        }
        return result.toLowerCase();
    }

    private record Source(String repoURL, String revision) {
    }

    private static final class Tracked {
        final String application;
        final String repoURL;
        final String targetRevision;
        String lastSeen;
        int failures;
        Instant nextPollAt;

        Tracked(String application, String repoURL, String targetRevision) {
            this.application = application;
            this.repoURL = repoURL;
            this.targetRevision = targetRevision;
        }
    }
}
