package com.redhat.cdsync.engine.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.redhat.cdsync.engine.app.ApplicationController;
import com.redhat.cdsync.engine.app.ApplicationRepository;
import com.redhat.cdsync.engine.pipeline.ImageRegistry;
import com.redhat.cdsync.engine.pipeline.InMemoryImageRegistry;
import com.redhat.cdsync.engine.pipeline.PipelineEngine;
import com.redhat.cdsync.engine.pipeline.PipelineOutcome;
import com.redhat.cdsync.engine.pipeline.PipelineTrigger;
import com.redhat.cdsync.engine.pipeline.TektonPipelineEngine;
import com.redhat.cdsync.engine.reconcile.Reconciler;
import com.redhat.cdsync.engine.reconcile.RetryPolicy;
import com.redhat.cdsync.engine.reconcile.Sleeper;
import com.redhat.cdsync.engine.render.ManifestRenderer;
import com.redhat.cdsync.engine.source.Backoff;
import com.redhat.cdsync.engine.source.GitSourceRepository;
import com.redhat.cdsync.engine.source.LocalDirectorySourceRepository;
import com.redhat.cdsync.engine.source.RoutingSourceRepository;
import com.redhat.cdsync.engine.source.SourceRepository;
import com.redhat.cdsync.engine.source.SourceWatcher;
import com.redhat.cdsync.engine.status.StatusReporter;
import com.redhat.cdsync.engine.store.InMemoryObjectStore;
import com.redhat.cdsync.engine.store.KindRegistry;
import com.redhat.cdsync.engine.store.KubernetesObjectStore;
import com.redhat.cdsync.engine.store.ObjectStore;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.tekton.client.TektonClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Wires the engine from configuration. Applications that include this jar get every component as a singleton bean.
 */
@Singleton
public class EngineProducer {

    private static final Logger log = Logger.getLogger(EngineProducer.class);

    public static final String STORE_KUBERNETES = "kubernetes";
    public static final String STORE_MEMORY = "memory";

    private final Instance<KubernetesClient> kubernetesClient;
    private final Instance<MeterRegistry> meterRegistry;
    private volatile MeterRegistry fallbackMeters;
    private volatile ExecutorService syncExecutor;
    private volatile ScheduledExecutorService pipelineScheduler;

    EngineProducer(Instance<KubernetesClient> kubernetesClient, Instance<MeterRegistry> meterRegistry) {
        this.kubernetesClient = kubernetesClient;
        this.meterRegistry = meterRegistry;
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    KindRegistry kindRegistry(@ConfigProperty(name = "cdsync.kinds.extra") Optional<List<String>> extra) {
        KindRegistry kinds = KindRegistry.defaults();
        extra.ifPresent(kinds::registerAll);
        return kinds;
    }

    @Produces
    @Singleton
    ObjectStore objectStore(@ConfigProperty(name = "cdsync.store", defaultValue = STORE_KUBERNETES) String type,
            KindRegistry kinds, Clock clock) {
        switch (type) {
            case STORE_MEMORY:
                log.infof("Using the in-memory object store, state is lost on exit");
                return new InMemoryObjectStore(kinds, clock);
            case STORE_KUBERNETES:
                return new KubernetesObjectStore(kubernetesClient.get(), kinds);
            default:
                throw new IllegalStateException("Unknown object store '" + type + "', expected " + STORE_KUBERNETES
                        + " or " + STORE_MEMORY);
        }
    }

    @Produces
    @Singleton
    ApplicationRepository applicationRepository(ObjectStore store, KindRegistry kinds,
            @ConfigProperty(name = "cdsync.namespace", defaultValue = "cdsync") String namespace) {
        return new ApplicationRepository(store, kinds, namespace);
    }

    @Produces
    @Singleton
    SourceRepository sourceRepository(@ConfigProperty(name = "cdsync.repository.cache-dir") Optional<String> cacheDir,
            @ConfigProperty(name = "cdsync.git.username") Optional<String> username,
            @ConfigProperty(name = "cdsync.git.password") Optional<String> password) throws IOException {
        Path dir = cacheDir.isPresent() ? Files.createDirectories(Path.of(cacheDir.get()))
                : Files.createTempDirectory("cdsync-repositories");
        Optional<CredentialsProvider> credentials = Optional.empty();
        if (username.isPresent()) {
            credentials = Optional.of(new UsernamePasswordCredentialsProvider(username.get(), password.orElse("")));
        }
        log.debugf("Caching repositories in %s", dir);
        return new RoutingSourceRepository(new GitSourceRepository(dir, credentials),
                new LocalDirectorySourceRepository());
    }

    void closeSourceRepository(@Disposes SourceRepository repository) {
        if (repository instanceof RoutingSourceRepository) {
            ((RoutingSourceRepository) repository).close();
        }
    }

    @Produces
    @Singleton
    SourceWatcher sourceWatcher(SourceRepository repository,
            @ConfigProperty(name = "cdsync.poll-interval", defaultValue = "3m") Duration pollInterval,
            @ConfigProperty(name = "cdsync.backoff.base", defaultValue = "5s") Duration backoffBase,
            @ConfigProperty(name = "cdsync.backoff.max", defaultValue = "5m") Duration backoffMax, Clock clock) {
        return new SourceWatcher(repository, pollInterval, new Backoff(backoffBase, backoffMax), clock);
    }

    @Produces
    @Singleton
    ManifestRenderer manifestRenderer(SourceRepository repository, KindRegistry kinds) {
        return new ManifestRenderer(repository, kinds);
    }

    @Produces
    @Singleton
    Reconciler reconciler(ObjectStore store, KindRegistry kinds,
            @ConfigProperty(name = "cdsync.sync.retry-limit", defaultValue = "5") int retryLimit,
            @ConfigProperty(name = "cdsync.sync.retry-backoff", defaultValue = "200ms") Duration retryBackoff,
            @ConfigProperty(name = "cdsync.sync.retry-max-backoff", defaultValue = "10s") Duration retryMaxBackoff) {
        return new Reconciler(store, kinds, new RetryPolicy(retryLimit, retryBackoff, retryMaxBackoff), Sleeper.SYSTEM,
                meters());
    }

    @Produces
    @Singleton
    ImageRegistry imageRegistry() {
        return new InMemoryImageRegistry();
    }

    @Produces
    @Singleton
    PipelineEngine pipelineEngine(@ConfigProperty(name = "cdsync.namespace", defaultValue = "cdsync") String namespace,
            @ConfigProperty(name = "cdsync.pipeline.namespace") Optional<String> pipelineNamespace,
            @ConfigProperty(name = "cdsync.pipeline.name", defaultValue = "build-and-push") String pipelineName) {
        return new TektonPipelineEngine(kubernetesClient.get().adapt(TektonClient.class),
                pipelineNamespace.orElse(namespace), pipelineName);
    }

    @Produces
    @Singleton
    PipelineTrigger pipelineTrigger(PipelineEngine engine, ImageRegistry registry,
            @ConfigProperty(name = "cdsync.pipeline.poll-interval", defaultValue = "5s") Duration pollInterval,
            Clock clock) {
        pipelineScheduler = Executors.newSingleThreadScheduledExecutor(daemon("cdsync-pipeline"));
        return new PipelineTrigger(engine, registry, pipelineScheduler, pollInterval, clock, meters());
    }

    void closePipelineTrigger(@Disposes PipelineTrigger trigger) {
        if (pipelineScheduler != null) {
            pipelineScheduler.shutdownNow();
        }
    }

    @Produces
    @Singleton
    ApplicationController applicationController(ApplicationRepository applications, ObjectStore store,
            KindRegistry kinds, SourceRepository source, ManifestRenderer renderer, Reconciler reconciler,
            SourceWatcher watcher, PipelineTrigger pipelines, Clock clock,
            @ConfigProperty(name = "cdsync.sync.workers", defaultValue = "4") int workers,
            @ConfigProperty(name = "cdsync.event-queue.capacity", defaultValue = "16") int queueCapacity,
            @ConfigProperty(name = "cdsync.status.history-limit", defaultValue = "10") int historyLimit,
            @ConfigProperty(name = "cdsync.pipeline.propagate-images", defaultValue = "true") boolean propagate) {
        syncExecutor = Executors.newFixedThreadPool(workers, daemon("cdsync-sync"));
        ApplicationController controller = new ApplicationController(applications, store, kinds, source, renderer,
                reconciler, watcher, syncExecutor, clock, queueCapacity, historyLimit, meters());
        if (propagate) {
            pipelines.addCompletionListener(run -> {
                if (run.outcome() == PipelineOutcome.SUCCEEDED) {
                    controller.onImagePublished(run.repository(), run.tag(), run.digest());
                }
            });
        }
        return controller;
    }

    void closeApplicationController(@Disposes ApplicationController controller) {
        controller.close();
        if (syncExecutor != null) {
            syncExecutor.shutdownNow();
        }
    }

    @Produces
    @Singleton
    StatusReporter statusReporter(ApplicationRepository applications, PipelineTrigger pipelines) {
        return new StatusReporter(applications, pipelines);
    }

    private synchronized MeterRegistry meters() {
        if (meterRegistry.isResolvable()) {
            return meterRegistry.get();
        }
        if (fallbackMeters == null) {
            fallbackMeters = new SimpleMeterRegistry();
        }
        return fallbackMeters;
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
