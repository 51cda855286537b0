package com.redhat.cdsync.controller;

import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.redhat.cdsync.engine.app.ApplicationController;
import com.redhat.cdsync.engine.error.SyncException;
import com.redhat.cdsync.engine.source.SourceWatcher;

import io.quarkus.logging.Log;
import io.quarkus.runtime.Startup;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;

/**
 * Registers the stored applications on startup and drives the source watcher's polling schedule.
 */
@Singleton
@Startup
public class SyncScheduler {

    final ApplicationController controller;
    final SourceWatcher watcher;
    final boolean watchLiveObjects;

    public SyncScheduler(ApplicationController controller, SourceWatcher watcher,
            @ConfigProperty(name = "cdsync.watch.enabled", defaultValue = "true") boolean watchLiveObjects) {
        this.controller = controller;
        this.watcher = watcher;
        this.watchLiveObjects = watchLiveObjects;
    }

    void onStart(@Observes StartupEvent event) {
        try {
            controller.trackAll();
        } catch (SyncException e) {
            //the next poll picks them up once the store is reachable
            Log.errorf(e, "Failed to load applications on startup");
        }
        if (watchLiveObjects) {
            controller.startWatching();
        }
    }

    @Scheduled(every = "${cdsync.watch-tick:10s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollSources() {
        var changes = watcher.pollDue();
        if (!changes.isEmpty()) {
            Log.infof("Source watcher found %d new revisions", changes.size());
        }
    }
}
