package com.redhat.cdsync.controller;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import com.redhat.cdsync.engine.error.ValidationException;
import com.redhat.cdsync.engine.source.SourceWatcher;

import io.quarkus.logging.Log;
import io.smallrye.common.annotation.Blocking;

@Path("/api/webhook")
@Blocking
public class WebhookResource {

    final SourceWatcher watcher;

    public WebhookResource(SourceWatcher watcher) {
        this.watcher = watcher;
    }

    /**
     * Makes every application on the pushed repository due and polls immediately, instead of waiting for the next
     * scheduled poll.
     */
    @POST
    @Path("git")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public PushResponse push(PushNotification notification) {
        if (notification == null) {
            throw new ValidationException("push notification body is required");
        }
        String repoURL = notification.resolveRepoURL();
        int applications = watcher.notifyPush(repoURL);
        if (applications == 0) {
            Log.debugf("Ignoring push to untracked repository %s", repoURL);
            return new PushResponse(repoURL, 0, 0);
        }
        String normalized = SourceWatcher.normalizeURL(repoURL);
        long changed = watcher.pollDue().stream()
                .filter(c -> SourceWatcher.normalizeURL(c.repoURL()).equals(normalized))
                .count();
        Log.infof("Push to %s, %d of %d applications moved", repoURL, changed, applications);
        return new PushResponse(repoURL, applications, (int) changed);
    }
}
