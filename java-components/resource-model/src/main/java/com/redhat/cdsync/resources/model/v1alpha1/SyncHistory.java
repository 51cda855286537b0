package com.redhat.cdsync.resources.model.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncHistory {

    private String fingerprint;
    private String revision;
    private String phase;
    private String health;
    private String finishedAt;

    public String getFingerprint() {
        return fingerprint;
    }

    public SyncHistory setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
        return this;
    }

    public String getRevision() {
        return revision;
    }

    public SyncHistory setRevision(String revision) {
        this.revision = revision;
        return this;
    }

    public String getPhase() {
        return phase;
    }

    public SyncHistory setPhase(String phase) {
        this.phase = phase;
        return this;
    }

    public String getHealth() {
        return health;
    }

    public SyncHistory setHealth(String health) {
        this.health = health;
        return this;
    }

    public String getFinishedAt() {
        return finishedAt;
    }

    public SyncHistory setFinishedAt(String finishedAt) {
        this.finishedAt = finishedAt;
        return this;
    }
}
