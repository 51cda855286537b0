package com.redhat.cdsync.resources.model.v1alpha1;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApplicationStatus {

    private String phase = ModelConstants.PHASE_IDLE;
    private String health = ModelConstants.HEALTH_UNKNOWN;
    private String lastAttemptedFingerprint;
    private String lastAttemptedRevision;
    private String lastSyncedFingerprint;
    private String lastSyncedRevision;
    private long syncGeneration;
    private String errorKind;
    private String message;
    private String reconciledAt;
    private List<ResourceStatus> resources = new ArrayList<>();
    private List<SyncHistory> history = new ArrayList<>();

    public String getPhase() {
        return phase;
    }

    public ApplicationStatus setPhase(String phase) {
        this.phase = phase;
        return this;
    }

    public String getHealth() {
        return health;
    }

    public ApplicationStatus setHealth(String health) {
        this.health = health;
        return this;
    }

    public String getLastAttemptedFingerprint() {
        return lastAttemptedFingerprint;
    }

    public ApplicationStatus setLastAttemptedFingerprint(String lastAttemptedFingerprint) {
        this.lastAttemptedFingerprint = lastAttemptedFingerprint;
        return this;
    }

    public String getLastAttemptedRevision() {
        return lastAttemptedRevision;
    }

    public ApplicationStatus setLastAttemptedRevision(String lastAttemptedRevision) {
        this.lastAttemptedRevision = lastAttemptedRevision;
        return this;
    }

    public String getLastSyncedFingerprint() {
        return lastSyncedFingerprint;
    }

    public ApplicationStatus setLastSyncedFingerprint(String lastSyncedFingerprint) {
        this.lastSyncedFingerprint = lastSyncedFingerprint;
        return this;
    }

    public String getLastSyncedRevision() {
        return lastSyncedRevision;
    }

    public ApplicationStatus setLastSyncedRevision(String lastSyncedRevision) {
        this.lastSyncedRevision = lastSyncedRevision;
        return this;
    }

    /**
     * The request generation this status was written for. Writes carrying an older generation are dropped.
     */
    public long getSyncGeneration() {
        return syncGeneration;
    }

    public ApplicationStatus setSyncGeneration(long syncGeneration) {
        this.syncGeneration = syncGeneration;
        return this;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public ApplicationStatus setErrorKind(String errorKind) {
        this.errorKind = errorKind;
        return this;
    }

    public String getMessage() {
        return message;
    }

    public ApplicationStatus setMessage(String message) {
        this.message = message;
        return this;
    }

    public String getReconciledAt() {
        return reconciledAt;
    }

    public ApplicationStatus setReconciledAt(String reconciledAt) {
        this.reconciledAt = reconciledAt;
        return this;
    }

    public List<ResourceStatus> getResources() {
        return resources;
    }

    public ApplicationStatus setResources(List<ResourceStatus> resources) {
        this.resources = resources;
        return this;
    }

    public List<SyncHistory> getHistory() {
        return history;
    }

    public ApplicationStatus setHistory(List<SyncHistory> history) {
        this.history = history;
        return this;
    }
}
