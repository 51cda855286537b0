package com.redhat.cdsync.resources.model.v1alpha1;

public class SyncPolicy {

    /**
     * When set, new revisions seen by the source watcher are synced without an explicit request.
     */
    private boolean automated;
    private boolean selfHeal;
    private boolean prune;

    public boolean isAutomated() {
        return automated;
    }

    public SyncPolicy setAutomated(boolean automated) {
        this.automated = automated;
        return this;
    }

    public boolean isSelfHeal() {
        return selfHeal;
    }

    public SyncPolicy setSelfHeal(boolean selfHeal) {
        this.selfHeal = selfHeal;
        return this;
    }

    public boolean isPrune() {
        return prune;
    }

    public SyncPolicy setPrune(boolean prune) {
        this.prune = prune;
        return this;
    }
}
