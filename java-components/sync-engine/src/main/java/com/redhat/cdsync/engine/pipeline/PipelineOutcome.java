package com.redhat.cdsync.engine.pipeline;

public enum PipelineOutcome {
    PENDING("Pending"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed");

    private final String displayName;

    PipelineOutcome(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
