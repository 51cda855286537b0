package com.redhat.cdsync.resources.model.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceStatus {

    private String kind;
    private String namespace;
    private String name;
    private String action;
    private String outcome;
    private String health;
    private int attempts;
    private String message;

    public String getKind() {
        return kind;
    }

    public ResourceStatus setKind(String kind) {
        this.kind = kind;
        return this;
    }

    public String getNamespace() {
        return namespace;
    }

    public ResourceStatus setNamespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    public String getName() {
        return name;
    }

    public ResourceStatus setName(String name) {
        this.name = name;
        return this;
    }

    public String getAction() {
        return action;
    }

    public ResourceStatus setAction(String action) {
        this.action = action;
        return this;
    }

    public String getOutcome() {
        return outcome;
    }

    public ResourceStatus setOutcome(String outcome) {
        this.outcome = outcome;
        return this;
    }

    public String getHealth() {
        return health;
    }

    public ResourceStatus setHealth(String health) {
        this.health = health;
        return this;
    }

    public int getAttempts() {
        return attempts;
    }

    public ResourceStatus setAttempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    public String getMessage() {
        return message;
    }

    public ResourceStatus setMessage(String message) {
        this.message = message;
        return this;
    }
}
