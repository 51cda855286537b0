package com.redhat.cdsync.controller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.redhat.cdsync.engine.error.ValidationException;

/**
 * A push notification from a git host. Either the plain {@code repoURL} form or the {@code repository} object sent
 * by GitHub and Gitea style webhooks is accepted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PushNotification(String repoURL, Repository repository) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("clone_url") String cloneUrl, @JsonProperty("html_url") String htmlUrl) {
    }

    String resolveRepoURL() {
        if (repoURL != null && !repoURL.isBlank()) {
            return repoURL;
        }
        if (repository != null) {
            if (repository.cloneUrl() != null && !repository.cloneUrl().isBlank()) {
                return repository.cloneUrl();
            }
            if (repository.htmlUrl() != null && !repository.htmlUrl().isBlank()) {
                return repository.htmlUrl();
            }
        }
        throw new ValidationException("push notification does not name a repository");
    }
}
