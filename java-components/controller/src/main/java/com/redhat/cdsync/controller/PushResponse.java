package com.redhat.cdsync.controller;

/**
 * @param applications the number of tracked applications on the repository
 * @param changed how many of them moved to a new revision
 */
public record PushResponse(String repoURL, int applications, int changed) {
}
