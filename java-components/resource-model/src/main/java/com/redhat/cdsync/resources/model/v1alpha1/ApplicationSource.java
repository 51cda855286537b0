package com.redhat.cdsync.resources.model.v1alpha1;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApplicationSource {

    private String repoURL;
    private String path;
    private String targetRevision = ModelConstants.DEFAULT_TARGET_REVISION;
    private List<ImageOverride> images = new ArrayList<>();

    public String getRepoURL() {
        return repoURL;
    }

    public ApplicationSource setRepoURL(String repoURL) {
        this.repoURL = repoURL;
        return this;
    }

    public String getPath() {
        return path;
    }

    public ApplicationSource setPath(String path) {
        this.path = path;
        return this;
    }

    public String getTargetRevision() {
        return targetRevision;
    }

    public ApplicationSource setTargetRevision(String targetRevision) {
        this.targetRevision = targetRevision;
        return this;
    }

    public List<ImageOverride> getImages() {
        return images;
    }

    public ApplicationSource setImages(List<ImageOverride> images) {
        this.images = images;
        return this;
    }
}
