package com.redhat.cdsync.resources.model.v1alpha1;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Rewrites container images whose repository matches {@link #getName()}. A digest wins over a tag.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageOverride {

    private String name;
    private String newName;
    private String newTag;
    private String digest;

    public ImageOverride() {
    }

    public ImageOverride(String name, String newName, String newTag, String digest) {
        this.name = name;
        this.newName = newName;
        this.newTag = newTag;
        this.digest = digest;
    }

    public String getName() {
        return name;
    }

    public ImageOverride setName(String name) {
        this.name = name;
        return this;
    }

    public String getNewName() {
        return newName;
    }

    public ImageOverride setNewName(String newName) {
        this.newName = newName;
        return this;
    }

    public String getNewTag() {
        return newTag;
    }

    public ImageOverride setNewTag(String newTag) {
        this.newTag = newTag;
        return this;
    }

    public String getDigest() {
        return digest;
    }

    public ImageOverride setDigest(String digest) {
        this.digest = digest;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ImageOverride that = (ImageOverride) o;
        return Objects.equals(name, that.name) && Objects.equals(newName, that.newName)
                && Objects.equals(newTag, that.newTag) && Objects.equals(digest, that.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, newName, newTag, digest);
    }

    @Override
    public String toString() {
        return "ImageOverride{" +
                "name='" + name + '\'' +
                ", newName='" + newName + '\'' +
                ", newTag='" + newTag + '\'' +
                ", digest='" + digest + '\'' +
                '}';
    }
}
