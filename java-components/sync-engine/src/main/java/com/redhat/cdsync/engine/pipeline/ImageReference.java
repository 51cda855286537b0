package com.redhat.cdsync.engine.pipeline;

import com.redhat.cdsync.engine.error.ValidationException;

/**
 * A tagged image reference such as {@code quay.io/acme/web:1.2}. A missing tag means {@code latest}.
 */
public record ImageReference(String repository, String tag) {

    public static final String DEFAULT_TAG = "latest";

    /**
     * @throws ValidationException if the reference is empty or pinned to a digest
     */
    public static ImageReference parse(String reference) {
        if (reference == null || reference.isBlank() || reference.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException("image tag '" + reference + "' is not a valid image reference");
        }
        if (reference.contains("@")) {
            throw new ValidationException("image tag '" + reference + "' must not contain a digest");
        }
        int colon = reference.lastIndexOf(':');
        if (colon > reference.lastIndexOf('/')) {
            String tag = reference.substring(colon + 1);
            String repository = reference.substring(0, colon);
            if (tag.isEmpty() || repository.isEmpty()) {
                throw new ValidationException("image tag '" + reference + "' is not a valid image reference");
            }
            return new ImageReference(repository, tag);
        }
        return new ImageReference(reference, DEFAULT_TAG);
    }

    @Override
    public String toString() {
        return repository + ":" + tag;
    }
}
