package dev.commentguard.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of content a comment can be attached to.
 * Entity fields keep the lower-case wire value for R2DBC compatibility.
 */
public enum CommentTargetType {
    POST("post", "/blog/posts/"),
    GALLERY_ITEM("gallery_item", "/gallery/items/");

    private final String value;
    private final String pathPrefix;

    CommentTargetType(String value, String pathPrefix) {
        this.value = value;
        this.pathPrefix = pathPrefix;
    }

    public String value() {
        return value;
    }

    public String pathPrefix() {
        return pathPrefix;
    }

    public boolean matches(String candidate) {
        return value.equals(candidate);
    }

    public static Optional<CommentTargetType> fromValue(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(candidate.trim()))
                .findFirst();
    }
}
