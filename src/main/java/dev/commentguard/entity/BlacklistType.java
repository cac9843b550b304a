package dev.commentguard.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Identity classes a blacklist entry can target.
 */
public enum BlacklistType {
    EMAIL("email"),
    IP("ip"),
    DOMAIN("domain"),
    KEYWORD("keyword");

    private final String value;

    BlacklistType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<BlacklistType> fromValue(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(candidate.trim()))
                .findFirst();
    }
}
