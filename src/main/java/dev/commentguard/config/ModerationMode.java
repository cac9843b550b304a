package dev.commentguard.config;

import java.util.Locale;

/**
 * How aggressively clean comments are held for review.
 */
public enum ModerationMode {
    /** Publish anything the pipeline does not flag. */
    AUTO,
    /** Hold every accepted comment for review. */
    ALL,
    /** Hold comments from submitters without a previously approved comment. */
    FIRST_TIME;

    public static ModerationMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
