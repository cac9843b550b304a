package dev.commentguard.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict of the submission pipeline. Only persisted verdicts produce a
 * {@link Comment} row; their flags are written as-is.
 */
public enum CommentDecision {
    REJECT("reject", false, false, false,
            "Your comment could not be submitted. Please try again."),
    RATE_LIMITED("rate_limited", false, false, false,
            "You are commenting too frequently. Please wait a moment and try again."),
    SPAM("spam", false, true, true,
            "Your comment has been submitted for review."),
    PENDING("pending", false, false, true,
            "Your comment has been submitted and is awaiting moderation."),
    APPROVED("approved", true, false, true,
            "Comment posted successfully!");

    private final String value;
    private final boolean approved;
    private final boolean spam;
    private final boolean persisted;
    private final String message;

    CommentDecision(String value, boolean approved, boolean spam, boolean persisted, String message) {
        this.value = value;
        this.approved = approved;
        this.spam = spam;
        this.persisted = persisted;
        this.message = message;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isApproved() {
        return approved;
    }

    public boolean isSpam() {
        return spam;
    }

    public boolean isPersisted() {
        return persisted;
    }

    public String message() {
        return message;
    }
}
