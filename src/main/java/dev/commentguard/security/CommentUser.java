package dev.commentguard.security;

/**
 * Identity of an authenticated commenter, taken from the bearer token.
 *
 * @param userId      opaque account id, used for ownership checks only
 * @param email       may be null when the identity provider withholds it
 * @param displayName name shown next to comments
 * @param avatarUrl   may be null
 * @param role        one of {@code USER}, {@code MODERATOR}, {@code ADMIN}
 */
public record CommentUser(String userId, String email, String displayName, String avatarUrl, String role) {
}
