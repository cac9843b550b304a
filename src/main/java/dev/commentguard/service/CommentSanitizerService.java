package dev.commentguard.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans comment bodies before anything else looks at them.
 * <p>
 * Comments are stored as plain text and escaped on render; this service only
 * refuses obviously hostile markup, normalises whitespace, counts links and
 * enforces the length limit. It has no collaborators and keeps no state.
 * </p>
 */
@Service
@Slf4j
public class CommentSanitizerService {

    public static final String REASON_EMPTY = "Content is empty";
    public static final String REASON_DANGEROUS = "Content contains disallowed markup";

    private static final String ELLIPSIS = "…";
    private static final String ANONYMOUS = "Anonymous";
    private static final int MAX_DISPLAY_NAME_LENGTH = 100;

    // Cut at a word boundary only when one exists this close to the limit
    private static final int WORD_BOUNDARY_WINDOW = 100;

    private static final int REPETITION_MIN_WORD_LENGTH = 3;
    private static final int REPETITION_MAX_OCCURRENCES = 5;

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("data:\\s*text/html", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<iframe", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<object", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<embed", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"']+", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{4,}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Result of {@link #sanitize(String, int)}. A rejected result always has empty content.
     */
    public record SanitizeResult(String content, int linkCount, boolean truncated,
                                 boolean rejected, String rejectReason) {

        static SanitizeResult rejected(String reason) {
            return new SanitizeResult("", 0, false, true, reason);
        }
    }

    public SanitizeResult sanitize(String raw, int maxLength) {
        if (raw == null || raw.isBlank()) {
            return SanitizeResult.rejected(REASON_EMPTY);
        }
        // Patterns see the text as it will be stored, so "<scr\0ipt" cannot slip through
        String content = CONTROL_CHARS.matcher(raw).replaceAll("").trim();
        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(content).find()) {
                log.debug("Comment content rejected by pattern {}", pattern.pattern());
                return SanitizeResult.rejected(REASON_DANGEROUS);
            }
        }

        content = EXCESS_NEWLINES.matcher(content).replaceAll("\n\n\n");
        if (content.isEmpty()) {
            return SanitizeResult.rejected(REASON_EMPTY);
        }

        int linkCount = countLinks(content);

        boolean truncated = false;
        if (content.length() > maxLength) {
            content = truncate(content, maxLength);
            truncated = true;
        }
        return new SanitizeResult(content, linkCount, truncated, false, null);
    }

    /**
     * True when some word of three or more letters occurs more than five times, ignoring case.
     */
    public boolean isRepetitive(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (String word : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            if (word.length() < REPETITION_MIN_WORD_LENGTH) {
                continue;
            }
            if (counts.merge(word, 1, Integer::sum) > REPETITION_MAX_OCCURRENCES) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strips any HTML from a display name and collapses whitespace.
     */
    public String cleanDisplayName(String name) {
        if (name == null || name.isBlank()) {
            return ANONYMOUS;
        }
        Document.OutputSettings settings = new Document.OutputSettings().prettyPrint(false);
        String text = Parser.unescapeEntities(Jsoup.clean(name, "", Safelist.none(), settings), false);
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (text.isEmpty()) {
            return ANONYMOUS;
        }
        return text.length() > MAX_DISPLAY_NAME_LENGTH ? text.substring(0, MAX_DISPLAY_NAME_LENGTH) : text;
    }

    private static int countLinks(String content) {
        Matcher matcher = URL_PATTERN.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String truncate(String content, int maxLength) {
        int end = maxLength;
        // never split a surrogate pair
        if (end > 0 && Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        String cut = content.substring(0, end);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > 0 && lastSpace > maxLength - WORD_BOUNDARY_WINDOW) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + ELLIPSIS;
    }
}
