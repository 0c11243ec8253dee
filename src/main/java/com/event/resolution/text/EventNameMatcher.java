package com.event.resolution.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fuzzy equality of event names, shared by per-file grouping and cross-batch dedup.
 *
 * <p>Two names are similar when their normalized forms are equal, or when one contains
 * the other and both are at least {@code minLength} characters long. Short generic names
 * can still produce false merges; the threshold is kept as is because published data
 * depends on it.</p>
 */
public class EventNameMatcher {

    public static final int DEFAULT_MIN_LENGTH = 5;

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final int minLength;

    public EventNameMatcher() {
        this(DEFAULT_MIN_LENGTH);
    }

    public EventNameMatcher(int minLength) {
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must be >= 0");
        }
        this.minLength = minLength;
    }

    /**
     * Strips underscores and punctuation, lowercases and collapses whitespace.
     */
    public String normalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String noUnderscores = name.replace("_", "");
        String noPunct = PUNCTUATION.matcher(noUnderscores.strip().toLowerCase(Locale.ROOT)).replaceAll("");
        return WHITESPACE.matcher(noPunct).replaceAll(" ").strip();
    }

    public boolean areSimilar(String name1, String name2) {
        return areNormalizedSimilar(normalize(name1), normalize(name2));
    }

    /**
     * Same as {@link #areSimilar} for names already passed through {@link #normalize}.
     */
    public boolean areNormalizedSimilar(String norm1, String norm2) {
        if (norm1.equals(norm2)) {
            return true;
        }
        return norm1.length() >= minLength && norm2.length() >= minLength
                && (norm1.contains(norm2) || norm2.contains(norm1));
    }

    public int getMinLength() {
        return minLength;
    }
}
