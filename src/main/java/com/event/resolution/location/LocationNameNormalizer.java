package com.event.resolution.location;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of venue names used both for index keys and for queries.
 *
 * <p>Lowercases, strips punctuation, drops a leading "the " from long names and a trailing
 * city or borough suffix. A borough written after a dash or underscore
 * ({@code "Bric - Brooklyn"}) is part of the venue's identifier and is kept. Online-only
 * markers normalize to empty and therefore never match.</p>
 */
public final class LocationNameNormalizer {

    private static final List<String> BOROUGHS = List.of("queens", "bronx", "brooklyn", "manhattan", "staten island");
    private static final List<String> GEOGRAPHIC_SUFFIXES =
            List.of("nyc", "new york", "brooklyn", "manhattan", "queens", "bronx", "staten island");
    private static final List<String> ONLINE_MARKERS = List.of("virtual", "online", "livestream");

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final int MIN_LENGTH_FOR_ARTICLE_DROP = 15;

    private LocationNameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String lower = name.toLowerCase(Locale.ROOT);
        boolean boroughIsIdentifier = BOROUGHS.stream()
                .anyMatch(b -> lower.contains("- " + b) || lower.contains("_" + b));

        String normalized = PUNCTUATION.matcher(lower).replaceAll("");
        if (ONLINE_MARKERS.contains(normalized)) {
            return "";
        }
        if (normalized.length() > MIN_LENGTH_FOR_ARTICLE_DROP && normalized.startsWith("the ")) {
            normalized = normalized.substring(4);
        }
        if (GEOGRAPHIC_SUFFIXES.contains(normalized)) {
            return "";
        }
        if (!boroughIsIdentifier) {
            for (String suffix : GEOGRAPHIC_SUFFIXES) {
                if (normalized.endsWith(" " + suffix) && normalized.length() > suffix.length() + 2) {
                    normalized = normalized.substring(0, normalized.length() - suffix.length() - 1).strip();
                    break;
                }
            }
        }
        return WHITESPACE.matcher(normalized).replaceAll(" ").strip();
    }
}
