package com.event.resolution.text;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans free-text event fields extracted from web pages.
 * Strips markup, decodes a fixed table of HTML entities, drops invisible characters
 * and collapses whitespace. Pure and deterministic.
 */
public final class FieldSanitizer {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern ESCAPED_PIPE = Pattern.compile(" \\\\ ?\\|");

    /** Decoded in insertion order. */
    private static final Map<String, String> HTML_ENTITIES = new LinkedHashMap<>();

    static {
        HTML_ENTITIES.put("&nbsp;", " ");
        HTML_ENTITIES.put("&amp;", "&");
        HTML_ENTITIES.put("&lt;", "<");
        HTML_ENTITIES.put("&gt;", ">");
        HTML_ENTITIES.put("&quot;", "\"");
        HTML_ENTITIES.put("&#39;", "'");
        HTML_ENTITIES.put("&apos;", "'");
        HTML_ENTITIES.put("&ndash;", "\u2013");
        HTML_ENTITIES.put("&mdash;", "\u2014");
        HTML_ENTITIES.put("&rsquo;", "\u2019");
        HTML_ENTITIES.put("&lsquo;", "\u2018");
        HTML_ENTITIES.put("&rdquo;", "\u201d");
        HTML_ENTITIES.put("&ldquo;", "\u201c");
    }

    /** Zero-width space, zero-width non-joiner, BOM, soft hyphen. */
    private static final String[] INVISIBLE = {"\u200b", "\u200c", "\ufeff", "\u00ad"};

    private FieldSanitizer() {
        // utility class
    }

    /**
     * Sanitizes a free-text field. Null and empty input are returned unchanged.
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = HTML_TAG.matcher(text).replaceAll(" ");
        for (Map.Entry<String, String> entity : HTML_ENTITIES.entrySet()) {
            result = result.replace(entity.getKey(), entity.getValue());
        }
        result = result.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
        for (String invisible : INVISIBLE) {
            result = result.replace(invisible, "");
        }
        return WHITESPACE.matcher(result).replaceAll(" ").strip();
    }

    /**
     * Sanitizes an event name and turns escaped table pipes ({@code " \|"}) into colons.
     */
    public static String sanitizeName(String name) {
        String result = sanitize(name);
        if (result == null || result.isEmpty()) {
            return result;
        }
        return ESCAPED_PIPE.matcher(result).replaceAll(":");
    }
}
