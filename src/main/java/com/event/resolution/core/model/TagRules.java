package com.event.resolution.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tag rewrite/exclude/remove rules. Loaded once per run, read-only afterwards.
 * All keys are stored in lookup form (lowercase, spaces removed).
 *
 * @param rewrite lookup form to canonical tag
 * @param exclude tags never kept on an event
 * @param remove  tags that void the whole event
 */
public record TagRules(Map<String, String> rewrite, Set<String> exclude, Set<String> remove) {

    public TagRules {
        Map<String, String> normalizedRewrite = new LinkedHashMap<>();
        if (rewrite != null) {
            rewrite.forEach((k, v) -> {
                if (k != null && v != null) {
                    normalizedRewrite.put(lookupKey(k), v);
                }
            });
        }
        rewrite = Map.copyOf(normalizedRewrite);
        exclude = lookupKeys(exclude);
        remove = lookupKeys(remove);
    }

    public static TagRules empty() {
        return new TagRules(Map.of(), Set.of(), Set.of());
    }

    /**
     * Case- and space-insensitive form used for every tag comparison.
     */
    public static String lookupKey(String tag) {
        return tag == null ? "" : tag.toLowerCase(Locale.ROOT).replace(" ", "");
    }

    public boolean isExcluded(String tag) {
        return exclude.contains(lookupKey(tag));
    }

    public boolean isRemoving(String tag) {
        return remove.contains(lookupKey(tag));
    }

    private static Set<String> lookupKeys(Collection<String> tags) {
        Set<String> keys = new LinkedHashSet<>();
        if (tags != null) {
            tags.forEach(t -> keys.add(lookupKey(t)));
        }
        return Set.copyOf(keys);
    }
}
