package com.event.resolution.text;

import com.event.resolution.core.model.TagRules;
import com.event.resolution.rules.DefaultNormalizationRules;
import com.event.resolution.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a raw {@code "#Tag1 #Tag2"} string into a deduplicated, cased tag list.
 *
 * <p>Per fragment: word splitting and name-prefix repair, then rewrite lookup
 * (case/space-insensitive, replacing the processed form), then casing fixes. A tag is
 * dropped when its lookup form is excluded or already seen.</p>
 */
public class TagNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TagNormalizer.class);

    private final NormalizationEngine splitEngine;
    private final NormalizationEngine casingEngine;

    public TagNormalizer() {
        this(DefaultNormalizationRules.createTagSplitEngine(), DefaultNormalizationRules.createTagCasingEngine());
    }

    public TagNormalizer(NormalizationEngine splitEngine, NormalizationEngine casingEngine) {
        this.splitEngine = splitEngine;
        this.casingEngine = casingEngine;
    }

    public List<String> normalize(String hashtags, TagRules rules) {
        List<String> tags = new ArrayList<>();
        if (hashtags == null || hashtags.isBlank()) {
            return tags;
        }
        TagRules effective = rules != null ? rules : TagRules.empty();

        Set<String> seen = new HashSet<>();
        for (String fragment : hashtags.split("#")) {
            String raw = stripTrailingCommas(fragment.strip());
            if (raw.isEmpty()) {
                continue;
            }
            String tag = normalizeTag(raw, effective);
            String key = TagRules.lookupKey(tag);
            if (effective.exclude().contains(key)) {
                log.debug("Excluded tag '{}'", tag);
                continue;
            }
            if (seen.add(key)) {
                tags.add(tag);
            }
        }
        return tags;
    }

    /**
     * Normalizes one hashtag fragment (without the leading {@code #}).
     */
    public String normalizeTag(String fragment, TagRules rules) {
        String processed = splitEngine.apply(fragment).strip();
        String rewritten = rules.rewrite().getOrDefault(TagRules.lookupKey(processed), processed);
        return casingEngine.apply(rewritten);
    }

    private static String stripTrailingCommas(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == ',') {
            end--;
        }
        return s.substring(0, end);
    }
}
