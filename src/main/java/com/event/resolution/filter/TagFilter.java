package com.event.resolution.filter;

import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.TagRules;

import java.util.Collection;

/**
 * Rejects rows and events carrying a tag from the remove set. Comparison ignores case and spaces.
 */
public class TagFilter {

    private final TagRules rules;

    public TagFilter(TagRules rules) {
        this.rules = rules != null ? rules : TagRules.empty();
    }

    public boolean accepts(Collection<String> tags) {
        return tags.stream().noneMatch(rules::isRemoving);
    }

    public boolean accepts(Event event) {
        return accepts(event.getTags());
    }
}
