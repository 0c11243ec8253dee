package com.event.resolution.filter;

import com.event.resolution.core.model.Event;
import com.event.resolution.core.model.TagRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagFilterTest {

    private final TagFilter filter = new TagFilter(new TagRules(Map.of(), Set.of(), Set.of("Private Event")));

    @Test
    @DisplayName("Should reject tags in the remove set ignoring case and spaces")
    void testRemoveTag() {
        assertFalse(filter.accepts(List.of("Jazz", "Private Event")));
        assertFalse(filter.accepts(List.of("privateEVENT")));
        assertTrue(filter.accepts(List.of("Jazz", "Private")));
        assertTrue(filter.accepts(List.of()));
    }

    @Test
    @DisplayName("Should check the tags of an event")
    void testEvent() {
        Event event = Event.builder()
                .name("Members Preview")
                .tags(List.of("Art", "Private Event"))
                .occurrence("2025-06-03", "", "", "")
                .build();

        assertFalse(filter.accepts(event));
        assertTrue(new TagFilter(null).accepts(event));
    }
}
