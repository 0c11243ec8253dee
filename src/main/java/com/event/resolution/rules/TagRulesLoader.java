package com.event.resolution.rules;

import com.event.resolution.core.model.TagRules;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads {@link TagRules} from a JSON file of the form
 * <pre>
 * {"rewrite": {"nyc": "NYC"}, "exclude": ["events"], "remove": ["privateevent"]}
 * </pre>
 * A missing or corrupt file degrades to {@link TagRules#empty()}.
 */
public final class TagRulesLoader {
    private static final Logger log = LoggerFactory.getLogger(TagRulesLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TagRulesLoader() {
    }

    public static TagRules load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("tags.missing path={} using empty rules", path);
            return TagRules.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            log.warn("tags.unreadable path={} error={} using empty rules", path, e.getMessage());
            return TagRules.empty();
        }
    }

    public static TagRules load(InputStream in) {
        try {
            TagRulesFile file = MAPPER.readValue(in, TagRulesFile.class);
            if (file == null) {
                return TagRules.empty();
            }
            TagRules rules = new TagRules(file.rewrite(), toSet(file.exclude()), toSet(file.remove()));
            log.info("tags.loaded rewrite={} exclude={} remove={}",
                    rules.rewrite().size(), rules.exclude().size(), rules.remove().size());
            return rules;
        } catch (IOException e) {
            log.warn("tags.unparseable error={} using empty rules", e.getMessage());
            return TagRules.empty();
        }
    }

    private static Set<String> toSet(List<String> tags) {
        return tags != null ? new LinkedHashSet<>(tags) : Set.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TagRulesFile(@JsonProperty("rewrite") Map<String, String> rewrite,
                        @JsonProperty("exclude") List<String> exclude,
                        @JsonProperty("remove") List<String> remove) {
    }
}
