package com.event.resolution.location;

import com.event.resolution.core.model.LocationEntry;
import com.event.resolution.core.model.LocationMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup from venue name keys to coordinates, built once from the location registry.
 *
 * <p>Every canonical name and alias contributes two keys: its lowercased raw form and its
 * {@linkplain LocationNameNormalizer normalized} form, each only if at least
 * {@code minKeyLength} characters long. Key iteration follows first insertion; when two
 * entries share a key the later entry wins the value but the key keeps its place. Immutable
 * once built and safe to share between threads.</p>
 */
public final class LocationIndex {
    private static final Logger log = LoggerFactory.getLogger(LocationIndex.class);

    public static final int DEFAULT_MIN_KEY_LENGTH = 5;

    private final Map<String, LocationMatch> keys;
    private final Map<String, String> normalizedKeys;
    private final List<LocationEntry> entries;

    private LocationIndex(Map<String, LocationMatch> keys, List<LocationEntry> entries) {
        this.keys = Collections.unmodifiableMap(keys);
        this.entries = List.copyOf(entries);
        Map<String, String> normalized = new HashMap<>();
        for (String key : keys.keySet()) {
            normalized.put(key, LocationNameNormalizer.normalize(key));
        }
        this.normalizedKeys = normalized;
    }

    public static LocationIndex build(List<LocationEntry> entries) {
        return build(entries, DEFAULT_MIN_KEY_LENGTH);
    }

    public static LocationIndex build(List<LocationEntry> entries, int minKeyLength) {
        if (minKeyLength < 1) {
            throw new IllegalArgumentException("minKeyLength must be >= 1");
        }
        Map<String, LocationMatch> keys = new LinkedHashMap<>();
        for (LocationEntry entry : entries) {
            LocationMatch match = entry.toMatch();
            addKeys(keys, entry.getName(), match, minKeyLength);
            for (String alias : entry.getAlternateNames()) {
                addKeys(keys, alias, match, minKeyLength);
            }
        }
        log.info("location.index.built entries={} keys={}", entries.size(), keys.size());
        return new LocationIndex(keys, entries);
    }

    private static void addKeys(Map<String, LocationMatch> keys, String name, LocationMatch match, int minKeyLength) {
        if (name == null) {
            return;
        }
        putIfLongEnough(keys, name.toLowerCase(Locale.ROOT), match, minKeyLength);
        putIfLongEnough(keys, LocationNameNormalizer.normalize(name), match, minKeyLength);
    }

    private static void putIfLongEnough(Map<String, LocationMatch> keys, String key, LocationMatch match, int minKeyLength) {
        if (key.length() >= minKeyLength) {
            keys.put(key, match);
        }
    }

    public Optional<LocationMatch> get(String key) {
        return Optional.ofNullable(keys.get(key));
    }

    public boolean containsKey(String key) {
        return keys.containsKey(key);
    }

    /**
     * The normalized form of an index key, computed once at build time.
     */
    public String normalizedKey(String key) {
        String normalized = normalizedKeys.get(key);
        return normalized != null ? normalized : LocationNameNormalizer.normalize(key);
    }

    /**
     * Keys in insertion order.
     */
    public Set<String> keys() {
        return keys.keySet();
    }

    /**
     * The registry entries the index was built from, in registry order.
     */
    public List<LocationEntry> entries() {
        return entries;
    }

    public int size() {
        return keys.size();
    }
}
