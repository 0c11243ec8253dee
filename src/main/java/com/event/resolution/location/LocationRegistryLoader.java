package com.event.resolution.location;

import com.event.resolution.core.model.LocationEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the location registry: a JSON array of {@code {name, alternate_names, lat, lng, emoji}}.
 */
public final class LocationRegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(LocationRegistryLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<LocationEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private LocationRegistryLoader() {
    }

    /**
     * @throws RegistryLoadException if the file is missing or is not a valid registry
     */
    public static List<LocationEntry> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new RegistryLoadException("Location registry not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<LocationEntry> entries = read(in);
            log.info("registry.loaded path={} entries={}", path, entries.size());
            return entries;
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read location registry " + path, e);
        }
    }

    /**
     * @throws RegistryLoadException if the stream is not a valid registry
     */
    public static List<LocationEntry> load(InputStream in) {
        try {
            return read(in);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read location registry", e);
        }
    }

    private static List<LocationEntry> read(InputStream in) throws IOException {
        List<LocationEntry> entries = MAPPER.readValue(in, ENTRY_LIST);
        if (entries == null) {
            throw new RegistryLoadException("Location registry is empty");
        }
        return entries;
    }
}
