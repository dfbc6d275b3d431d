package com.depintel.core.metadata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads {@link ProjectSnapshot} files in JSON or YAML, chosen by file extension.
 */
public final class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private SnapshotLoader() {
        // Utility class
    }

    /**
     * Loads a snapshot.
     *
     * @param path {@code .json}, {@code .yaml} or {@code .yml} file
     * @return parsed snapshot
     * @throws IOException when the file is missing or malformed
     */
    public static ProjectSnapshot load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        ObjectMapper mapper = isYaml(path) ? YAML_MAPPER : JSON_MAPPER;
        log.debug("Loading project snapshot from: {}", path);
        ProjectSnapshot snapshot = mapper.readValue(path.toFile(), ProjectSnapshot.class);
        if (snapshot == null) {
            throw new IOException("Snapshot file is empty: " + path);
        }
        log.info("Loaded snapshot for project '{}' ({} declared dependencies, {} packages)",
            snapshot.projectId(), snapshot.dependencies().size(), snapshot.packages().size());
        return snapshot;
    }

    private static boolean isYaml(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }
}
