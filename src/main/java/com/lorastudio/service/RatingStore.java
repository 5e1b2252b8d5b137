package com.lorastudio.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lorastudio.model.ImageRating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-project image ratings in {@code <root>/.lora-studio/ratings.json}.
 *
 * File format: {@code {"ratings": {"<relative path>": "good"}}}. Unrated
 * images have no entry.
 */
@Service
public class RatingStore {

    private static final Logger log = LoggerFactory.getLogger(RatingStore.class);

    static final String RATINGS_DIR = ".lora-studio";
    static final String RATINGS_FILE = "ratings.json";

    private final ObjectMapper objectMapper;

    public RatingStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static Path ratingsFile(Path projectRoot) {
        return projectRoot.resolve(RATINGS_DIR).resolve(RATINGS_FILE);
    }

    /**
     * Ratings keyed by relative path. A missing or malformed file means no
     * ratings.
     */
    public Map<String, ImageRating> read(Path projectRoot) {
        Path file = ratingsFile(projectRoot);
        Map<String, ImageRating> ratings = new TreeMap<>();
        if (!Files.isRegularFile(file)) {
            return ratings;
        }
        try {
            JsonNode node = objectMapper.readTree(file.toFile()).path("ratings");
            node.fields().forEachRemaining(e -> {
                ImageRating rating = ImageRating.fromValue(e.getValue().asText());
                if (rating != ImageRating.NONE) {
                    ratings.put(e.getKey(), rating);
                }
            });
        } catch (IOException e) {
            log.warn("Ignoring unreadable ratings file {}: {}", file, e.getMessage());
        }
        return ratings;
    }

    /**
     * Replaces the ratings file. {@link ImageRating#NONE} entries are not
     * written.
     */
    public void write(Path projectRoot, Map<String, ImageRating> ratings) throws IOException {
        Path file = ratingsFile(projectRoot);
        Files.createDirectories(file.getParent());

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode entries = root.putObject("ratings");
        for (Map.Entry<String, ImageRating> e : new TreeMap<>(ratings).entrySet()) {
            if (e.getValue() != null && e.getValue() != ImageRating.NONE) {
                entries.put(e.getKey(), e.getValue().getValue());
            }
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
    }
}
