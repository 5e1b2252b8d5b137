package com.lorastudio.service;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps each caption in a text file next to its image with the same base
 * name, e.g. {@code cat.png} → {@code cat.txt}. Tags are stored comma
 * separated.
 */
@Service
public class TextFileCaptionStore implements CaptionStore {

    static final String TAG_SEPARATOR = ", ";

    @Override
    public void writeCaption(String imagePath, List<String> tags) throws IOException {
        Files.writeString(captionPathFor(imagePath), String.join(TAG_SEPARATOR, tags), StandardCharsets.UTF_8);
    }

    @Override
    public CaptionData readCaption(String imagePath) throws IOException {
        Path captionPath = captionPathFor(imagePath);
        if (!Files.exists(captionPath)) {
            return CaptionData.missing();
        }
        String raw = Files.readString(captionPath, StandardCharsets.UTF_8);
        return new CaptionData(true, raw.trim(), parseTags(raw));
    }

    /**
     * Splits on commas, trims and drops empty entries.
     */
    public static List<String> parseTags(String raw) {
        List<String> tags = new ArrayList<>();
        if (raw == null) {
            return tags;
        }
        for (String part : raw.split(",")) {
            String tag = part.trim();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    public static Path captionPathFor(String imagePath) {
        Path path = Path.of(imagePath);
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return path.resolveSibling(stem + ".txt");
    }
}
