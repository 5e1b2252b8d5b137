package com.lorastudio.service;

import com.lorastudio.model.ImageRating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads and changes the ratings of a project's images. Every change evicts
 * the project's cached image listing.
 */
@Service
public class RatingService {

    private static final Logger log = LoggerFactory.getLogger(RatingService.class);

    private final RatingStore ratingStore;
    private final ImageIndex imageIndex;

    public RatingService(RatingStore ratingStore, ImageIndex imageIndex) {
        this.ratingStore = ratingStore;
        this.imageIndex = imageIndex;
    }

    public Map<String, ImageRating> getRatings(String projectRoot) {
        return ratingStore.read(resolveRoot(projectRoot));
    }

    /**
     * Sets the rating of one image. {@link ImageRating#NONE} removes it.
     *
     * @param relativePath path of the image relative to the project root
     */
    public synchronized void setRating(String projectRoot, String relativePath, ImageRating rating)
            throws IOException {
        Path root = resolveRoot(projectRoot);
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath is required");
        }
        String key = relativePath.trim().replace('\\', '/');

        Map<String, ImageRating> ratings = ratingStore.read(root);
        if (rating == null || rating == ImageRating.NONE) {
            ratings.remove(key);
        } else {
            ratings.put(key, rating);
        }
        ratingStore.write(root, ratings);
        imageIndex.invalidate(projectRoot);
        log.debug("Rated {} as {}", key, rating != null ? rating.getValue() : ImageRating.NONE.getValue());
    }

    /**
     * Removes every rating of the project.
     *
     * @return number of ratings removed
     */
    public synchronized int clearAllRatings(String projectRoot) throws IOException {
        Path root = resolveRoot(projectRoot);
        if (!Files.isRegularFile(RatingStore.ratingsFile(root))) {
            return 0;
        }
        int count = ratingStore.read(root).size();
        ratingStore.write(root, Map.of());
        imageIndex.invalidate(projectRoot);
        log.info("Cleared {} ratings under {}", count, root);
        return count;
    }

    private static Path resolveRoot(String projectRoot) {
        if (projectRoot == null || projectRoot.isBlank()) {
            throw new IllegalArgumentException("Project folder is not set");
        }
        Path root = Path.of(projectRoot).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Folder does not exist: " + projectRoot);
        }
        return root;
    }
}
