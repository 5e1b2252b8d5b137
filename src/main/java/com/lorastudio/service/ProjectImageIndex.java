package com.lorastudio.service;

import com.lorastudio.event.CaptionsInvalidatedEvent;
import com.lorastudio.model.ImageRating;
import com.lorastudio.model.ImageRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Scans a project folder recursively for images.
 *
 * Caption state comes from the sibling {@code .txt} files, ratings from the
 * {@link RatingStore}. Listings are cached per root until a
 * {@link CaptionsInvalidatedEvent} for that root arrives or a rescan replaces
 * them. Batch runs always rescan.
 */
@Service
public class ProjectImageIndex implements ImageIndex {

    private static final Logger log = LoggerFactory.getLogger(ProjectImageIndex.class);

    private final ImageEncoder imageEncoder;
    private final CaptionStore captionStore;
    private final RatingStore ratingStore;

    private final Map<Path, List<ImageRef>> cache = new ConcurrentHashMap<>();

    public ProjectImageIndex(ImageEncoder imageEncoder, CaptionStore captionStore, RatingStore ratingStore) {
        this.imageEncoder = imageEncoder;
        this.captionStore = captionStore;
        this.ratingStore = ratingStore;
    }

    @Override
    public List<ImageRef> listImages(String projectRoot) {
        Path root = resolveRoot(projectRoot);
        return cache.computeIfAbsent(root, this::scan);
    }

    @Override
    public List<ImageRef> rescan(String projectRoot) {
        Path root = resolveRoot(projectRoot);
        List<ImageRef> images = scan(root);
        cache.put(root, images);
        return images;
    }

    @Override
    public void invalidate(String projectRoot) {
        if (projectRoot == null || projectRoot.isBlank()) {
            return;
        }
        Path key = Path.of(projectRoot).toAbsolutePath().normalize();
        if (Files.isDirectory(key)) {
            try {
                key = key.toRealPath();
            } catch (IOException e) {
                log.debug("Could not resolve {}: {}", key, e.getMessage());
            }
        }
        if (cache.remove(key) != null) {
            log.debug("Image index cache evicted for {}", key);
        }
    }

    @EventListener
    public void onCaptionsInvalidated(CaptionsInvalidatedEvent event) {
        invalidate(event.getProjectRoot());
    }

    private Path resolveRoot(String projectRoot) {
        if (projectRoot == null || projectRoot.isBlank()) {
            throw new IllegalArgumentException("Project folder is not set");
        }
        Path root = Path.of(projectRoot).toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            throw new IllegalArgumentException("Folder does not exist: " + projectRoot);
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Path is not a folder: " + projectRoot);
        }
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve project folder " + projectRoot, e);
        }
    }

    private List<ImageRef> scan(Path root) {
        long start = System.currentTimeMillis();
        Map<String, ImageRating> ratings = ratingStore.read(root);
        List<ImageRef> images = new ArrayList<>();

        try (Stream<Path> walk = Files.walk(root)) {
            Iterator<Path> it = walk.iterator();
            while (it.hasNext()) {
                Path path = it.next();
                if (!Files.isRegularFile(path) || !imageEncoder.isSupportedImage(path)) {
                    continue;
                }
                images.add(toImageRef(root, path, ratings));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }

        images.sort(Comparator.comparing(ImageRef::getRelativePath));
        log.info("Indexed {} images under {} in {}ms", images.size(), root, System.currentTimeMillis() - start);
        return Collections.unmodifiableList(images);
    }

    private ImageRef toImageRef(Path root, Path path, Map<String, ImageRating> ratings) {
        String absolute = path.toString();
        String relative = root.relativize(path).toString().replace('\\', '/');

        boolean hasCaption = false;
        List<String> tags = List.of();
        try {
            CaptionStore.CaptionData caption = captionStore.readCaption(absolute);
            hasCaption = caption.isExists();
            tags = caption.getTags();
        } catch (IOException e) {
            log.warn("Unreadable caption for {}: {}", relative, e.getMessage());
        }

        ImageRating rating = ratings.getOrDefault(relative, ImageRating.NONE);
        return new ImageRef(absolute, absolute, relative, hasCaption, tags, rating);
    }
}
