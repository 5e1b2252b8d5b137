package com.lorastudio.controller;

import com.lorastudio.dto.BatchTarget;
import com.lorastudio.model.ImageRating;
import com.lorastudio.model.ImageRef;
import com.lorastudio.model.SelectionCriteria;
import com.lorastudio.service.BatchCaptionService;
import com.lorastudio.service.ImageIndex;
import com.lorastudio.service.RatingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for project image listings and ratings.
 *
 * Endpoints:
 * GET /api/projects/images?root=: images of a project folder
 * GET /api/projects/batch-target?root=&includeAll=&ratings=&ids=: what a batch would caption
 * GET /api/projects/ratings?root=: ratings keyed by relative path
 * PUT /api/projects/ratings: rate one image ("none" removes the rating)
 * DELETE /api/projects/ratings?root=: clear all ratings of a project
 */
@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ImageIndex imageIndex;
    private final BatchCaptionService batchCaptionService;
    private final RatingService ratingService;

    public ProjectController(ImageIndex imageIndex, BatchCaptionService batchCaptionService,
            RatingService ratingService) {
        this.imageIndex = imageIndex;
        this.batchCaptionService = batchCaptionService;
        this.ratingService = ratingService;
    }

    /**
     * Lists images; {@code refresh=true} drops the cached listing first.
     */
    @GetMapping("/images")
    public ResponseEntity<List<ImageRef>> listImages(@RequestParam("root") String root,
            @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
        if (refresh) {
            imageIndex.invalidate(root);
        }
        return ResponseEntity.ok(imageIndex.listImages(root));
    }

    @GetMapping("/batch-target")
    public ResponseEntity<BatchTarget> batchTarget(@RequestParam("root") String root,
            @RequestParam(value = "includeAll", defaultValue = "false") boolean includeAll,
            @RequestParam(value = "ratings", required = false) List<String> ratings,
            @RequestParam(value = "ids", required = false) List<String> ids) {

        Set<ImageRating> ratingFilter = EnumSet.noneOf(ImageRating.class);
        if (ratings != null) {
            for (String r : ratings) {
                ratingFilter.add(ImageRating.fromValue(r));
            }
        }
        Set<String> explicitIds = ids != null ? new LinkedHashSet<>(ids) : new LinkedHashSet<>();
        SelectionCriteria criteria = new SelectionCriteria(explicitIds, ratingFilter, includeAll);
        return ResponseEntity.ok(batchCaptionService.previewTarget(root, criteria));
    }

    @GetMapping("/ratings")
    public ResponseEntity<Map<String, ImageRating>> getRatings(@RequestParam("root") String root) {
        return ResponseEntity.ok(ratingService.getRatings(root));
    }

    /**
     * Body: {@code {"root": "/projects/alice", "relativePath": "sub/a.png", "rating": "good"}}
     */
    @PutMapping("/ratings")
    public ResponseEntity<Map<String, Object>> setRating(@RequestBody SetRatingRequest request) {
        ImageRating rating = request.getRating() != null ? request.getRating() : ImageRating.NONE;
        try {
            ratingService.setRating(request.getRoot(), request.getRelativePath(), rating);
        } catch (IOException e) {
            log.warn("Failed to save rating for {}: {}", request.getRelativePath(), e.getMessage());
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to save rating: " + e.getMessage()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("relativePath", request.getRelativePath());
        body.put("rating", rating);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/ratings")
    public ResponseEntity<Map<String, Object>> clearRatings(@RequestParam("root") String root) {
        try {
            return ResponseEntity.ok(Map.of("cleared", ratingService.clearAllRatings(root)));
        } catch (IOException e) {
            log.warn("Failed to clear ratings under {}: {}", root, e.getMessage());
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to clear ratings: " + e.getMessage()));
        }
    }

    public static class SetRatingRequest {
        private String root;
        private String relativePath;
        private ImageRating rating;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public String getRelativePath() {
            return relativePath;
        }

        public void setRelativePath(String relativePath) {
            this.relativePath = relativePath;
        }

        public ImageRating getRating() {
            return rating;
        }

        public void setRating(ImageRating rating) {
            this.rating = rating;
        }
    }
}
