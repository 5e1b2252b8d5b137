package com.lorastudio.service;

import com.lorastudio.model.ImageRef;
import com.lorastudio.model.SelectionCriteria;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which images a batch run captions.
 *
 * Exactly one selection mode applies, first match wins:
 * <ol>
 * <li>{@code includeAll}: every image, including captioned ones</li>
 * <li>a non-empty rating filter: images with one of those ratings</li>
 * <li>explicitly selected ids: those images, captioned or not</li>
 * <li>otherwise: images without a caption</li>
 * </ol>
 * Modes are never combined. Input order is kept.
 */
@Component
public class TargetSelector {

    public enum Mode {
        ALL, RATING_FILTER, SELECTED, UNCAPTIONED
    }

    public Mode modeFor(SelectionCriteria criteria) {
        if (criteria.isIncludeAll()) {
            return Mode.ALL;
        }
        if (!criteria.getRatingFilter().isEmpty()) {
            return Mode.RATING_FILTER;
        }
        if (!criteria.getExplicitIds().isEmpty()) {
            return Mode.SELECTED;
        }
        return Mode.UNCAPTIONED;
    }

    public List<ImageRef> select(List<ImageRef> allImages, SelectionCriteria criteria) {
        Mode mode = modeFor(criteria);
        if (mode == Mode.ALL) {
            return List.copyOf(allImages);
        }
        List<ImageRef> targets = new ArrayList<>();
        for (ImageRef image : allImages) {
            boolean match;
            switch (mode) {
                case RATING_FILTER:
                    match = criteria.getRatingFilter().contains(image.getRating());
                    break;
                case SELECTED:
                    match = criteria.getExplicitIds().contains(image.getId());
                    break;
                default:
                    match = !image.isHasCaption();
            }
            if (match) {
                targets.add(image);
            }
        }
        return targets;
    }

    /**
     * Short label for the batch action, e.g. {@code "7 uncaptioned"}.
     */
    public String describe(List<ImageRef> allImages, SelectionCriteria criteria) {
        int count = select(allImages, criteria).size();
        switch (modeFor(criteria)) {
            case ALL:
                return count + " (all)";
            case RATING_FILTER:
                return count + " (rating filter)";
            case SELECTED:
                return count + " selected";
            default:
                return count + " uncaptioned";
        }
    }
}
