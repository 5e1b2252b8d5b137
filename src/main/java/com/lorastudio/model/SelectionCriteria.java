package com.lorastudio.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What the "Batch" action should act on: an explicit selection, a rating
 * filter, or everything. Which one applies is decided by
 * {@link com.lorastudio.service.TargetSelector}.
 */
public class SelectionCriteria {

    private Set<String> explicitIds = new LinkedHashSet<>();
    private Set<ImageRating> ratingFilter = EnumSet.noneOf(ImageRating.class);
    private boolean includeAll;

    public SelectionCriteria() {
    }

    public SelectionCriteria(Set<String> explicitIds, Set<ImageRating> ratingFilter, boolean includeAll) {
        setExplicitIds(explicitIds);
        setRatingFilter(ratingFilter);
        this.includeAll = includeAll;
    }

    public static SelectionCriteria uncaptioned() {
        return new SelectionCriteria();
    }

    public static SelectionCriteria all() {
        return new SelectionCriteria(null, null, true);
    }

    public static SelectionCriteria ofIds(Set<String> ids) {
        return new SelectionCriteria(ids, null, false);
    }

    public static SelectionCriteria ofRatings(Set<ImageRating> ratings) {
        return new SelectionCriteria(null, ratings, false);
    }

    public Set<String> getExplicitIds() {
        return Collections.unmodifiableSet(explicitIds);
    }

    public void setExplicitIds(Set<String> explicitIds) {
        this.explicitIds = explicitIds != null ? new LinkedHashSet<>(explicitIds) : new LinkedHashSet<>();
    }

    public Set<ImageRating> getRatingFilter() {
        return Collections.unmodifiableSet(ratingFilter);
    }

    public void setRatingFilter(Set<ImageRating> ratingFilter) {
        this.ratingFilter = (ratingFilter == null || ratingFilter.isEmpty())
                ? EnumSet.noneOf(ImageRating.class)
                : EnumSet.copyOf(ratingFilter);
    }

    public boolean isIncludeAll() {
        return includeAll;
    }

    public void setIncludeAll(boolean includeAll) {
        this.includeAll = includeAll;
    }
}
