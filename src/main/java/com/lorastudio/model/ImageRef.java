package com.lorastudio.model;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one image in a project, taken when the project is scanned.
 * A batch run works on the snapshots it was started with and never refreshes
 * them mid-run.
 */
public final class ImageRef {

    private final String id;
    private final String path;
    private final String relativePath;
    private final boolean hasCaption;
    private final List<String> tags;
    private final ImageRating rating;

    public ImageRef(String id, String path, String relativePath, boolean hasCaption,
            List<String> tags, ImageRating rating) {
        this.id = Objects.requireNonNull(id, "id");
        this.path = Objects.requireNonNull(path, "path");
        this.relativePath = relativePath != null ? relativePath : path;
        this.hasCaption = hasCaption;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.rating = rating != null ? rating : ImageRating.NONE;
    }

    public String getId() {
        return id;
    }

    public String getPath() {
        return path;
    }

    public String getRelativePath() {
        return relativePath;
    }

    public boolean isHasCaption() {
        return hasCaption;
    }

    public List<String> getTags() {
        return tags;
    }

    public ImageRating getRating() {
        return rating;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ImageRef))
            return false;
        ImageRef other = (ImageRef) o;
        return hasCaption == other.hasCaption
                && id.equals(other.id)
                && path.equals(other.path)
                && relativePath.equals(other.relativePath)
                && tags.equals(other.tags)
                && rating == other.rating;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, path, relativePath, hasCaption, tags, rating);
    }

    @Override
    public String toString() {
        return "ImageRef{" + relativePath + ", rating=" + rating.getValue() + ", hasCaption=" + hasCaption + "}";
    }
}
