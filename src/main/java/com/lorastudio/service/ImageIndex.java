package com.lorastudio.service;

import com.lorastudio.model.ImageRef;

import java.util.List;

/**
 * Source of the images in a project.
 */
public interface ImageIndex {

    /**
     * Images under {@code projectRoot}, sorted by relative path.
     *
     * @throws IllegalArgumentException if the root does not exist or is not a
     *                                  directory
     */
    List<ImageRef> listImages(String projectRoot);

    /**
     * Scans {@code projectRoot} now, ignoring any cached listing, and makes
     * the result the new cached listing.
     *
     * @throws IllegalArgumentException if the root does not exist or is not a
     *                                  directory
     */
    List<ImageRef> rescan(String projectRoot);

    /**
     * Drops anything cached for {@code projectRoot} so the next listing
     * reflects the files on disk.
     */
    void invalidate(String projectRoot);
}
