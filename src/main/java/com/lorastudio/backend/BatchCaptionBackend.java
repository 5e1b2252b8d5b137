package com.lorastudio.backend;

import com.lorastudio.model.CaptionResult;

import java.util.List;

/**
 * A provider that accepts a whole chunk of images in one call.
 */
public interface BatchCaptionBackend extends CaptionBackend {

    int MIN_CONCURRENCY = 1;
    int MAX_CONCURRENCY = 8;

    /**
     * Captions every image in {@code imagePaths} and returns once all of them
     * are resolved. Returns exactly one result per path, in input order;
     * partial failure is reported through the results, never thrown.
     *
     * @param concurrency upper bound on requests in flight at once (1-8)
     */
    List<CaptionResult> generateBatch(List<String> imagePaths, String prompt, int concurrency);

    static int clampConcurrency(int concurrency) {
        return Math.max(MIN_CONCURRENCY, Math.min(MAX_CONCURRENCY, concurrency));
    }
}
