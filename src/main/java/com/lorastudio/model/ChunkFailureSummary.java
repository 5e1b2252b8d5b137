package com.lorastudio.model;

import java.util.List;

/**
 * Failures of one chunk condensed into a single notification.
 * {@code message} carries only the first error; every distinct error text is
 * kept in {@code distinctErrors}.
 */
public final class ChunkFailureSummary {

    private final int failed;
    private final int chunkSize;
    private final String firstError;
    private final List<String> distinctErrors;
    private final String message;

    public ChunkFailureSummary(int failed, int chunkSize, String firstError, List<String> distinctErrors,
            String message) {
        this.failed = failed;
        this.chunkSize = chunkSize;
        this.firstError = firstError;
        this.distinctErrors = List.copyOf(distinctErrors);
        this.message = message;
    }

    public int getFailed() {
        return failed;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public String getFirstError() {
        return firstError;
    }

    public List<String> getDistinctErrors() {
        return distinctErrors;
    }

    public String getMessage() {
        return message;
    }
}
