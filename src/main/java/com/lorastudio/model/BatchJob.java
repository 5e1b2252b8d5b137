package com.lorastudio.model;

import com.lorastudio.backend.BackendConfig;

import java.util.List;
import java.util.Objects;

/**
 * Everything a batch run needs, fixed when the run is started. The prompt is
 * the final built text, so later edits to prompt settings do not affect a run
 * in progress.
 */
public final class BatchJob {

    private final String projectRoot;
    private final List<ImageRef> targets;
    private final BackendConfig backend;
    private final String prompt;
    private final int chunkSize;
    private final int concurrency;

    public BatchJob(String projectRoot, List<ImageRef> targets, BackendConfig backend, String prompt,
            int chunkSize, int concurrency) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1");
        }
        this.projectRoot = projectRoot;
        this.targets = List.copyOf(targets);
        this.backend = Objects.requireNonNull(backend, "backend");
        this.prompt = prompt != null ? prompt : "";
        this.chunkSize = chunkSize;
        this.concurrency = concurrency;
    }

    public String getProjectRoot() {
        return projectRoot;
    }

    public List<ImageRef> getTargets() {
        return targets;
    }

    public BackendConfig getBackend() {
        return backend;
    }

    public String getPrompt() {
        return prompt;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getConcurrency() {
        return concurrency;
    }
}
