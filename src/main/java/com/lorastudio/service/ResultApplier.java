package com.lorastudio.service;

import com.lorastudio.model.CaptionResult;
import com.lorastudio.model.ChunkFailureSummary;
import com.lorastudio.model.FailureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes successful captions to the caption store and records everything
 * else as a failure of the run.
 */
@Service
public class ResultApplier {

    private static final Logger log = LoggerFactory.getLogger(ResultApplier.class);

    static final String EMPTY_CAPTION = "Backend returned an empty caption";
    static final int MAX_ERROR_CHARS = 200;

    private final CaptionStore captionStore;

    public ResultApplier(CaptionStore captionStore) {
        this.captionStore = captionStore;
    }

    /**
     * Applies one result to the store and the run state.
     *
     * @return the failure recorded for this result, if any
     */
    public Optional<FailureRecord> apply(CaptionResult result, BatchRunState state) {
        FailureRecord failure = applyResult(result);
        if (failure == null) {
            state.recordSuccess();
            return Optional.empty();
        }
        state.recordFailure(failure);
        return Optional.of(failure);
    }

    private FailureRecord applyResult(CaptionResult result) {
        if (!result.isSuccess()) {
            return new FailureRecord(result.getPath(), result.getError(), FailureRecord.Kind.GENERATION);
        }
        List<String> tags = TextFileCaptionStore.parseTags(result.getCaption());
        if (tags.isEmpty()) {
            return new FailureRecord(result.getPath(), EMPTY_CAPTION, FailureRecord.Kind.GENERATION);
        }
        try {
            captionStore.writeCaption(result.getPath(), tags);
            return null;
        } catch (IOException e) {
            log.warn("Could not write caption for {}: {}", result.getPath(), e.getMessage());
            return new FailureRecord(result.getPath(), "Failed to save caption: " + e.getMessage(),
                    FailureRecord.Kind.PERSISTENCE);
        }
    }

    /**
     * Condenses a chunk's failures into one notification:
     * {@code "<failed> of <chunkSize> failed: <first error>"}, the error cut
     * to 200 characters.
     */
    public ChunkFailureSummary summarizeChunk(List<FailureRecord> failures, int chunkSize) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("No failures to summarize");
        }
        String firstError = failures.get(0).getError();
        if (firstError == null || firstError.isEmpty()) {
            firstError = "Unknown error";
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (FailureRecord failure : failures) {
            distinct.add(failure.getError());
        }
        String shown = firstError.length() > MAX_ERROR_CHARS
                ? firstError.substring(0, MAX_ERROR_CHARS) + "…"
                : firstError;
        String message = failures.size() + " of " + chunkSize + " failed: " + shown;
        return new ChunkFailureSummary(failures.size(), chunkSize, firstError, new ArrayList<>(distinct), message);
    }
}
