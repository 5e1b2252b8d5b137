package com.lorastudio.event;

import com.lorastudio.model.ChunkFailureSummary;
import org.springframework.context.ApplicationEvent;

/**
 * A message for the user about a batch run: a chunk with failures, the final
 * summary, or an aborted run.
 */
public class BatchNotificationEvent extends ApplicationEvent {

    public enum Level {
        INFO, WARNING, ERROR
    }

    private final Level level;
    private final String message;
    private final ChunkFailureSummary chunkSummary;

    public BatchNotificationEvent(Object source, Level level, String message, ChunkFailureSummary chunkSummary) {
        super(source);
        this.level = level;
        this.message = message;
        this.chunkSummary = chunkSummary;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /** Set for per-chunk failure notifications only. */
    public ChunkFailureSummary getChunkSummary() {
        return chunkSummary;
    }
}
