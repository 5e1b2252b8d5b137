package com.lorastudio.dto;

import com.lorastudio.model.RunStatus;

import java.time.Instant;

/**
 * Read-only snapshot of a batch run for polling and the progress stream.
 * When the run has ended, {@code succeeded + failed + skipped == total}.
 */
public class BatchProgress {

    private final RunStatus status;
    private final int current;
    private final int total;
    private final boolean running;
    private final boolean canceled;
    private final int succeeded;
    private final int failed;
    private final int skipped;
    private final String lastMessage;
    private final Instant startedAt;
    private final Instant finishedAt;

    public BatchProgress(RunStatus status, int current, int total, boolean running, boolean canceled,
            int succeeded, int failed, int skipped, String lastMessage, Instant startedAt, Instant finishedAt) {
        this.status = status;
        this.current = current;
        this.total = total;
        this.running = running;
        this.canceled = canceled;
        this.succeeded = succeeded;
        this.failed = failed;
        this.skipped = skipped;
        this.lastMessage = lastMessage;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getCurrent() {
        return current;
    }

    public int getTotal() {
        return total;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }

    public int getSkipped() {
        return skipped;
    }

    public String getLastMessage() {
        return lastMessage;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public int getPercentage() {
        if (total <= 0)
            return 0;
        return (int) Math.min(100, (current * 100L / total));
    }
}
