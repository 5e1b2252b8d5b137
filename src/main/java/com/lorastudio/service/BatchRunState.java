package com.lorastudio.service;

import com.lorastudio.dto.BatchProgress;
import com.lorastudio.model.FailureRecord;
import com.lorastudio.model.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live state of one batch run.
 *
 * Only the runner thread writes progress; the cancel flag is the one field
 * other threads may set. Readers take consistent-enough copies through
 * {@link #snapshot()}.
 */
public class BatchRunState {

    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.IDLE);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean canceled = new AtomicBoolean(false);
    private final AtomicInteger cursor = new AtomicInteger(0);
    private final AtomicInteger current = new AtomicInteger(0);
    private final AtomicInteger total = new AtomicInteger(0);
    private final AtomicInteger succeeded = new AtomicInteger(0);
    private final List<FailureRecord> failures = new CopyOnWriteArrayList<>();

    private volatile String lastMessage;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    /**
     * Resets counters and enters RUNNING. A cancel request made before the
     * first chunk is kept.
     */
    public void start(int totalImages) {
        cursor.set(0);
        current.set(0);
        total.set(totalImages);
        succeeded.set(0);
        failures.clear();
        lastMessage = "Generating " + totalImages + " captions";
        startedAt = Instant.now();
        finishedAt = null;
        running.set(true);
        status.set(RunStatus.RUNNING);
    }

    /**
     * Asks the runner to stop before the next chunk. No effect unless a run is
     * active.
     *
     * @return true if the request was recorded
     */
    public boolean requestCancel() {
        if (!running.get()) {
            return false;
        }
        canceled.set(true);
        return true;
    }

    public boolean isCancelRequested() {
        return canceled.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public RunStatus getStatus() {
        return status.get();
    }

    void recordSuccess() {
        succeeded.incrementAndGet();
    }

    void recordFailure(FailureRecord failure) {
        failures.add(failure);
    }

    /**
     * Marks one chunk as processed. {@code current} never moves backwards and
     * never passes {@code total}.
     */
    void advance(int chunkIndex, int chunkSize) {
        cursor.set(chunkIndex + 1);
        int totalImages = total.get();
        current.updateAndGet(c -> Math.min(c + chunkSize, totalImages));
    }

    void setLastMessage(String message) {
        this.lastMessage = message;
    }

    public void finish(RunStatus terminal, String message) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        lastMessage = message;
        finishedAt = Instant.now();
        status.set(terminal);
        running.set(false);
    }

    public List<FailureRecord> getFailures() {
        return new ArrayList<>(failures);
    }

    public int getCursor() {
        return cursor.get();
    }

    public BatchProgress snapshot() {
        RunStatus s = status.get();
        int totalImages = total.get();
        int ok = succeeded.get();
        int failed = failures.size();
        int skipped = s.isTerminal() ? Math.max(0, totalImages - ok - failed) : 0;
        return new BatchProgress(s, current.get(), totalImages, running.get(), canceled.get(),
                ok, failed, skipped, lastMessage, startedAt, finishedAt);
    }
}
