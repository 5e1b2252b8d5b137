package com.lorastudio.service;

import com.lorastudio.backend.BatchCaptionBackend;
import com.lorastudio.backend.CaptionBackend;
import com.lorastudio.dto.BatchProgress;
import com.lorastudio.event.BatchNotificationEvent;
import com.lorastudio.event.BatchProgressEvent;
import com.lorastudio.model.BatchJob;
import com.lorastudio.model.CaptionResult;
import com.lorastudio.model.ChunkFailureSummary;
import com.lorastudio.model.FailureRecord;
import com.lorastudio.model.ImageRef;
import com.lorastudio.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one batch run to the end, on the calling thread or on the caption
 * executor.
 *
 * Targets are cut into chunks of the job's chunk size and processed in order.
 * A backend with native batching gets each chunk in one call; any other
 * backend is called once per image. Results are applied as soon as their
 * chunk returns. Cancellation is checked between chunks only, so a chunk that
 * was already dispatched always finishes and is applied. Failed images are
 * never retried. The run's owner is released before the terminal progress
 * event goes out.
 */
@Service
public class BatchCaptionRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchCaptionRunner.class);

    private final ResultApplier resultApplier;
    private final ApplicationEventPublisher eventPublisher;

    public BatchCaptionRunner(ResultApplier resultApplier, ApplicationEventPublisher eventPublisher) {
        this.resultApplier = resultApplier;
        this.eventPublisher = eventPublisher;
    }

    public void run(BatchJob job, CaptionBackend backend, BatchRunState state) {
        run(job, backend, state, () -> {
        });
    }

    /**
     * Runs the job on the caption executor.
     */
    @Async("captionExecutor")
    public void runInBackground(BatchJob job, CaptionBackend backend, BatchRunState state, Runnable onFinished) {
        run(job, backend, state, onFinished);
    }

    /**
     * Runs the job to a terminal state.
     *
     * @param onFinished called once the state is terminal, before the final
     *                   notifications and progress event are published; also
     *                   called if the run dies on an unexpected throwable
     */
    public void run(BatchJob job, CaptionBackend backend, BatchRunState state, Runnable onFinished) {
        List<ImageRef> targets = job.getTargets();
        int chunkSize = job.getChunkSize();
        state.start(targets.size());

        log.info("Batch started: {} images, provider={}, chunkSize={}, concurrency={}",
                targets.size(), backend.getProvider().getValue(), chunkSize, job.getConcurrency());

        int chunkIndex = 0;
        try {
            publishProgress(state);
            for (int start = 0; start < targets.size(); start += chunkSize) {
                if (state.isCancelRequested()) {
                    log.info("Batch canceled before chunk {}", chunkIndex + 1);
                    break;
                }
                List<ImageRef> chunk = targets.subList(start, Math.min(start + chunkSize, targets.size()));
                processChunk(chunkIndex, chunk, job, backend, state);
                chunkIndex++;
            }
            RunStatus terminal = state.isCancelRequested() && state.snapshot().getCurrent() < targets.size()
                    ? RunStatus.CANCELED
                    : RunStatus.COMPLETED;
            state.finish(terminal, finalMessage(terminal, state));
        } catch (RuntimeException e) {
            log.error("Batch aborted in chunk {}: {}", chunkIndex + 1, e.getMessage(), e);
            state.finish(RunStatus.FAILED, "Caption generation stopped: " + e.getMessage());
        } finally {
            onFinished.run();
        }

        if (state.getStatus() == RunStatus.FAILED) {
            publishNotification(BatchNotificationEvent.Level.ERROR, state.snapshot().getLastMessage(), null);
        } else {
            publishFinalSummary(state);
        }
        publishProgress(state);
    }

    private void processChunk(int chunkIndex, List<ImageRef> chunk, BatchJob job, CaptionBackend backend,
            BatchRunState state) {
        List<String> paths = new ArrayList<>(chunk.size());
        for (ImageRef image : chunk) {
            paths.add(image.getPath());
        }

        List<CaptionResult> results = dispatch(paths, job, backend);

        List<FailureRecord> chunkFailures = new ArrayList<>();
        for (CaptionResult result : results) {
            resultApplier.apply(result, state).ifPresent(chunkFailures::add);
        }

        state.advance(chunkIndex, job.getChunkSize());
        BatchProgress progress = state.snapshot();
        log.info("Chunk {} done: {} images, {} failed ({}/{})",
                chunkIndex + 1, chunk.size(), chunkFailures.size(), progress.getCurrent(), progress.getTotal());

        if (!chunkFailures.isEmpty()) {
            ChunkFailureSummary summary = resultApplier.summarizeChunk(chunkFailures, chunk.size());
            if (summary.getDistinctErrors().size() > 1) {
                log.warn("Chunk {} distinct errors: {}", chunkIndex + 1, summary.getDistinctErrors());
            }
            publishNotification(BatchNotificationEvent.Level.WARNING, summary.getMessage(), summary);
        }
        state.setLastMessage("Captioned " + progress.getCurrent() + " of " + progress.getTotal());
        publishProgress(state);
    }

    /**
     * One call for batch-capable backends, one call per image otherwise. A
     * batch reply missing entries is padded with failures so every image is
     * accounted for.
     */
    private List<CaptionResult> dispatch(List<String> paths, BatchJob job, CaptionBackend backend) {
        if (backend instanceof BatchCaptionBackend) {
            List<CaptionResult> results = ((BatchCaptionBackend) backend)
                    .generateBatch(paths, job.getPrompt(), job.getConcurrency());
            List<CaptionResult> complete = new ArrayList<>(paths.size());
            for (int i = 0; i < paths.size(); i++) {
                CaptionResult result = results != null && i < results.size() ? results.get(i) : null;
                complete.add(result != null ? result
                        : CaptionResult.failure(paths.get(i), "No result returned for this image"));
            }
            return complete;
        }

        List<CaptionResult> results = new ArrayList<>(paths.size());
        for (String path : paths) {
            results.add(backend.generateSingle(path, job.getPrompt()));
        }
        return results;
    }

    private String finalMessage(RunStatus terminal, BatchRunState state) {
        BatchProgress progress = state.snapshot();
        int current = progress.getCurrent();
        int total = progress.getTotal();
        int failed = progress.getFailed();
        if (terminal == RunStatus.CANCELED) {
            return "Canceled after " + current + " of " + total + " images";
        }
        if (failed == 0) {
            return "Generated captions for " + total + " images";
        }
        return "Finished: " + (current - failed) + " captioned, " + failed + " failed";
    }

    private void publishFinalSummary(BatchRunState state) {
        List<FailureRecord> failures = state.getFailures();
        String message = state.snapshot().getLastMessage();
        log.info("Batch {}: {}", state.getStatus(), message);
        if (failures.isEmpty()) {
            return;
        }
        long persistence = failures.stream().filter(f -> f.getKind() == FailureRecord.Kind.PERSISTENCE).count();
        String detail = persistence > 0 ? " (" + persistence + " could not be saved)" : "";
        publishNotification(BatchNotificationEvent.Level.WARNING,
                failures.size() + " of " + state.snapshot().getTotal() + " images failed" + detail, null);
    }

    private void publishNotification(BatchNotificationEvent.Level level, String message, ChunkFailureSummary summary) {
        eventPublisher.publishEvent(new BatchNotificationEvent(this, level, message, summary));
    }

    private void publishProgress(BatchRunState state) {
        eventPublisher.publishEvent(new BatchProgressEvent(this, state.snapshot()));
    }
}
