package com.lorastudio.service;

import com.lorastudio.backend.BackendConfig;
import com.lorastudio.backend.BatchCaptionBackend;
import com.lorastudio.backend.CaptionBackend;
import com.lorastudio.backend.CaptionBackendFactory;
import com.lorastudio.config.AppConfig;
import com.lorastudio.dto.AcceptCaptionRequest;
import com.lorastudio.dto.BatchCaptionRequest;
import com.lorastudio.dto.BatchProgress;
import com.lorastudio.dto.BatchTarget;
import com.lorastudio.dto.GenerateCaptionRequest;
import com.lorastudio.event.CaptionsInvalidatedEvent;
import com.lorastudio.exception.BatchAlreadyRunningException;
import com.lorastudio.exception.InvalidBatchConfigurationException;
import com.lorastudio.exception.SelectionEmptyException;
import com.lorastudio.model.BatchJob;
import com.lorastudio.model.CaptionResult;
import com.lorastudio.model.ImageRef;
import com.lorastudio.model.RunStatus;
import com.lorastudio.model.SelectionCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for caption generation.
 *
 * Validates a batch request, freezes it into a {@link BatchJob} and hands it
 * to the runner's background method on the caption executor. Only one batch runs at a time. The state of the last
 * run stays readable until the next one starts.
 */
@Service
public class BatchCaptionService {

    private static final Logger log = LoggerFactory.getLogger(BatchCaptionService.class);

    private final CaptionBackendFactory backendFactory;
    private final ImageIndex imageIndex;
    private final TargetSelector targetSelector;
    private final PromptService promptService;
    private final BatchCaptionRunner runner;
    private final CaptionStore captionStore;
    private final AppConfig appConfig;
    private final ApplicationEventPublisher eventPublisher;

    // State of the run holding the single-run slot; null when idle
    private final AtomicReference<BatchRunState> activeRun = new AtomicReference<>();
    private final AtomicReference<BatchRunState> lastRun = new AtomicReference<>(new BatchRunState());

    public BatchCaptionService(CaptionBackendFactory backendFactory,
            ImageIndex imageIndex,
            TargetSelector targetSelector,
            PromptService promptService,
            BatchCaptionRunner runner,
            CaptionStore captionStore,
            AppConfig appConfig,
            ApplicationEventPublisher eventPublisher) {
        this.backendFactory = backendFactory;
        this.imageIndex = imageIndex;
        this.targetSelector = targetSelector;
        this.promptService = promptService;
        this.runner = runner;
        this.captionStore = captionStore;
        this.appConfig = appConfig;
        this.eventPublisher = eventPublisher;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    /**
     * Starts a batch run in the background.
     *
     * @return progress right after the run was accepted
     * @throws SelectionEmptyException            if the selection matches no images
     * @throws InvalidBatchConfigurationException if the backend settings or
     *                                            concurrency are unusable
     * @throws BatchAlreadyRunningException       if a run is in progress
     */
    public BatchProgress startBatch(BatchCaptionRequest request) {
        int concurrency = resolveConcurrency(request.getConcurrency());
        BackendConfig backendConfig = backendFactory.resolve(request.getBackend());
        CaptionBackend backend = backendFactory.create(backendConfig);
        BatchJob job = prepareJob(request, backendConfig, backend, concurrency);

        BatchRunState state = new BatchRunState();
        if (!activeRun.compareAndSet(null, state)) {
            throw new BatchAlreadyRunningException();
        }

        state.start(job.getTargets().size());
        lastRun.set(state);
        try {
            runner.runInBackground(job, backend, state, () -> release(job, state));
        } catch (TaskRejectedException e) {
            state.finish(RunStatus.FAILED, "Caption executor is busy");
            activeRun.compareAndSet(state, null);
            throw new BatchAlreadyRunningException();
        }
        log.info("Batch accepted: {} images with {}", job.getTargets().size(),
                backendConfig.getProvider().getValue());
        return state.snapshot();
    }

    /**
     * Count of images a request would caption and the matching button label.
     */
    public BatchTarget previewTarget(String projectRoot, SelectionCriteria criteria) {
        List<ImageRef> images = imageIndex.rescan(projectRoot);
        int count = targetSelector.select(images, criteria).size();
        return new BatchTarget(count, targetSelector.describe(images, criteria),
                targetSelector.modeFor(criteria).name());
    }

    int resolveConcurrency(Integer requested) {
        int concurrency = requested != null ? requested : appConfig.getBatchConcurrency();
        if (concurrency < BatchCaptionBackend.MIN_CONCURRENCY || concurrency > BatchCaptionBackend.MAX_CONCURRENCY) {
            throw new InvalidBatchConfigurationException("Concurrency must be between "
                    + BatchCaptionBackend.MIN_CONCURRENCY + " and " + BatchCaptionBackend.MAX_CONCURRENCY
                    + ", got " + concurrency);
        }
        return concurrency;
    }

    /**
     * Freezes the request into a job from a fresh scan of the project, so
     * captions and ratings changed since the last listing are honoured.
     * Nothing is dispatched.
     */
    BatchJob prepareJob(BatchCaptionRequest request, BackendConfig backendConfig, CaptionBackend backend,
            int concurrency) {
        List<ImageRef> images = imageIndex.rescan(request.getProjectRoot());
        List<ImageRef> targets = targetSelector.select(images, request.getSelection());
        if (targets.isEmpty()) {
            throw new SelectionEmptyException();
        }

        String prompt = promptService.buildPrompt(request.getPrompt());
        return new BatchJob(request.getProjectRoot(), targets, backendConfig, prompt,
                backend.getChunkSize(), concurrency);
    }

    /**
     * Frees the single-run slot and invalidates the project's listing. Only
     * the first call for a given run has any effect.
     */
    private void release(BatchJob job, BatchRunState state) {
        if (!activeRun.compareAndSet(state, null)) {
            return;
        }
        BatchProgress progress = state.snapshot();
        eventPublisher.publishEvent(new CaptionsInvalidatedEvent(this, job.getProjectRoot(),
                progress.getSucceeded()));
    }

    public BatchProgress getProgress() {
        return lastRun.get().snapshot();
    }

    /**
     * Stops the active run after its current chunk.
     *
     * @return false if no run is active
     */
    public boolean requestCancel() {
        boolean requested = lastRun.get().requestCancel();
        if (requested) {
            log.info("Cancellation requested; stopping after the current chunk");
        }
        return requested;
    }

    /**
     * Captions one image for preview. Nothing is written.
     */
    public CaptionResult generatePreview(GenerateCaptionRequest request) {
        if (request.getImagePath() == null || request.getImagePath().isBlank()) {
            throw new IllegalArgumentException("imagePath is required");
        }
        CaptionBackend backend = backendFactory.create(request.getBackend());
        String prompt = promptService.buildPrompt(request.getPrompt());
        return backend.generateSingle(request.getImagePath(), prompt);
    }

    /**
     * Saves a caption the user accepted from a preview.
     *
     * @return the tags written
     */
    public List<String> acceptCaption(AcceptCaptionRequest request) throws IOException {
        if (request.getImagePath() == null || request.getImagePath().isBlank()) {
            throw new IllegalArgumentException("imagePath is required");
        }
        List<String> tags = TextFileCaptionStore.parseTags(request.getCaption());
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("Caption is empty");
        }
        captionStore.writeCaption(request.getImagePath(), tags);
        if (request.getProjectRoot() != null && !request.getProjectRoot().isBlank()) {
            eventPublisher.publishEvent(new CaptionsInvalidatedEvent(this, request.getProjectRoot(), 1));
        }
        return tags;
    }
}
