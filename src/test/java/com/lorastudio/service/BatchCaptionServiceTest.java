package com.lorastudio.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorastudio.backend.CaptionBackend;
import com.lorastudio.backend.CaptionBackendFactory;
import com.lorastudio.backend.LmStudioBackend;
import com.lorastudio.backend.ProviderType;
import com.lorastudio.config.AppConfig;
import com.lorastudio.dto.AcceptCaptionRequest;
import com.lorastudio.dto.BackendSelection;
import com.lorastudio.dto.BatchCaptionRequest;
import com.lorastudio.dto.BatchProgress;
import com.lorastudio.dto.BatchTarget;
import com.lorastudio.dto.PromptRequest;
import com.lorastudio.event.CaptionsInvalidatedEvent;
import com.lorastudio.exception.BatchAlreadyRunningException;
import com.lorastudio.exception.InvalidBatchConfigurationException;
import com.lorastudio.exception.SelectionEmptyException;
import com.lorastudio.model.BatchJob;
import com.lorastudio.model.ImageRating;
import com.lorastudio.model.ImageRef;
import com.lorastudio.model.RunStatus;
import com.lorastudio.model.SelectionCriteria;
import com.lorastudio.prompt.CaptionLength;
import com.lorastudio.prompt.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BatchCaptionServiceTest {

    private static final String ROOT = "/projects/alice";

    @TempDir
    Path tempDir;

    private ImageIndex imageIndex;
    private BatchCaptionRunner runner;
    private CaptionStore captionStore;
    private ApplicationEventPublisher publisher;
    private AppConfig appConfig;

    // completion callbacks of runs handed to the runner, in start order
    private final List<Runnable> finishers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        imageIndex = mock(ImageIndex.class);
        runner = mock(BatchCaptionRunner.class);
        captionStore = mock(CaptionStore.class);
        publisher = mock(ApplicationEventPublisher.class);
        appConfig = new AppConfig();

        List<ImageRef> images = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            boolean captioned = i <= 2;
            images.add(new ImageRef("/p/" + i + ".png", "/p/" + i + ".png", i + ".png", captioned,
                    captioned ? List.of("tag") : List.of(), i % 2 == 0 ? ImageRating.GOOD : ImageRating.NONE));
        }
        when(imageIndex.rescan(ROOT)).thenReturn(images);

        doAnswer(inv -> {
            finishers.add(inv.getArgument(3));
            return null;
        }).when(runner).runInBackground(any(BatchJob.class), any(CaptionBackend.class), any(BatchRunState.class),
                any(Runnable.class));
    }

    private BatchCaptionService service() {
        return service(imageIndex, captionStore);
    }

    private BatchCaptionService service(ImageIndex index, CaptionStore store) {
        CaptionBackendFactory factory = new CaptionBackendFactory(appConfig, new ImageEncoder(), new ObjectMapper());
        PromptService promptService = new PromptService(new PromptBuilder());
        return new BatchCaptionService(factory, index, new TargetSelector(), promptService, runner,
                store, appConfig, publisher);
    }

    private static BatchCaptionRequest request(String root, SelectionCriteria selection) {
        BackendSelection backend = new BackendSelection();
        backend.setProvider(ProviderType.LM_STUDIO);
        PromptRequest prompt = new PromptRequest();
        prompt.setTemplateId("descriptive");
        prompt.setLength(CaptionLength.SHORT);

        BatchCaptionRequest request = new BatchCaptionRequest();
        request.setProjectRoot(root);
        request.setSelection(selection);
        request.setBackend(backend);
        request.setPrompt(prompt);
        return request;
    }

    private static BatchCaptionRequest request(SelectionCriteria selection) {
        return request(ROOT, selection);
    }

    private BatchJob submittedJob() {
        ArgumentCaptor<BatchJob> job = ArgumentCaptor.forClass(BatchJob.class);
        verify(runner).runInBackground(job.capture(), any(CaptionBackend.class), any(BatchRunState.class),
                any(Runnable.class));
        return job.getValue();
    }

    private static List<String> ids(List<ImageRef> images) {
        return images.stream().map(ImageRef::getId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("uncaptioned images become the job and the run reports RUNNING")
    void startsBatch() {
        BatchCaptionService service = service();
        BatchCaptionRequest request = request(SelectionCriteria.uncaptioned());
        request.setConcurrency(3);

        BatchProgress progress = service.startBatch(request);

        assertEquals(RunStatus.RUNNING, progress.getStatus());
        assertEquals(4, progress.getTotal());
        assertTrue(service.isRunning());

        ArgumentCaptor<CaptionBackend> backend = ArgumentCaptor.forClass(CaptionBackend.class);
        verify(runner).runInBackground(any(BatchJob.class), backend.capture(), any(BatchRunState.class),
                any(Runnable.class));
        assertInstanceOf(LmStudioBackend.class, backend.getValue());

        BatchJob job = submittedJob();
        assertEquals(List.of("/p/3.png", "/p/4.png", "/p/5.png", "/p/6.png"), ids(job.getTargets()));
        assertEquals(5, job.getChunkSize());
        assertEquals(3, job.getConcurrency());
        assertTrue(job.getPrompt().endsWith("Write a short caption."), job.getPrompt());
    }

    @Test
    @DisplayName("finishing a run frees the slot and invalidates the project's image list once")
    void finishReleasesRun() {
        BatchCaptionService service = service();
        service.startBatch(request(SelectionCriteria.all()));

        finishers.get(0).run();
        finishers.get(0).run();

        assertFalse(service.isRunning());
        ArgumentCaptor<CaptionsInvalidatedEvent> event = ArgumentCaptor.forClass(CaptionsInvalidatedEvent.class);
        verify(publisher, times(1)).publishEvent(event.capture());
        assertEquals(ROOT, event.getValue().getProjectRoot());
    }

    @Test
    @DisplayName("a caption saved after the folder was listed is not captioned again")
    void jobUsesFreshScan() throws IOException {
        Files.write(tempDir.resolve("a.png"), new byte[] { 1 });
        Files.write(tempDir.resolve("b.png"), new byte[] { 1 });
        String root = tempDir.toString();
        TextFileCaptionStore store = new TextFileCaptionStore();
        ProjectImageIndex index = new ProjectImageIndex(new ImageEncoder(), store,
                new RatingStore(new ObjectMapper()));
        BatchCaptionService service = service(index, store);

        assertEquals("2 uncaptioned", service.previewTarget(root, SelectionCriteria.uncaptioned()).getLabel());
        index.listImages(root);

        AcceptCaptionRequest accept = new AcceptCaptionRequest();
        accept.setImagePath(tempDir.resolve("a.png").toString());
        accept.setCaption("hand, written");
        service.acceptCaption(accept);
        Files.createDirectories(tempDir.resolve(".lora-studio"));
        Files.writeString(tempDir.resolve(".lora-studio/ratings.json"), "{\"ratings\": {\"b.png\": \"good\"}}");

        assertEquals(1, service.previewTarget(root, SelectionCriteria.ofRatings(Set.of(ImageRating.GOOD)))
                .getCount());
        service.startBatch(request(root, SelectionCriteria.uncaptioned()));

        List<ImageRef> targets = submittedJob().getTargets();
        assertEquals(1, targets.size());
        assertEquals("b.png", targets.get(0).getRelativePath());
        assertEquals("hand, written", Files.readString(tempDir.resolve("a.txt")));
    }

    @Test
    @DisplayName("empty selection is rejected before anything runs")
    void emptySelection() {
        BatchCaptionService service = service();

        assertThrows(SelectionEmptyException.class,
                () -> service.startBatch(request(SelectionCriteria.ofRatings(Set.of(ImageRating.BAD)))));

        verifyNoInteractions(runner);
        assertEquals(RunStatus.IDLE, service.getProgress().getStatus());
        assertFalse(service.isRunning());
    }

    @Test
    @DisplayName("concurrency outside 1-8 is rejected")
    void invalidConcurrency() {
        BatchCaptionService service = service();
        BatchCaptionRequest request = request(SelectionCriteria.all());
        request.setConcurrency(9);

        InvalidBatchConfigurationException ex = assertThrows(InvalidBatchConfigurationException.class,
                () -> service.startBatch(request));
        assertEquals("Concurrency must be between 1 and 8, got 9", ex.getMessage());

        request.setConcurrency(0);
        assertThrows(InvalidBatchConfigurationException.class, () -> service.startBatch(request));
        verifyNoInteractions(runner);
    }

    @Test
    @DisplayName("configured default concurrency applies when the request omits it")
    void defaultConcurrency() {
        appConfig.setBatchConcurrency(4);

        assertEquals(4, service().resolveConcurrency(null));
    }

    @Test
    @DisplayName("a second batch is refused while one is active")
    void singleActiveRun() {
        BatchCaptionService service = service();

        service.startBatch(request(SelectionCriteria.all()));
        assertThrows(BatchAlreadyRunningException.class, () -> service.startBatch(request(SelectionCriteria.all())));

        finishers.get(0).run();
        service.startBatch(request(SelectionCriteria.all()));
        assertEquals(2, finishers.size());
        assertTrue(service.isRunning());
    }

    @Test
    @DisplayName("a late callback from a finished run does not free the next run's slot")
    void staleFinisherIgnored() {
        BatchCaptionService service = service();
        service.startBatch(request(SelectionCriteria.all()));
        finishers.get(0).run();
        service.startBatch(request(SelectionCriteria.all()));

        finishers.get(0).run();

        assertTrue(service.isRunning());
    }

    @Test
    @DisplayName("a rejected submission fails the run and frees the slot")
    void executorRejects() {
        doThrow(new TaskRejectedException("queue full")).when(runner).runInBackground(any(BatchJob.class),
                any(CaptionBackend.class), any(BatchRunState.class), any(Runnable.class));
        BatchCaptionService service = service();

        assertThrows(BatchAlreadyRunningException.class, () -> service.startBatch(request(SelectionCriteria.all())));

        assertFalse(service.isRunning());
        assertEquals(RunStatus.FAILED, service.getProgress().getStatus());
    }

    @Test
    @DisplayName("cancel is recorded only while a run is active")
    void cancel() {
        BatchCaptionService service = service();
        assertFalse(service.requestCancel());

        service.startBatch(request(SelectionCriteria.all()));

        assertTrue(service.requestCancel());
        assertTrue(service.getProgress().isCanceled());
    }

    @Test
    @DisplayName("preview target reports count and label for the current selection")
    void previewTarget() {
        BatchTarget target = service().previewTarget(ROOT, SelectionCriteria.ofRatings(Set.of(ImageRating.GOOD)));

        assertEquals(3, target.getCount());
        assertEquals("3 (rating filter)", target.getLabel());
        assertEquals("RATING_FILTER", target.getMode());
    }

    @Test
    @DisplayName("accepted preview caption is normalized, written, and invalidates the list")
    void acceptCaption() throws IOException {
        AcceptCaptionRequest request = new AcceptCaptionRequest();
        request.setImagePath("/p/3.png");
        request.setCaption(" 1girl ,  solo,, smile ");
        request.setProjectRoot(ROOT);

        List<String> tags = service().acceptCaption(request);

        assertEquals(List.of("1girl", "solo", "smile"), tags);
        verify(captionStore).writeCaption("/p/3.png", tags);
        verify(publisher).publishEvent(any(CaptionsInvalidatedEvent.class));
    }

    @Test
    @DisplayName("empty accepted caption is rejected")
    void acceptEmptyCaption() throws IOException {
        AcceptCaptionRequest request = new AcceptCaptionRequest();
        request.setImagePath("/p/3.png");
        request.setCaption(" , ");

        assertThrows(IllegalArgumentException.class, () -> service().acceptCaption(request));
        verify(captionStore, never()).writeCaption(eq("/p/3.png"), any());
    }

    @Test
    @DisplayName("backend settings are validated at start")
    void invalidBackend() {
        BatchCaptionRequest request = request(SelectionCriteria.all());
        request.getBackend().setProvider(ProviderType.WD14);

        assertThrows(InvalidBatchConfigurationException.class, () -> service().startBatch(request));
        verifyNoInteractions(runner);
    }
}
