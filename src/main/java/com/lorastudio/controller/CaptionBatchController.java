package com.lorastudio.controller;

import com.lorastudio.config.AppConfig;
import com.lorastudio.dto.BatchCaptionRequest;
import com.lorastudio.dto.BatchProgress;
import com.lorastudio.event.BatchNotificationEvent;
import com.lorastudio.event.BatchProgressEvent;
import com.lorastudio.service.BatchCaptionService;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * REST controller for batch caption runs and their progress stream.
 *
 * Endpoints:
 * POST /api/captions/batch: start a batch run
 * GET /api/captions/batch/status: current progress snapshot
 * POST /api/captions/batch/cancel: stop after the current chunk
 * GET /api/captions/batch/progress: SSE stream of progress and notifications
 */
@RestController
@RequestMapping("/api/captions/batch")
public class CaptionBatchController {

    private final BatchCaptionService batchCaptionService;
    private final AppConfig appConfig;

    // Active SSE clients subscribed to batch events
    private final List<SseEmitter> sseClients = new CopyOnWriteArrayList<>();

    public CaptionBatchController(BatchCaptionService batchCaptionService, AppConfig appConfig) {
        this.batchCaptionService = batchCaptionService;
        this.appConfig = appConfig;
    }

    /**
     * Starts a run. Validation errors and a run already in progress are
     * answered by the exception handler (400 / 409).
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> startBatch(@RequestBody BatchCaptionRequest request) {
        BatchProgress progress = batchCaptionService.startBatch(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "STARTED");
        body.put("message", "Captioning " + progress.getTotal()
                + " images. Subscribe to /api/captions/batch/progress for updates.");
        body.put("progress", progress);
        return ResponseEntity.accepted().body(body);
    }

    @GetMapping("/status")
    public ResponseEntity<BatchProgress> getStatus() {
        return ResponseEntity.ok(batchCaptionService.getProgress());
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean requested = batchCaptionService.requestCancel();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("canceled", requested);
        body.put("message", requested
                ? "Stopping after the current chunk."
                : "No batch is running.");
        body.put("progress", batchCaptionService.getProgress());
        return ResponseEntity.ok(body);
    }

    /**
     * SSE endpoint. Sends the current snapshot on connect, then every
     * progress and notification event until the run ends.
     */
    @GetMapping(value = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamProgress() {
        SseEmitter emitter = new SseEmitter(appConfig.getProgressStreamTimeoutMs());
        sseClients.add(emitter);

        emitter.onCompletion(() -> sseClients.remove(emitter));
        emitter.onTimeout(() -> sseClients.remove(emitter));
        emitter.onError(e -> sseClients.remove(emitter));

        try {
            emitter.send(SseEmitter.event().name("progress").data(batchCaptionService.getProgress()));
        } catch (IOException e) {
            sseClients.remove(emitter);
        }
        return emitter;
    }

    @EventListener
    public void onBatchProgress(BatchProgressEvent event) {
        if (sseClients.isEmpty())
            return;

        boolean finished = event.getProgress().getStatus().isTerminal();
        List<SseEmitter> dead = new CopyOnWriteArrayList<>();
        for (SseEmitter emitter : sseClients) {
            try {
                emitter.send(SseEmitter.event().name("progress").data(event.getProgress()));
                if (finished) {
                    emitter.complete();
                    dead.add(emitter);
                }
            } catch (IOException e) {
                dead.add(emitter);
            }
        }
        sseClients.removeAll(dead);
    }

    @EventListener
    public void onBatchNotification(BatchNotificationEvent event) {
        if (sseClients.isEmpty())
            return;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", event.getLevel().name());
        data.put("message", event.getMessage());
        if (event.getChunkSummary() != null) {
            data.put("failed", event.getChunkSummary().getFailed());
            data.put("chunkSize", event.getChunkSummary().getChunkSize());
            data.put("distinctErrors", event.getChunkSummary().getDistinctErrors());
        }

        List<SseEmitter> dead = new CopyOnWriteArrayList<>();
        for (SseEmitter emitter : sseClients) {
            try {
                emitter.send(SseEmitter.event().name("notification").data(data));
            } catch (IOException e) {
                dead.add(emitter);
            }
        }
        sseClients.removeAll(dead);
    }
}
