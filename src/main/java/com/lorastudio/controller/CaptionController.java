package com.lorastudio.controller;

import com.lorastudio.dto.AcceptCaptionRequest;
import com.lorastudio.dto.GenerateCaptionRequest;
import com.lorastudio.model.CaptionResult;
import com.lorastudio.service.BatchCaptionService;
import com.lorastudio.service.CaptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST controller for single-image captioning and caption files.
 *
 * Endpoints:
 * POST /api/captions/generate: caption one image without saving (preview)
 * POST /api/captions/accept: save a previewed caption
 * GET /api/captions?path=: read the caption file of an image
 */
@RestController
@RequestMapping("/api/captions")
public class CaptionController {

    private static final Logger log = LoggerFactory.getLogger(CaptionController.class);

    private final BatchCaptionService batchCaptionService;
    private final CaptionStore captionStore;

    public CaptionController(BatchCaptionService batchCaptionService, CaptionStore captionStore) {
        this.batchCaptionService = batchCaptionService;
        this.captionStore = captionStore;
    }

    /**
     * A failed generation is still a 200; the result carries the error.
     */
    @PostMapping("/generate")
    public ResponseEntity<CaptionResult> generate(@RequestBody GenerateCaptionRequest request) {
        return ResponseEntity.ok(batchCaptionService.generatePreview(request));
    }

    @PostMapping("/accept")
    public ResponseEntity<Map<String, Object>> accept(@RequestBody AcceptCaptionRequest request) {
        try {
            List<String> tags = batchCaptionService.acceptCaption(request);
            return ResponseEntity.ok(Map.of("path", request.getImagePath(), "tags", tags));
        } catch (IOException e) {
            log.warn("Failed to save caption for {}: {}", request.getImagePath(), e.getMessage());
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to save caption: " + e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<?> read(@RequestParam("path") String path) {
        try {
            return ResponseEntity.ok(captionStore.readCaption(path));
        } catch (IOException e) {
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to read caption: " + e.getMessage()));
        }
    }
}
