package com.lorastudio.controller;

import com.lorastudio.backend.CaptionBackendFactory;
import com.lorastudio.backend.ProviderType;
import com.lorastudio.dto.BackendSelection;
import com.lorastudio.dto.ConnectionStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for captioning providers.
 *
 * Endpoints:
 * GET /api/backends: list providers
 * POST /api/backends/test: list the models of an LM Studio or Ollama server
 */
@RestController
@RequestMapping("/api/backends")
public class BackendController {

    private final CaptionBackendFactory backendFactory;

    public BackendController(CaptionBackendFactory backendFactory) {
        this.backendFactory = backendFactory;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listProviders() {
        List<Map<String, Object>> providers = new ArrayList<>();
        for (ProviderType type : ProviderType.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", type.getValue());
            entry.put("nativeBatch", type.isNativeBatch());
            providers.add(entry);
        }
        return ResponseEntity.ok(providers);
    }

    /**
     * Body: a provider selection, e.g.
     * {@code {"provider": "ollama", "ollama": {"baseUrl": "http://host:11434/v1"}}}.
     */
    @PostMapping("/test")
    public ResponseEntity<ConnectionStatus> testConnection(@RequestBody BackendSelection selection) {
        return ResponseEntity.ok(backendFactory.createHttp(selection).testConnection());
    }
}
