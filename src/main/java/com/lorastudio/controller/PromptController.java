package com.lorastudio.controller;

import com.lorastudio.dto.PromptRequest;
import com.lorastudio.prompt.ExtraOption;
import com.lorastudio.prompt.PromptConfig;
import com.lorastudio.prompt.PromptTemplate;
import com.lorastudio.service.PromptService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for prompt templates and the effective prompt.
 *
 * Endpoints:
 * GET /api/prompts/templates: built-in templates
 * GET /api/prompts/options: extra options in the order they are applied
 * POST /api/prompts/preview: the prompt a run would send
 * POST /api/prompts/options/toggle: toggle one option, returns the new set
 */
@RestController
@RequestMapping("/api/prompts")
public class PromptController {

    private final PromptService promptService;

    public PromptController(PromptService promptService) {
        this.promptService = promptService;
    }

    @GetMapping("/templates")
    public ResponseEntity<List<PromptTemplate>> getTemplates() {
        return ResponseEntity.ok(promptService.getTemplates());
    }

    @GetMapping("/options")
    public ResponseEntity<List<Map<String, Object>>> getOptions() {
        List<Map<String, Object>> options = new ArrayList<>();
        for (ExtraOption option : promptService.getExtraOptions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", option.getId());
            entry.put("label", option.getLabel());
            entry.put("instruction", option.getInstruction());
            entry.put("exclusiveWith", option.getExclusiveWith());
            options.add(entry);
        }
        return ResponseEntity.ok(options);
    }

    @PostMapping("/preview")
    public ResponseEntity<Map<String, String>> preview(@RequestBody PromptRequest request) {
        return ResponseEntity.ok(Map.of("prompt", promptService.buildPrompt(request)));
    }

    /**
     * Body: {@code {"optionId": "keep_pg", "prompt": {...current settings...}}}
     */
    @PostMapping("/options/toggle")
    public ResponseEntity<Map<String, Object>> toggleOption(@RequestBody ToggleOptionRequest request) {
        if (request.getOptionId() == null || request.getOptionId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "optionId is required"));
        }
        PromptConfig config = promptService.toggleOption(request.getPrompt(), request.getOptionId());
        return ResponseEntity.ok(Map.of("extraOptionIds", new ArrayList<>(config.getExtraOptionIds())));
    }

    public static class ToggleOptionRequest {
        private String optionId;
        private PromptRequest prompt = new PromptRequest();

        public String getOptionId() {
            return optionId;
        }

        public void setOptionId(String optionId) {
            this.optionId = optionId;
        }

        public PromptRequest getPrompt() {
            return prompt;
        }

        public void setPrompt(PromptRequest prompt) {
            this.prompt = prompt != null ? prompt : new PromptRequest();
        }
    }
}
