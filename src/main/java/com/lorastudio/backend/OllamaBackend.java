package com.lorastudio.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorastudio.service.ImageEncoder;

/**
 * Ollama through its OpenAI-compatible API. The base URL already carries the
 * API prefix, e.g. {@code http://localhost:11434/v1}.
 */
public class OllamaBackend extends OpenAiCompatibleBackend {

    public OllamaBackend(HttpBackendSettings settings, ImageEncoder imageEncoder, ObjectMapper objectMapper) {
        super(settings, imageEncoder, objectMapper);
    }

    @Override
    public ProviderType getProvider() {
        return ProviderType.OLLAMA;
    }

    @Override
    protected String chatCompletionsUrl() {
        return getSettings().trimmedBaseUrl() + "/chat/completions";
    }

    @Override
    protected String modelsUrl() {
        return getSettings().trimmedBaseUrl() + "/models";
    }
}
