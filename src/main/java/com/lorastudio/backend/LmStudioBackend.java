package com.lorastudio.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorastudio.service.ImageEncoder;

/**
 * LM Studio local server. The base URL is the server root, e.g.
 * {@code http://localhost:1234}; endpoints live under {@code /v1}.
 */
public class LmStudioBackend extends OpenAiCompatibleBackend {

    public LmStudioBackend(HttpBackendSettings settings, ImageEncoder imageEncoder, ObjectMapper objectMapper) {
        super(settings, imageEncoder, objectMapper);
    }

    @Override
    public ProviderType getProvider() {
        return ProviderType.LM_STUDIO;
    }

    @Override
    protected String chatCompletionsUrl() {
        return getSettings().trimmedBaseUrl() + "/v1/chat/completions";
    }

    @Override
    protected String modelsUrl() {
        return getSettings().trimmedBaseUrl() + "/v1/models";
    }
}
