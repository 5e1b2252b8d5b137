package com.lorastudio.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorastudio.config.AppConfig;
import com.lorastudio.dto.BackendSelection;
import com.lorastudio.exception.InvalidBatchConfigurationException;
import com.lorastudio.service.ImageEncoder;
import org.springframework.stereotype.Component;

/**
 * Turns a client's provider selection into a ready adapter.
 *
 * Request settings win over the configured defaults field by field. Settings a
 * provider cannot work without (a base URL, the WD14 script) are checked here
 * so a bad request fails before any image is dispatched.
 */
@Component
public class CaptionBackendFactory {

    private final AppConfig appConfig;
    private final ImageEncoder imageEncoder;
    private final ObjectMapper objectMapper;
    private final ScriptRunner scriptRunner = new ScriptRunner();

    public CaptionBackendFactory(AppConfig appConfig, ImageEncoder imageEncoder, ObjectMapper objectMapper) {
        this.appConfig = appConfig;
        this.imageEncoder = imageEncoder;
        this.objectMapper = objectMapper;
    }

    /**
     * Merges the selection with the configured defaults and validates the
     * result.
     *
     * @throws InvalidBatchConfigurationException if the provider is missing
     *                                            or lacks required settings
     */
    public BackendConfig resolve(BackendSelection selection) {
        if (selection == null || selection.getProvider() == null) {
            throw new InvalidBatchConfigurationException("No captioning provider selected");
        }
        switch (selection.getProvider()) {
            case LM_STUDIO:
                return BackendConfig.lmStudio(resolveHttp(selection.getLmStudio(), appConfig.getLmStudio(), "LM Studio"));
            case OLLAMA:
                return BackendConfig.ollama(resolveHttp(selection.getOllama(), appConfig.getOllama(), "Ollama"));
            case WD14:
                return BackendConfig.wd14(resolveWd14(selection.getWd14()));
            case JOYCAPTION:
                return BackendConfig.joyCaption(resolveJoyCaption(selection.getJoycaption()));
            case HYBRID:
                return BackendConfig.hybrid(resolveWd14(selection.getWd14()),
                        resolveJoyCaption(selection.getJoycaption()));
            default:
                throw new InvalidBatchConfigurationException("Unsupported provider: " + selection.getProvider());
        }
    }

    public CaptionBackend create(BackendSelection selection) {
        return create(resolve(selection));
    }

    public CaptionBackend create(BackendConfig config) {
        switch (config.getProvider()) {
            case LM_STUDIO:
                return new LmStudioBackend(config.getHttp(), imageEncoder, objectMapper);
            case OLLAMA:
                return new OllamaBackend(config.getHttp(), imageEncoder, objectMapper);
            case WD14:
                return new Wd14Backend(config.getWd14(), scriptRunner);
            case JOYCAPTION:
                return new JoyCaptionBackend(config.getJoyCaption(), scriptRunner);
            case HYBRID:
                return new HybridBackend(new Wd14Backend(config.getWd14(), scriptRunner),
                        new JoyCaptionBackend(config.getJoyCaption(), scriptRunner));
            default:
                throw new InvalidBatchConfigurationException("Unsupported provider: " + config.getProvider());
        }
    }

    /**
     * Adapter for a connection test; only the HTTP providers expose a model
     * list.
     */
    public OpenAiCompatibleBackend createHttp(BackendSelection selection) {
        CaptionBackend backend = create(selection);
        if (!(backend instanceof OpenAiCompatibleBackend)) {
            throw new InvalidBatchConfigurationException(
                    "Connection test is only available for LM Studio and Ollama");
        }
        return (OpenAiCompatibleBackend) backend;
    }

    private HttpBackendSettings resolveHttp(HttpBackendSettings requested, HttpBackendSettings defaults,
            String label) {
        HttpBackendSettings own = requested != null ? requested : new HttpBackendSettings();
        HttpBackendSettings merged = own.mergedWith(defaults);
        if (merged.trimmedBaseUrl().isEmpty()) {
            throw new InvalidBatchConfigurationException(label + " base URL is not set");
        }
        return merged;
    }

    private ScriptBackendSettings resolveWd14(ScriptBackendSettings requested) {
        ScriptBackendSettings own = requested != null ? requested : new ScriptBackendSettings();
        ScriptBackendSettings merged = own.mergedWith(appConfig.getWd14());
        if (!merged.hasScriptPath()) {
            throw new InvalidBatchConfigurationException(Wd14Backend.SCRIPT_NOT_SET);
        }
        return merged;
    }

    private JoyCaptionSettings resolveJoyCaption(JoyCaptionSettings requested) {
        JoyCaptionSettings own = requested != null ? requested : new JoyCaptionSettings();
        return own.mergedWith(appConfig.getJoycaption());
    }
}
