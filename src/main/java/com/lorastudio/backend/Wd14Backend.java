package com.lorastudio.backend;

import com.lorastudio.exception.CaptionBackendException;
import com.lorastudio.exception.InferenceException;
import com.lorastudio.model.CaptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * WD14 tagger. Runs {@code <python> <script> --image <path>}, which prints
 * comma-separated Danbooru-style tags. The prompt is not used.
 */
public class Wd14Backend implements CaptionBackend {

    private static final Logger log = LoggerFactory.getLogger(Wd14Backend.class);

    static final String SCRIPT_NOT_SET = "WD14 script path is not set. Set it in AI settings.";

    private final ScriptBackendSettings settings;
    private final ScriptRunner scriptRunner;

    public Wd14Backend(ScriptBackendSettings settings, ScriptRunner scriptRunner) {
        this.settings = settings;
        this.scriptRunner = scriptRunner;
    }

    @Override
    public ProviderType getProvider() {
        return ProviderType.WD14;
    }

    @Override
    public CaptionResult generateSingle(String imagePath, String prompt) {
        try {
            return CaptionResult.success(imagePath, tag(imagePath));
        } catch (CaptionBackendException e) {
            log.warn("WD14 tagging failed for {}: {}", imagePath, e.getMessage());
            return CaptionResult.failure(imagePath, e.getMessage());
        }
    }

    private String tag(String imagePath) throws CaptionBackendException {
        if (!settings.hasScriptPath()) {
            throw new InferenceException(SCRIPT_NOT_SET);
        }
        List<String> command = List.of(settings.getPythonPath(), settings.getScriptPath(), "--image", imagePath);
        return scriptRunner.run(command, "WD14 script");
    }
}
