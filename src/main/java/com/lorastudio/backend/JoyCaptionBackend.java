package com.lorastudio.backend;

import com.lorastudio.exception.CaptionBackendException;
import com.lorastudio.model.CaptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * JoyCaption vision-language model run as a local Python process.
 *
 * Command: {@code <python> <script> | -m joycaption --image <path> --mode <mode> [--low-vram]}.
 * The caption style comes from the mode, so the prompt text is ignored.
 * Batches are captioned one image at a time since the model occupies a
 * single local GPU; {@code concurrency} is accepted but not used.
 */
public class JoyCaptionBackend implements BatchCaptionBackend {

    private static final Logger log = LoggerFactory.getLogger(JoyCaptionBackend.class);

    public static final int CHUNK_SIZE = 20;

    private final JoyCaptionSettings settings;
    private final ScriptRunner scriptRunner;

    public JoyCaptionBackend(JoyCaptionSettings settings, ScriptRunner scriptRunner) {
        this.settings = settings;
        this.scriptRunner = scriptRunner;
    }

    @Override
    public ProviderType getProvider() {
        return ProviderType.JOYCAPTION;
    }

    @Override
    public int getChunkSize() {
        return CHUNK_SIZE;
    }

    @Override
    public CaptionResult generateSingle(String imagePath, String prompt) {
        try {
            return CaptionResult.success(imagePath, scriptRunner.run(buildCommand(imagePath), "JoyCaption"));
        } catch (CaptionBackendException e) {
            log.warn("JoyCaption failed for {}: {}", imagePath, e.getMessage());
            return CaptionResult.failure(imagePath, e.getMessage());
        }
    }

    @Override
    public List<CaptionResult> generateBatch(List<String> imagePaths, String prompt, int concurrency) {
        List<CaptionResult> results = new ArrayList<>(imagePaths.size());
        for (String path : imagePaths) {
            results.add(generateSingle(path, prompt));
        }
        return results;
    }

    List<String> buildCommand(String imagePath) {
        List<String> command = new ArrayList<>();
        command.add(settings.getPythonPath());
        if (settings.hasScriptPath()) {
            command.add(settings.getScriptPath());
        } else {
            command.add("-m");
            command.add("joycaption");
        }
        command.add("--image");
        command.add(imagePath);
        command.add("--mode");
        command.add(settings.getMode());
        if (settings.isLowVramEnabled()) {
            command.add("--low-vram");
        }
        return command;
    }
}
