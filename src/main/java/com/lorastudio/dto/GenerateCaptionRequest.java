package com.lorastudio.dto;

/**
 * Body of {@code POST /api/captions/generate}: caption a single image without
 * saving it.
 */
public class GenerateCaptionRequest {

    private String imagePath;
    private BackendSelection backend;
    private PromptRequest prompt = new PromptRequest();

    public String getImagePath() {
        return imagePath;
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    public BackendSelection getBackend() {
        return backend;
    }

    public void setBackend(BackendSelection backend) {
        this.backend = backend;
    }

    public PromptRequest getPrompt() {
        return prompt;
    }

    public void setPrompt(PromptRequest prompt) {
        this.prompt = prompt != null ? prompt : new PromptRequest();
    }
}
