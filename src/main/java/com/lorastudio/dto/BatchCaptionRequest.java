package com.lorastudio.dto;

import com.lorastudio.model.SelectionCriteria;

/**
 * Body of {@code POST /api/captions/batch}.
 */
public class BatchCaptionRequest {

    private String projectRoot;
    private SelectionCriteria selection = new SelectionCriteria();
    private BackendSelection backend;
    private PromptRequest prompt = new PromptRequest();

    /** Requests in flight per chunk (1-8); null uses the configured default */
    private Integer concurrency;

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    public SelectionCriteria getSelection() {
        return selection;
    }

    public void setSelection(SelectionCriteria selection) {
        this.selection = selection != null ? selection : new SelectionCriteria();
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

    public Integer getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(Integer concurrency) {
        this.concurrency = concurrency;
    }
}
