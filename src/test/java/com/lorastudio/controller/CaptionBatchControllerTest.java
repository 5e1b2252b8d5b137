package com.lorastudio.controller;

import com.lorastudio.config.AppConfig;
import com.lorastudio.dto.BatchCaptionRequest;
import com.lorastudio.dto.BatchProgress;
import com.lorastudio.exception.BatchAlreadyRunningException;
import com.lorastudio.exception.GlobalExceptionHandler;
import com.lorastudio.exception.SelectionEmptyException;
import com.lorastudio.model.RunStatus;
import com.lorastudio.service.BatchCaptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CaptionBatchControllerTest {

    private static final String BODY = "{"
            + "\"projectRoot\": \"/projects/alice\","
            + "\"selection\": {\"includeAll\": false, \"ratingFilter\": [\"good\"]},"
            + "\"backend\": {\"provider\": \"lm_studio\", \"lmStudio\": {\"model\": \"llava\"}},"
            + "\"prompt\": {\"templateId\": \"booru_tags\", \"wordLimit\": 40},"
            + "\"concurrency\": 2"
            + "}";

    private BatchCaptionService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(BatchCaptionService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new CaptionBatchController(service, new AppConfig()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static BatchProgress running(int current, int total) {
        return new BatchProgress(RunStatus.RUNNING, current, total, true, false, 0, 0, 0,
                "Generating " + total + " captions", null, null);
    }

    @Test
    @DisplayName("POST starts a run and answers 202 with the first snapshot")
    void startBatch() throws Exception {
        when(service.startBatch(any(BatchCaptionRequest.class))).thenReturn(running(0, 12));

        mockMvc.perform(post("/api/captions/batch").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("STARTED"))
                .andExpect(jsonPath("$.progress.total").value(12))
                .andExpect(jsonPath("$.progress.status").value("RUNNING"));

        ArgumentCaptor<BatchCaptionRequest> request = ArgumentCaptor.forClass(BatchCaptionRequest.class);
        verify(service).startBatch(request.capture());
        assertEquals("/projects/alice", request.getValue().getProjectRoot());
        assertEquals(2, request.getValue().getConcurrency());
        assertEquals("llava", request.getValue().getBackend().getLmStudio().getModel());
        assertEquals("booru_tags", request.getValue().getPrompt().getTemplateId());
    }

    @Test
    @DisplayName("empty selection maps to 400 SELECTION_EMPTY")
    void selectionEmpty() throws Exception {
        when(service.startBatch(any(BatchCaptionRequest.class))).thenThrow(new SelectionEmptyException());

        mockMvc.perform(post("/api/captions/batch").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SELECTION_EMPTY"))
                .andExpect(jsonPath("$.message").value(SelectionEmptyException.DEFAULT_MESSAGE));
    }

    @Test
    @DisplayName("a run in progress maps to 409 ALREADY_RUNNING")
    void alreadyRunning() throws Exception {
        when(service.startBatch(any(BatchCaptionRequest.class))).thenThrow(new BatchAlreadyRunningException());

        mockMvc.perform(post("/api/captions/batch").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_RUNNING"));
    }

    @Test
    @DisplayName("unknown provider in the body is a bad request")
    void unknownProvider() throws Exception {
        mockMvc.perform(post("/api/captions/batch").contentType(MediaType.APPLICATION_JSON)
                .content("{\"backend\": {\"provider\": \"dall-e\"}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("status returns the current snapshot")
    void statusSnapshot() throws Exception {
        when(service.getProgress()).thenReturn(running(5, 12));

        mockMvc.perform(get("/api/captions/batch/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current").value(5))
                .andExpect(jsonPath("$.total").value(12))
                .andExpect(jsonPath("$.percentage").value(41));
    }

    @Test
    @DisplayName("cancel reports whether a run was stopped")
    void cancel() throws Exception {
        when(service.requestCancel()).thenReturn(false);
        when(service.getProgress()).thenReturn(running(0, 0));

        mockMvc.perform(post("/api/captions/batch/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canceled").value(false))
                .andExpect(jsonPath("$.message").value("No batch is running."));
    }
}
