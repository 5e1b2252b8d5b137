package com.lorastudio.service;

import com.lorastudio.dto.PromptRequest;
import com.lorastudio.prompt.ExtraOption;
import com.lorastudio.prompt.PromptBuilder;
import com.lorastudio.prompt.PromptConfig;
import com.lorastudio.prompt.PromptTemplate;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Turns client prompt settings into the effective prompt text.
 */
@Service
public class PromptService {

    private final PromptBuilder promptBuilder;

    public PromptService(PromptBuilder promptBuilder) {
        this.promptBuilder = promptBuilder;
    }

    public List<PromptTemplate> getTemplates() {
        return PromptTemplate.DEFAULTS;
    }

    public List<ExtraOption> getExtraOptions() {
        return Arrays.asList(ExtraOption.values());
    }

    /**
     * Resolves the base prompt and folds the request into a
     * {@link PromptConfig}. Unknown option ids are rejected.
     */
    public PromptConfig toConfig(PromptRequest request) {
        PromptRequest req = request != null ? request : new PromptRequest();
        PromptTemplate template = PromptTemplate.findDefault(req.getTemplateId()).orElse(null);
        String base = promptBuilder.resolveBasePrompt(req.getCustomPrompt(), template);
        for (String id : req.getExtraOptionIds()) {
            if (ExtraOption.byId(id).isEmpty()) {
                throw new IllegalArgumentException("Unknown prompt option: " + id);
            }
        }
        return new PromptConfig(base, req.getWordLimit(), req.getLength(), req.getCharacterName(),
                req.getExtraOptionIds());
    }

    public String buildPrompt(PromptRequest request) {
        return promptBuilder.build(toConfig(request));
    }

    /**
     * Applies one option toggle and returns the resulting option set.
     */
    public PromptConfig toggleOption(PromptRequest request, String optionId) {
        return toConfig(request).toggleExtraOption(optionId);
    }
}
