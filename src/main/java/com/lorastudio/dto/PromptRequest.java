package com.lorastudio.dto;

import com.lorastudio.prompt.CaptionLength;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Prompt settings as sent by the client. A non-blank {@code customPrompt}
 * takes precedence over {@code templateId}.
 */
public class PromptRequest {

    private String customPrompt;
    private String templateId;
    private Integer wordLimit;
    private CaptionLength length;
    private String characterName;
    private Set<String> extraOptionIds = new LinkedHashSet<>();

    public String getCustomPrompt() {
        return customPrompt;
    }

    public void setCustomPrompt(String customPrompt) {
        this.customPrompt = customPrompt;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public Integer getWordLimit() {
        return wordLimit;
    }

    public void setWordLimit(Integer wordLimit) {
        this.wordLimit = wordLimit;
    }

    public CaptionLength getLength() {
        return length;
    }

    public void setLength(CaptionLength length) {
        this.length = length;
    }

    public String getCharacterName() {
        return characterName;
    }

    public void setCharacterName(String characterName) {
        this.characterName = characterName;
    }

    public Set<String> getExtraOptionIds() {
        return extraOptionIds;
    }

    public void setExtraOptionIds(Set<String> extraOptionIds) {
        this.extraOptionIds = extraOptionIds != null ? extraOptionIds : new LinkedHashSet<>();
    }
}
