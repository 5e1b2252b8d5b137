package com.lorastudio.prompt;

import java.util.List;
import java.util.Optional;

/**
 * A named base prompt the user can start from.
 */
public class PromptTemplate {

    public static final List<PromptTemplate> DEFAULTS = List.of(
            new PromptTemplate("descriptive", "Descriptive (Natural Language)",
                    "Describe this image in detail. Include the subject, setting, style, colors, and mood. "
                            + "Be thorough but concise."),
            new PromptTemplate("booru_tags", "Booru Tags",
                    "Generate comma-separated booru-style tags for this image. Include: character features "
                            + "(hair color, eye color, clothing), art style, setting, and quality tags. "
                            + "Format: tag1, tag2, tag3"),
            new PromptTemplate("lora_training", "LoRA Training Caption",
                    "Create a training caption for this image. Start with the main subject, then describe pose, "
                            + "expression, clothing, background, and art style. Use comma-separated tags. "
                            + "Be specific about visual details."),
            new PromptTemplate("character_focus", "Character Focus",
                    "Describe the character in this image. Include: gender, hair (color, style, length), eyes, "
                            + "face, body type, clothing, accessories, pose, and expression. "
                            + "Use comma-separated descriptors."));

    private final String id;
    private final String name;
    private final String prompt;

    public PromptTemplate(String id, String name, String prompt) {
        this.id = id;
        this.name = name;
        this.prompt = prompt;
    }

    public static Optional<PromptTemplate> findDefault(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return DEFAULTS.stream().filter(t -> t.id.equals(id)).findFirst();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getPrompt() {
        return prompt;
    }
}
