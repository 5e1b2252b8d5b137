package com.lorastudio.prompt;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the instruction text sent to a captioning backend.
 *
 * Order: base prompt with {@code {name}} filled in, length hint, word limit,
 * then extra-option fragments in catalogue order. Pure; the same input always
 * gives the same text.
 */
@Component
public class PromptBuilder {

    public static final String FALLBACK_PROMPT = "Describe this image.";

    private static final String NAME_PLACEHOLDER = "{name}";

    public String build(String basePrompt, PromptConfig config) {
        String name = config.getCharacterName().trim();
        List<String> parts = new ArrayList<>();

        String base = basePrompt != null ? basePrompt.trim() : "";
        if (!base.isEmpty()) {
            parts.add(substituteName(base, name));
        }
        if (config.getLength() != null) {
            parts.add(config.getLength().getHint());
        }
        Integer limit = config.getWordLimit();
        if (limit != null && limit > 0) {
            parts.add("Keep it within " + limit + " words.");
        }
        for (ExtraOption option : ExtraOption.values()) {
            if (!config.getExtraOptionIds().contains(option.getId())) {
                continue;
            }
            if (option.isRequiresName() && name.isEmpty()) {
                continue;
            }
            parts.add(substituteName(option.getInstruction(), name));
        }
        return String.join(" ", parts);
    }

    /**
     * Builds from the config's own base prompt.
     */
    public String build(PromptConfig config) {
        return build(config.getBasePrompt(), config);
    }

    /**
     * A non-blank custom prompt wins over the template; with neither, the
     * generic fallback is used.
     */
    public String resolveBasePrompt(String customPrompt, PromptTemplate template) {
        if (customPrompt != null && !customPrompt.trim().isEmpty()) {
            return customPrompt.trim();
        }
        if (template != null && template.getPrompt() != null && !template.getPrompt().isBlank()) {
            return template.getPrompt();
        }
        return FALLBACK_PROMPT;
    }

    private static String substituteName(String text, String name) {
        return name.isEmpty() ? text : text.replace(NAME_PLACEHOLDER, name);
    }
}
