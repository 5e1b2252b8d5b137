package com.lorastudio.prompt;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Modifiers applied on top of a base prompt. Immutable; changes return a new
 * instance. Both options of an exclusive pair are never enabled together.
 */
public final class PromptConfig {

    private final String basePrompt;
    private final Integer wordLimit;
    private final CaptionLength length;
    private final String characterName;
    private final Set<String> extraOptionIds;

    public PromptConfig(String basePrompt, Integer wordLimit, CaptionLength length,
            String characterName, Set<String> extraOptionIds) {
        this.basePrompt = basePrompt != null ? basePrompt : "";
        this.wordLimit = wordLimit;
        this.length = length;
        this.characterName = characterName != null ? characterName : "";
        this.extraOptionIds = Collections.unmodifiableSet(withoutConflicts(extraOptionIds));
    }

    /**
     * When both options of an exclusive pair are present the later one wins.
     */
    private static Set<String> withoutConflicts(Set<String> ids) {
        Set<String> result = new LinkedHashSet<>();
        if (ids == null) {
            return result;
        }
        for (String id : ids) {
            ExtraOption.byId(id).map(ExtraOption::getExclusiveWith).ifPresent(result::remove);
            result.add(id);
        }
        return result;
    }

    public static PromptConfig of(String basePrompt) {
        return new PromptConfig(basePrompt, null, null, "", null);
    }

    /**
     * Turns the option off if it is on. Otherwise turns it on and removes its
     * exclusive partner.
     *
     * @throws IllegalArgumentException for an unknown option id
     */
    public PromptConfig toggleExtraOption(String optionId) {
        ExtraOption option = ExtraOption.byId(optionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown prompt option: " + optionId));

        Set<String> next = new LinkedHashSet<>(extraOptionIds);
        if (!next.remove(option.getId())) {
            if (option.getExclusiveWith() != null) {
                next.remove(option.getExclusiveWith());
            }
            next.add(option.getId());
        }
        return new PromptConfig(basePrompt, wordLimit, length, characterName, next);
    }

    public PromptConfig withBasePrompt(String prompt) {
        return new PromptConfig(prompt, wordLimit, length, characterName, extraOptionIds);
    }

    public PromptConfig withWordLimit(Integer limit) {
        return new PromptConfig(basePrompt, limit, length, characterName, extraOptionIds);
    }

    public PromptConfig withLength(CaptionLength captionLength) {
        return new PromptConfig(basePrompt, wordLimit, captionLength, characterName, extraOptionIds);
    }

    public PromptConfig withCharacterName(String name) {
        return new PromptConfig(basePrompt, wordLimit, length, name, extraOptionIds);
    }

    public String getBasePrompt() {
        return basePrompt;
    }

    public Integer getWordLimit() {
        return wordLimit;
    }

    public CaptionLength getLength() {
        return length;
    }

    public String getCharacterName() {
        return characterName;
    }

    public Set<String> getExtraOptionIds() {
        return extraOptionIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PromptConfig))
            return false;
        PromptConfig that = (PromptConfig) o;
        return basePrompt.equals(that.basePrompt)
                && Objects.equals(wordLimit, that.wordLimit)
                && length == that.length
                && characterName.equals(that.characterName)
                && extraOptionIds.equals(that.extraOptionIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(basePrompt, wordLimit, length, characterName, extraOptionIds);
    }
}
