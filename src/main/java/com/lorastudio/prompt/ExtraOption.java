package com.lorastudio.prompt;

import java.util.Optional;

/**
 * Optional instruction fragments appended to the prompt. Declaration order is
 * the order fragments appear in the built prompt.
 */
public enum ExtraOption {
    REFER_BY_NAME("refer_by_name", "Refer to the character by name",
            "If there is a person or character in the image, refer to them as {name}.", null, true),
    EXCLUDE_IMMUTABLE("exclude_immutable", "Skip unchangeable traits",
            "Do not describe traits of people that cannot be changed, such as ethnicity or gender, "
                    + "but do describe changeable attributes like hair style.", null, false),
    INCLUDE_LIGHTING("include_lighting", "Lighting",
            "Include information about lighting.", null, false),
    INCLUDE_CAMERA_ANGLE("include_camera_angle", "Camera angle",
            "Include information about camera angle.", null, false),
    INCLUDE_COMPOSITION("include_composition", "Composition",
            "Include information about the composition, such as leading lines, rule of thirds or symmetry.",
            "only_important_elements", false),
    INCLUDE_WATERMARK("include_watermark", "Watermark",
            "Mention whether there is a watermark.", null, false),
    EXCLUDE_TEXT("exclude_text", "Ignore text",
            "Do not mention any text that appears in the image.", null, false),
    INCLUDE_AESTHETIC_QUALITY("include_aesthetic_quality", "Aesthetic quality",
            "Rate the aesthetic quality of the image from low to very high.", null, false),
    INCLUDE_RATING("include_rating", "Content rating",
            "State whether the image is sfw, suggestive or nsfw.", "keep_pg", false),
    KEEP_PG("keep_pg", "Keep it PG",
            "Do not include anything sexual; keep it PG.", "include_rating", false),
    NO_AMBIGUOUS_LANGUAGE("no_ambiguous_language", "No ambiguous language",
            "Do not use ambiguous language.", null, false),
    ONLY_IMPORTANT_ELEMENTS("only_important_elements", "Only important elements",
            "Only describe the most important elements of the image.", "include_composition", false);

    private final String id;
    private final String label;
    private final String instruction;
    private final String exclusiveWith;
    private final boolean requiresName;

    ExtraOption(String id, String label, String instruction, String exclusiveWith, boolean requiresName) {
        this.id = id;
        this.label = label;
        this.instruction = instruction;
        this.exclusiveWith = exclusiveWith;
        this.requiresName = requiresName;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getInstruction() {
        return instruction;
    }

    /** Id of the option that cannot be enabled together with this one, or null. */
    public String getExclusiveWith() {
        return exclusiveWith;
    }

    /** Fragment only makes sense with a character name set. */
    public boolean isRequiresName() {
        return requiresName;
    }

    public static Optional<ExtraOption> byId(String id) {
        for (ExtraOption option : values()) {
            if (option.id.equals(id)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
