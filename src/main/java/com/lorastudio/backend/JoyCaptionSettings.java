package com.lorastudio.backend;

/**
 * JoyCaption script settings. Without a script path the installed
 * {@code joycaption} module is run instead.
 */
public class JoyCaptionSettings extends ScriptBackendSettings {

    public static final String DEFAULT_MODE = "descriptive";

    /** descriptive | straightforward | booru */
    private String mode;

    private Boolean lowVram;

    public JoyCaptionSettings mergedWith(JoyCaptionSettings defaults) {
        JoyCaptionSettings merged = new JoyCaptionSettings();
        copyMerged(this, defaults, merged);
        merged.mode = hasText(mode) ? mode
                : (defaults != null && hasText(defaults.mode) ? defaults.mode : DEFAULT_MODE);
        merged.lowVram = lowVram != null ? lowVram : (defaults != null ? defaults.lowVram : Boolean.FALSE);
        return merged;
    }

    public boolean isLowVramEnabled() {
        return Boolean.TRUE.equals(lowVram);
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Boolean getLowVram() {
        return lowVram;
    }

    public void setLowVram(Boolean lowVram) {
        this.lowVram = lowVram;
    }
}
