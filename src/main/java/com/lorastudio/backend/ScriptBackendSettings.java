package com.lorastudio.backend;

/**
 * Settings for a provider that runs a user-supplied Python script per image.
 */
public class ScriptBackendSettings {

    public static final String DEFAULT_PYTHON = "python";

    private String pythonPath;
    private String scriptPath;

    public ScriptBackendSettings() {
    }

    public ScriptBackendSettings(String pythonPath, String scriptPath) {
        this.pythonPath = pythonPath;
        this.scriptPath = scriptPath;
    }

    public ScriptBackendSettings mergedWith(ScriptBackendSettings defaults) {
        ScriptBackendSettings merged = new ScriptBackendSettings();
        copyMerged(this, defaults, merged);
        return merged;
    }

    static void copyMerged(ScriptBackendSettings own, ScriptBackendSettings defaults, ScriptBackendSettings target) {
        target.pythonPath = hasText(own.pythonPath) ? own.pythonPath
                : (defaults != null && hasText(defaults.pythonPath) ? defaults.pythonPath : DEFAULT_PYTHON);
        target.scriptPath = hasText(own.scriptPath) ? own.scriptPath
                : (defaults != null ? defaults.scriptPath : null);
    }

    static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    public boolean hasScriptPath() {
        return hasText(scriptPath);
    }

    public String getPythonPath() {
        return pythonPath;
    }

    public void setPythonPath(String pythonPath) {
        this.pythonPath = pythonPath;
    }

    public String getScriptPath() {
        return scriptPath;
    }

    public void setScriptPath(String scriptPath) {
        this.scriptPath = scriptPath;
    }
}
