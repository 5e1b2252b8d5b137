package com.lorastudio.model;

/**
 * Outcome of generating a caption for one image. Backends always produce one
 * of these, success or failure; they never throw past their boundary.
 */
public final class CaptionResult {

    private final String path;
    private final boolean success;
    private final String caption;
    private final String error;

    private CaptionResult(String path, boolean success, String caption, String error) {
        this.path = path;
        this.success = success;
        this.caption = caption != null ? caption : "";
        this.error = error;
    }

    public static CaptionResult success(String path, String caption) {
        return new CaptionResult(path, true, caption, null);
    }

    public static CaptionResult failure(String path, String error) {
        return new CaptionResult(path, false, "", error != null ? error : "Unknown error");
    }

    public String getPath() {
        return path;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getCaption() {
        return caption;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return success
                ? "CaptionResult{" + path + ", success}"
                : "CaptionResult{" + path + ", error=" + error + "}";
    }
}
