package com.lorastudio.backend;

/**
 * Connection settings for an OpenAI-compatible vision server (LM Studio,
 * Ollama). Null fields mean "use the configured default".
 */
public class HttpBackendSettings {

    public static final int DEFAULT_TIMEOUT_SECS = 120;
    public static final int MAX_TIMEOUT_SECS = 600;
    public static final int DEFAULT_MAX_TOKENS = 300;

    private String baseUrl;
    private String model;
    private Integer timeoutSecs;
    private Integer maxImageDimension;
    private Integer maxTokens;

    public HttpBackendSettings() {
    }

    public HttpBackendSettings(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Returns a copy in which every unset field is taken from {@code defaults}.
     */
    public HttpBackendSettings mergedWith(HttpBackendSettings defaults) {
        HttpBackendSettings merged = new HttpBackendSettings();
        merged.baseUrl = firstNonBlank(baseUrl, defaults != null ? defaults.baseUrl : null);
        merged.model = firstNonBlank(model, defaults != null ? defaults.model : null);
        merged.timeoutSecs = timeoutSecs != null ? timeoutSecs : (defaults != null ? defaults.timeoutSecs : null);
        merged.maxImageDimension = maxImageDimension != null ? maxImageDimension
                : (defaults != null ? defaults.maxImageDimension : null);
        merged.maxTokens = maxTokens != null ? maxTokens : (defaults != null ? defaults.maxTokens : null);
        return merged;
    }

    /**
     * Timeout clamped to 1..600 seconds.
     */
    public int effectiveTimeoutSecs() {
        int secs = timeoutSecs != null ? timeoutSecs : DEFAULT_TIMEOUT_SECS;
        return Math.max(1, Math.min(MAX_TIMEOUT_SECS, secs));
    }

    public int effectiveMaxTokens() {
        return maxTokens != null && maxTokens > 0 ? maxTokens : DEFAULT_MAX_TOKENS;
    }

    /**
     * Base URL without trailing slashes.
     */
    public String trimmedBaseUrl() {
        String url = baseUrl != null ? baseUrl.trim() : "";
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank())
            return a;
        return b;
    }

    // ───────────── getters / setters ─────────────

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Integer getTimeoutSecs() {
        return timeoutSecs;
    }

    public void setTimeoutSecs(Integer timeoutSecs) {
        this.timeoutSecs = timeoutSecs;
    }

    public Integer getMaxImageDimension() {
        return maxImageDimension;
    }

    public void setMaxImageDimension(Integer maxImageDimension) {
        this.maxImageDimension = maxImageDimension;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
        this.maxTokens = maxTokens;
    }
}
