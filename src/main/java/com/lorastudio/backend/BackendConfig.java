package com.lorastudio.backend;

import java.util.Objects;

/**
 * Which provider a run uses and the fully-resolved settings for it. Only the
 * settings belonging to {@link #getProvider()} are meaningful; Hybrid uses
 * both the WD14 and JoyCaption settings.
 */
public final class BackendConfig {

    private final ProviderType provider;
    private final HttpBackendSettings http;
    private final ScriptBackendSettings wd14;
    private final JoyCaptionSettings joyCaption;

    private BackendConfig(ProviderType provider, HttpBackendSettings http,
            ScriptBackendSettings wd14, JoyCaptionSettings joyCaption) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.http = http;
        this.wd14 = wd14;
        this.joyCaption = joyCaption;
    }

    public static BackendConfig lmStudio(HttpBackendSettings settings) {
        return new BackendConfig(ProviderType.LM_STUDIO, settings, null, null);
    }

    public static BackendConfig ollama(HttpBackendSettings settings) {
        return new BackendConfig(ProviderType.OLLAMA, settings, null, null);
    }

    public static BackendConfig wd14(ScriptBackendSettings settings) {
        return new BackendConfig(ProviderType.WD14, null, settings, null);
    }

    public static BackendConfig joyCaption(JoyCaptionSettings settings) {
        return new BackendConfig(ProviderType.JOYCAPTION, null, null, settings);
    }

    public static BackendConfig hybrid(ScriptBackendSettings wd14, JoyCaptionSettings joyCaption) {
        return new BackendConfig(ProviderType.HYBRID, null, wd14, joyCaption);
    }

    public ProviderType getProvider() {
        return provider;
    }

    public boolean isSupportsNativeBatch() {
        return provider.isNativeBatch();
    }

    public HttpBackendSettings getHttp() {
        return http;
    }

    public ScriptBackendSettings getWd14() {
        return wd14;
    }

    public JoyCaptionSettings getJoyCaption() {
        return joyCaption;
    }
}
