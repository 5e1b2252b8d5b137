package com.lorastudio.dto;

import com.lorastudio.backend.HttpBackendSettings;
import com.lorastudio.backend.JoyCaptionSettings;
import com.lorastudio.backend.ProviderType;
import com.lorastudio.backend.ScriptBackendSettings;

/**
 * Provider choice as sent by the client, with optional per-request overrides
 * of the configured provider settings.
 */
public class BackendSelection {

    private ProviderType provider;
    private HttpBackendSettings lmStudio;
    private HttpBackendSettings ollama;
    private ScriptBackendSettings wd14;
    private JoyCaptionSettings joycaption;

    public BackendSelection() {
    }

    public BackendSelection(ProviderType provider) {
        this.provider = provider;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public void setProvider(ProviderType provider) {
        this.provider = provider;
    }

    public HttpBackendSettings getLmStudio() {
        return lmStudio;
    }

    public void setLmStudio(HttpBackendSettings lmStudio) {
        this.lmStudio = lmStudio;
    }

    public HttpBackendSettings getOllama() {
        return ollama;
    }

    public void setOllama(HttpBackendSettings ollama) {
        this.ollama = ollama;
    }

    public ScriptBackendSettings getWd14() {
        return wd14;
    }

    public void setWd14(ScriptBackendSettings wd14) {
        this.wd14 = wd14;
    }

    public JoyCaptionSettings getJoycaption() {
        return joycaption;
    }

    public void setJoycaption(JoyCaptionSettings joycaption) {
        this.joycaption = joycaption;
    }
}
