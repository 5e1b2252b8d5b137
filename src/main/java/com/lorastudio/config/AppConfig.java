package com.lorastudio.config;

import com.lorastudio.backend.HttpBackendSettings;
import com.lorastudio.backend.JoyCaptionSettings;
import com.lorastudio.backend.ScriptBackendSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Provider defaults and batch tuning. Values sent with a batch or preview
 * request override these per call; nothing here is written back at runtime.
 */
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    /** Default number of concurrent requests per chunk for HTTP providers (1-8) */
    private int batchConcurrency = 1;

    /** SSE emitter timeout for the progress stream in milliseconds */
    private long progressStreamTimeoutMs = 30 * 60 * 1000L;

    /** LM Studio server, OpenAI-compatible endpoints under /v1 */
    private HttpBackendSettings lmStudio = new HttpBackendSettings("http://localhost:1234");

    /** Ollama server; the base URL already includes /v1 */
    private HttpBackendSettings ollama = new HttpBackendSettings("http://localhost:11434/v1");

    /** WD14 tagger script: python {script} --image {path} */
    private ScriptBackendSettings wd14 = new ScriptBackendSettings(ScriptBackendSettings.DEFAULT_PYTHON, null);

    /** JoyCaption script: python {script} --image {path} --mode {mode} [--low-vram] */
    private JoyCaptionSettings joycaption = new JoyCaptionSettings();

    // ───────────── getters / setters ─────────────

    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = batchConcurrency;
    }

    public long getProgressStreamTimeoutMs() {
        return progressStreamTimeoutMs;
    }

    public void setProgressStreamTimeoutMs(long progressStreamTimeoutMs) {
        this.progressStreamTimeoutMs = progressStreamTimeoutMs;
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
