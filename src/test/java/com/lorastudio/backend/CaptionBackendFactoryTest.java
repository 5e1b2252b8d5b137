package com.lorastudio.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorastudio.config.AppConfig;
import com.lorastudio.dto.BackendSelection;
import com.lorastudio.exception.InvalidBatchConfigurationException;
import com.lorastudio.service.ImageEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaptionBackendFactoryTest {

    private AppConfig appConfig;
    private CaptionBackendFactory factory;

    @BeforeEach
    void setUp() {
        appConfig = new AppConfig();
        factory = new CaptionBackendFactory(appConfig, new ImageEncoder(), new ObjectMapper());
    }

    private static BackendSelection selection(ProviderType provider) {
        BackendSelection selection = new BackendSelection();
        selection.setProvider(provider);
        return selection;
    }

    @Test
    @DisplayName("missing provider is rejected")
    void noProvider() {
        InvalidBatchConfigurationException ex = assertThrows(InvalidBatchConfigurationException.class,
                () -> factory.resolve(new BackendSelection()));
        assertEquals("No captioning provider selected", ex.getMessage());
        assertThrows(InvalidBatchConfigurationException.class, () -> factory.resolve(null));
    }

    @Test
    @DisplayName("request settings override configured defaults field by field")
    void mergesHttpSettings() {
        HttpBackendSettings defaults = new HttpBackendSettings("http://gpu-box:1234");
        defaults.setModel("llava");
        defaults.setTimeoutSecs(90);
        appConfig.setLmStudio(defaults);

        HttpBackendSettings requested = new HttpBackendSettings();
        requested.setModel("qwen2-vl");
        requested.setMaxImageDimension(1024);
        BackendSelection selection = selection(ProviderType.LM_STUDIO);
        selection.setLmStudio(requested);

        BackendConfig config = factory.resolve(selection);

        assertEquals(ProviderType.LM_STUDIO, config.getProvider());
        assertEquals("http://gpu-box:1234", config.getHttp().getBaseUrl());
        assertEquals("qwen2-vl", config.getHttp().getModel());
        assertEquals(90, config.getHttp().getTimeoutSecs());
        assertEquals(1024, config.getHttp().getMaxImageDimension());
        assertTrue(config.isSupportsNativeBatch());
    }

    @Test
    @DisplayName("HTTP provider without any base URL is rejected")
    void blankBaseUrl() {
        appConfig.setOllama(new HttpBackendSettings("  "));

        InvalidBatchConfigurationException ex = assertThrows(InvalidBatchConfigurationException.class,
                () -> factory.create(selection(ProviderType.OLLAMA)));
        assertEquals("Ollama base URL is not set", ex.getMessage());
    }

    @Test
    @DisplayName("WD14 and Hybrid need a WD14 script path")
    void wd14ScriptRequired() {
        InvalidBatchConfigurationException wd14 = assertThrows(InvalidBatchConfigurationException.class,
                () -> factory.resolve(selection(ProviderType.WD14)));
        assertEquals(Wd14Backend.SCRIPT_NOT_SET, wd14.getMessage());

        assertThrows(InvalidBatchConfigurationException.class,
                () -> factory.resolve(selection(ProviderType.HYBRID)));
    }

    @Test
    @DisplayName("each provider maps to its adapter")
    void createsAdapters() {
        appConfig.setWd14(new ScriptBackendSettings(null, "/opt/wd14/tag.py"));

        assertInstanceOf(LmStudioBackend.class, factory.create(selection(ProviderType.LM_STUDIO)));
        assertInstanceOf(OllamaBackend.class, factory.create(selection(ProviderType.OLLAMA)));
        assertInstanceOf(Wd14Backend.class, factory.create(selection(ProviderType.WD14)));
        assertInstanceOf(JoyCaptionBackend.class, factory.create(selection(ProviderType.JOYCAPTION)));

        CaptionBackend hybrid = factory.create(selection(ProviderType.HYBRID));
        assertInstanceOf(HybridBackend.class, hybrid);
        assertFalse(hybrid instanceof BatchCaptionBackend);
        assertEquals(1, hybrid.getChunkSize());
    }

    @Test
    @DisplayName("script settings fall back to python and descriptive mode")
    void scriptDefaults() {
        appConfig.setWd14(new ScriptBackendSettings(null, "/opt/wd14/tag.py"));

        BackendConfig config = factory.resolve(selection(ProviderType.HYBRID));

        assertEquals("python", config.getWd14().getPythonPath());
        assertEquals("/opt/wd14/tag.py", config.getWd14().getScriptPath());
        assertEquals("python", config.getJoyCaption().getPythonPath());
        assertEquals(JoyCaptionSettings.DEFAULT_MODE, config.getJoyCaption().getMode());
        assertFalse(config.getJoyCaption().isLowVramEnabled());
    }

    @Test
    @DisplayName("connection test is limited to HTTP providers")
    void createHttpRejectsScripts() {
        assertInstanceOf(LmStudioBackend.class, factory.createHttp(selection(ProviderType.LM_STUDIO)));

        InvalidBatchConfigurationException ex = assertThrows(InvalidBatchConfigurationException.class,
                () -> factory.createHttp(selection(ProviderType.JOYCAPTION)));
        assertEquals("Connection test is only available for LM Studio and Ollama", ex.getMessage());
    }
}
