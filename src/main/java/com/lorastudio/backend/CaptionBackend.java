package com.lorastudio.backend;

import com.lorastudio.model.CaptionResult;

/**
 * A captioning provider bound to its connection or process settings.
 *
 * Implementations never throw from {@link #generateSingle}: unreachable
 * servers, bad responses and failed scripts all come back as a failed
 * {@link CaptionResult}. Any per-call timeout is the implementation's own.
 */
public interface CaptionBackend {

    ProviderType getProvider();

    /**
     * Generates a caption for one image.
     *
     * @param imagePath absolute path of the image
     * @param prompt    effective instruction text; providers that do not take
     *                  a prompt ignore it
     */
    CaptionResult generateSingle(String imagePath, String prompt);

    /**
     * Number of images the batch runner hands over per chunk. Providers
     * without native batching are driven one image at a time.
     */
    default int getChunkSize() {
        return 1;
    }
}
