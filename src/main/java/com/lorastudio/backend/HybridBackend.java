package com.lorastudio.backend;

import com.lorastudio.model.CaptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tags from WD14 followed by a JoyCaption description of the same image.
 *
 * A failed half contributes nothing instead of failing the image; the result
 * is a failure only when neither half produced text.
 */
public class HybridBackend implements CaptionBackend {

    private static final Logger log = LoggerFactory.getLogger(HybridBackend.class);

    private static final String SEPARATOR = ", ";

    private final CaptionBackend tagger;
    private final CaptionBackend describer;

    /**
     * @param tagger    produces the leading tag list (WD14)
     * @param describer produces the trailing description (JoyCaption)
     */
    public HybridBackend(CaptionBackend tagger, CaptionBackend describer) {
        this.tagger = tagger;
        this.describer = describer;
    }

    @Override
    public ProviderType getProvider() {
        return ProviderType.HYBRID;
    }

    @Override
    public CaptionResult generateSingle(String imagePath, String prompt) {
        CaptionResult tags = tagger.generateSingle(imagePath, prompt);
        CaptionResult description = describer.generateSingle(imagePath, prompt);
        return merge(imagePath, tags, description);
    }

    static CaptionResult merge(String imagePath, CaptionResult tags, CaptionResult description) {
        List<String> parts = new ArrayList<>(2);
        List<String> errors = new ArrayList<>(2);
        collect(tags, "WD14", parts, errors);
        collect(description, "JoyCaption", parts, errors);

        if (parts.isEmpty()) {
            String error = errors.isEmpty()
                    ? "Both WD14 and JoyCaption returned empty output"
                    : String.join("; ", errors);
            return CaptionResult.failure(imagePath, error);
        }
        if (!errors.isEmpty()) {
            log.debug("Hybrid caption for {} is partial: {}", imagePath, errors);
        }
        return CaptionResult.success(imagePath, String.join(SEPARATOR, parts));
    }

    private static void collect(CaptionResult result, String label, List<String> parts, List<String> errors) {
        String text = result.isSuccess() ? result.getCaption().trim() : "";
        if (!text.isEmpty()) {
            parts.add(text);
        } else if (!result.isSuccess()) {
            errors.add(label + ": " + result.getError());
        }
    }
}
