package com.lorastudio.service;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage for image captions.
 */
public interface CaptionStore {

    /**
     * Replaces the caption of {@code imagePath} with {@code tags}. Last write
     * wins.
     */
    void writeCaption(String imagePath, List<String> tags) throws IOException;

    CaptionData readCaption(String imagePath) throws IOException;

    /**
     * Stored caption of one image; {@code exists} is false when none was
     * written yet.
     */
    class CaptionData {
        private final boolean exists;
        private final String raw;
        private final List<String> tags;

        public CaptionData(boolean exists, String raw, List<String> tags) {
            this.exists = exists;
            this.raw = raw;
            this.tags = List.copyOf(tags);
        }

        public static CaptionData missing() {
            return new CaptionData(false, "", List.of());
        }

        public boolean isExists() {
            return exists;
        }

        public String getRaw() {
            return raw;
        }

        public List<String> getTags() {
            return tags;
        }
    }
}
