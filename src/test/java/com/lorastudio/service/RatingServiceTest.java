package com.lorastudio.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorastudio.model.ImageRating;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RatingServiceTest {

    @TempDir
    Path root;

    private ImageIndex imageIndex;
    private RatingService service;

    @BeforeEach
    void setUp() {
        imageIndex = mock(ImageIndex.class);
        service = new RatingService(new RatingStore(new ObjectMapper()), imageIndex);
    }

    @Test
    @DisplayName("setting a rating stores it and evicts the cached listing")
    void setRating() throws Exception {
        service.setRating(root.toString(), "sub\\a.png", ImageRating.GOOD);

        assertEquals(Map.of("sub/a.png", ImageRating.GOOD), service.getRatings(root.toString()));
        verify(imageIndex).invalidate(root.toString());
    }

    @Test
    @DisplayName("rating an image none removes its entry")
    void noneRemoves() throws Exception {
        service.setRating(root.toString(), "a.png", ImageRating.BAD);
        service.setRating(root.toString(), "b.png", ImageRating.NEEDS_EDIT);

        service.setRating(root.toString(), "a.png", ImageRating.NONE);

        Map<String, ImageRating> ratings = service.getRatings(root.toString());
        assertFalse(ratings.containsKey("a.png"));
        assertEquals(Map.of("b.png", ImageRating.NEEDS_EDIT), ratings);
        assertFalse(Files.readString(root.resolve(".lora-studio/ratings.json")).contains("a.png"));
        verify(imageIndex, times(3)).invalidate(root.toString());
    }

    @Test
    @DisplayName("clearing returns the number of ratings removed")
    void clearAll() throws Exception {
        service.setRating(root.toString(), "a.png", ImageRating.GOOD);
        service.setRating(root.toString(), "b.png", ImageRating.BAD);

        assertEquals(2, service.clearAllRatings(root.toString()));

        assertTrue(service.getRatings(root.toString()).isEmpty());
        assertTrue(Files.exists(root.resolve(".lora-studio/ratings.json")));
        assertEquals(0, service.clearAllRatings(root.toString()));
    }

    @Test
    @DisplayName("clearing a project that was never rated does nothing")
    void clearWithoutFile() throws Exception {
        assertEquals(0, service.clearAllRatings(root.toString()));

        assertFalse(Files.exists(root.resolve(".lora-studio")));
        verify(imageIndex, never()).invalidate(anyString());
    }

    @Test
    @DisplayName("blank path and missing folder are rejected")
    void invalidInput() {
        assertThrows(IllegalArgumentException.class,
                () -> service.setRating(root.toString(), " ", ImageRating.GOOD));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.getRatings(root.resolve("gone").toString()));
        assertTrue(ex.getMessage().startsWith("Folder does not exist"));
        assertThrows(IllegalArgumentException.class, () -> service.clearAllRatings(""));
    }
}
