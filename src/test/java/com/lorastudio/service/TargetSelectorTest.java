package com.lorastudio.service;

import com.lorastudio.model.ImageRating;
import com.lorastudio.model.ImageRef;
import com.lorastudio.model.SelectionCriteria;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TargetSelectorTest {

    private final TargetSelector selector = new TargetSelector();

    private static ImageRef image(int n, boolean captioned, ImageRating rating) {
        String path = "/data/img" + n + ".png";
        return new ImageRef(path, path, "img" + n + ".png", captioned,
                captioned ? List.of("tag") : List.of(), rating);
    }

    private static List<String> ids(List<ImageRef> images) {
        return images.stream().map(ImageRef::getId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("no selection, filter or all: only uncaptioned images, in order")
    void defaultsToUncaptioned() {
        List<ImageRef> images = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            images.add(image(i, i == 1 || i == 4 || i == 8, ImageRating.NONE));
        }

        List<ImageRef> targets = selector.select(images, SelectionCriteria.uncaptioned());

        assertEquals(7, targets.size());
        assertEquals(List.of("/data/img0.png", "/data/img2.png", "/data/img3.png", "/data/img5.png",
                "/data/img6.png", "/data/img7.png", "/data/img9.png"), ids(targets));
        assertEquals("7 uncaptioned", selector.describe(images, SelectionCriteria.uncaptioned()));
    }

    @Test
    @DisplayName("explicit selection is used regardless of caption state")
    void explicitSelection() {
        List<ImageRef> images = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            images.add(image(i, i % 2 == 0, ImageRating.NONE));
        }
        Set<String> selected = Set.of("/data/img0.png", "/data/img1.png", "/data/img6.png", "/data/img9.png");

        List<ImageRef> targets = selector.select(images, SelectionCriteria.ofIds(selected));

        assertEquals(List.of("/data/img0.png", "/data/img1.png", "/data/img6.png", "/data/img9.png"), ids(targets));
        assertEquals("4 selected", selector.describe(images, SelectionCriteria.ofIds(selected)));
    }

    @Test
    @DisplayName("includeAll returns every image, captioned or not")
    void includeAll() {
        List<ImageRef> images = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            images.add(image(i, i < 5, ImageRating.NONE));
        }

        assertEquals(10, selector.select(images, SelectionCriteria.all()).size());
        assertEquals("10 (all)", selector.describe(images, SelectionCriteria.all()));
    }

    @Test
    @DisplayName("rating filter selects images with any of the given ratings")
    void ratingFilter() {
        List<ImageRef> images = new ArrayList<>();
        int n = 0;
        for (int i = 0; i < 3; i++)
            images.add(image(n++, false, ImageRating.GOOD));
        for (int i = 0; i < 2; i++)
            images.add(image(n++, true, ImageRating.BAD));
        for (int i = 0; i < 5; i++)
            images.add(image(n++, false, ImageRating.NONE));

        SelectionCriteria criteria = SelectionCriteria.ofRatings(EnumSet.of(ImageRating.GOOD, ImageRating.BAD));

        assertEquals(5, selector.select(images, criteria).size());
        assertEquals("5 (rating filter)", selector.describe(images, criteria));
    }

    @Test
    @DisplayName("modes are never intersected: includeAll beats filter beats selection")
    void precedence() {
        List<ImageRef> images = List.of(
                image(0, true, ImageRating.GOOD),
                image(1, false, ImageRating.BAD),
                image(2, false, ImageRating.NONE));

        SelectionCriteria everything = new SelectionCriteria(
                Set.of("/data/img2.png"), EnumSet.of(ImageRating.GOOD), true);
        assertEquals(3, selector.select(images, everything).size());

        SelectionCriteria filterAndIds = new SelectionCriteria(
                Set.of("/data/img2.png"), EnumSet.of(ImageRating.GOOD), false);
        assertEquals(List.of("/data/img0.png"), ids(selector.select(images, filterAndIds)));
        assertEquals(TargetSelector.Mode.RATING_FILTER, selector.modeFor(filterAndIds));
    }

    @Test
    @DisplayName("ids that are not in the project are ignored")
    void unknownIdsIgnored() {
        List<ImageRef> images = List.of(image(0, true, ImageRating.NONE));

        List<ImageRef> targets = selector.select(images, SelectionCriteria.ofIds(Set.of("/elsewhere/x.png")));

        assertEquals(0, targets.size());
    }
}
