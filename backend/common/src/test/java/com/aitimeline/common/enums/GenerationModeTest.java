package com.aitimeline.common.enums;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GenerationModeTest {

    @Test
    void fromCodeResolvesWireNames() {
        assertEquals(Optional.of(GenerationMode.FIRST_FRAME_TO_VIDEO), GenerationMode.fromCode("first-frame-to-video"));
        assertEquals(Optional.of(GenerationMode.TEXT_TO_VIDEO), GenerationMode.fromCode("text-to-video"));
    }

    @Test
    void fromCodeRejectsUnknownOrNull() {
        assertTrue(GenerationMode.fromCode("TEXT_TO_VIDEO").isEmpty());
        assertTrue(GenerationMode.fromCode("audio-to-video").isEmpty());
        assertTrue(GenerationMode.fromCode(null).isEmpty());
    }

    @Test
    void onlyImageToVideoIsAvailableForEveryPosition() {
        assertEquals(1, Arrays.stream(GenerationMode.values()).filter(GenerationMode::isAvailableForAll).count());
        assertTrue(GenerationMode.DEFAULT.isAvailableForAll());
        assertEquals(GenerationMode.IMAGE_TO_VIDEO, GenerationMode.DEFAULT);
    }

    @Test
    void requiredInputsMatchMode() {
        assertTrue(GenerationMode.IMAGE_TO_VIDEO.requiresImage());
        assertTrue(GenerationMode.FIRST_FRAME_TO_VIDEO.requiresImage());
        assertTrue(GenerationMode.VIDEO_TO_VIDEO.requiresVideo());
        assertFalse(GenerationMode.TEXT_TO_VIDEO.requiresImage());
        assertFalse(GenerationMode.TEXT_TO_VIDEO.requiresVideo());
    }
}
