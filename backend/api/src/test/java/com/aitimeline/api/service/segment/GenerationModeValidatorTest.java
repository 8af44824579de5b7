package com.aitimeline.api.service.segment;

import com.aitimeline.common.enums.GenerationMode;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationModeValidatorTest {

    private final GenerationModeValidator validator = new GenerationModeValidator();

    @ParameterizedTest
    @ValueSource(strings = {"text-to-video", "image-to-video", "video-to-video", "first-frame-to-video"})
    void firstSegmentAcceptsEveryMode(String mode) {
        assertTrue(validator.validate(0, mode).valid());
    }

    @ParameterizedTest
    @ValueSource(strings = {"text-to-video", "video-to-video", "first-frame-to-video"})
    void laterSegmentsRejectNonChainingModes(String mode) {
        // When
        ModeValidationResult result = validator.validate(3, mode);

        // Then
        assertFalse(result.valid());
        assertTrue(result.error().contains("Subsequent segments must use image-to-video"));
    }

    @Test
    void laterSegmentsAcceptImageToVideo() {
        assertTrue(validator.validate(1, "image-to-video").valid());
        assertNull(validator.validate(7, "image-to-video").error());
    }

    @Test
    void unknownModeIsInvalidAtAnyPosition() {
        assertFalse(validator.validate(0, "audio-to-video").valid());
        assertFalse(validator.validate(2, null).valid());
    }

    @Test
    void negativePositionIsInvalid() {
        assertFalse(validator.validate(-1, "image-to-video").valid());
        assertFalse(validator.validate(null, "image-to-video").valid());
    }

    @Test
    void requireValidThrowsInvalidGenerationMode() {
        // When
        ApiException e = assertThrows(ApiException.class, () -> validator.requireValid(1, "text-to-video"));

        // Then
        assertEquals(ErrorCode.INVALID_GENERATION_MODE, e.getErrorCode());
        assertEquals(GenerationMode.TEXT_TO_VIDEO, validator.requireValid(0, "text-to-video"));
    }

    @Test
    void availableModesDependOnPosition() {
        assertEquals(4, validator.availableModes(0).size());
        assertEquals(List.of("image-to-video"), validator.availableModes(1));
        assertEquals(List.of("image-to-video"), validator.availableModes(12));
    }
}
