package com.aitimeline.api.service.segment;

import com.aitimeline.common.enums.GenerationMode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GenerationPayloadBuilderTest {

    private final GenerationPayloadBuilder builder = new GenerationPayloadBuilder();

    private static SegmentGenerationRequest.SegmentGenerationRequestBuilder base() {
        return SegmentGenerationRequest.builder()
                .timelineId(1L)
                .userId(7L)
                .modelId("kling-2.5-pro")
                .durationSec(5)
                .promptText("a cat walking on the beach");
    }

    @Test
    void endpointsByMode() {
        assertEquals("/video/text-to-video", builder.endpointFor(GenerationMode.TEXT_TO_VIDEO));
        assertEquals("/video/image-to-video", builder.endpointFor(GenerationMode.IMAGE_TO_VIDEO));
        assertEquals("/video/video-to-video", builder.endpointFor(GenerationMode.VIDEO_TO_VIDEO));
        assertEquals("/video/image-to-video", builder.endpointFor(GenerationMode.FIRST_FRAME_TO_VIDEO));
    }

    @Test
    void chainedSegmentSendsPreviousLastFrameAsImage() {
        // Given
        SegmentGenerationRequest request = base()
                .position(2)
                .firstSegment(false)
                .mode(GenerationMode.IMAGE_TO_VIDEO)
                .sourceUrl("https://cdn.example.com/ignored.jpg")
                .previousLastFrameUrl("https://cdn.example.com/1_last.jpg")
                .build();

        // When
        Map<String, Object> payload = builder.build(request);

        // Then
        assertEquals("https://cdn.example.com/1_last.jpg", payload.get("image_url"));
        assertEquals("kling-2.5-pro", payload.get("model_id"));
        assertEquals(5, payload.get("duration"));
        assertFalse(payload.containsKey("motion_profile"));
        assertFalse(payload.containsKey("camera_path"));
    }

    @Test
    void firstSegmentImageToVideoUsesSource() {
        SegmentGenerationRequest request = base()
                .position(0)
                .firstSegment(true)
                .mode(GenerationMode.IMAGE_TO_VIDEO)
                .sourceUrl("https://cdn.example.com/source.jpg")
                .motionProfile("slow")
                .cameraPath("dolly-in")
                .build();

        Map<String, Object> payload = builder.build(request);

        assertEquals("https://cdn.example.com/source.jpg", payload.get("image_url"));
        assertEquals("slow", payload.get("motion_profile"));
        assertEquals("dolly-in", payload.get("camera_path"));
    }

    @Test
    void firstFrameModeMarksImageAsFirstFrame() {
        SegmentGenerationRequest request = base()
                .position(0)
                .firstSegment(true)
                .mode(GenerationMode.FIRST_FRAME_TO_VIDEO)
                .sourceUrl("https://cdn.example.com/first.jpg")
                .build();

        Map<String, Object> payload = builder.build(request);

        assertEquals("https://cdn.example.com/first.jpg", payload.get("image_url"));
        assertEquals(true, payload.get("use_as_first_frame"));
    }

    @Test
    void videoToVideoSendsVideoUrl() {
        SegmentGenerationRequest request = base()
                .position(0)
                .firstSegment(true)
                .mode(GenerationMode.VIDEO_TO_VIDEO)
                .sourceUrl("https://cdn.example.com/clip.mp4")
                .build();

        Map<String, Object> payload = builder.build(request);

        assertEquals("https://cdn.example.com/clip.mp4", payload.get("video_url"));
        assertFalse(payload.containsKey("image_url"));
    }

    @Test
    void textToVideoHasNoMediaInput() {
        SegmentGenerationRequest request = base()
                .position(0)
                .firstSegment(true)
                .mode(GenerationMode.TEXT_TO_VIDEO)
                .build();

        Map<String, Object> payload = builder.build(request);

        assertEquals("a cat walking on the beach", payload.get("prompt"));
        assertFalse(payload.containsKey("image_url"));
        assertFalse(payload.containsKey("video_url"));
    }

    @Test
    void missingImageInputIsRejected() {
        SegmentGenerationRequest request = base()
                .position(1)
                .firstSegment(false)
                .mode(GenerationMode.IMAGE_TO_VIDEO)
                .build();

        assertThrows(IllegalArgumentException.class, () -> builder.build(request));
    }
}
