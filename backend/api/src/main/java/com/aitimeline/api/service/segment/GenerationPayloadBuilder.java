package com.aitimeline.api.service.segment;

import com.aitimeline.common.enums.GenerationMode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 생성 모드별 provider 엔드포인트와 요청 본문
 */
@Component
public class GenerationPayloadBuilder {

    public String endpointFor(GenerationMode mode) {
        switch (mode) {
            case TEXT_TO_VIDEO:
                return "/video/text-to-video";
            case VIDEO_TO_VIDEO:
                return "/video/video-to-video";
            case IMAGE_TO_VIDEO:
            case FIRST_FRAME_TO_VIDEO:
            default:
                // first-frame 도 image-to-video 엔드포인트를 쓴다
                return "/video/image-to-video";
        }
    }

    public Map<String, Object> build(SegmentGenerationRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model_id", request.getModelId());
        payload.put("duration", request.getDurationSec());
        putIfPresent(payload, "motion_profile", request.getMotionProfile());
        putIfPresent(payload, "camera_path", request.getCameraPath());
        payload.put("prompt", request.getPromptText());

        GenerationMode mode = request.getMode();
        switch (mode) {
            case IMAGE_TO_VIDEO:
                payload.put("image_url", require(request.imageInput(), mode, request.isFirstSegment()
                        ? "source image" : "previous segment last frame"));
                break;
            case VIDEO_TO_VIDEO:
                payload.put("video_url", require(request.getSourceUrl(), mode, "source video"));
                break;
            case FIRST_FRAME_TO_VIDEO:
                payload.put("image_url", require(request.getSourceUrl(), mode, "source image"));
                payload.put("use_as_first_frame", true);
                break;
            case TEXT_TO_VIDEO:
            default:
                break;
        }
        return payload;
    }

    private static void putIfPresent(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    private static String require(String value, GenerationMode mode, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(mode.getCode() + " requires " + what);
        }
        return value;
    }
}
