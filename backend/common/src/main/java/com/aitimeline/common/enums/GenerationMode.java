package com.aitimeline.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 세그먼트 생성 모드
 * 첫 세그먼트(position 0)만 IMAGE_TO_VIDEO 이외의 모드를 사용할 수 있다.
 */
@Getter
@RequiredArgsConstructor
public enum GenerationMode {

    TEXT_TO_VIDEO("text-to-video", "Text to Video",
            "Generate video from a text prompt only", false, List.of("prompt")),
    IMAGE_TO_VIDEO("image-to-video", "Image to Video",
            "Generate video from an image and prompt", true, List.of("prompt", "image")),
    VIDEO_TO_VIDEO("video-to-video", "Video to Video",
            "Transform an existing video with a prompt", false, List.of("prompt", "video")),
    FIRST_FRAME_TO_VIDEO("first-frame-to-video", "First Frame to Video",
            "Use an image as the exact first frame", false, List.of("prompt", "image"));

    public static final GenerationMode DEFAULT = IMAGE_TO_VIDEO;

    private final String code;
    private final String displayName;
    private final String description;
    private final boolean availableForAll;
    private final List<String> requiredInputs;

    public static Optional<GenerationMode> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(mode -> mode.code.equals(code))
                .findFirst();
    }

    public boolean requiresImage() {
        return requiredInputs.contains("image");
    }

    public boolean requiresVideo() {
        return requiredInputs.contains("video");
    }
}
