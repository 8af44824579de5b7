package com.aitimeline.api.entity;

import com.aitimeline.common.enums.GenerationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * 영상 생성 모델 + 기능 정보 (video_models ⋈ model_capabilities)
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoModelCapability {
    private String modelId;
    private String displayName;
    private String provider;
    private Boolean supportsTextToVideo;
    private Boolean supportsImageToVideo;
    private Boolean supportsVideoToVideo;
    private Boolean supportsFirstFrame;
    private List<String> supportedAspects;
    private Integer minDurationSec;
    private Integer maxDurationSec;
    private Boolean isActive;

    public boolean supports(GenerationMode mode) {
        return switch (mode) {
            case TEXT_TO_VIDEO -> Boolean.TRUE.equals(supportsTextToVideo);
            case IMAGE_TO_VIDEO -> Boolean.TRUE.equals(supportsImageToVideo);
            case VIDEO_TO_VIDEO -> Boolean.TRUE.equals(supportsVideoToVideo);
            case FIRST_FRAME_TO_VIDEO -> Boolean.TRUE.equals(supportsFirstFrame);
        };
    }

    public boolean acceptsDuration(int durationSec) {
        if (minDurationSec != null && durationSec < minDurationSec) {
            return false;
        }
        return maxDurationSec == null || durationSec <= maxDurationSec;
    }
}
