package com.aitimeline.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 세그먼트 엔티티
 * 타임라인의 개별 생성 단위. position 0 이 첫 세그먼트이고,
 * 이후 세그먼트는 이전 세그먼트의 lastFrameUrl 을 입력 이미지로 사용한다.
 *
 * enhance* 필드는 enhancement_jobs 의 최신 상태를 반영한 projection
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Segment {
    private Long segmentId;
    private Long timelineId;
    private Integer position;         // 0부터 시작
    private Integer durationSec;
    private String modelId;
    private String generationMode;    // text-to-video, image-to-video, video-to-video, first-frame-to-video
    private Boolean isFirstSegment;
    private String promptText;
    private String finalPromptText;
    private String dialogue;
    private String sourceUrl;         // 첫 세그먼트 전용 이미지/영상 입력
    private String motionProfile;
    private String cameraPath;
    private String transitionType;

    // 생성 결과
    private String status;            // pending, generating, generated, error
    private String videoUrl;
    private String firstFrameUrl;
    private String lastFrameUrl;
    private String thumbnailUrl;
    private Double generationTimeSec;
    private String errorMessage;
    private Integer version;          // 생성 lease 카운터

    // 업스케일 projection
    private Boolean enhanceEnabled;
    private String enhanceModel;
    private String enhanceStatus;     // none, queued, processing, done, failed
    private String enhancedVideoUrl;
    private String enhanceError;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isFirst() {
        return position != null && position == 0;
    }

    /**
     * 생성에 쓸 프롬프트 (최종 프롬프트 우선)
     */
    public String effectivePrompt() {
        if (finalPromptText != null && !finalPromptText.isBlank()) {
            return finalPromptText;
        }
        return promptText;
    }

    public boolean isGenerated() {
        return "generated".equals(status);
    }

    public boolean isGenerating() {
        return "generating".equals(status);
    }

    public boolean hasVideo() {
        return videoUrl != null && !videoUrl.isBlank();
    }

    public boolean isEnhanceRequested() {
        return Boolean.TRUE.equals(enhanceEnabled);
    }
}
