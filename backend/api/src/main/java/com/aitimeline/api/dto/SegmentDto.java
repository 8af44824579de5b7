package com.aitimeline.api.dto;

import com.aitimeline.api.entity.Segment;
import com.aitimeline.api.service.segment.SegmentGenerationResult;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 세그먼트 API DTO
 * 요청 필드는 camelCase 와 snake_case 를 모두 받는다.
 */
public class SegmentDto {

    /**
     * 생성 모드 설명
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModeInfo {
        private String id;
        private String name;
        private String description;
        private String availableFor;      // all | first
        private List<String> requiresInput;
        private Boolean isDefault;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionModes {
        private Integer position;
        private List<String> availableModes;
        private Boolean isFirstSegment;
        private boolean frameChaining;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidateRequest {
        private Integer position;
        private String mode;
    }

    /**
     * 세그먼트 추가 요청 (position 은 현재 세그먼트 수와 같아야 한다)
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        @JsonAlias("timeline_id")
        private Long timelineId;
        private Integer position;
        @JsonAlias("duration_sec")
        private Integer durationSec;
        @JsonAlias("model_id")
        private String modelId;
        @JsonAlias("generation_mode")
        private String generationMode;
        @JsonAlias("prompt_text")
        private String promptText;
        @JsonAlias("source_url")
        private String sourceUrl;
        @JsonAlias("motion_profile")
        private String motionProfile;
        @JsonAlias("camera_path")
        private String cameraPath;
        @JsonAlias("transition_type")
        private String transitionType;
    }

    @Getter
    @AllArgsConstructor
    public static class CreateResponse {
        private SegmentInfo segment;
        private List<String> availableModes;
    }

    /**
     * 단일 세그먼트 (재)생성 요청, 모두 선택
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerateRequest {
        @JsonAlias("override_mode")
        private String overrideMode;
        @JsonAlias("override_source_url")
        private String overrideSourceUrl;   // position 0 에서만 사용
        @JsonAlias("override_prompt")
        private String overridePrompt;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateModeRequest {
        @JsonAlias("generation_mode")
        private String generationMode;
        @JsonAlias("source_url")
        private String sourceUrl;
    }

    /**
     * 세그먼트 부분 수정 (null 필드는 유지)
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateRequest {
        @JsonAlias("prompt_text")
        private String promptText;
        @JsonAlias("final_prompt_text")
        private String finalPromptText;
        private String dialogue;
        @JsonAlias("motion_profile")
        private String motionProfile;
        @JsonAlias("camera_path")
        private String cameraPath;
        @JsonAlias("transition_type")
        private String transitionType;
        @JsonAlias("duration_sec")
        private Integer durationSec;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerateTimelineRequest {
        @JsonAlias("timeline_id")
        private Long timelineId;
        @JsonAlias("first_segment_mode")
        private String firstSegmentMode;
        @JsonAlias("first_segment_source")
        private String firstSegmentSource;
    }

    @Getter
    @AllArgsConstructor
    public static class FrameChaining {
        private boolean enabled;
        private String firstSegmentMode;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineGenerationResponse {
        private Long timelineId;
        private int segmentsGenerated;
        private boolean stoppedEarly;
        private boolean cancelled;
        private List<SegmentGenerationResult> results;
        private FrameChaining frameChaining;
    }

    @Getter
    @AllArgsConstructor
    public static class CancelResponse {
        private Long timelineId;
        private boolean cancelled;
    }

    @Getter
    @AllArgsConstructor
    public static class TimelineSegments {
        private Long timelineId;
        private List<SegmentInfo> segments;
        private int total;
    }

    /**
     * 세그먼트 상세 (모드/체이닝 정보 포함)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SegmentInfo {
        private Long segmentId;
        private Long timelineId;
        private Integer position;
        private Integer durationSec;
        private String modelId;
        private String generationMode;
        private Boolean isFirstSegment;
        private String promptText;
        private String finalPromptText;
        private String dialogue;
        private String sourceUrl;
        private String motionProfile;
        private String cameraPath;
        private String transitionType;
        private String status;
        private String videoUrl;
        private String firstFrameUrl;
        private String lastFrameUrl;
        private String thumbnailUrl;
        private Double generationTimeSec;
        private String errorMessage;
        private Boolean enhanceEnabled;
        private String enhanceModel;
        private String enhanceStatus;
        private String enhancedVideoUrl;
        private List<String> availableModes;
        private boolean frameChaining;
        private Long previousSegmentId;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;

        public static SegmentInfo of(Segment segment, List<String> availableModes, Long previousSegmentId) {
            return SegmentInfo.builder()
                    .segmentId(segment.getSegmentId())
                    .timelineId(segment.getTimelineId())
                    .position(segment.getPosition())
                    .durationSec(segment.getDurationSec())
                    .modelId(segment.getModelId())
                    .generationMode(segment.getGenerationMode())
                    .isFirstSegment(segment.isFirst())
                    .promptText(segment.getPromptText())
                    .finalPromptText(segment.getFinalPromptText())
                    .dialogue(segment.getDialogue())
                    .sourceUrl(segment.getSourceUrl())
                    .motionProfile(segment.getMotionProfile())
                    .cameraPath(segment.getCameraPath())
                    .transitionType(segment.getTransitionType())
                    .status(segment.getStatus())
                    .videoUrl(segment.getVideoUrl())
                    .firstFrameUrl(segment.getFirstFrameUrl())
                    .lastFrameUrl(segment.getLastFrameUrl())
                    .thumbnailUrl(segment.getThumbnailUrl())
                    .generationTimeSec(segment.getGenerationTimeSec())
                    .errorMessage(segment.getErrorMessage())
                    .enhanceEnabled(segment.getEnhanceEnabled())
                    .enhanceModel(segment.getEnhanceModel())
                    .enhanceStatus(segment.getEnhanceStatus())
                    .enhancedVideoUrl(segment.getEnhancedVideoUrl())
                    .availableModes(availableModes)
                    .frameChaining(!segment.isFirst())
                    .previousSegmentId(previousSegmentId)
                    .createdAt(segment.getCreatedAt())
                    .updatedAt(segment.getUpdatedAt())
                    .build();
        }
    }
}
