package com.aitimeline.api.dto;

import com.aitimeline.api.entity.EnhancementJob;
import com.aitimeline.api.entity.UpscalerModel;
import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 업스케일 API DTO
 */
public class EnhancementDto {

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpscalerInfo {
        private String id;
        private String provider;
        private String displayName;
        private String description;
        private List<Integer> scaleFactors;
        private String maxOutputResolution;
        private Integer qualityScore;
        private Integer creditsPerUse;

        public static UpscalerInfo from(UpscalerModel model) {
            return UpscalerInfo.builder()
                    .id(model.getId())
                    .provider(model.getProvider())
                    .displayName(model.getDisplayName())
                    .description(model.getDescription())
                    .scaleFactors(model.getScaleFactors())
                    .maxOutputResolution(model.getMaxOutputResolution())
                    .qualityScore(model.getQualityScore())
                    .creditsPerUse(model.getCreditsPerUse())
                    .build();
        }
    }

    /**
     * 업스케일 작업 등록 요청
     * modelId 미지정 시 세그먼트에 선택된 모델, 그것도 없으면 replicate-esrgan
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QueueRequest {
        @JsonAlias("model_id")
        private String modelId;
        @JsonAlias("scale_factor")
        private Integer scaleFactor;
        @JsonAlias("input_url")
        private String inputUrl;
        @JsonAlias("target_resolution")
        private String targetResolution;
        @JsonAlias("preserve_audio")
        private Boolean preserveAudio;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnableRequest {
        @JsonAlias("model_id")
        private String modelId;
    }

    @Getter
    @AllArgsConstructor
    public static class QueueResponse {
        private Long jobId;
        private String status;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobInfo {
        private Long jobId;
        private Long segmentId;
        private Long timelineId;
        private String modelId;
        private String provider;
        private String inputUrl;
        private String outputUrl;
        private Integer scaleFactor;
        private String targetResolution;
        private Boolean preserveAudio;
        private String status;
        private Integer progress;
        private String errorMessage;
        private Double processingTimeSec;
        private LocalDateTime startedAt;
        private LocalDateTime completedAt;
        private LocalDateTime createdAt;

        public static JobInfo from(EnhancementJob job) {
            return JobInfo.builder()
                    .jobId(job.getJobId())
                    .segmentId(job.getSegmentId())
                    .timelineId(job.getTimelineId())
                    .modelId(job.getModelId())
                    .provider(job.getProvider())
                    .inputUrl(job.getInputUrl())
                    .outputUrl(job.getOutputUrl())
                    .scaleFactor(job.getScaleFactor())
                    .targetResolution(job.getTargetResolution())
                    .preserveAudio(job.getPreserveAudio())
                    .status(job.getStatus())
                    .progress(job.getProgress())
                    .errorMessage(job.getErrorMessage())
                    .processingTimeSec(job.getProcessingTimeSec())
                    .startedAt(job.getStartedAt())
                    .completedAt(job.getCompletedAt())
                    .createdAt(job.getCreatedAt())
                    .build();
        }
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SegmentStatus {
        private Long segmentId;
        private Integer position;
        private Boolean enhanceEnabled;
        private String enhanceModel;
        private String enhanceStatus;
        private String enhancedVideoUrl;
        private String enhanceError;
        private List<JobInfo> jobs;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineStatus {
        private Long timelineId;
        private int total;
        private int enabled;
        private int queued;
        private int processing;
        private int done;
        private int failed;
        private List<SegmentStatus> segments;
    }

    /**
     * 타임라인 일괄 업스케일 결과 (세그먼트별 실패는 errors 에 누적)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnhanceAllResponse {
        private Long timelineId;
        private int queued;
        private List<Long> jobIds;
        private List<String> errors;
    }
}
