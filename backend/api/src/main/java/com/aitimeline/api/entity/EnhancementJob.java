package com.aitimeline.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 업스케일 작업 엔티티
 * 상태 흐름: queued → processing → done | failed
 * outputUrl 은 done 일 때만, errorMessage 는 failed 일 때만 채워진다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnhancementJob {
    private Long jobId;
    private Long segmentId;
    private Long timelineId;
    private Long userId;
    private String modelId;
    private String provider;
    private String inputUrl;
    private String outputUrl;
    private Integer scaleFactor;
    private String targetResolution;
    private Boolean preserveAudio;
    private String status;
    private Integer progress;         // 0-100
    private String errorMessage;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Double processingTimeSec;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isTerminal() {
        return "done".equals(status) || "failed".equals(status);
    }
}
