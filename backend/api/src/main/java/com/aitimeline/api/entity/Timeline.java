package com.aitimeline.api.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 타임라인 엔티티
 * 세그먼트 묶음. segmentCount / totalDurationSec 는 세그먼트 추가/삭제 시 재계산되는 캐시 값
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Timeline {
    private Long timelineId;
    private Long userId;              // 소유자
    private String name;
    private String description;
    private Integer segmentCount;
    private Integer totalDurationSec;
    private String status;            // draft, generating, ready
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isOwnedBy(Long userId) {
        return this.userId != null && this.userId.equals(userId);
    }

    public boolean isGenerating() {
        return "generating".equals(status);
    }
}
