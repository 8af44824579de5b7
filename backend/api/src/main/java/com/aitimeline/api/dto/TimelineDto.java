package com.aitimeline.api.dto;

import com.aitimeline.api.entity.Timeline;
import lombok.*;

import java.time.LocalDateTime;

public class TimelineDto {

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        private String name;
        private String description;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineInfo {
        private Long timelineId;
        private String name;
        private String description;
        private Integer segmentCount;
        private Integer totalDurationSec;
        private String status;
        private LocalDateTime createdAt;
        private LocalDateTime updatedAt;

        public static TimelineInfo from(Timeline timeline) {
            return TimelineInfo.builder()
                    .timelineId(timeline.getTimelineId())
                    .name(timeline.getName())
                    .description(timeline.getDescription())
                    .segmentCount(timeline.getSegmentCount())
                    .totalDurationSec(timeline.getTotalDurationSec())
                    .status(timeline.getStatus())
                    .createdAt(timeline.getCreatedAt())
                    .updatedAt(timeline.getUpdatedAt())
                    .build();
        }
    }
}
