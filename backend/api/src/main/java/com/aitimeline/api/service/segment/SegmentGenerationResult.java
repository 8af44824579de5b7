package com.aitimeline.api.service.segment;

import lombok.Builder;
import lombok.Getter;

/**
 * 세그먼트 1건 생성 결과
 * 실패 시 URL 필드는 비어 있고 error 에 사유가 담긴다.
 */
@Getter
@Builder
public class SegmentGenerationResult {
    private final Long segmentId;
    private final Integer position;
    private final String generationMode;
    private final boolean success;
    private final String videoUrl;
    private final String firstFrameUrl;
    private final String lastFrameUrl;
    private final String thumbnailUrl;
    private final Double generationTimeSec;
    private final String error;
    private final boolean frameChained;
    private final String previousFrameUsed;
}
