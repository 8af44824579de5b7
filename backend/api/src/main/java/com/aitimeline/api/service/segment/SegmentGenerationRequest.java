package com.aitimeline.api.service.segment;

import com.aitimeline.common.enums.GenerationMode;
import lombok.Builder;
import lombok.Getter;

/**
 * 세그먼트 1건 생성 요청
 * segmentId 가 없으면 생성 전에 세그먼트를 새로 만든다.
 */
@Getter
@Builder(toBuilder = true)
public class SegmentGenerationRequest {
    private final Long segmentId;
    private final Long timelineId;
    private final Long userId;
    private final Integer position;
    private final boolean firstSegment;
    private final GenerationMode mode;
    private final String modelId;
    private final Integer durationSec;
    private final String promptText;
    private final String sourceUrl;             // 첫 세그먼트 전용
    private final String previousLastFrameUrl;  // 이후 세그먼트 체이닝 입력
    private final String motionProfile;
    private final String cameraPath;
    private final String transitionType;

    /**
     * 이미지 입력: 첫 세그먼트는 sourceUrl, 이후는 이전 세그먼트 마지막 프레임
     */
    public String imageInput() {
        return firstSegment ? sourceUrl : previousLastFrameUrl;
    }

    public boolean isFrameChained() {
        return !firstSegment && previousLastFrameUrl != null;
    }
}
