package com.aitimeline.api.service.provider;

/**
 * 생성된 영상에서 첫/마지막 프레임을 추출해 저장소에 올린다.
 * 마지막 프레임 URL 은 다음 세그먼트의 입력 이미지가 된다.
 */
public interface FrameExtractor {

    ExtractedFrames extract(String videoUrl, Long userId, Long timelineId, Long segmentId);

    record ExtractedFrames(String firstFrameUrl, String lastFrameUrl) {
    }
}
