package com.aitimeline.api.service.storage;

/**
 * 저장 키 규칙
 * frames/{userId}/{timelineId}/{segmentId}_first.jpg
 * segments/enhanced/{timelineId}/{segmentId}.mp4
 */
public final class StorageKeys {

    private StorageKeys() {
    }

    public static String firstFrame(Long userId, Long timelineId, Long segmentId) {
        return String.format("frames/%d/%d/%d_first.jpg", userId, timelineId, segmentId);
    }

    public static String lastFrame(Long userId, Long timelineId, Long segmentId) {
        return String.format("frames/%d/%d/%d_last.jpg", userId, timelineId, segmentId);
    }

    public static String enhancedVideo(Long timelineId, Long segmentId) {
        return String.format("segments/enhanced/%d/%d.mp4", timelineId, segmentId);
    }
}
