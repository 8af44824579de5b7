package com.aitimeline.api.service.timeline;

import com.aitimeline.api.entity.Timeline;
import com.aitimeline.api.mapper.EnhancementJobMapper;
import com.aitimeline.api.mapper.SegmentMapper;
import com.aitimeline.api.mapper.TimelineMapper;
import com.aitimeline.common.enums.TimelineStatus;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TimelineService {

    private final TimelineMapper timelineMapper;
    private final SegmentMapper segmentMapper;
    private final EnhancementJobMapper enhancementJobMapper;
    private final GenerationCancellationRegistry cancellationRegistry;

    @Transactional
    public Timeline create(Long userId, String name, String description) {
        if (name == null || name.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "name 은 필수입니다");
        }
        Timeline timeline = Timeline.builder()
                .userId(userId)
                .name(name.trim())
                .description(description)
                .segmentCount(0)
                .totalDurationSec(0)
                .status(TimelineStatus.DRAFT.getCode())
                .build();
        timelineMapper.insert(timeline);
        log.info("[Timeline] created - timelineId: {}, userId: {}", timeline.getTimelineId(), userId);
        return timeline;
    }

    /**
     * 소유 타임라인 조회 (없거나 다른 사용자 소유면 TIMELINE_NOT_FOUND)
     */
    public Timeline getOwnedTimeline(Long timelineId, Long userId) {
        return timelineMapper.findById(timelineId)
                .filter(timeline -> timeline.isOwnedBy(userId))
                .orElseThrow(() -> new ApiException(ErrorCode.TIMELINE_NOT_FOUND));
    }

    public List<Timeline> getTimelines(Long userId) {
        return timelineMapper.findByUserId(userId);
    }

    /**
     * 진행 중인 생성은 취소 요청 후 작업/세그먼트/타임라인을 함께 삭제
     */
    @Transactional
    public void delete(Long timelineId, Long userId) {
        getOwnedTimeline(timelineId, userId);
        cancellationRegistry.cancel(timelineId);

        enhancementJobMapper.deleteByTimelineId(timelineId);
        segmentMapper.deleteByTimelineId(timelineId);
        timelineMapper.delete(timelineId);
        log.info("[Timeline] deleted - timelineId: {}", timelineId);
    }

    /**
     * generating 으로 전환 (즉시 커밋)
     * @throws ApiException 이미 생성 중이면 TIMELINE_GENERATION_IN_PROGRESS
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markGenerating(Long timelineId) {
        if (timelineMapper.markGenerating(timelineId) == 0) {
            throw new ApiException(ErrorCode.TIMELINE_GENERATION_IN_PROGRESS);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markReady(Long timelineId) {
        timelineMapper.updateStatus(timelineId, TimelineStatus.READY.getCode());
    }
}
