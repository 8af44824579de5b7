package com.aitimeline.api.service.segment;

import com.aitimeline.api.mapper.SegmentMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 생성 중 세그먼트 상태 업데이트 전용 서비스
 *
 * provider 호출/프레임 추출 동안 트랜잭션을 잡고 있지 않도록
 * 각 상태 전이를 독립 트랜잭션(REQUIRES_NEW)으로 즉시 커밋한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentUpdateService {

    private final SegmentMapper segmentMapper;

    /**
     * 생성 lease 획득 (즉시 커밋)
     * @return false 면 다른 생성이 진행 중이거나 version 이 바뀜
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean acquireLease(Long segmentId, Integer version) {
        boolean acquired = segmentMapper.acquireGenerationLease(segmentId, version) == 1;
        log.info("[SegmentUpdate] segmentId={} lease {} (version={})",
                segmentId, acquired ? "acquired" : "rejected", version);
        return acquired;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateGenerationInput(Long segmentId, String generationMode, boolean firstSegment,
                                      String sourceUrl, String promptText) {
        segmentMapper.updateGenerationInput(segmentId, generationMode, firstSegment, sourceUrl, promptText);
        log.info("[SegmentUpdate] segmentId={} mode={} (committed)", segmentId, generationMode);
    }

    /**
     * 생성 결과 저장 (즉시 커밋)
     * @return false 면 세그먼트가 삭제되었거나 generating 상태가 아님
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean updateGenerationResult(Long segmentId, String videoUrl, String firstFrameUrl,
                                          String lastFrameUrl, String thumbnailUrl, Double generationTimeSec) {
        int rows = segmentMapper.updateGenerationResult(segmentId, videoUrl, firstFrameUrl,
                lastFrameUrl, thumbnailUrl, generationTimeSec);
        log.info("[SegmentUpdate] segmentId={} generated (rows={})", segmentId, rows);
        return rows == 1;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateGenerationError(Long segmentId, String errorMessage) {
        segmentMapper.updateGenerationError(segmentId, errorMessage);
        log.info("[SegmentUpdate] segmentId={} error recorded (committed)", segmentId);
    }
}
