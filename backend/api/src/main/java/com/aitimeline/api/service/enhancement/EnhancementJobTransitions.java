package com.aitimeline.api.service.enhancement;

import com.aitimeline.api.entity.EnhancementJob;
import com.aitimeline.api.mapper.EnhancementJobMapper;
import com.aitimeline.api.mapper.SegmentMapper;
import com.aitimeline.common.enums.EnhanceStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 업스케일 작업 상태 전이
 * 작업 row 와 세그먼트 projection(enhance_*)을 같은 트랜잭션에서 바꾼다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnhancementJobTransitions {

    private final EnhancementJobMapper jobMapper;
    private final SegmentMapper segmentMapper;

    @Transactional
    public EnhancementJob queue(EnhancementJob job) {
        job.setStatus(EnhanceStatus.QUEUED.getCode());
        job.setProgress(0);
        jobMapper.insert(job);
        project(job, EnhanceStatus.QUEUED, null, null);
        log.info("[Enhance] job {} queued - segmentId: {}, model: {}, scale: {}x",
                job.getJobId(), job.getSegmentId(), job.getModelId(), job.getScaleFactor());
        return job;
    }

    /**
     * queued → processing
     * @return false 면 queued 상태가 아니어서 전이하지 않음
     */
    @Transactional
    public boolean markProcessing(EnhancementJob job) {
        if (jobMapper.markProcessing(job.getJobId()) == 0) {
            return false;
        }
        project(job, EnhanceStatus.PROCESSING, null, null);
        log.info("[Enhance] job {} processing", job.getJobId());
        return true;
    }

    @Transactional
    public boolean markDone(EnhancementJob job, String outputUrl, double processingTimeSec) {
        if (jobMapper.markDone(job.getJobId(), outputUrl, processingTimeSec) == 0) {
            log.warn("[Enhance] job {} was not processing, done ignored", job.getJobId());
            return false;
        }
        project(job, EnhanceStatus.DONE, outputUrl, null);
        log.info("[Enhance] job {} done - {}s", job.getJobId(), processingTimeSec);
        return true;
    }

    @Transactional
    public boolean markFailed(EnhancementJob job, String errorMessage, double processingTimeSec) {
        if (jobMapper.markFailed(job.getJobId(), errorMessage, processingTimeSec) == 0) {
            log.warn("[Enhance] job {} already terminal, failure ignored", job.getJobId());
            return false;
        }
        project(job, EnhanceStatus.FAILED, null, errorMessage);
        log.info("[Enhance] job {} failed - {}", job.getJobId(), errorMessage);
        return true;
    }

    public void updateProgress(Long jobId, int progress) {
        jobMapper.updateProgress(jobId, progress);
    }

    /**
     * 세그먼트의 최신 작업만 projection 을 갱신한다
     */
    private void project(EnhancementJob job, EnhanceStatus status, String outputUrl, String errorMessage) {
        int updated = segmentMapper.updateEnhanceProjection(job.getSegmentId(), job.getJobId(),
                job.getModelId(), status.getCode(), outputUrl, errorMessage);
        if (updated == 0) {
            log.info("[Enhance] job {} superseded, segment {} projection kept", job.getJobId(), job.getSegmentId());
        }
    }
}
