package com.aitimeline.api.service.enhancement;

import com.aitimeline.api.config.AsyncConfig;
import com.aitimeline.api.entity.EnhancementJob;
import com.aitimeline.api.entity.UpscalerModel;
import com.aitimeline.api.mapper.EnhancementJobMapper;
import com.aitimeline.api.service.model.UpscalerRegistry;
import com.aitimeline.api.service.provider.EnhancementProvider;
import com.aitimeline.api.service.storage.RemoteMediaStore;
import com.aitimeline.api.service.storage.StorageKeys;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 업스케일 작업 실행
 * provider 호출 → 결과물 저장소 복사 → done, 어느 단계든 실패하면 failed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnhancementJobProcessor {

    private static final String VIDEO_MP4 = "video/mp4";

    private final EnhancementJobMapper jobMapper;
    private final EnhancementJobTransitions transitions;
    private final UpscalerRegistry upscalerRegistry;
    private final List<EnhancementProvider> providers;
    private final RemoteMediaStore remoteMediaStore;

    @Async(AsyncConfig.ENHANCEMENT_EXECUTOR)
    public void processAsync(Long jobId) {
        try {
            process(jobId);
        } catch (ApiException e) {
            log.error("[Enhance] async job {} rejected: {}", jobId, e.getMessage());
        }
    }

    /**
     * queued 작업 1건 처리
     * 이미 끝난 작업은 그대로 돌려주고, 다른 스레드가 처리 중이면 ENHANCEMENT_JOB_NOT_QUEUED
     */
    public EnhancementJob process(Long jobId) {
        EnhancementJob job = findJob(jobId);
        if (job.isTerminal()) {
            return job;
        }
        if (!transitions.markProcessing(job)) {
            throw new ApiException(ErrorCode.ENHANCEMENT_JOB_NOT_QUEUED);
        }

        long startTime = System.currentTimeMillis();
        try {
            UpscalerModel model = upscalerRegistry.findById(job.getModelId())
                    .orElseThrow(() -> new ApiException(ErrorCode.UPSCALER_NOT_FOUND,
                            "Upscaler model not found: " + job.getModelId()));
            EnhancementProvider provider = providers.stream()
                    .filter(candidate -> candidate.supports(model.getProvider()))
                    .findFirst()
                    .orElseThrow(() -> new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                            "No enhancement provider for: " + model.getProvider()));

            EnhancementProvider.EnhancementTask task = new EnhancementProvider.EnhancementTask(
                    job.getInputUrl(), model, job.getScaleFactor(), job.getTargetResolution(),
                    Boolean.TRUE.equals(job.getPreserveAudio()));
            String providerOutput = provider.enhance(task, progress -> transitions.updateProgress(jobId, progress));

            String outputUrl = remoteMediaStore.copyToStorage(providerOutput,
                    StorageKeys.enhancedVideo(job.getTimelineId(), job.getSegmentId()), VIDEO_MP4);
            transitions.markDone(job, outputUrl, elapsedSec(startTime));

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[Enhance] job {} failed: {}", jobId, message);
            transitions.markFailed(job, message, elapsedSec(startTime));
        }
        return findJob(jobId);
    }

    private EnhancementJob findJob(Long jobId) {
        return jobMapper.findById(jobId)
                .orElseThrow(() -> new ApiException(ErrorCode.ENHANCEMENT_JOB_NOT_FOUND));
    }

    private static double elapsedSec(long startTime) {
        return (System.currentTimeMillis() - startTime) / 1000.0;
    }
}
