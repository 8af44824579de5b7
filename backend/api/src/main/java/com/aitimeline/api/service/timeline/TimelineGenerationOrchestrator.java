package com.aitimeline.api.service.timeline;

import com.aitimeline.api.dto.SegmentDto;
import com.aitimeline.api.entity.Segment;
import com.aitimeline.api.mapper.SegmentMapper;
import com.aitimeline.api.service.segment.SegmentGenerationRequest;
import com.aitimeline.api.service.segment.SegmentGenerationResult;
import com.aitimeline.api.service.segment.SegmentGenerationService;
import com.aitimeline.common.enums.GenerationMode;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 타임라인 전체 순차 생성
 *
 * position 순서대로 한 세그먼트씩 생성하고, 각 세그먼트의 마지막 프레임을
 * 다음 세그먼트의 image-to-video 입력으로 넘긴다.
 * 실패하면 즉시 중단한다 (이후 세그먼트는 입력 프레임이 없다).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimelineGenerationOrchestrator {

    private final TimelineService timelineService;
    private final SegmentMapper segmentMapper;
    private final SegmentGenerationService segmentGenerationService;
    private final GenerationCancellationRegistry cancellationRegistry;

    public SegmentDto.TimelineGenerationResponse generateTimeline(Long userId, SegmentDto.GenerateTimelineRequest request) {
        if (request.getTimelineId() == null) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "timelineId 는 필수입니다");
        }
        Long timelineId = request.getTimelineId();
        timelineService.getOwnedTimeline(timelineId, userId);

        List<Segment> segments = segmentMapper.findByTimelineIdOrderByPosition(timelineId);
        if (segments.isEmpty()) {
            throw new ApiException(ErrorCode.NO_SEGMENTS);
        }
        GenerationMode firstMode = resolveFirstMode(request.getFirstSegmentMode(), segments.get(0));

        timelineService.markGenerating(timelineId);
        GenerationCancellationRegistry.CancellationToken token = cancellationRegistry.register(timelineId);

        log.info("========================================");
        log.info("[Timeline] generation start - timelineId: {}, segments: {}, firstMode: {}",
                timelineId, segments.size(), firstMode.getCode());
        log.info("========================================");

        List<SegmentGenerationResult> results = new ArrayList<>();
        FrameChainCursor cursor = new FrameChainCursor();
        boolean stoppedEarly = false;
        boolean cancelled = false;

        try {
            for (int i = 0; i < segments.size(); i++) {
                if (token.isCancelled()) {
                    cancelled = true;
                    log.info("[Timeline] cancelled before position {} - timelineId: {}", i, timelineId);
                    break;
                }

                Segment segment = segments.get(i);
                boolean first = i == 0;
                SegmentGenerationRequest segmentRequest = SegmentGenerationRequest.builder()
                        .segmentId(segment.getSegmentId())
                        .timelineId(timelineId)
                        .userId(userId)
                        .position(i)
                        .firstSegment(first)
                        .mode(first ? firstMode : GenerationMode.IMAGE_TO_VIDEO)
                        .modelId(segment.getModelId())
                        .durationSec(segment.getDurationSec())
                        .promptText(segment.effectivePrompt())
                        .sourceUrl(first ? firstSource(request, segment) : null)
                        .previousLastFrameUrl(first ? null : cursor.lastFrameUrl())
                        .motionProfile(segment.getMotionProfile())
                        .cameraPath(segment.getCameraPath())
                        .transitionType(segment.getTransitionType())
                        .build();

                SegmentGenerationResult result = generateSafely(segmentRequest);
                results.add(result);

                if (!result.isSuccess()) {
                    stoppedEarly = true;
                    log.warn("[Timeline] stopped at position {} - timelineId: {}, error: {}",
                            i, timelineId, result.getError());
                    break;
                }
                cursor.advance(result.getLastFrameUrl());
            }
        } finally {
            cancellationRegistry.release(timelineId, token);
            timelineService.markReady(timelineId);
        }

        int generated = (int) results.stream().filter(SegmentGenerationResult::isSuccess).count();
        log.info("[Timeline] generation end - timelineId: {}, generated: {}/{}, stoppedEarly: {}, cancelled: {}",
                timelineId, generated, segments.size(), stoppedEarly, cancelled);

        return SegmentDto.TimelineGenerationResponse.builder()
                .timelineId(timelineId)
                .segmentsGenerated(generated)
                .stoppedEarly(stoppedEarly)
                .cancelled(cancelled)
                .results(results)
                .frameChaining(new SegmentDto.FrameChaining(true, firstMode.getCode()))
                .build();
    }

    public boolean cancel(Long timelineId, Long userId) {
        timelineService.getOwnedTimeline(timelineId, userId);
        return cancellationRegistry.cancel(timelineId);
    }

    /**
     * lease 충돌 등 생성 서비스가 던진 예외도 실패 결과로 바꿔 체인을 멈춘다.
     */
    private SegmentGenerationResult generateSafely(SegmentGenerationRequest request) {
        try {
            return segmentGenerationService.generate(request);
        } catch (ApiException e) {
            log.warn("[Timeline] segment {} rejected: {}", request.getSegmentId(), e.getMessage());
            return SegmentGenerationResult.builder()
                    .segmentId(request.getSegmentId())
                    .position(request.getPosition())
                    .generationMode(request.getMode().getCode())
                    .success(false)
                    .videoUrl("")
                    .firstFrameUrl("")
                    .lastFrameUrl("")
                    .thumbnailUrl("")
                    .error(e.getMessage())
                    .frameChained(request.isFrameChained())
                    .previousFrameUsed(request.getPreviousLastFrameUrl())
                    .build();
        }
    }

    private GenerationMode resolveFirstMode(String requested, Segment firstSegment) {
        if (requested != null) {
            return GenerationMode.fromCode(requested)
                    .orElseThrow(() -> new ApiException(ErrorCode.INVALID_GENERATION_MODE,
                            "지원하지 않는 생성 모드입니다: " + requested));
        }
        return GenerationMode.fromCode(firstSegment.getGenerationMode()).orElse(GenerationMode.DEFAULT);
    }

    private String firstSource(SegmentDto.GenerateTimelineRequest request, Segment segment) {
        return request.getFirstSegmentSource() != null ? request.getFirstSegmentSource() : segment.getSourceUrl();
    }
}
