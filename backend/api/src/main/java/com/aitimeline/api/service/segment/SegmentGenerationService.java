package com.aitimeline.api.service.segment;

import com.aitimeline.api.dto.SegmentDto;
import com.aitimeline.api.entity.Segment;
import com.aitimeline.api.mapper.SegmentMapper;
import com.aitimeline.api.mapper.TimelineMapper;
import com.aitimeline.api.service.model.ModelCapabilityRegistry;
import com.aitimeline.api.service.provider.FrameExtractor;
import com.aitimeline.api.service.provider.VideoGenerationProvider;
import com.aitimeline.common.enums.GenerationMode;
import com.aitimeline.common.enums.SegmentStatus;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 세그먼트 1건 생성
 *
 * 순서: 모드 검증 → (신규면 세그먼트 생성) → lease 획득 → 모델 기능 확인
 *       → provider 호출 → 프레임 추출 → 결과 저장
 *
 * lease 이후의 실패는 예외 대신 실패 결과로 돌려주고 세그먼트에 error 로 기록한다.
 * 긴 외부 호출 동안 트랜잭션을 잡지 않도록 상태 변경은 SegmentUpdateService 로 즉시 커밋한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentGenerationService {

    private final SegmentMapper segmentMapper;
    private final TimelineMapper timelineMapper;
    private final SegmentService segmentService;
    private final SegmentUpdateService segmentUpdateService;
    private final GenerationModeValidator modeValidator;
    private final FrameChainResolver chainResolver;
    private final GenerationPayloadBuilder payloadBuilder;
    private final ModelCapabilityRegistry capabilityRegistry;
    private final VideoGenerationProvider generationProvider;
    private final FrameExtractor frameExtractor;

    /**
     * @throws ApiException 다른 생성이 진행 중이면 SEGMENT_GENERATION_IN_PROGRESS
     */
    public SegmentGenerationResult generate(SegmentGenerationRequest request) {
        long startTime = System.currentTimeMillis();
        String modeCode = request.getMode() != null ? request.getMode().getCode() : null;

        ModeValidationResult validation = modeValidator.validate(request.getPosition(), modeCode);
        if (!validation.valid()) {
            log.warn("[Generate] invalid mode - segmentId: {}, position: {}, mode: {}",
                    request.getSegmentId(), request.getPosition(), modeCode);
            return failure(request, request.getSegmentId(), validation.error(), startTime);
        }

        Segment segment = request.getSegmentId() != null
                ? segmentMapper.findById(request.getSegmentId())
                    .orElseThrow(() -> new ApiException(ErrorCode.SEGMENT_NOT_FOUND))
                : createSegment(request);
        Long segmentId = segment.getSegmentId();

        if (!segmentUpdateService.acquireLease(segmentId, segment.getVersion())) {
            throw new ApiException(ErrorCode.SEGMENT_GENERATION_IN_PROGRESS);
        }

        log.info("[Generate] start - segmentId: {}, position: {}, mode: {}, chained: {}",
                segmentId, request.getPosition(), modeCode, request.isFrameChained());

        try {
            Optional<String> unsupported = capabilityRegistry.checkSupport(
                    request.getModelId(), request.getMode(), request.getDurationSec());
            if (unsupported.isPresent()) {
                throw new ApiException(ErrorCode.MODEL_CAPABILITY_UNSUPPORTED, unsupported.get());
            }

            segmentUpdateService.updateGenerationInput(segmentId, modeCode, request.isFirstSegment(),
                    request.isFirstSegment() ? request.getSourceUrl() : null, request.getPromptText());

            String endpoint = payloadBuilder.endpointFor(request.getMode());
            Map<String, Object> payload = payloadBuilder.build(request);
            String videoUrl = generationProvider.generate(endpoint, payload);

            FrameExtractor.ExtractedFrames frames = frameExtractor.extract(
                    videoUrl, request.getUserId(), request.getTimelineId(), segmentId);

            double elapsed = elapsedSec(startTime);
            boolean stored = segmentUpdateService.updateGenerationResult(segmentId, videoUrl,
                    frames.firstFrameUrl(), frames.lastFrameUrl(), frames.firstFrameUrl(), elapsed);
            if (!stored) {
                log.warn("[Generate] segment {} was removed during generation", segmentId);
                return failure(request, segmentId, "Segment was removed during generation", startTime);
            }

            log.info("[Generate] done - segmentId: {}, {}s", segmentId, elapsed);
            return SegmentGenerationResult.builder()
                    .segmentId(segmentId)
                    .position(request.getPosition())
                    .generationMode(modeCode)
                    .success(true)
                    .videoUrl(videoUrl)
                    .firstFrameUrl(frames.firstFrameUrl())
                    .lastFrameUrl(frames.lastFrameUrl())
                    .thumbnailUrl(frames.firstFrameUrl())
                    .generationTimeSec(elapsed)
                    .frameChained(request.isFrameChained())
                    .previousFrameUsed(request.isFirstSegment() ? null : request.getPreviousLastFrameUrl())
                    .build();

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[Generate] failed - segmentId: {}, error: {}", segmentId, message);
            segmentUpdateService.updateGenerationError(segmentId, message);
            return failure(request, segmentId, message, startTime);
        }
    }

    /**
     * 기존 세그먼트 (재)생성
     * 체이닝 입력은 현재 이전 세그먼트 기준으로 다시 계산한다.
     */
    public SegmentGenerationResult regenerate(Long segmentId, Long userId, SegmentDto.GenerateRequest overrides) {
        Segment segment = segmentService.getOwnedSegment(segmentId, userId);
        SegmentDto.GenerateRequest options = overrides != null ? overrides : new SegmentDto.GenerateRequest();

        String modeCode = options.getOverrideMode() != null ? options.getOverrideMode() : segment.getGenerationMode();
        GenerationMode mode = modeValidator.requireValid(segment.getPosition(), modeCode);

        List<Segment> ordered = segmentMapper.findByTimelineIdOrderByPosition(segment.getTimelineId());
        int index = chainResolver.indexOf(ordered, segmentId);
        boolean first = index == 0;
        String previousLastFrame = first ? null : chainResolver.requireChainInput(ordered, index);

        // override_source_url 은 첫 세그먼트에서만 의미가 있다
        String sourceUrl = first
                ? (options.getOverrideSourceUrl() != null ? options.getOverrideSourceUrl() : segment.getSourceUrl())
                : null;

        SegmentGenerationRequest request = SegmentGenerationRequest.builder()
                .segmentId(segmentId)
                .timelineId(segment.getTimelineId())
                .userId(userId)
                .position(index)
                .firstSegment(first)
                .mode(mode)
                .modelId(segment.getModelId())
                .durationSec(segment.getDurationSec())
                .promptText(promptOf(segment, options.getOverridePrompt()))
                .sourceUrl(sourceUrl)
                .previousLastFrameUrl(previousLastFrame)
                .motionProfile(segment.getMotionProfile())
                .cameraPath(segment.getCameraPath())
                .transitionType(segment.getTransitionType())
                .build();
        return generate(request);
    }

    private static String promptOf(Segment segment, String overridePrompt) {
        if (overridePrompt != null && !overridePrompt.isBlank()) {
            return overridePrompt;
        }
        return segment.effectivePrompt();
    }

    private Segment createSegment(SegmentGenerationRequest request) {
        Segment segment = Segment.builder()
                .timelineId(request.getTimelineId())
                .position(request.getPosition())
                .durationSec(request.getDurationSec())
                .modelId(request.getModelId())
                .generationMode(request.getMode().getCode())
                .isFirstSegment(request.isFirstSegment())
                .promptText(request.getPromptText())
                .sourceUrl(request.isFirstSegment() ? request.getSourceUrl() : null)
                .motionProfile(request.getMotionProfile())
                .cameraPath(request.getCameraPath())
                .transitionType(request.getTransitionType())
                .status(SegmentStatus.PENDING.getCode())
                .version(0)
                .build();
        try {
            segmentMapper.insert(segment);
        } catch (DuplicateKeyException e) {
            log.warn("[Generate] position {} of timeline {} taken by a concurrent insert",
                    request.getPosition(), request.getTimelineId());
            throw new ApiException(ErrorCode.SEGMENT_POSITION_CONFLICT,
                    ErrorCode.SEGMENT_POSITION_CONFLICT.getMessage(), e);
        }
        timelineMapper.recountSegments(request.getTimelineId());
        return segment;
    }

    private SegmentGenerationResult failure(SegmentGenerationRequest request, Long segmentId,
                                            String error, long startTime) {
        return SegmentGenerationResult.builder()
                .segmentId(segmentId)
                .position(request.getPosition())
                .generationMode(request.getMode() != null ? request.getMode().getCode() : null)
                .success(false)
                .videoUrl("")
                .firstFrameUrl("")
                .lastFrameUrl("")
                .thumbnailUrl("")
                .generationTimeSec(elapsedSec(startTime))
                .error(error)
                .frameChained(request.isFrameChained())
                .previousFrameUsed(request.isFirstSegment() ? null : request.getPreviousLastFrameUrl())
                .build();
    }

    private static double elapsedSec(long startTime) {
        return (System.currentTimeMillis() - startTime) / 1000.0;
    }
}
