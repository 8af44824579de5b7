package com.aitimeline.api.service.segment;

import com.aitimeline.api.dto.SegmentDto;
import com.aitimeline.api.entity.Segment;
import com.aitimeline.api.entity.Timeline;
import com.aitimeline.api.mapper.SegmentMapper;
import com.aitimeline.api.mapper.TimelineMapper;
import com.aitimeline.api.service.model.ModelCapabilityRegistry;
import com.aitimeline.api.service.storage.StorageKeys;
import com.aitimeline.api.service.storage.StorageService;
import com.aitimeline.api.service.timeline.TimelineService;
import com.aitimeline.api.util.UrlValidator;
import com.aitimeline.common.enums.GenerationMode;
import com.aitimeline.common.enums.SegmentStatus;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 세그먼트 관리 (추가/조회/수정/삭제)
 * 생성 자체는 SegmentGenerationService 가 담당한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentService {

    private static final int DEFAULT_DURATION_SEC = 5;

    private final SegmentMapper segmentMapper;
    private final TimelineMapper timelineMapper;
    private final TimelineService timelineService;
    private final GenerationModeValidator modeValidator;
    private final FrameChainResolver chainResolver;
    private final ModelCapabilityRegistry capabilityRegistry;
    private final StorageService storageService;

    // ========== 모드 ==========

    public List<SegmentDto.ModeInfo> getModes() {
        return Arrays.stream(GenerationMode.values())
                .map(mode -> SegmentDto.ModeInfo.builder()
                        .id(mode.getCode())
                        .name(mode.getDisplayName())
                        .description(mode.getDescription())
                        .availableFor(mode.isAvailableForAll() ? "all" : "first")
                        .requiresInput(mode.getRequiredInputs())
                        .isDefault(mode == GenerationMode.DEFAULT)
                        .build())
                .collect(Collectors.toList());
    }

    public SegmentDto.PositionModes getPositionModes(int position) {
        if (position < 0) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "position 은 0 이상이어야 합니다");
        }
        return SegmentDto.PositionModes.builder()
                .position(position)
                .availableModes(modeValidator.availableModes(position))
                .isFirstSegment(position == 0)
                .frameChaining(position > 0)
                .build();
    }

    public ModeValidationResult validateMode(SegmentDto.ValidateRequest request) {
        return modeValidator.validate(request.getPosition(), request.getMode());
    }

    // ========== 조회 ==========

    /**
     * 소유 세그먼트 조회
     * @throws ApiException 없으면 SEGMENT_NOT_FOUND, 다른 사용자 소유면 FORBIDDEN
     */
    public Segment getOwnedSegment(Long segmentId, Long userId) {
        Segment segment = segmentMapper.findById(segmentId)
                .orElseThrow(() -> new ApiException(ErrorCode.SEGMENT_NOT_FOUND));
        boolean owned = timelineMapper.findById(segment.getTimelineId())
                .map(timeline -> timeline.isOwnedBy(userId))
                .orElse(false);
        if (!owned) {
            throw new ApiException(ErrorCode.FORBIDDEN);
        }
        return segment;
    }

    public SegmentDto.TimelineSegments getTimelineSegments(Long timelineId, Long userId) {
        timelineService.getOwnedTimeline(timelineId, userId);
        List<Segment> ordered = segmentMapper.findByTimelineIdOrderByPosition(timelineId);

        List<SegmentDto.SegmentInfo> infos = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            infos.add(toInfo(ordered.get(i), chainResolver.previousSegmentId(ordered, i)));
        }
        return new SegmentDto.TimelineSegments(timelineId, infos, infos.size());
    }

    public SegmentDto.SegmentInfo getSegmentInfo(Long segmentId, Long userId) {
        Segment segment = getOwnedSegment(segmentId, userId);
        return toInfo(segment, previousSegmentId(segment));
    }

    // ========== 추가 ==========

    @Transactional
    public SegmentDto.CreateResponse create(Long userId, SegmentDto.CreateRequest request) {
        if (request.getTimelineId() == null || request.getPosition() == null
                || request.getModelId() == null || request.getModelId().isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "timelineId, position, modelId 는 필수입니다");
        }

        int position = request.getPosition();
        String modeCode = request.getGenerationMode() != null
                ? request.getGenerationMode()
                : GenerationMode.DEFAULT.getCode();
        GenerationMode mode = modeValidator.requireValid(position, modeCode);
        int durationSec = request.getDurationSec() != null ? request.getDurationSec() : DEFAULT_DURATION_SEC;

        Timeline timeline = timelineService.getOwnedTimeline(request.getTimelineId(), userId);

        // position 은 항상 0..n-1 로 연속
        int count = segmentMapper.findByTimelineIdOrderByPosition(timeline.getTimelineId()).size();
        if (position != count) {
            throw new ApiException(ErrorCode.INVALID_REQUEST,
                    String.format("세그먼트는 순서대로 추가해야 합니다 (다음 position: %d)", count));
        }

        checkModel(request.getModelId(), mode, durationSec);
        String sourceUrl = position == 0 ? validSourceUrl(request.getSourceUrl()) : null;

        Segment segment = Segment.builder()
                .timelineId(timeline.getTimelineId())
                .position(position)
                .durationSec(durationSec)
                .modelId(request.getModelId())
                .generationMode(mode.getCode())
                .isFirstSegment(position == 0)
                .promptText(request.getPromptText())
                .sourceUrl(sourceUrl)
                .motionProfile(request.getMotionProfile())
                .cameraPath(request.getCameraPath())
                .transitionType(request.getTransitionType())
                .status(SegmentStatus.PENDING.getCode())
                .version(0)
                .enhanceEnabled(false)
                .enhanceStatus("none")
                .build();
        try {
            segmentMapper.insert(segment);
        } catch (DuplicateKeyException e) {
            log.warn("[Segment] position {} of timeline {} taken by a concurrent insert",
                    position, timeline.getTimelineId());
            throw new ApiException(ErrorCode.SEGMENT_POSITION_CONFLICT,
                    ErrorCode.SEGMENT_POSITION_CONFLICT.getMessage(), e);
        }
        timelineMapper.recountSegments(timeline.getTimelineId());

        log.info("[Segment] created - segmentId: {}, timelineId: {}, position: {}, mode: {}",
                segment.getSegmentId(), timeline.getTimelineId(), position, mode.getCode());

        List<String> availableModes = modeValidator.availableModes(position);
        return new SegmentDto.CreateResponse(toInfo(segment, previousSegmentId(segment)), availableModes);
    }

    // ========== 수정 ==========

    @Transactional
    public SegmentDto.SegmentInfo updateMode(Long segmentId, Long userId, SegmentDto.UpdateModeRequest request) {
        Segment segment = getOwnedSegment(segmentId, userId);
        GenerationMode mode = modeValidator.requireValid(segment.getPosition(), request.getGenerationMode());
        checkModel(segment.getModelId(), mode, segment.getDurationSec());

        String sourceUrl = segment.isFirst()
                ? validSourceUrl(request.getSourceUrl() != null ? request.getSourceUrl() : segment.getSourceUrl())
                : null;
        segmentMapper.updateMode(segmentId, mode.getCode(), sourceUrl);
        log.info("[Segment] mode updated - segmentId: {}, mode: {}", segmentId, mode.getCode());

        return getSegmentInfo(segmentId, userId);
    }

    @Transactional
    public SegmentDto.SegmentInfo update(Long segmentId, Long userId, SegmentDto.UpdateRequest request) {
        Segment segment = getOwnedSegment(segmentId, userId);
        if (request.getDurationSec() != null) {
            checkModel(segment.getModelId(),
                    GenerationMode.fromCode(segment.getGenerationMode()).orElse(GenerationMode.DEFAULT),
                    request.getDurationSec());
        }

        Segment changes = Segment.builder()
                .segmentId(segmentId)
                .promptText(request.getPromptText())
                .finalPromptText(request.getFinalPromptText())
                .dialogue(request.getDialogue())
                .motionProfile(request.getMotionProfile())
                .cameraPath(request.getCameraPath())
                .transitionType(request.getTransitionType())
                .durationSec(request.getDurationSec())
                .build();
        segmentMapper.updateDetails(changes);

        if (request.getDurationSec() != null) {
            timelineMapper.recountSegments(segment.getTimelineId());
        }
        log.info("[Segment] updated - segmentId: {}", segmentId);
        return getSegmentInfo(segmentId, userId);
    }

    // ========== 삭제 ==========

    /**
     * 삭제 후 뒤 세그먼트를 당긴다. 체이닝 입력은 생성 시점에 다시 계산된다.
     */
    @Transactional
    public void delete(Long segmentId, Long userId) {
        Segment segment = getOwnedSegment(segmentId, userId);
        if (segment.isGenerating()) {
            throw new ApiException(ErrorCode.SEGMENT_GENERATION_IN_PROGRESS);
        }

        segmentMapper.delete(segmentId);
        segmentMapper.parkPositionsAfter(segment.getTimelineId(), segment.getPosition());
        segmentMapper.shiftParkedPositions(segment.getTimelineId());
        timelineMapper.recountSegments(segment.getTimelineId());
        deleteFrames(userId, segment);

        log.info("[Segment] deleted - segmentId: {}, timelineId: {}, position: {}",
                segmentId, segment.getTimelineId(), segment.getPosition());
    }

    // ========== 내부 ==========

    private SegmentDto.SegmentInfo toInfo(Segment segment, Long previousSegmentId) {
        return SegmentDto.SegmentInfo.of(segment, modeValidator.availableModes(segment.getPosition()), previousSegmentId);
    }

    private Long previousSegmentId(Segment segment) {
        if (segment.isFirst()) {
            return null;
        }
        return segmentMapper.findByTimelineIdAndPosition(segment.getTimelineId(), segment.getPosition() - 1)
                .map(Segment::getSegmentId)
                .orElse(null);
    }

    private void checkModel(String modelId, GenerationMode mode, Integer durationSec) {
        if (capabilityRegistry.find(modelId).isEmpty()) {
            throw new ApiException(ErrorCode.MODEL_NOT_FOUND, "등록되지 않은 모델입니다: " + modelId);
        }
        Optional<String> unsupported = capabilityRegistry.checkSupport(modelId, mode, durationSec);
        if (unsupported.isPresent()) {
            throw new ApiException(ErrorCode.MODEL_CAPABILITY_UNSUPPORTED, unsupported.get());
        }
    }

    private String validSourceUrl(String sourceUrl) {
        if (sourceUrl != null && !UrlValidator.isValid(sourceUrl)) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "sourceUrl 이 유효하지 않습니다");
        }
        return sourceUrl;
    }

    private void deleteFrames(Long userId, Segment segment) {
        if (segment.getFirstFrameUrl() == null && segment.getLastFrameUrl() == null) {
            return;
        }
        try {
            storageService.delete(StorageKeys.firstFrame(userId, segment.getTimelineId(), segment.getSegmentId()));
            storageService.delete(StorageKeys.lastFrame(userId, segment.getTimelineId(), segment.getSegmentId()));
        } catch (Exception e) {
            log.warn("[Segment] frame cleanup failed - segmentId: {}, error: {}", segment.getSegmentId(), e.getMessage());
        }
    }
}
