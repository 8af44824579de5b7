package com.aitimeline.api.service.enhancement;

import com.aitimeline.api.dto.EnhancementDto;
import com.aitimeline.api.entity.EnhancementJob;
import com.aitimeline.api.entity.Segment;
import com.aitimeline.api.entity.UpscalerModel;
import com.aitimeline.api.mapper.EnhancementJobMapper;
import com.aitimeline.api.mapper.SegmentMapper;
import com.aitimeline.api.service.model.UpscalerRegistry;
import com.aitimeline.api.service.segment.SegmentService;
import com.aitimeline.api.service.timeline.TimelineService;
import com.aitimeline.api.util.UrlValidator;
import com.aitimeline.common.enums.EnhanceStatus;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 세그먼트 업스케일 작업 관리
 *
 * 작업 등록은 즉시 커밋되고, enhancement.auto-process 가 켜져 있으면
 * 커밋 후 enhancementExecutor 에서 처리를 시작한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnhancementJobService {

    static final String DEFAULT_UPSCALER = "replicate-esrgan";
    static final int DEFAULT_SCALE_FACTOR = 2;

    private final EnhancementJobMapper jobMapper;
    private final SegmentMapper segmentMapper;
    private final SegmentService segmentService;
    private final TimelineService timelineService;
    private final UpscalerRegistry upscalerRegistry;
    private final EnhancementJobTransitions transitions;
    private final EnhancementJobProcessor processor;

    @Value("${enhancement.auto-process:true}")
    private boolean autoProcess = true;

    // ========== 등록 ==========

    public EnhancementJob queue(Long segmentId, Long userId, EnhancementDto.QueueRequest request) {
        Segment segment = segmentService.getOwnedSegment(segmentId, userId);
        EnhancementDto.QueueRequest options = request != null ? request : new EnhancementDto.QueueRequest();

        String modelId = options.getModelId() != null ? options.getModelId()
                : segment.getEnhanceModel() != null ? segment.getEnhanceModel()
                : DEFAULT_UPSCALER;
        String inputUrl = options.getInputUrl() != null ? options.getInputUrl() : segment.getVideoUrl();

        EnhancementJob job = createJob(segment, userId, modelId, options.getScaleFactor(), inputUrl,
                options.getTargetResolution(), options.getPreserveAudio());
        startProcessing(job);
        return job;
    }

    /**
     * 업스케일이 켜져 있고 아직 done 이 아닌 세그먼트를 모두 등록
     * 세그먼트별 실패는 중단하지 않고 errors 에 모은다.
     */
    public EnhancementDto.EnhanceAllResponse enhanceTimeline(Long timelineId, Long userId) {
        timelineService.getOwnedTimeline(timelineId, userId);
        List<Segment> eligible = segmentMapper.findEnhanceEligibleByTimelineId(timelineId);

        List<Long> jobIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Segment segment : eligible) {
            if (segment.getEnhanceModel() == null || segment.getEnhanceModel().isBlank()) {
                errors.add("Segment " + segment.getSegmentId() + ": No upscaler model selected");
                continue;
            }
            if (!segment.hasVideo()) {
                errors.add("Segment " + segment.getSegmentId() + ": No video to enhance");
                continue;
            }
            try {
                EnhancementJob job = createJob(segment, userId, segment.getEnhanceModel(), DEFAULT_SCALE_FACTOR,
                        segment.getVideoUrl(), null, true);
                jobIds.add(job.getJobId());
            } catch (ApiException e) {
                errors.add("Segment " + segment.getSegmentId() + ": " + e.getMessage());
            }
        }

        log.info("[Enhance] timeline {} - eligible: {}, queued: {}, errors: {}",
                timelineId, eligible.size(), jobIds.size(), errors.size());
        jobIds.forEach(this::startProcessing);

        return EnhancementDto.EnhanceAllResponse.builder()
                .timelineId(timelineId)
                .queued(jobIds.size())
                .jobIds(jobIds)
                .errors(errors)
                .build();
    }

    // ========== 선택 ==========

    @Transactional
    public void enable(Long segmentId, Long userId, String modelId) {
        segmentService.getOwnedSegment(segmentId, userId);
        String resolved = requireUpscaler(modelId != null ? modelId : DEFAULT_UPSCALER).getId();
        segmentMapper.updateEnhanceSelection(segmentId, true, resolved);
        log.info("[Enhance] segment {} enabled - model: {}", segmentId, resolved);
    }

    @Transactional
    public void disable(Long segmentId, Long userId) {
        segmentService.getOwnedSegment(segmentId, userId);
        segmentMapper.updateEnhanceSelection(segmentId, false, null);
        log.info("[Enhance] segment {} disabled", segmentId);
    }

    @Transactional
    public void enableAll(Long timelineId, Long userId, String modelId) {
        timelineService.getOwnedTimeline(timelineId, userId);
        String resolved = requireUpscaler(modelId != null ? modelId : DEFAULT_UPSCALER).getId();
        segmentMapper.enableEnhanceForTimeline(timelineId, resolved);
        log.info("[Enhance] timeline {} enabled for all segments - model: {}", timelineId, resolved);
    }

    // ========== 처리 ==========

    public EnhancementJob process(Long jobId, Long userId) {
        getOwnedJob(jobId, userId);
        return processor.process(jobId);
    }

    // ========== 조회 ==========

    public EnhancementJob getOwnedJob(Long jobId, Long userId) {
        EnhancementJob job = jobMapper.findById(jobId)
                .orElseThrow(() -> new ApiException(ErrorCode.ENHANCEMENT_JOB_NOT_FOUND));
        if (!userId.equals(job.getUserId())) {
            throw new ApiException(ErrorCode.FORBIDDEN);
        }
        return job;
    }

    public EnhancementDto.SegmentStatus getSegmentStatus(Long segmentId, Long userId) {
        Segment segment = segmentService.getOwnedSegment(segmentId, userId);
        List<EnhancementDto.JobInfo> jobs = jobMapper.findBySegmentId(segmentId).stream()
                .map(EnhancementDto.JobInfo::from)
                .collect(Collectors.toList());
        return toStatus(segment, jobs);
    }

    public EnhancementDto.TimelineStatus getTimelineStatus(Long timelineId, Long userId) {
        timelineService.getOwnedTimeline(timelineId, userId);
        List<Segment> segments = segmentMapper.findByTimelineIdOrderByPosition(timelineId);

        int enabled = 0;
        int queued = 0;
        int processing = 0;
        int done = 0;
        int failed = 0;
        List<EnhancementDto.SegmentStatus> statuses = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment.isEnhanceRequested()) {
                enabled++;
            }
            switch (EnhanceStatus.fromCode(segment.getEnhanceStatus())) {
                case QUEUED -> queued++;
                case PROCESSING -> processing++;
                case DONE -> done++;
                case FAILED -> failed++;
                default -> { }
            }
            statuses.add(toStatus(segment, null));
        }

        return EnhancementDto.TimelineStatus.builder()
                .timelineId(timelineId)
                .total(segments.size())
                .enabled(enabled)
                .queued(queued)
                .processing(processing)
                .done(done)
                .failed(failed)
                .segments(statuses)
                .build();
    }

    public List<EnhancementJob> getPendingJobs(Long timelineId, Long userId) {
        timelineService.getOwnedTimeline(timelineId, userId);
        return jobMapper.findPendingByTimelineId(timelineId);
    }

    // ========== 내부 ==========

    private EnhancementJob createJob(Segment segment, Long userId, String modelId, Integer scaleFactor,
                                     String inputUrl, String targetResolution, Boolean preserveAudio) {
        UpscalerModel model = requireUpscaler(modelId);
        int scale = scaleFactor != null ? scaleFactor : DEFAULT_SCALE_FACTOR;
        if (!model.supportsScale(scale)) {
            throw new ApiException(ErrorCode.UNSUPPORTED_SCALE_FACTOR,
                    String.format("Scale factor %dx not supported by %s", scale, model.getDisplayName()));
        }
        if (inputUrl == null || inputUrl.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "업스케일할 영상이 없습니다. 세그먼트를 먼저 생성해주세요.");
        }
        if (!UrlValidator.isValid(inputUrl)) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "inputUrl 이 유효하지 않습니다");
        }

        EnhancementJob job = EnhancementJob.builder()
                .segmentId(segment.getSegmentId())
                .timelineId(segment.getTimelineId())
                .userId(userId)
                .modelId(model.getId())
                .provider(model.getProvider())
                .inputUrl(inputUrl)
                .scaleFactor(scale)
                .targetResolution(targetResolution)
                .preserveAudio(preserveAudio == null || preserveAudio)
                .build();
        return transitions.queue(job);
    }

    private UpscalerModel requireUpscaler(String modelId) {
        return upscalerRegistry.findById(modelId)
                .orElseThrow(() -> new ApiException(ErrorCode.UPSCALER_NOT_FOUND,
                        "Upscaler model not found: " + modelId));
    }

    private void startProcessing(EnhancementJob job) {
        startProcessing(job.getJobId());
    }

    private void startProcessing(Long jobId) {
        if (autoProcess) {
            processor.processAsync(jobId);
        }
    }

    private EnhancementDto.SegmentStatus toStatus(Segment segment, List<EnhancementDto.JobInfo> jobs) {
        return EnhancementDto.SegmentStatus.builder()
                .segmentId(segment.getSegmentId())
                .position(segment.getPosition())
                .enhanceEnabled(segment.getEnhanceEnabled())
                .enhanceModel(segment.getEnhanceModel())
                .enhanceStatus(segment.getEnhanceStatus())
                .enhancedVideoUrl(segment.getEnhancedVideoUrl())
                .enhanceError(segment.getEnhanceError())
                .jobs(jobs)
                .build();
    }
}
