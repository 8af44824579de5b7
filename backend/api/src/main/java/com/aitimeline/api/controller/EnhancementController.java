package com.aitimeline.api.controller;

import com.aitimeline.api.dto.EnhancementDto;
import com.aitimeline.api.entity.EnhancementJob;
import com.aitimeline.api.security.UserPrincipal;
import com.aitimeline.api.service.enhancement.EnhancementJobService;
import com.aitimeline.api.service.model.UpscalerRegistry;
import com.aitimeline.common.dto.ApiResponse;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/enhancement")
@Tag(name = "Enhancement", description = "세그먼트 업스케일 API")
public class EnhancementController {

    private final EnhancementJobService enhancementJobService;
    private final UpscalerRegistry upscalerRegistry;

    // ========== 업스케일러 ==========

    @GetMapping("/upscalers")
    @Operation(summary = "업스케일러 목록")
    public ApiResponse<List<EnhancementDto.UpscalerInfo>> getUpscalers() {
        return ApiResponse.success(upscalerRegistry.getAll().stream()
                .map(EnhancementDto.UpscalerInfo::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/upscalers/{id}")
    @Operation(summary = "업스케일러 조회")
    public ApiResponse<EnhancementDto.UpscalerInfo> getUpscaler(@PathVariable String id) {
        return upscalerRegistry.findById(id)
                .map(model -> ApiResponse.success(EnhancementDto.UpscalerInfo.from(model)))
                .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "Upscaler model not found: " + id));
    }

    @GetMapping("/upscalers/provider/{provider}")
    @Operation(summary = "provider 별 업스케일러 목록")
    public ApiResponse<List<EnhancementDto.UpscalerInfo>> getUpscalersByProvider(@PathVariable String provider) {
        return ApiResponse.success(upscalerRegistry.getByProvider(provider).stream()
                .map(EnhancementDto.UpscalerInfo::from)
                .collect(Collectors.toList()));
    }

    // ========== 세그먼트 ==========

    @PostMapping("/segment/{segmentId}/queue")
    @Operation(summary = "업스케일 작업 등록", description = "세그먼트 영상을 업스케일 큐에 등록합니다.")
    public ApiResponse<EnhancementDto.QueueResponse> queue(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId,
            @RequestBody(required = false) EnhancementDto.QueueRequest request) {
        log.info("[Enhance] Queue - userId: {}, segmentId: {}", user.getUserId(), segmentId);
        EnhancementJob job = enhancementJobService.queue(segmentId, user.getUserId(), request);
        return ApiResponse.success("업스케일 작업이 등록되었습니다.",
                new EnhancementDto.QueueResponse(job.getJobId(), job.getStatus()));
    }

    @PostMapping("/segment/{segmentId}/enable")
    @Operation(summary = "세그먼트 업스케일 켜기")
    public ApiResponse<Void> enable(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId,
            @RequestBody(required = false) EnhancementDto.EnableRequest request) {
        enhancementJobService.enable(segmentId, user.getUserId(), request != null ? request.getModelId() : null);
        return ApiResponse.success("업스케일이 설정되었습니다.", null);
    }

    @PostMapping("/segment/{segmentId}/disable")
    @Operation(summary = "세그먼트 업스케일 끄기")
    public ApiResponse<Void> disable(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId) {
        enhancementJobService.disable(segmentId, user.getUserId());
        return ApiResponse.success("업스케일이 해제되었습니다.", null);
    }

    @GetMapping("/segment/{segmentId}")
    @Operation(summary = "세그먼트 업스케일 상태", description = "projection 과 작업 이력을 조회합니다.")
    public ApiResponse<EnhancementDto.SegmentStatus> getSegmentStatus(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId) {
        return ApiResponse.success(enhancementJobService.getSegmentStatus(segmentId, user.getUserId()));
    }

    // ========== 작업 ==========

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "업스케일 작업 조회")
    public ApiResponse<EnhancementDto.JobInfo> getJob(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long jobId) {
        return ApiResponse.success(EnhancementDto.JobInfo.from(enhancementJobService.getOwnedJob(jobId, user.getUserId())));
    }

    @PostMapping("/jobs/{jobId}/process")
    @Operation(summary = "업스케일 작업 처리", description = "대기 중인 작업을 즉시 처리합니다.")
    public ApiResponse<EnhancementDto.JobInfo> process(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long jobId) {
        log.info("[Enhance] Process - userId: {}, jobId: {}", user.getUserId(), jobId);
        return ApiResponse.success(EnhancementDto.JobInfo.from(enhancementJobService.process(jobId, user.getUserId())));
    }

    @GetMapping("/jobs/pending/{timelineId}")
    @Operation(summary = "대기/처리 중인 작업 목록")
    public ApiResponse<List<EnhancementDto.JobInfo>> getPendingJobs(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId) {
        return ApiResponse.success(enhancementJobService.getPendingJobs(timelineId, user.getUserId()).stream()
                .map(EnhancementDto.JobInfo::from)
                .collect(Collectors.toList()));
    }

    // ========== 타임라인 ==========

    @GetMapping("/timeline/{timelineId}")
    @Operation(summary = "타임라인 업스케일 현황")
    public ApiResponse<EnhancementDto.TimelineStatus> getTimelineStatus(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId) {
        return ApiResponse.success(enhancementJobService.getTimelineStatus(timelineId, user.getUserId()));
    }

    @PostMapping("/timeline/{timelineId}/enable-all")
    @Operation(summary = "타임라인 전체 업스케일 켜기")
    public ApiResponse<Void> enableAll(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId,
            @RequestBody(required = false) EnhancementDto.EnableRequest request) {
        enhancementJobService.enableAll(timelineId, user.getUserId(), request != null ? request.getModelId() : null);
        return ApiResponse.success("전체 세그먼트에 업스케일이 설정되었습니다.", null);
    }

    @PostMapping("/timeline/{timelineId}/enhance-all")
    @Operation(summary = "타임라인 일괄 업스케일", description = "업스케일이 켜진 세그먼트를 모두 큐에 등록합니다.")
    public ApiResponse<EnhancementDto.EnhanceAllResponse> enhanceAll(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId) {
        log.info("[Enhance] Enhance all - userId: {}, timelineId: {}", user.getUserId(), timelineId);
        return ApiResponse.success(enhancementJobService.enhanceTimeline(timelineId, user.getUserId()));
    }
}
