package com.aitimeline.api.controller;

import com.aitimeline.api.dto.SegmentDto;
import com.aitimeline.api.security.UserPrincipal;
import com.aitimeline.api.service.segment.ModeValidationResult;
import com.aitimeline.api.service.segment.SegmentGenerationResult;
import com.aitimeline.api.service.segment.SegmentGenerationService;
import com.aitimeline.api.service.segment.SegmentService;
import com.aitimeline.api.service.timeline.TimelineGenerationOrchestrator;
import com.aitimeline.common.dto.ApiResponse;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/segments")
@Tag(name = "Segment", description = "세그먼트 생성/프레임 체이닝 API")
public class SegmentController {

    private final SegmentService segmentService;
    private final SegmentGenerationService segmentGenerationService;
    private final TimelineGenerationOrchestrator orchestrator;

    // ========== 모드 ==========

    @GetMapping("/modes")
    @Operation(summary = "생성 모드 목록", description = "모든 생성 모드와 사용 가능한 위치를 조회합니다.")
    public ApiResponse<List<SegmentDto.ModeInfo>> getModes() {
        return ApiResponse.success(segmentService.getModes());
    }

    @GetMapping("/modes/{position}")
    @Operation(summary = "위치별 생성 모드", description = "해당 position 에서 사용할 수 있는 모드를 조회합니다.")
    public ApiResponse<SegmentDto.PositionModes> getPositionModes(@PathVariable int position) {
        return ApiResponse.success(segmentService.getPositionModes(position));
    }

    @PostMapping("/validate")
    @Operation(summary = "생성 모드 검증", description = "position 과 모드 조합이 유효한지 확인합니다.")
    public ApiResponse<ModeValidationResult> validate(@RequestBody SegmentDto.ValidateRequest request) {
        return ApiResponse.success(segmentService.validateMode(request));
    }

    // ========== 세그먼트 ==========

    @GetMapping("/{timelineId}")
    @Operation(summary = "타임라인 세그먼트 목록", description = "position 순으로 모드/체이닝 정보를 포함해 조회합니다.")
    public ApiResponse<SegmentDto.TimelineSegments> getTimelineSegments(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId) {
        return ApiResponse.success(segmentService.getTimelineSegments(timelineId, user.getUserId()));
    }

    @PostMapping("/create")
    @Operation(summary = "세그먼트 추가", description = "타임라인 끝에 세그먼트를 추가합니다.")
    public ApiResponse<SegmentDto.CreateResponse> create(
            @AuthenticationPrincipal UserPrincipal user,
            @RequestBody SegmentDto.CreateRequest request) {
        log.info("[Segment] Create - userId: {}, timelineId: {}, position: {}",
                user.getUserId(), request.getTimelineId(), request.getPosition());
        return ApiResponse.success("세그먼트가 추가되었습니다.", segmentService.create(user.getUserId(), request));
    }

    @PostMapping("/{segmentId}/generate")
    @Operation(summary = "세그먼트 생성", description = "세그먼트 1건을 (재)생성합니다. 이후 세그먼트는 이전 세그먼트의 마지막 프레임을 사용합니다.")
    public ResponseEntity<ApiResponse<SegmentGenerationResult>> generate(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId,
            @RequestBody(required = false) SegmentDto.GenerateRequest request) {
        log.info("[Segment] Generate - userId: {}, segmentId: {}", user.getUserId(), segmentId);
        SegmentGenerationResult result = segmentGenerationService.regenerate(segmentId, user.getUserId(), request);

        if (!result.isSuccess()) {
            ErrorCode errorCode = ErrorCode.SEGMENT_GENERATION_FAILED;
            return ResponseEntity.status(errorCode.getStatus())
                    .body(ApiResponse.error(errorCode, result.getError(), result));
        }
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @PostMapping("/{segmentId}/update-mode")
    @Operation(summary = "생성 모드 변경", description = "세그먼트의 생성 모드와 입력 소스를 변경합니다.")
    public ApiResponse<SegmentDto.SegmentInfo> updateMode(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId,
            @RequestBody SegmentDto.UpdateModeRequest request) {
        if (request.getGenerationMode() == null) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "generationMode 는 필수입니다");
        }
        return ApiResponse.success(segmentService.updateMode(segmentId, user.getUserId(), request));
    }

    @PatchMapping("/{segmentId}")
    @Operation(summary = "세그먼트 수정", description = "프롬프트/대사/모션/카메라/전환/길이를 수정합니다.")
    public ApiResponse<SegmentDto.SegmentInfo> update(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId,
            @RequestBody SegmentDto.UpdateRequest request) {
        return ApiResponse.success(segmentService.update(segmentId, user.getUserId(), request));
    }

    @DeleteMapping("/{segmentId}")
    @Operation(summary = "세그먼트 삭제", description = "세그먼트를 삭제하고 뒤 세그먼트의 position 을 당깁니다.")
    public ApiResponse<Void> delete(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long segmentId) {
        log.info("[Segment] Delete - userId: {}, segmentId: {}", user.getUserId(), segmentId);
        segmentService.delete(segmentId, user.getUserId());
        return ApiResponse.success("세그먼트가 삭제되었습니다.", null);
    }

    // ========== 타임라인 생성 ==========

    @PostMapping("/generate-timeline")
    @Operation(summary = "타임라인 전체 생성", description = "프레임 체이닝으로 모든 세그먼트를 순서대로 생성합니다. 실패 시 즉시 중단합니다.")
    public ApiResponse<SegmentDto.TimelineGenerationResponse> generateTimeline(
            @AuthenticationPrincipal UserPrincipal user,
            @RequestBody SegmentDto.GenerateTimelineRequest request) {
        log.info("[Segment] Generate timeline - userId: {}, timelineId: {}", user.getUserId(), request.getTimelineId());
        return ApiResponse.success(orchestrator.generateTimeline(user.getUserId(), request));
    }

    @PostMapping("/generate-timeline/{timelineId}/cancel")
    @Operation(summary = "타임라인 생성 취소", description = "진행 중인 세그먼트가 끝난 뒤 생성을 멈춥니다.")
    public ApiResponse<SegmentDto.CancelResponse> cancel(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId) {
        boolean cancelled = orchestrator.cancel(timelineId, user.getUserId());
        log.info("[Segment] Cancel timeline - timelineId: {}, running: {}", timelineId, cancelled);
        return ApiResponse.success(new SegmentDto.CancelResponse(timelineId, cancelled));
    }
}
