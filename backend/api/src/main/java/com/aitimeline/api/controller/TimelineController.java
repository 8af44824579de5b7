package com.aitimeline.api.controller;

import com.aitimeline.api.dto.TimelineDto;
import com.aitimeline.api.security.UserPrincipal;
import com.aitimeline.api.service.timeline.TimelineService;
import com.aitimeline.common.dto.ApiResponse;
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
@RequestMapping("/api/timelines")
@Tag(name = "Timeline", description = "타임라인 API")
public class TimelineController {

    private final TimelineService timelineService;

    @PostMapping
    @Operation(summary = "타임라인 생성")
    public ApiResponse<TimelineDto.TimelineInfo> create(
            @AuthenticationPrincipal UserPrincipal user,
            @RequestBody TimelineDto.CreateRequest request) {
        log.info("[Timeline] Create - userId: {}", user.getUserId());
        return ApiResponse.success("타임라인이 생성되었습니다.",
                TimelineDto.TimelineInfo.from(timelineService.create(user.getUserId(), request.getName(), request.getDescription())));
    }

    @GetMapping
    @Operation(summary = "내 타임라인 목록")
    public ApiResponse<List<TimelineDto.TimelineInfo>> getTimelines(@AuthenticationPrincipal UserPrincipal user) {
        return ApiResponse.success(timelineService.getTimelines(user.getUserId()).stream()
                .map(TimelineDto.TimelineInfo::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{timelineId}")
    @Operation(summary = "타임라인 조회")
    public ApiResponse<TimelineDto.TimelineInfo> getTimeline(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId) {
        return ApiResponse.success(TimelineDto.TimelineInfo.from(timelineService.getOwnedTimeline(timelineId, user.getUserId())));
    }

    @DeleteMapping("/{timelineId}")
    @Operation(summary = "타임라인 삭제", description = "진행 중인 생성을 취소하고 세그먼트/업스케일 작업을 함께 삭제합니다.")
    public ApiResponse<Void> delete(
            @AuthenticationPrincipal UserPrincipal user,
            @PathVariable Long timelineId) {
        log.info("[Timeline] Delete - userId: {}, timelineId: {}", user.getUserId(), timelineId);
        timelineService.delete(timelineId, user.getUserId());
        return ApiResponse.success("타임라인이 삭제되었습니다.", null);
    }
}
