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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimelineGenerationOrchestratorTest {

    private static final Long USER_ID = 7L;
    private static final Long TIMELINE_ID = 1L;

    @Mock
    private TimelineService timelineService;
    @Mock
    private SegmentMapper segmentMapper;
    @Mock
    private SegmentGenerationService segmentGenerationService;

    private GenerationCancellationRegistry cancellationRegistry;
    private TimelineGenerationOrchestrator orchestrator;
    private final List<SegmentGenerationRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        cancellationRegistry = new GenerationCancellationRegistry();
        orchestrator = new TimelineGenerationOrchestrator(timelineService, segmentMapper,
                segmentGenerationService, cancellationRegistry);
    }

    private static Segment segment(long id, int position) {
        return Segment.builder()
                .segmentId(id)
                .timelineId(TIMELINE_ID)
                .position(position)
                .modelId("kling-2.5-pro")
                .durationSec(5)
                .generationMode("image-to-video")
                .promptText("scene " + position)
                .sourceUrl(position == 0 ? "https://cdn.example.com/source.jpg" : null)
                .status("pending")
                .version(0)
                .build();
    }

    private static SegmentGenerationResult success(SegmentGenerationRequest request) {
        return SegmentGenerationResult.builder()
                .segmentId(request.getSegmentId())
                .position(request.getPosition())
                .generationMode(request.getMode().getCode())
                .success(true)
                .videoUrl("https://provider.example.com/" + request.getSegmentId() + ".mp4")
                .lastFrameUrl("https://cdn.example.com/" + request.getSegmentId() + "_last.jpg")
                .frameChained(request.isFrameChained())
                .build();
    }

    private static SegmentGenerationResult failure(SegmentGenerationRequest request) {
        return SegmentGenerationResult.builder()
                .segmentId(request.getSegmentId())
                .position(request.getPosition())
                .success(false)
                .videoUrl("")
                .lastFrameUrl("")
                .error("provider timeout")
                .build();
    }

    private void givenThreeSegments() {
        when(segmentMapper.findByTimelineIdOrderByPosition(TIMELINE_ID))
                .thenReturn(List.of(segment(10, 0), segment(11, 1), segment(12, 2)));
    }

    private static SegmentDto.GenerateTimelineRequest request(String firstMode) {
        return new SegmentDto.GenerateTimelineRequest(TIMELINE_ID, firstMode, null);
    }

    @Test
    void chainsLastFrameIntoNextSegment() {
        // Given
        givenThreeSegments();
        when(segmentGenerationService.generate(any())).thenAnswer(invocation -> {
            SegmentGenerationRequest request = invocation.getArgument(0);
            requests.add(request);
            return success(request);
        });

        // When
        SegmentDto.TimelineGenerationResponse response = orchestrator.generateTimeline(USER_ID, request("text-to-video"));

        // Then
        assertEquals(3, response.getSegmentsGenerated());
        assertFalse(response.isStoppedEarly());
        assertFalse(response.isCancelled());
        assertEquals("text-to-video", response.getFrameChaining().getFirstSegmentMode());

        assertEquals(GenerationMode.TEXT_TO_VIDEO, requests.get(0).getMode());
        assertTrue(requests.get(0).isFirstSegment());
        assertEquals("https://cdn.example.com/source.jpg", requests.get(0).getSourceUrl());

        assertEquals(GenerationMode.IMAGE_TO_VIDEO, requests.get(1).getMode());
        assertEquals("https://cdn.example.com/10_last.jpg", requests.get(1).getPreviousLastFrameUrl());
        assertNull(requests.get(1).getSourceUrl());
        assertEquals(GenerationMode.IMAGE_TO_VIDEO, requests.get(2).getMode());
        assertEquals("https://cdn.example.com/11_last.jpg", requests.get(2).getPreviousLastFrameUrl());

        verify(timelineService).markGenerating(TIMELINE_ID);
        verify(timelineService).markReady(TIMELINE_ID);
        assertFalse(cancellationRegistry.isRunning(TIMELINE_ID));
    }

    @Test
    void stopsAtFirstFailure() {
        // Given
        givenThreeSegments();
        when(segmentGenerationService.generate(any())).thenAnswer(invocation -> {
            SegmentGenerationRequest request = invocation.getArgument(0);
            return request.getPosition() == 1 ? failure(request) : success(request);
        });

        // When
        SegmentDto.TimelineGenerationResponse response = orchestrator.generateTimeline(USER_ID, request(null));

        // Then
        assertEquals(2, response.getResults().size());
        assertEquals(1, response.getSegmentsGenerated());
        assertTrue(response.isStoppedEarly());
        assertFalse(response.getResults().get(1).isSuccess());
        verify(segmentGenerationService, times(2)).generate(any());
        verify(timelineService).markReady(TIMELINE_ID);
    }

    @Test
    void cancellationStopsBeforeNextSegment() {
        // Given
        givenThreeSegments();
        when(segmentGenerationService.generate(any())).thenAnswer(invocation -> {
            SegmentGenerationRequest request = invocation.getArgument(0);
            cancellationRegistry.cancel(TIMELINE_ID);
            return success(request);
        });

        // When
        SegmentDto.TimelineGenerationResponse response = orchestrator.generateTimeline(USER_ID, request(null));

        // Then
        assertTrue(response.isCancelled());
        assertEquals(1, response.getResults().size());
        assertTrue(response.getResults().get(0).isSuccess());
        verify(segmentGenerationService, times(1)).generate(any());
    }

    @Test
    void concurrentRunIsRejected() {
        // Given
        givenThreeSegments();
        doThrow(new ApiException(ErrorCode.TIMELINE_GENERATION_IN_PROGRESS))
                .when(timelineService).markGenerating(TIMELINE_ID);

        // When
        ApiException e = assertThrows(ApiException.class,
                () -> orchestrator.generateTimeline(USER_ID, request(null)));

        // Then
        assertEquals(ErrorCode.TIMELINE_GENERATION_IN_PROGRESS, e.getErrorCode());
        verifyNoInteractions(segmentGenerationService);
        verify(timelineService, never()).markReady(any());
    }

    @Test
    void emptyTimelineIsRejected() {
        when(segmentMapper.findByTimelineIdOrderByPosition(TIMELINE_ID)).thenReturn(List.of());

        ApiException e = assertThrows(ApiException.class,
                () -> orchestrator.generateTimeline(USER_ID, request(null)));

        assertEquals(ErrorCode.NO_SEGMENTS, e.getErrorCode());
    }

    @Test
    void unknownFirstSegmentModeIsRejected() {
        givenThreeSegments();

        ApiException e = assertThrows(ApiException.class,
                () -> orchestrator.generateTimeline(USER_ID, request("audio-to-video")));

        assertEquals(ErrorCode.INVALID_GENERATION_MODE, e.getErrorCode());
        verify(timelineService, never()).markGenerating(any());
    }

    @Test
    void segmentLeaseConflictStopsChainAsFailure() {
        // Given
        givenThreeSegments();
        when(segmentGenerationService.generate(any()))
                .thenThrow(new ApiException(ErrorCode.SEGMENT_GENERATION_IN_PROGRESS));

        // When
        SegmentDto.TimelineGenerationResponse response = orchestrator.generateTimeline(USER_ID, request(null));

        // Then
        assertTrue(response.isStoppedEarly());
        assertEquals(1, response.getResults().size());
        assertEquals(ErrorCode.SEGMENT_GENERATION_IN_PROGRESS.getMessage(), response.getResults().get(0).getError());
        verify(timelineService).markReady(TIMELINE_ID);
    }
}
