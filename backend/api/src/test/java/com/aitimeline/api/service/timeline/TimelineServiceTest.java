package com.aitimeline.api.service.timeline;

import com.aitimeline.api.entity.Timeline;
import com.aitimeline.api.mapper.EnhancementJobMapper;
import com.aitimeline.api.mapper.SegmentMapper;
import com.aitimeline.api.mapper.TimelineMapper;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimelineServiceTest {

    @Mock
    private TimelineMapper timelineMapper;
    @Mock
    private SegmentMapper segmentMapper;
    @Mock
    private EnhancementJobMapper enhancementJobMapper;

    private GenerationCancellationRegistry cancellationRegistry;
    private TimelineService service;

    @BeforeEach
    void setUp() {
        cancellationRegistry = new GenerationCancellationRegistry();
        service = new TimelineService(timelineMapper, segmentMapper, enhancementJobMapper, cancellationRegistry);
    }

    private static Timeline timeline(Long userId) {
        return Timeline.builder().timelineId(1L).userId(userId).name("demo").status("draft").build();
    }

    @Test
    void timelineOfAnotherUserLooksMissing() {
        when(timelineMapper.findById(1L)).thenReturn(Optional.of(timeline(7L)));

        ApiException e = assertThrows(ApiException.class, () -> service.getOwnedTimeline(1L, 8L));

        assertEquals(ErrorCode.TIMELINE_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void createRequiresName() {
        ApiException e = assertThrows(ApiException.class, () -> service.create(7L, "  ", null));

        assertEquals(ErrorCode.INVALID_REQUEST, e.getErrorCode());
        verifyNoInteractions(timelineMapper);
    }

    @Test
    void deleteCancelsRunningGenerationAndRemovesChildren() {
        // Given
        when(timelineMapper.findById(1L)).thenReturn(Optional.of(timeline(7L)));
        GenerationCancellationRegistry.CancellationToken token = cancellationRegistry.register(1L);

        // When
        service.delete(1L, 7L);

        // Then
        assertTrue(token.isCancelled());
        InOrder inOrder = inOrder(enhancementJobMapper, segmentMapper, timelineMapper);
        inOrder.verify(enhancementJobMapper).deleteByTimelineId(1L);
        inOrder.verify(segmentMapper).deleteByTimelineId(1L);
        inOrder.verify(timelineMapper).delete(1L);
    }

    @Test
    void markGeneratingRejectsSecondRun() {
        when(timelineMapper.markGenerating(1L)).thenReturn(0);

        ApiException e = assertThrows(ApiException.class, () -> service.markGenerating(1L));

        assertEquals(ErrorCode.TIMELINE_GENERATION_IN_PROGRESS, e.getErrorCode());
    }
}
