package com.aitimeline.api.service.enhancement;

import com.aitimeline.api.entity.EnhancementJob;
import com.aitimeline.api.mapper.EnhancementJobMapper;
import com.aitimeline.api.mapper.SegmentMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnhancementJobTransitionsTest {

    private static final Long SEGMENT_ID = 11L;

    @Mock
    private EnhancementJobMapper jobMapper;
    @Mock
    private SegmentMapper segmentMapper;

    private EnhancementJobTransitions transitions;

    @BeforeEach
    void setUp() {
        transitions = new EnhancementJobTransitions(jobMapper, segmentMapper);
    }

    private static EnhancementJob job(long jobId) {
        return EnhancementJob.builder()
                .jobId(jobId)
                .segmentId(SEGMENT_ID)
                .timelineId(1L)
                .modelId("real-esrgan")
                .scaleFactor(2)
                .status("processing")
                .build();
    }

    @Test
    void queueProjectsQueuedStateForTheNewJob() {
        // Given
        EnhancementJob job = EnhancementJob.builder().segmentId(SEGMENT_ID).modelId("real-esrgan").scaleFactor(2).build();
        doAnswer(invocation -> {
            invocation.<EnhancementJob>getArgument(0).setJobId(5L);
            return null;
        }).when(jobMapper).insert(job);
        when(segmentMapper.updateEnhanceProjection(SEGMENT_ID, 5L, "real-esrgan", "queued", null, null)).thenReturn(1);

        // When
        EnhancementJob queued = transitions.queue(job);

        // Then
        assertEquals("queued", queued.getStatus());
        assertEquals(0, queued.getProgress());
        verify(segmentMapper).updateEnhanceProjection(SEGMENT_ID, 5L, "real-esrgan", "queued", null, null);
    }

    @Test
    void doneProjectionCarriesTheJobIdSoANewerJobKeepsTheSegment() {
        // Given
        EnhancementJob stale = job(4L);
        when(jobMapper.markDone(4L, "https://cdn.example.com/old.mp4", 3.0)).thenReturn(1);
        when(segmentMapper.updateEnhanceProjection(SEGMENT_ID, 4L, "real-esrgan", "done",
                "https://cdn.example.com/old.mp4", null)).thenReturn(0);

        // When
        boolean marked = transitions.markDone(stale, "https://cdn.example.com/old.mp4", 3.0);

        // Then
        assertTrue(marked);
        verify(segmentMapper).updateEnhanceProjection(SEGMENT_ID, 4L, "real-esrgan", "done",
                "https://cdn.example.com/old.mp4", null);
        verifyNoMoreInteractions(segmentMapper);
    }

    @Test
    void failedProjectionCarriesTheJobId() {
        // Given
        when(jobMapper.markFailed(4L, "timeout", 1.5)).thenReturn(1);
        when(segmentMapper.updateEnhanceProjection(SEGMENT_ID, 4L, "real-esrgan", "failed", null, "timeout"))
                .thenReturn(1);

        // When
        boolean marked = transitions.markFailed(job(4L), "timeout", 1.5);

        // Then
        assertTrue(marked);
    }

    @Test
    void doneAfterTerminalStateLeavesProjectionUntouched() {
        // Given
        when(jobMapper.markDone(4L, "https://cdn.example.com/late.mp4", 9.0)).thenReturn(0);

        // When
        boolean marked = transitions.markDone(job(4L), "https://cdn.example.com/late.mp4", 9.0);

        // Then
        assertFalse(marked);
        verify(segmentMapper, never()).updateEnhanceProjection(anyLong(), anyLong(), any(), any(), any(), any());
    }

    @Test
    void processingIsSkippedWhenJobIsNoLongerQueued() {
        // Given
        when(jobMapper.markProcessing(4L)).thenReturn(0);

        // When
        boolean marked = transitions.markProcessing(job(4L));

        // Then
        assertFalse(marked);
        verifyNoInteractions(segmentMapper);
    }
}
