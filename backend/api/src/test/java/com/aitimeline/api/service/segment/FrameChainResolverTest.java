package com.aitimeline.api.service.segment;

import com.aitimeline.api.entity.Segment;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FrameChainResolverTest {

    private final FrameChainResolver resolver = new FrameChainResolver();

    private static Segment segment(long id, int position, String status, String lastFrameUrl) {
        return Segment.builder()
                .segmentId(id)
                .timelineId(1L)
                .position(position)
                .status(status)
                .lastFrameUrl(lastFrameUrl)
                .build();
    }

    @Test
    void firstSegmentHasNoChainInput() {
        List<Segment> ordered = List.of(segment(10, 0, "generated", "https://cdn.example.com/10_last.jpg"));

        assertEquals(Optional.empty(), resolver.chainInput(ordered, 0));
        assertNull(resolver.previousSegmentId(ordered, 0));
    }

    @Test
    void laterSegmentUsesPreviousLastFrame() {
        // Given
        List<Segment> ordered = List.of(
                segment(10, 0, "generated", "https://cdn.example.com/10_last.jpg"),
                segment(11, 1, "pending", null));

        // When
        String input = resolver.requireChainInput(ordered, 1);

        // Then
        assertEquals("https://cdn.example.com/10_last.jpg", input);
        assertEquals(10L, resolver.previousSegmentId(ordered, 1));
    }

    @Test
    void missingPreviousFrameFailsWithChainInputMissing() {
        // Given: 이전 세그먼트가 error 상태
        List<Segment> ordered = List.of(
                segment(10, 0, "error", null),
                segment(11, 1, "pending", null));

        // When
        ApiException e = assertThrows(ApiException.class, () -> resolver.requireChainInput(ordered, 1));

        // Then
        assertEquals(ErrorCode.CHAIN_INPUT_MISSING, e.getErrorCode());
    }

    @Test
    void staleFrameOfRegeneratingPredecessorIsNotUsed() {
        List<Segment> ordered = List.of(
                segment(10, 0, "generating", "https://cdn.example.com/old_last.jpg"),
                segment(11, 1, "pending", null));

        assertTrue(resolver.chainInput(ordered, 1).isEmpty());
    }

    @Test
    void indexOfFindsSegmentById() {
        List<Segment> ordered = List.of(segment(10, 0, "pending", null), segment(11, 1, "pending", null));

        assertEquals(1, resolver.indexOf(ordered, 11L));
        assertEquals(-1, resolver.indexOf(ordered, 99L));
    }
}
