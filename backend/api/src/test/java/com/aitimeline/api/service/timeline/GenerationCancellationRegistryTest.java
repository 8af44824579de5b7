package com.aitimeline.api.service.timeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GenerationCancellationRegistryTest {

    private final GenerationCancellationRegistry registry = new GenerationCancellationRegistry();

    @Test
    void cancelWithoutRunningGenerationReturnsFalse() {
        assertFalse(registry.cancel(1L));
    }

    @Test
    void cancelFlagsRegisteredToken() {
        GenerationCancellationRegistry.CancellationToken token = registry.register(1L);

        assertTrue(registry.cancel(1L));
        assertTrue(token.isCancelled());
    }

    @Test
    void releaseOnlyRemovesOwnToken() {
        // Given: 이전 실행의 토큰이 늦게 release 되는 경우
        GenerationCancellationRegistry.CancellationToken stale = registry.register(1L);
        GenerationCancellationRegistry.CancellationToken current = registry.register(1L);

        // When
        registry.release(1L, stale);

        // Then
        assertTrue(registry.isRunning(1L));
        registry.release(1L, current);
        assertFalse(registry.isRunning(1L));
    }
}
