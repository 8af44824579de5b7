package com.aitimeline.api.service.enhancement;

import com.aitimeline.api.entity.EnhancementJob;
import com.aitimeline.api.entity.UpscalerModel;
import com.aitimeline.api.mapper.EnhancementJobMapper;
import com.aitimeline.api.service.model.UpscalerRegistry;
import com.aitimeline.api.service.provider.EnhancementProvider;
import com.aitimeline.api.service.storage.RemoteMediaStore;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnhancementJobProcessorTest {

    @Mock
    private EnhancementJobMapper jobMapper;
    @Mock
    private EnhancementJobTransitions transitions;
    @Mock
    private UpscalerRegistry upscalerRegistry;
    @Mock
    private EnhancementProvider replicateProvider;
    @Mock
    private RemoteMediaStore remoteMediaStore;

    private EnhancementJobProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new EnhancementJobProcessor(jobMapper, transitions, upscalerRegistry,
                List.of(replicateProvider), remoteMediaStore);
    }

    private static EnhancementJob job(String status, String modelId) {
        return EnhancementJob.builder()
                .jobId(100L)
                .segmentId(11L)
                .timelineId(1L)
                .userId(7L)
                .modelId(modelId)
                .inputUrl("https://provider.example.com/11.mp4")
                .scaleFactor(2)
                .preserveAudio(true)
                .status(status)
                .build();
    }

    private static UpscalerModel model(String id, String provider) {
        return UpscalerModel.builder().id(id).provider(provider).displayName(id).scaleFactors(List.of(2, 4)).build();
    }

    @Test
    void successfulJobIsStoredAndMarkedDone() {
        // Given
        EnhancementJob queued = job("queued", "replicate-esrgan");
        when(jobMapper.findById(100L)).thenReturn(Optional.of(queued), Optional.of(job("done", "replicate-esrgan")));
        when(transitions.markProcessing(queued)).thenReturn(true);
        when(upscalerRegistry.findById("replicate-esrgan")).thenReturn(Optional.of(model("replicate-esrgan", "replicate")));
        when(replicateProvider.supports("replicate")).thenReturn(true);
        when(replicateProvider.enhance(any(), any())).thenReturn("https://replicate.delivery/out.mp4");
        when(remoteMediaStore.copyToStorage("https://replicate.delivery/out.mp4", "segments/enhanced/1/11.mp4", "video/mp4"))
                .thenReturn("https://cdn.example.com/segments/enhanced/1/11.mp4");

        // When
        EnhancementJob result = processor.process(100L);

        // Then
        assertEquals("done", result.getStatus());
        verify(transitions).markDone(eq(queued), eq("https://cdn.example.com/segments/enhanced/1/11.mp4"), anyDouble());
        verify(transitions, never()).markFailed(any(), any(), anyDouble());
    }

    @Test
    void providerFailureMarksJobFailed() {
        // Given
        EnhancementJob queued = job("queued", "replicate-esrgan");
        when(jobMapper.findById(100L)).thenReturn(Optional.of(queued));
        when(transitions.markProcessing(queued)).thenReturn(true);
        when(upscalerRegistry.findById("replicate-esrgan")).thenReturn(Optional.of(model("replicate-esrgan", "replicate")));
        when(replicateProvider.supports("replicate")).thenReturn(true);
        when(replicateProvider.enhance(any(), any()))
                .thenThrow(new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, "Replicate prediction failed: CUDA out of memory"));

        // When
        processor.process(100L);

        // Then
        verify(transitions).markFailed(eq(queued), eq("Replicate prediction failed: CUDA out of memory"), anyDouble());
        verify(transitions, never()).markDone(any(), any(), anyDouble());
        verifyNoInteractions(remoteMediaStore);
    }

    @Test
    void missingProviderMarksJobFailed() {
        // Given
        EnhancementJob queued = job("queued", "topaz-video");
        when(jobMapper.findById(100L)).thenReturn(Optional.of(queued));
        when(transitions.markProcessing(queued)).thenReturn(true);
        when(upscalerRegistry.findById("topaz-video")).thenReturn(Optional.of(model("topaz-video", "topaz")));

        // When
        processor.process(100L);

        // Then
        verify(transitions).markFailed(eq(queued), eq("No enhancement provider for: topaz"), anyDouble());
    }

    @Test
    void jobAlreadyProcessingIsRejected() {
        EnhancementJob processing = job("processing", "replicate-esrgan");
        when(jobMapper.findById(100L)).thenReturn(Optional.of(processing));
        when(transitions.markProcessing(processing)).thenReturn(false);

        ApiException e = assertThrows(ApiException.class, () -> processor.process(100L));

        assertEquals(ErrorCode.ENHANCEMENT_JOB_NOT_QUEUED, e.getErrorCode());
        verifyNoInteractions(replicateProvider);
    }

    @Test
    void terminalJobIsReturnedUnchanged() {
        when(jobMapper.findById(100L)).thenReturn(Optional.of(job("done", "replicate-esrgan")));

        EnhancementJob result = processor.process(100L);

        assertEquals("done", result.getStatus());
        verifyNoInteractions(transitions);
    }
}
