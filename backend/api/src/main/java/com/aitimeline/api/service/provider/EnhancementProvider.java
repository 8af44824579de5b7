package com.aitimeline.api.service.provider;

import com.aitimeline.api.entity.UpscalerModel;

import java.util.function.IntConsumer;

/**
 * 업스케일 provider
 * upscaler_models.provider 값으로 구현체를 고른다.
 */
public interface EnhancementProvider {

    boolean supports(String provider);

    /**
     * @param progressListener 0-100 진행률 콜백
     * @return provider 가 돌려준 결과 영상 URL
     */
    String enhance(EnhancementTask task, IntConsumer progressListener);

    record EnhancementTask(String inputUrl,
                           UpscalerModel model,
                           int scaleFactor,
                           String targetResolution,
                           boolean preserveAudio) {
    }
}
