package com.aitimeline.api.service.provider;

import java.util.Map;

/**
 * 영상 생성 provider
 * 실패 시 ApiException(GENERATION_PROVIDER_FAILED | GENERATION_PROVIDER_UNAVAILABLE)
 */
public interface VideoGenerationProvider {

    /**
     * @param endpoint 모드별 엔드포인트 (예: /video/image-to-video)
     * @param payload  JSON 요청 본문
     * @return 생성된 영상 URL
     */
    String generate(String endpoint, Map<String, Object> payload);
}
