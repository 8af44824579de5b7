package com.aitimeline.api.service.model;

import com.aitimeline.api.entity.VideoModelCapability;
import com.aitimeline.api.mapper.VideoModelMapper;
import com.aitimeline.common.enums.GenerationMode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 영상 생성 모델 기능 조회 (읽기 전용, Caffeine 캐싱)
 * 생성 직전에 모델이 모드/길이를 지원하는지 확인한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelCapabilityRegistry {

    private final VideoModelMapper videoModelMapper;

    @Value("${cache.capabilities.ttl-minutes:10}")
    private long ttlMinutes = 10;

    private Cache<String, VideoModelCapability> capabilityCache;

    @PostConstruct
    public void initCache() {
        this.capabilityCache = Caffeine.newBuilder()
            .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
            .maximumSize(200)
            .build();
        log.info("ModelCapabilityRegistry 캐시 초기화 완료 (TTL: {}분)", ttlMinutes);
    }

    /**
     * 모델 기능 조회 (비활성/미등록 모델은 empty)
     */
    public Optional<VideoModelCapability> find(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return Optional.empty();
        }
        // 미등록 모델은 캐시하지 않는다 (loader 가 null 반환)
        VideoModelCapability capability = capabilityCache.get(modelId,
            id -> videoModelMapper.findCapabilityByModelId(id).orElse(null));
        if (capability == null || Boolean.FALSE.equals(capability.getIsActive())) {
            return Optional.empty();
        }
        return Optional.of(capability);
    }

    /**
     * 모델이 모드/길이를 지원하는지 확인
     * @return 지원하지 않으면 사유, 지원하면 empty
     */
    public Optional<String> checkSupport(String modelId, GenerationMode mode, Integer durationSec) {
        Optional<VideoModelCapability> found = find(modelId);
        if (found.isEmpty()) {
            return Optional.of("Unknown or inactive model: " + modelId);
        }

        VideoModelCapability capability = found.get();
        if (!capability.supports(mode)) {
            return Optional.of(String.format("Model %s does not support %s", modelId, mode.getCode()));
        }
        if (durationSec != null && !capability.acceptsDuration(durationSec)) {
            return Optional.of(String.format("Model %s supports %d-%d seconds, requested %d",
                modelId, capability.getMinDurationSec(), capability.getMaxDurationSec(), durationSec));
        }
        return Optional.empty();
    }

    public void invalidateAll() {
        capabilityCache.invalidateAll();
        log.info("ModelCapabilityRegistry 캐시 초기화");
    }
}
