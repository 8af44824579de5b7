package com.aitimeline.api.service.model;

import com.aitimeline.api.entity.UpscalerModel;
import com.aitimeline.api.mapper.UpscalerModelMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 업스케일러 모델 레지스트리 (활성 목록 1건을 통째로 캐싱)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpscalerRegistry {

    private static final String LIST_KEY = "upscalers:list";

    private final UpscalerModelMapper upscalerModelMapper;

    @Value("${cache.upscalers.ttl-minutes:60}")
    private long ttlMinutes = 60;

    private Cache<String, List<UpscalerModel>> upscalerCache;

    @PostConstruct
    public void initCache() {
        this.upscalerCache = Caffeine.newBuilder()
            .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
            .maximumSize(1)
            .build();
        log.info("UpscalerRegistry 캐시 초기화 완료 (TTL: {}분)", ttlMinutes);
    }

    public List<UpscalerModel> getAll() {
        return upscalerCache.get(LIST_KEY, key -> List.copyOf(upscalerModelMapper.findAllActive()));
    }

    public Optional<UpscalerModel> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return getAll().stream()
            .filter(model -> model.getId().equals(id))
            .findFirst();
    }

    public List<UpscalerModel> getByProvider(String provider) {
        return getAll().stream()
            .filter(model -> model.getProvider().equalsIgnoreCase(provider))
            .collect(Collectors.toList());
    }
}
