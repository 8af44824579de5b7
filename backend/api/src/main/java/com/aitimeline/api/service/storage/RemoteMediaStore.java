package com.aitimeline.api.service.storage;

import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 외부 provider 결과물을 내려받아 저장소로 옮긴다.
 * provider 가 돌려주는 URL 은 일정 시간 후 만료된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteMediaStore {

    private final RestTemplate restTemplate;
    private final StorageService storageService;

    /**
     * @return 저장소 공개 URL
     */
    public String copyToStorage(String sourceUrl, String key, String contentType) {
        log.info("[Storage] Downloading {} -> {}", sourceUrl, key);
        try {
            ResponseEntity<byte[]> response = restTemplate.exchange(
                    sourceUrl, HttpMethod.GET, new HttpEntity<>(new HttpHeaders()), byte[].class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ApiException(ErrorCode.STORAGE_FAILED, "결과물 다운로드 실패: " + response.getStatusCode());
            }

            String storedKey = storageService.upload(key, response.getBody(), contentType);
            log.info("[Storage] Stored {} ({} bytes)", storedKey, response.getBody().length);
            return storageService.getPublicUrl(storedKey);
        } catch (RestClientException e) {
            throw new ApiException(ErrorCode.STORAGE_FAILED, "결과물 다운로드 실패: " + e.getMessage(), e);
        }
    }
}
