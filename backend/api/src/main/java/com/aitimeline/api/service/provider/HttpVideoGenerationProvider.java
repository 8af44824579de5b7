package com.aitimeline.api.service.provider;

import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * HTTP 영상 생성 provider
 * POST {base-url}{endpoint}, Bearer 인증, 응답 {"video_url": "..."}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpVideoGenerationProvider implements VideoGenerationProvider {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${generation.provider.base-url}")
    private String baseUrl;

    @Value("${generation.provider.api-key:}")
    private String apiKey;

    @Override
    public String generate(String endpoint, Map<String, Object> payload) {
        String url = baseUrl + endpoint;
        log.info("[Provider] POST {}", url);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        try {
            String requestJson = objectMapper.writeValueAsString(payload);
            log.debug("[Provider] request: {}", requestJson.substring(0, Math.min(800, requestJson.length())));

            ResponseEntity<String> response = restTemplate.exchange(
                    url,
                    HttpMethod.POST,
                    new HttpEntity<>(requestJson, headers),
                    String.class
            );

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ApiException(ErrorCode.GENERATION_PROVIDER_FAILED,
                        "Provider 응답 오류: " + response.getStatusCode());
            }

            JsonNode body = objectMapper.readTree(response.getBody());
            String videoUrl = body.path("video_url").asText(null);
            if (videoUrl == null || videoUrl.isBlank()) {
                throw new ApiException(ErrorCode.GENERATION_PROVIDER_FAILED,
                        "Provider 응답에 video_url 이 없습니다");
            }

            log.info("[Provider] video generated: {}", videoUrl);
            return videoUrl;

        } catch (ApiException e) {
            throw e;
        } catch (HttpClientErrorException e) {
            log.error("[Provider] HTTP 클라이언트 에러 - status: {}, body: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ApiException(ErrorCode.GENERATION_PROVIDER_FAILED,
                    "Provider 요청 실패: " + e.getStatusCode());
        } catch (HttpServerErrorException e) {
            log.error("[Provider] HTTP 서버 에러 - status: {}", e.getStatusCode());
            throw new ApiException(ErrorCode.GENERATION_PROVIDER_UNAVAILABLE,
                    "Provider 서버 오류: " + e.getStatusCode());
        } catch (ResourceAccessException e) {
            log.error("[Provider] 네트워크 에러: {}", e.getMessage());
            throw new ApiException(ErrorCode.GENERATION_PROVIDER_UNAVAILABLE,
                    "Provider 서버 연결 실패");
        } catch (Exception e) {
            log.error("[Provider] 예상치 못한 에러: {}", e.getMessage(), e);
            throw new ApiException(ErrorCode.GENERATION_PROVIDER_FAILED,
                    "Provider 호출 실패: " + e.getMessage(), e);
        }
    }
}
