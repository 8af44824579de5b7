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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntConsumer;

/**
 * Replicate 업스케일 provider
 * prediction 생성 후 urls.get 을 폴링한다 (succeeded | failed | canceled).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplicateEnhancementProvider implements EnhancementProvider {

    private static final String PROVIDER = "replicate";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${enhancement.replicate.api-url:https://api.replicate.com/v1/predictions}")
    private String apiUrl;

    @Value("${enhancement.replicate.api-token:}")
    private String apiToken;

    @Value("${enhancement.replicate.poll-interval-ms:5000}")
    private long pollIntervalMs;

    @Value("${enhancement.replicate.max-poll-attempts:120}")
    private int maxPollAttempts;

    @Override
    public boolean supports(String provider) {
        return PROVIDER.equalsIgnoreCase(provider);
    }

    @Override
    public String enhance(EnhancementTask task, IntConsumer progressListener) {
        String version = task.model().getProviderVersion();
        if (version == null || version.isBlank()) {
            throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                    "Replicate version 이 설정되지 않은 업스케일러입니다: " + task.model().getId());
        }

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("video", task.inputUrl());
        input.put("scale", task.scaleFactor());

        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("version", version);
        requestBody.put("input", input);

        try {
            String requestJson = objectMapper.writeValueAsString(requestBody);
            ResponseEntity<String> response = restTemplate.exchange(
                    apiUrl,
                    HttpMethod.POST,
                    new HttpEntity<>(requestJson, headers()),
                    String.class
            );

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                        "Replicate 응답 오류: " + response.getStatusCode());
            }

            JsonNode prediction = objectMapper.readTree(response.getBody());
            log.info("[Replicate] prediction created: {} (model: {}, scale: {}x)",
                    prediction.path("id").asText(), task.model().getId(), task.scaleFactor());
            return pollPrediction(prediction, progressListener);

        } catch (ApiException e) {
            throw e;
        } catch (HttpClientErrorException e) {
            log.error("[Replicate] HTTP 클라이언트 에러 - status: {}, body: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                    "Replicate 요청 실패: " + e.getStatusCode());
        } catch (HttpServerErrorException e) {
            log.error("[Replicate] HTTP 서버 에러 - status: {}", e.getStatusCode());
            throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                    "Replicate 서버 오류: " + e.getStatusCode());
        } catch (ResourceAccessException e) {
            log.error("[Replicate] 네트워크 에러: {}", e.getMessage());
            throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, "Replicate 서버 연결 실패");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, "Replicate 폴링이 중단되었습니다");
        } catch (Exception e) {
            log.error("[Replicate] 예상치 못한 에러: {}", e.getMessage(), e);
            throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                    "Replicate 호출 실패: " + e.getMessage(), e);
        }
    }

    private String pollPrediction(JsonNode prediction, IntConsumer progressListener) throws Exception {
        JsonNode current = prediction;
        String pollUrl = prediction.path("urls").path("get").asText(null);

        for (int attempt = 1; attempt <= maxPollAttempts; attempt++) {
            String status = current.path("status").asText("");
            switch (status) {
                case "succeeded":
                    progressListener.accept(100);
                    return extractOutput(current);
                case "failed":
                case "canceled":
                    throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                            "Replicate prediction " + status + ": " + current.path("error").asText("unknown error"));
                default:
                    break;
            }

            if (pollUrl == null) {
                throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, "Replicate 응답에 urls.get 이 없습니다");
            }

            // 완료 전에는 100 을 보고하지 않는다
            progressListener.accept(Math.min(95, attempt * 100 / maxPollAttempts));
            Thread.sleep(pollIntervalMs);

            ResponseEntity<String> statusResponse = restTemplate.exchange(
                    pollUrl, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            if (statusResponse.getBody() != null) {
                current = objectMapper.readTree(statusResponse.getBody());
            }
            log.debug("[Replicate] poll {}/{} status: {}", attempt, maxPollAttempts, current.path("status").asText());
        }

        throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED,
                "Replicate 업스케일 시간 초과 (" + maxPollAttempts + "회 폴링)");
    }

    /**
     * output 은 문자열 또는 문자열 배열
     */
    private String extractOutput(JsonNode prediction) {
        JsonNode output = prediction.path("output");
        String url = null;
        if (output.isTextual()) {
            url = output.asText();
        } else if (output.isArray() && output.size() > 0) {
            url = output.get(0).asText(null);
        }
        if (url == null || url.isBlank()) {
            throw new ApiException(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, "Replicate 응답에 output 이 없습니다");
        }
        return url;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + apiToken);
        return headers;
    }
}
