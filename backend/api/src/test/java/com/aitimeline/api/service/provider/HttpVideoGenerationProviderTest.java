package com.aitimeline.api.service.provider;

import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpVideoGenerationProviderTest {

    private static final String BASE_URL = "https://video.provider.test";

    private MockRestServiceServer server;
    private HttpVideoGenerationProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new HttpVideoGenerationProvider(restTemplate, new ObjectMapper());
        ReflectionTestUtils.setField(provider, "baseUrl", BASE_URL);
        ReflectionTestUtils.setField(provider, "apiKey", "secret");
    }

    private static Map<String, Object> payload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model_id", "veo-3");
        payload.put("duration", 8);
        payload.put("prompt", "a fox in the snow");
        payload.put("image_url", "https://cdn.example.com/last.jpg");
        return payload;
    }

    @Test
    void postsPayloadAndReturnsVideoUrl() {
        // Given
        server.expect(requestTo(BASE_URL + "/video/image-to-video"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.model_id").value("veo-3"))
                .andExpect(jsonPath("$.image_url").value("https://cdn.example.com/last.jpg"))
                .andRespond(withSuccess("{\"video_url\":\"https://provider.test/v/1.mp4\"}", MediaType.APPLICATION_JSON));

        // When
        String videoUrl = provider.generate("/video/image-to-video", payload());

        // Then
        assertEquals("https://provider.test/v/1.mp4", videoUrl);
        server.verify();
    }

    @Test
    void responseWithoutVideoUrlFails() {
        server.expect(requestTo(BASE_URL + "/video/text-to-video"))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        ApiException e = assertThrows(ApiException.class, () -> provider.generate("/video/text-to-video", payload()));

        assertEquals(ErrorCode.GENERATION_PROVIDER_FAILED, e.getErrorCode());
    }

    @Test
    void clientErrorIsProviderFailure() {
        server.expect(requestTo(BASE_URL + "/video/text-to-video"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        ApiException e = assertThrows(ApiException.class, () -> provider.generate("/video/text-to-video", payload()));

        assertEquals(ErrorCode.GENERATION_PROVIDER_FAILED, e.getErrorCode());
    }

    @Test
    void serverErrorIsProviderUnavailable() {
        server.expect(requestTo(BASE_URL + "/video/text-to-video"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        ApiException e = assertThrows(ApiException.class, () -> provider.generate("/video/text-to-video", payload()));

        assertEquals(ErrorCode.GENERATION_PROVIDER_UNAVAILABLE, e.getErrorCode());
    }
}
