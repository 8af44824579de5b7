package com.aitimeline.api.service.provider;

import com.aitimeline.api.entity.UpscalerModel;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ReplicateEnhancementProviderTest {

    private static final String API_URL = "https://api.replicate.test/v1/predictions";
    private static final String POLL_URL = "https://api.replicate.test/v1/predictions/p-1";

    private MockRestServiceServer server;
    private ReplicateEnhancementProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new ReplicateEnhancementProvider(restTemplate, new ObjectMapper());
        ReflectionTestUtils.setField(provider, "apiUrl", API_URL);
        ReflectionTestUtils.setField(provider, "apiToken", "r8_test");
        ReflectionTestUtils.setField(provider, "pollIntervalMs", 0L);
        ReflectionTestUtils.setField(provider, "maxPollAttempts", 10);
    }

    private static EnhancementProvider.EnhancementTask task(String providerVersion) {
        UpscalerModel model = UpscalerModel.builder()
                .id("replicate-esrgan")
                .provider("replicate")
                .providerVersion(providerVersion)
                .scaleFactors(List.of(2, 4))
                .build();
        return new EnhancementProvider.EnhancementTask("https://cdn.example.com/11.mp4", model, 2, null, true);
    }

    private static String prediction(String status, String extra) {
        return "{\"id\":\"p-1\",\"status\":\"" + status + "\",\"urls\":{\"get\":\"" + POLL_URL + "\"}" + extra + "}";
    }

    @Test
    void pollsUntilSucceededAndReportsProgress() {
        // Given
        server.expect(requestTo(API_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Token r8_test"))
                .andExpect(jsonPath("$.version").value("v-hash"))
                .andExpect(jsonPath("$.input.video").value("https://cdn.example.com/11.mp4"))
                .andExpect(jsonPath("$.input.scale").value(2))
                .andRespond(withSuccess(prediction("starting", ""), MediaType.APPLICATION_JSON));
        server.expect(requestTo(POLL_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(prediction("processing", ""), MediaType.APPLICATION_JSON));
        server.expect(requestTo(POLL_URL))
                .andRespond(withSuccess(prediction("succeeded", ",\"output\":[\"https://replicate.delivery/out.mp4\"]"),
                        MediaType.APPLICATION_JSON));
        List<Integer> progress = new ArrayList<>();

        // When
        String output = provider.enhance(task("v-hash"), progress::add);

        // Then
        assertEquals("https://replicate.delivery/out.mp4", output);
        assertEquals(List.of(10, 20, 100), progress);
        server.verify();
    }

    @Test
    void failedPredictionCarriesProviderError() {
        server.expect(requestTo(API_URL))
                .andRespond(withSuccess(prediction("failed", ",\"error\":\"CUDA out of memory\""),
                        MediaType.APPLICATION_JSON));

        ApiException e = assertThrows(ApiException.class, () -> provider.enhance(task("v-hash"), progress -> { }));

        assertEquals(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, e.getErrorCode());
        assertEquals("Replicate prediction failed: CUDA out of memory", e.getMessage());
    }

    @Test
    void pollingGivesUpAfterMaxAttempts() {
        ReflectionTestUtils.setField(provider, "maxPollAttempts", 1);
        server.expect(requestTo(API_URL))
                .andRespond(withSuccess(prediction("starting", ""), MediaType.APPLICATION_JSON));
        server.expect(requestTo(POLL_URL))
                .andRespond(withSuccess(prediction("processing", ""), MediaType.APPLICATION_JSON));

        ApiException e = assertThrows(ApiException.class, () -> provider.enhance(task("v-hash"), progress -> { }));

        assertEquals(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, e.getErrorCode());
        assertTrue(e.getMessage().contains("시간 초과"));
    }

    @Test
    void serverErrorIsMappedToProviderFailure() {
        server.expect(requestTo(API_URL)).andRespond(withServerError());

        ApiException e = assertThrows(ApiException.class, () -> provider.enhance(task("v-hash"), progress -> { }));

        assertEquals(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, e.getErrorCode());
    }

    @Test
    void upscalerWithoutVersionIsRejectedBeforeCalling() {
        ApiException e = assertThrows(ApiException.class, () -> provider.enhance(task(null), progress -> { }));

        assertEquals(ErrorCode.ENHANCEMENT_PROVIDER_FAILED, e.getErrorCode());
        server.verify();
    }
}
