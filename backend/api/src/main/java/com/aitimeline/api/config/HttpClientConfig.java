package com.aitimeline.api.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP 클라이언트 공통 설정
 * - RestTemplate: 영상 생성 provider, Replicate 호출 공용
 * - ObjectMapper: API 응답 + provider payload 직렬화
 */
@Configuration
public class HttpClientConfig {

    @Value("${generation.provider.connect-timeout-ms:30000}")
    private int connectTimeoutMs;

    /**
     * 영상 생성은 수 분이 걸릴 수 있어 read timeout 을 별도로 둔다 (0 = 무제한)
     */
    @Value("${generation.provider.read-timeout-ms:600000}")
    private int readTimeoutMs;

    @Bean
    @Primary
    public RestTemplate restTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);

        return new RestTemplate(factory);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // 알 수 없는 속성이 있어도 에러 발생 안 함 (provider 응답 필드 추가 대비)
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }
}
