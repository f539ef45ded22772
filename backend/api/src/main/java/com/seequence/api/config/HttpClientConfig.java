package com.seequence.api.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP 클라이언트 공통 설정
 * - RestTemplate: LLM, 이미지, TTS 호출 공용 (타임아웃은 seequence.http.*)
 * - ObjectMapper: 모델 응답 파싱용
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final SeequenceProperties properties;

    /**
     * RestTemplate Bean
     * 이미지 생성은 Prefer: wait 로 동기 대기하므로 read timeout을 길게 둔다.
     */
    @Bean
    @Primary
    public RestTemplate restTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(properties.getHttp().getReadTimeoutMs());

        return new RestTemplate(factory);
    }

    /**
     * ObjectMapper Bean
     * - 알 수 없는 속성 무시
     * - base64 이미지/오디오 응답을 위해 String 길이 제한 100MB
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        StreamReadConstraints constraints = StreamReadConstraints.builder()
            .maxStringLength(100_000_000)
            .build();
        mapper.getFactory().setStreamReadConstraints(constraints);

        return mapper;
    }
}
