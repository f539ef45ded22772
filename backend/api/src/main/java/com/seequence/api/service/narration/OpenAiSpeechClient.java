package com.seequence.api.service.narration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.config.SeequenceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI /v1/audio/speech 호출
 * 스트리밍 응답을 먼저 시도하고, 실패하면 일반 요청으로 한 번 더 시도한다.
 * 일반 요청 응답이 JSON이면 data / b64 필드의 base64 오디오를 디코딩한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiSpeechClient implements SpeechSynthesisClient {

    private static final String SPEECH_PATH = "/v1/audio/speech";
    private static final String PROVIDER = "openai";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SeequenceProperties properties;

    @Override
    public byte[] synthesize(String text) {
        String url = properties.getNarration().getBaseUrl() + SPEECH_PATH;
        String requestJson = buildRequest(text);

        try {
            byte[] streamed = restTemplate.execute(url, HttpMethod.POST,
                    request -> {
                        request.getHeaders().putAll(headers());
                        StreamUtils.copy(requestJson, StandardCharsets.UTF_8, request.getBody());
                    },
                    response -> StreamUtils.copyToByteArray(response.getBody()));
            if (streamed != null && streamed.length > 0) {
                return streamed;
            }
            log.warn("[TTS] Streaming response was empty, falling back to non-streaming");
        } catch (RestClientException e) {
            log.warn("[TTS] Streaming failed, falling back to non-streaming: {}", e.getMessage());
        }

        ResponseEntity<byte[]> response = restTemplate.exchange(
                url, HttpMethod.POST, new HttpEntity<>(requestJson, headers()), byte[].class);
        byte[] audio = decodeBody(response);
        if (audio == null || audio.length == 0) {
            throw new IllegalStateException("OpenAI TTS returned no audio bytes");
        }
        return audio;
    }

    private byte[] decodeBody(ResponseEntity<byte[]> response) {
        byte[] body = response.getBody();
        MediaType contentType = response.getHeaders().getContentType();
        if (body == null || contentType == null || !MediaType.APPLICATION_JSON.isCompatibleWith(contentType)) {
            return body;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode container = root.has("audio") ? root.get("audio") : root;
            String b64 = container.path("data").asText(container.path("b64").asText(""));
            return b64.isEmpty() ? null : Base64.getDecoder().decode(b64);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[TTS] Could not decode JSON audio body: {}", e.getMessage());
            return null;
        }
    }

    private String buildRequest(String text) {
        SeequenceProperties.Narration config = properties.getNarration();
        Map<String, Object> body = new HashMap<>();
        body.put("model", config.getModel());
        body.put("voice", config.getVoice());
        body.put("input", text);
        body.put("response_format", "mp3");
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize TTS request", e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL));
        headers.setBearerAuth(apiKey());
        return headers;
    }

    private String apiKey() {
        String key = properties.getNarration().getApiKey();
        return StringUtils.hasText(key) ? key : properties.getLlm().getApiKey();
    }

    @Override
    public boolean isConfigured() {
        return PROVIDER.equalsIgnoreCase(properties.getNarration().getProvider()) && StringUtils.hasText(apiKey());
    }

    @Override
    public String getVoice() {
        return properties.getNarration().getVoice();
    }
}
