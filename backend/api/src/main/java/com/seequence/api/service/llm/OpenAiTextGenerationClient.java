package com.seequence.api.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.config.SeequenceProperties;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions 기반 텍스트 생성 / 이미지 텍스트 추출
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiTextGenerationClient implements TextGenerationClient, VisionTextExtractor {

    private static final String CHAT_COMPLETIONS_PATH = "/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SeequenceProperties properties;

    @Override
    public String complete(String systemInstruction, String userInstruction, Map<String, ?> variables) {
        SeequenceProperties.Llm llm = properties.getLlm();

        List<Map<String, Object>> messages = List.of(
                Map.of("role", "system", "content", TextGenerationClient.render(systemInstruction, variables)),
                Map.of("role", "user", "content", TextGenerationClient.render(userInstruction, variables))
        );

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", llm.getModel());
        requestBody.put("temperature", llm.getTemperature());
        requestBody.put("messages", messages);

        return callChat(requestBody, "LLM");
    }

    @Override
    public String extractText(String imageUrl, String instruction) {
        SeequenceProperties.Llm llm = properties.getLlm();

        List<Map<String, Object>> content = List.of(
                Map.of("type", "text", "text", instruction),
                Map.of("type", "image_url", "image_url", Map.of("url", imageUrl))
        );

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", llm.getVisionModel());
        requestBody.put("temperature", 0);
        requestBody.put("messages", List.of(Map.of("role", "user", "content", content)));

        return callChat(requestBody, "VISION");
    }

    private String callChat(Map<String, Object> requestBody, String tag) {
        SeequenceProperties.Llm llm = properties.getLlm();
        if (!StringUtils.hasText(llm.getApiKey())) {
            throw new ApiException(ErrorCode.AI_API_KEY_INVALID, "OpenAI API key is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(llm.getApiKey());

        try {
            String requestJson = objectMapper.writeValueAsString(requestBody);
            HttpEntity<String> entity = new HttpEntity<>(requestJson, headers);

            log.debug("[{}] model={}, bytes={}", tag, requestBody.get("model"), requestJson.length());
            ResponseEntity<String> response = restTemplate.exchange(
                    llm.getBaseUrl() + CHAT_COMPLETIONS_PATH, HttpMethod.POST, entity, String.class);

            JsonNode root = objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
            JsonNode message = root.path("choices").path(0).path("message").path("content");
            if (message.isMissingNode() || message.isNull()) {
                throw new ApiException(ErrorCode.AI_SERVICE_UNAVAILABLE, "Empty completion from text model");
            }
            return message.asText().trim();

        } catch (HttpClientErrorException.Unauthorized e) {
            throw new ApiException(ErrorCode.AI_API_KEY_INVALID, "OpenAI rejected the API key", e);
        } catch (ApiException e) {
            throw e;
        } catch (RestClientException | JsonProcessingException e) {
            log.error("[{}] OpenAI call failed: {}", tag, e.getMessage());
            throw new ApiException(ErrorCode.AI_SERVICE_UNAVAILABLE, "Text generation failed: " + e.getMessage(), e);
        }
    }
}
