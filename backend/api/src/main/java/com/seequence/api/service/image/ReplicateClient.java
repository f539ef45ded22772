package com.seequence.api.service.image;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.config.SeequenceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Replicate predictions API 호출
 * - owner/name → POST /v1/models/{owner}/{name}/predictions
 * - owner/name:version → POST /v1/predictions (version 지정)
 * - Prefer: wait 로 동기 대기, 끝나지 않았으면 urls.get 폴링
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "seequence.image.provider", havingValue = "replicate", matchIfMissing = true)
public class ReplicateClient {

    private static final String STATUS_SUCCEEDED = "succeeded";
    private static final String STATUS_FAILED = "failed";
    private static final String STATUS_CANCELED = "canceled";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SeequenceProperties properties;

    /**
     * prediction 실행 후 output 노드 반환
     * @throws ProviderRejectedException HTTP 오류 또는 prediction 실패
     * @throws UpstreamProviderException 타임아웃 내에 끝나지 않음
     */
    public JsonNode predict(String modelId, ImageRequestPayload payload) {
        SeequenceProperties.Replicate config = properties.getImage().getReplicate();

        Map<String, Object> body = new HashMap<>();
        body.put("input", payload.toMap());
        String url;
        int versionSeparator = modelId.indexOf(':');
        if (versionSeparator > 0) {
            body.put("version", modelId.substring(versionSeparator + 1));
            url = config.getBaseUrl() + "/v1/predictions";
        } else {
            url = config.getBaseUrl() + "/v1/models/" + modelId + "/predictions";
        }

        HttpHeaders headers = authHeaders(config.getApiToken());
        headers.set("Prefer", "wait");

        log.info("[REPLICATE] POST {} input: {}", url, payload);
        JsonNode prediction = exchange(url, HttpMethod.POST, new HttpEntity<>(toJson(body), headers));
        prediction = awaitCompletion(prediction, config);
        return prediction.get("output");
    }

    private JsonNode awaitCompletion(JsonNode prediction, SeequenceProperties.Replicate config) {
        long deadline = System.currentTimeMillis() + config.getTimeoutSeconds() * 1000L;
        JsonNode current = prediction;

        while (true) {
            String status = current.path("status").asText("");
            if (STATUS_SUCCEEDED.equals(status) || (status.isEmpty() && current.has("output"))) {
                return current;
            }
            if (STATUS_FAILED.equals(status) || STATUS_CANCELED.equals(status)) {
                String error = current.path("error").asText("prediction " + status);
                log.warn("[REPLICATE] Prediction {} {}: {}", current.path("id").asText(), status, error);
                throw new ProviderRejectedException(0, error);
            }

            String pollUrl = current.path("urls").path("get").asText("");
            if (pollUrl.isEmpty()) {
                throw new UpstreamProviderException("prediction status '" + status + "' without poll URL", null);
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new UpstreamProviderException(
                        "prediction did not finish within " + config.getTimeoutSeconds() + "s", null);
            }

            try {
                Thread.sleep(config.getPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamProviderException("interrupted while waiting for prediction", e);
            }
            log.debug("[REPLICATE] Polling prediction {} (status: {})", current.path("id").asText(), status);
            current = exchange(pollUrl, HttpMethod.GET, new HttpEntity<>(authHeaders(config.getApiToken())));
        }
    }

    private JsonNode exchange(String url, HttpMethod method, HttpEntity<?> entity) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, entity, String.class);
            return objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String message = "ReplicateError status: " + status + " " + describeError(e.getResponseBodyAsString());
            log.warn("[REPLICATE] Rejected ({}): {}", status, message);
            throw new ProviderRejectedException(status, message);
        } catch (JsonProcessingException e) {
            throw new UnrecognizedProviderResponseException("non-JSON body");
        }
    }

    private String describeError(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            String title = node.path("title").asText("");
            String detail = node.path("detail").asText("");
            if (!title.isEmpty() || !detail.isEmpty()) {
                return (title + " " + detail).trim();
            }
        } catch (JsonProcessingException e) {
            log.debug("[REPLICATE] Error body is not JSON");
        }
        return body.length() > 500 ? body.substring(0, 500) : body;
    }

    private HttpHeaders authHeaders(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(token);
        return headers;
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize prediction request", e);
        }
    }
}
