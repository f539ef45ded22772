package com.seequence.api.service.image;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.service.storage.StorageArea;
import com.seequence.api.service.storage.StorageService;
import com.seequence.api.util.FileNames;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * OpenAI Images API 직접 호출
 * 선호 크기부터 요청하고, 크기 관련 거부 시 fallback-sizes 순서대로 재요청한다.
 * base64 응답은 IMAGE 저장소에 저장하고 /static/images/... 경로를 반환한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "seequence.image.provider", havingValue = "openai")
public class OpenAiImageGenerator implements ImageGeneratorService {

    private static final String IMAGES_PATH = "/v1/images/generations";
    private static final String PROVIDER = "OpenAI";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final StorageService storageService;
    private final SeequenceProperties properties;

    @Override
    public String generate(String prompt, Integer seed) {
        if (!canGenerateImages()) {
            throw new ApiException(ErrorCode.IMAGE_PROVIDER_NOT_CONFIGURED, "OPENAI_API_KEY is not set");
        }
        if (seed != null) {
            log.debug("[IMAGE] OpenAI images API ignores seed {}", seed);
        }

        List<String> sizes = candidateSizes();
        ProviderRejectedException lastRejection = null;

        for (String size : sizes) {
            try {
                JsonNode response = requestImage(prompt, size);
                return persist(response);
            } catch (ProviderRejectedException e) {
                if (BillingCreditException.isBillingFailure(e)) {
                    throw new BillingCreditException(PROVIDER);
                }
                if (!isSizeRejection(e.getMessage())) {
                    throw new UpstreamProviderException(e.getMessage(), e);
                }
                log.warn("[IMAGE] Size {} rejected, trying next: {}", size, e.getMessage());
                lastRejection = e;
            }
        }

        throw new UpstreamProviderException(
                "no supported size among " + sizes + (lastRejection != null ? ": " + lastRejection.getMessage() : ""),
                lastRejection);
    }

    List<String> candidateSizes() {
        SeequenceProperties.OpenAi config = properties.getImage().getOpenai();
        Set<String> sizes = new LinkedHashSet<>();
        if (StringUtils.hasText(config.getSize())) {
            sizes.add(config.getSize().trim());
        }
        for (String fallback : config.getFallbackSizes()) {
            if (StringUtils.hasText(fallback)) {
                sizes.add(fallback.trim());
            }
        }
        return new ArrayList<>(sizes);
    }

    private JsonNode requestImage(String prompt, String size) {
        SeequenceProperties.OpenAi config = properties.getImage().getOpenai();

        Map<String, Object> body = new HashMap<>();
        body.put("model", config.getModel());
        body.put("prompt", prompt);
        body.put("size", size);
        body.put("n", 1);
        if (config.getModel().toLowerCase(Locale.ROOT).startsWith("dall-e")) {
            body.put("response_format", "b64_json");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey());

        try {
            HttpEntity<String> entity = new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
            log.info("[IMAGE] OpenAI images - model: {}, size: {}, prompt length: {}",
                    config.getModel(), size, prompt.length());
            ResponseEntity<String> response = restTemplate.exchange(
                    config.getBaseUrl() + IMAGES_PATH, HttpMethod.POST, entity, String.class);
            return objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            throw new ProviderRejectedException(status, "status: " + status + " " + e.getResponseBodyAsString());
        } catch (JsonProcessingException e) {
            throw new UnrecognizedProviderResponseException("non-JSON body");
        } catch (RestClientException e) {
            throw new UpstreamProviderException(e.getMessage(), e);
        }
    }

    private String persist(JsonNode response) {
        JsonNode first = response.path("data").path(0);
        String b64 = first.path("b64_json").asText("");
        if (!b64.isEmpty()) {
            byte[] bytes = Base64.getDecoder().decode(b64);
            String fileName = "img_" + FileNames.epochNanos() + "_" + FileNames.shortRandom() + ".png";
            String url = storageService.upload(StorageArea.IMAGE, fileName, bytes);
            log.info("[IMAGE] Saved OpenAI image: {} ({} bytes)", url, bytes.length);
            return url;
        }
        if (ProviderOutputNormalizer.isUrl(first.get("url"))) {
            return first.get("url").asText();
        }
        throw new UnrecognizedProviderResponseException(ProviderOutputNormalizer.describe(response));
    }

    private boolean isSizeRejection(String message) {
        return message != null && message.toLowerCase(Locale.ROOT).contains("size");
    }

    private String apiKey() {
        String imageKey = properties.getImage().getOpenai().getApiKey();
        return StringUtils.hasText(imageKey) ? imageKey : properties.getLlm().getApiKey();
    }

    @Override
    public boolean canGenerateImages() {
        return StringUtils.hasText(apiKey());
    }

    @Override
    public String getProviderName() {
        return "openai";
    }
}
