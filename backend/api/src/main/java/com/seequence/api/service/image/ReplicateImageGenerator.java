package com.seequence.api.service.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.seequence.api.config.SeequenceProperties;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Replicate 호스팅 모델 기반 이미지 생성
 *
 * 흐름: 크기 파라미터 결정 → 요청 → (거부 시) 크레딧 확인 → RetryLadder 규칙 1회 재요청 → 응답 정규화
 * 전체를 최대 maxAttempts 회 지수 백오프로 감싸며, 크레딧 부족은 즉시 중단한다.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "seequence.image.provider", havingValue = "replicate", matchIfMissing = true)
public class ReplicateImageGenerator implements ImageGeneratorService {

    private static final String PROVIDER = "Replicate";

    private final ReplicateClient replicateClient;
    private final SeequenceProperties.Replicate config;
    private final RetryLadder retryLadder;

    public ReplicateImageGenerator(ReplicateClient replicateClient, SeequenceProperties properties) {
        this.replicateClient = replicateClient;
        this.config = properties.getImage().getReplicate();
        this.retryLadder = RetryLadder.standard(config.getAspectRatio());
    }

    @Override
    public String generate(String prompt, Integer seed) {
        if (!canGenerateImages()) {
            throw new ApiException(ErrorCode.IMAGE_PROVIDER_NOT_CONFIGURED, "REPLICATE_API_TOKEN is not set");
        }

        int maxAttempts = Math.max(1, config.getMaxAttempts());
        long backoffMs = config.getInitialBackoffMs();
        RuntimeException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                log.debug("[IMAGE] Attempt {}/{} - model: {}", attempt, maxAttempts, config.getModel());
                return generateOnce(prompt, seed);
            } catch (BillingCreditException e) {
                log.error("[IMAGE] Billing failure, aborting without retry: {}", e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("[IMAGE] Attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                sleep(backoffMs);
                backoffMs = Math.min(backoffMs * 2, config.getMaxBackoffMs());
            }
        }

        log.error("[IMAGE] Replicate failed after {} attempts: {}", maxAttempts, lastException.getMessage());
        if (lastException instanceof ApiException) {
            throw lastException;
        }
        throw new UpstreamProviderException(lastException.getMessage(), lastException);
    }

    /**
     * 한 번의 시도 (크기 결정 + 요청 + 폴백 1회 + 정규화)
     */
    String generateOnce(String prompt, Integer seed) {
        ImageRequestPayload payload = ImageSizing.apply(ImageRequestPayload.of(prompt), config.getModel(),
                config.getWidth(), config.getHeight(), config.getAspectRatio());
        if (seed != null) {
            payload = payload.with(ImageRequestPayload.SEED, seed);
        }

        JsonNode output;
        try {
            output = replicateClient.predict(config.getModel(), payload);
        } catch (ProviderRejectedException e) {
            if (BillingCreditException.isBillingFailure(e)) {
                throw new BillingCreditException(PROVIDER);
            }
            ReshapeRule rule = retryLadder.select(e.getMessage());
            if (rule == null) {
                throw e;
            }
            ImageRequestPayload reshaped = rule.reshape(payload);
            log.info("[LADDER] {} rejected input, retrying with '{}': {}", config.getModel(), rule.getName(), reshaped);
            output = predictReshaped(reshaped);
        }

        String url = ProviderOutputNormalizer.normalize(output);
        log.info("[IMAGE] Generated: {}", url);
        return url;
    }

    private JsonNode predictReshaped(ImageRequestPayload reshaped) {
        try {
            return replicateClient.predict(config.getModel(), reshaped);
        } catch (ProviderRejectedException e) {
            if (BillingCreditException.isBillingFailure(e)) {
                throw new BillingCreditException(PROVIDER);
            }
            throw e;
        }
    }

    @Override
    public boolean canGenerateImages() {
        return StringUtils.hasText(config.getApiToken());
    }

    @Override
    public String getProviderName() {
        return "replicate";
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamProviderException("interrupted during retry backoff", e);
        }
    }
}
