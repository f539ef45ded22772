package com.seequence.api.service.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.config.SeequenceProperties;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReplicateImageGeneratorTest {

    private static final String MODEL = "black-forest-labs/flux-1.1-pro";
    private static final String URL = "https://replicate.delivery/pbxt/out-0.webp";

    @Mock
    private ReplicateClient replicateClient;

    private SeequenceProperties properties;
    private ReplicateImageGenerator generator;
    private JsonNode successOutput;

    @BeforeEach
    void setUp() throws Exception {
        properties = new SeequenceProperties();
        SeequenceProperties.Replicate replicate = properties.getImage().getReplicate();
        replicate.setApiToken("r8_test");
        replicate.setModel(MODEL);
        replicate.setAspectRatio("16:9");
        replicate.setMaxAttempts(3);
        replicate.setInitialBackoffMs(1);
        replicate.setMaxBackoffMs(2);
        generator = new ReplicateImageGenerator(replicateClient, properties);
        successOutput = new ObjectMapper().readTree("[\"" + URL + "\"]");
    }

    @Test
    void returnsNormalizedUrlOnFirstSuccess() {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class))).thenReturn(successOutput);

        assertThat(generator.generate("a fox in snow", 42)).isEqualTo(URL);

        ArgumentCaptor<ImageRequestPayload> payload = ArgumentCaptor.forClass(ImageRequestPayload.class);
        verify(replicateClient).predict(eq(MODEL), payload.capture());
        assertThat(payload.getValue().get(ImageRequestPayload.SEED)).isEqualTo(42);
        assertThat(payload.getValue().get(ImageRequestPayload.ASPECT_RATIO)).isEqualTo("16:9");
    }

    @Test
    void billingFailureRaisesOnFirstAttemptWithoutRetry() {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenThrow(new ProviderRejectedException(402, "ReplicateError status: 402 Insufficient credit"));

        assertThatThrownBy(() -> generator.generate("a fox", null))
                .isInstanceOf(BillingCreditException.class)
                .hasMessageContaining("Replicate billing: insufficient credit")
                .satisfies(e -> assertThat(((ApiException) e).getErrorCode()).isEqualTo(ErrorCode.PAYMENT_REQUIRED));
        verify(replicateClient, times(1)).predict(eq(MODEL), any(ImageRequestPayload.class));
    }

    @Test
    void aspectRatioRejectionRetriesWithoutAspectRatio() {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenThrow(new ProviderRejectedException(422, "ReplicateError status: 422 aspect_ratio: invalid aspect ratio"))
                .thenReturn(successOutput);

        assertThat(generator.generate("a fox", null)).isEqualTo(URL);

        ArgumentCaptor<ImageRequestPayload> payloads = ArgumentCaptor.forClass(ImageRequestPayload.class);
        verify(replicateClient, times(2)).predict(eq(MODEL), payloads.capture());
        List<ImageRequestPayload> sent = payloads.getAllValues();
        assertThat(sent.get(0).has(ImageRequestPayload.ASPECT_RATIO)).isTrue();
        assertThat(sent.get(1).has(ImageRequestPayload.ASPECT_RATIO)).isFalse();
        assertThat(sent.get(1).get(ImageRequestPayload.WIDTH)).isEqualTo(1280);
        assertThat(sent.get(1).get(ImageRequestPayload.HEIGHT)).isEqualTo(720);
    }

    @Test
    void dimensionRejectionRetriesWithAspectRatio() {
        properties.getImage().getReplicate().setWidth(1000);
        properties.getImage().getReplicate().setHeight(570);
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenThrow(new ProviderRejectedException(422, "input.width must be a multiple of 32"))
                .thenReturn(successOutput);

        assertThat(generator.generate("a fox", null)).isEqualTo(URL);

        ArgumentCaptor<ImageRequestPayload> payloads = ArgumentCaptor.forClass(ImageRequestPayload.class);
        verify(replicateClient, times(2)).predict(eq(MODEL), payloads.capture());
        assertThat(payloads.getAllValues().get(0).get(ImageRequestPayload.WIDTH)).isEqualTo(960);
        assertThat(payloads.getAllValues().get(1).toMap())
                .containsEntry(ImageRequestPayload.ASPECT_RATIO, "16:9")
                .doesNotContainKeys(ImageRequestPayload.WIDTH, ImageRequestPayload.HEIGHT);
    }

    @Test
    void otherRejectionRetriesWithCompositionHint() {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenThrow(new ProviderRejectedException(0, "NSFW content detected"))
                .thenReturn(successOutput);

        assertThat(generator.generate("a fox", null)).isEqualTo(URL);

        ArgumentCaptor<ImageRequestPayload> payloads = ArgumentCaptor.forClass(ImageRequestPayload.class);
        verify(replicateClient, times(2)).predict(eq(MODEL), payloads.capture());
        assertThat(payloads.getAllValues().get(1).getPrompt()).isEqualTo("a fox" + RetryLadder.COMPOSITION_HINT);
    }

    @Test
    void billingOnReshapedRequestStillAborts() {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenThrow(new ProviderRejectedException(422, "invalid aspect ratio"))
                .thenThrow(new ProviderRejectedException(400, "billing_hard_limit_reached"));

        assertThatThrownBy(() -> generator.generate("a fox", null)).isInstanceOf(BillingCreditException.class);
        verify(replicateClient, times(2)).predict(eq(MODEL), any(ImageRequestPayload.class));
    }

    @Test
    void transientFailureIsRetriedByOuterLoop() {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenThrow(new ProviderRejectedException(503, "Service Unavailable"))
                .thenThrow(new ProviderRejectedException(503, "Service Unavailable"))
                .thenReturn(successOutput);

        assertThat(generator.generate("a fox", null)).isEqualTo(URL);
        verify(replicateClient, times(3)).predict(eq(MODEL), any(ImageRequestPayload.class));
    }

    @Test
    void exhaustedAttemptsSurfaceAsUpstreamFailure() {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenThrow(new ProviderRejectedException(500, "Internal Server Error"));

        assertThatThrownBy(() -> generator.generate("a fox", null))
                .isInstanceOf(UpstreamProviderException.class)
                .hasMessage("Image generation failed: Internal Server Error");
        // 시도마다 원 요청 + 폴백 1회
        verify(replicateClient, times(6)).predict(eq(MODEL), any(ImageRequestPayload.class));
    }

    @Test
    void unrecognizedOutputIsNotWrapped() throws Exception {
        when(replicateClient.predict(eq(MODEL), any(ImageRequestPayload.class)))
                .thenReturn(new ObjectMapper().readTree("{\"id\": \"abc\"}"));

        assertThatThrownBy(() -> generator.generate("a fox", null))
                .isInstanceOf(UnrecognizedProviderResponseException.class);
    }

    @Test
    void missingTokenFailsWithoutCallingProvider() {
        properties.getImage().getReplicate().setApiToken("");

        assertThat(generator.canGenerateImages()).isFalse();
        assertThatThrownBy(() -> generator.generate("a fox", null))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getErrorCode())
                        .isEqualTo(ErrorCode.IMAGE_PROVIDER_NOT_CONFIGURED));
        verifyNoInteractions(replicateClient);
    }
}
