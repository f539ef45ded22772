package com.seequence.api.service.image;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.service.storage.StorageArea;
import com.seequence.api.service.storage.StorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class OpenAiImageGeneratorTest {

    private static final String ENDPOINT = "https://api.openai.com/v1/images/generations";

    @Mock
    private StorageService storageService;

    private MockRestServiceServer server;
    private SeequenceProperties properties;
    private OpenAiImageGenerator generator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new SeequenceProperties();
        properties.getImage().getOpenai().setApiKey("sk-test");
        properties.getImage().getOpenai().setSize("1536x1024");
        properties.getImage().getOpenai().setFallbackSizes(List.of("1792x1024", "1536x1024", "1024x1024"));
        generator = new OpenAiImageGenerator(restTemplate, new ObjectMapper(), storageService, properties);
    }

    @Test
    void candidateSizesAreDeduplicatedInOrder() {
        assertThat(generator.candidateSizes()).containsExactly("1536x1024", "1792x1024", "1024x1024");
    }

    @Test
    void sizeRejectionFallsBackToNextSizeAndStoresBase64Image() {
        server.expect(once(), requestTo(ENDPOINT))
                .andExpect(jsonPath("$.size").value("1536x1024"))
                .andRespond(withBadRequest().contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"Invalid size '1536x1024'\"}}"));
        server.expect(once(), requestTo(ENDPOINT))
                .andExpect(jsonPath("$.size").value("1792x1024"))
                .andRespond(withSuccess("{\"data\":[{\"b64_json\":\"aGVsbG8=\"}]}", MediaType.APPLICATION_JSON));
        when(storageService.upload(eq(StorageArea.IMAGE), startsWith("img_"),
                eq("hello".getBytes(StandardCharsets.UTF_8))))
                .thenReturn("/static/images/img_1.png");

        assertThat(generator.generate("a lighthouse", null)).isEqualTo("/static/images/img_1.png");
        server.verify();
    }

    @Test
    void remoteUrlResponseIsReturnedDirectly() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"data\":[{\"url\":\"https://oaidalle.example/img.png\"}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(generator.generate("a lighthouse", null)).isEqualTo("https://oaidalle.example/img.png");
        verifyNoInteractions(storageService);
    }

    @Test
    void billingLimitAbortsImmediately() {
        server.expect(once(), requestTo(ENDPOINT))
                .andRespond(withBadRequest().contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"code\":\"billing_hard_limit_reached\"}}"));

        assertThatThrownBy(() -> generator.generate("a lighthouse", null))
                .isInstanceOf(BillingCreditException.class)
                .hasMessageContaining("OpenAI billing");
        server.verify();
    }

    @Test
    void nonSizeRejectionIsUpstreamFailure() {
        server.expect(once(), requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR).body("upstream exploded"));

        assertThatThrownBy(() -> generator.generate("a lighthouse", null))
                .isInstanceOf(UpstreamProviderException.class)
                .hasMessageContaining("upstream exploded");
    }

    @Test
    void llmKeyIsUsedWhenImageKeyMissing() {
        properties.getImage().getOpenai().setApiKey(null);
        properties.getLlm().setApiKey("sk-llm");
        assertThat(generator.canGenerateImages()).isTrue();

        properties.getLlm().setApiKey(null);
        assertThat(generator.canGenerateImages()).isFalse();
    }
}
