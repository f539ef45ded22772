package com.seequence.api.service.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.config.SeequenceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ReplicateClientTest {

    private static final String BASE = "https://api.replicate.com";
    private static final String MODEL = "black-forest-labs/flux-1.1-pro";

    private MockRestServiceServer server;
    private ReplicateClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        SeequenceProperties properties = new SeequenceProperties();
        properties.getImage().getReplicate().setApiToken("r8_test");
        properties.getImage().getReplicate().setPollIntervalMs(1);
        client = new ReplicateClient(restTemplate, new ObjectMapper(), properties);
    }

    @Test
    void modelEndpointWaitsAndReturnsOutput() {
        server.expect(requestTo(BASE + "/v1/models/" + MODEL + "/predictions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Prefer", "wait"))
                .andExpect(header("Authorization", "Bearer r8_test"))
                .andExpect(jsonPath("$.input.prompt").value("a fox"))
                .andExpect(jsonPath("$.input.aspect_ratio").value("16:9"))
                .andRespond(withSuccess("{\"id\":\"p1\",\"status\":\"succeeded\",\"output\":[\"https://x/1.webp\"]}",
                        MediaType.APPLICATION_JSON));

        JsonNode output = client.predict(MODEL,
                ImageRequestPayload.of("a fox").with(ImageRequestPayload.ASPECT_RATIO, "16:9"));

        assertThat(output.get(0).asText()).isEqualTo("https://x/1.webp");
        server.verify();
    }

    @Test
    void versionedModelUsesPredictionsEndpoint() {
        server.expect(requestTo(BASE + "/v1/predictions"))
                .andExpect(jsonPath("$.version").value("abc123"))
                .andRespond(withSuccess("{\"status\":\"succeeded\",\"output\":\"https://x/2.png\"}",
                        MediaType.APPLICATION_JSON));

        JsonNode output = client.predict("stability-ai/sdxl:abc123", ImageRequestPayload.of("a fox"));

        assertThat(output.asText()).isEqualTo("https://x/2.png");
        server.verify();
    }

    @Test
    void unfinishedPredictionIsPolled() {
        server.expect(requestTo(BASE + "/v1/models/" + MODEL + "/predictions"))
                .andRespond(withSuccess("{\"id\":\"p2\",\"status\":\"processing\","
                        + "\"urls\":{\"get\":\"" + BASE + "/v1/predictions/p2\"}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1/predictions/p2"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"id\":\"p2\",\"status\":\"succeeded\",\"output\":[\"https://x/3.webp\"]}",
                        MediaType.APPLICATION_JSON));

        JsonNode output = client.predict(MODEL, ImageRequestPayload.of("a fox"));

        assertThat(output.get(0).asText()).isEqualTo("https://x/3.webp");
        server.verify();
    }

    @Test
    void failedPredictionIsRejectionWithZeroStatus() {
        server.expect(requestTo(BASE + "/v1/models/" + MODEL + "/predictions"))
                .andRespond(withSuccess("{\"id\":\"p3\",\"status\":\"failed\",\"error\":\"NSFW content detected\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.predict(MODEL, ImageRequestPayload.of("a fox")))
                .isInstanceOf(ProviderRejectedException.class)
                .hasMessage("NSFW content detected")
                .satisfies(e -> assertThat(((ProviderRejectedException) e).getStatus()).isZero());
    }

    @Test
    void httpErrorCarriesStatusAndProblemDetail() {
        server.expect(requestTo(BASE + "/v1/models/" + MODEL + "/predictions"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"title\":\"Input validation failed\",\"detail\":\"aspect_ratio is not allowed\"}"));

        assertThatThrownBy(() -> client.predict(MODEL, ImageRequestPayload.of("a fox")))
                .isInstanceOf(ProviderRejectedException.class)
                .hasMessage("ReplicateError status: 422 Input validation failed aspect_ratio is not allowed")
                .satisfies(e -> assertThat(((ProviderRejectedException) e).getStatus()).isEqualTo(422));
    }
}
