package com.seequence.api.service.pipeline;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.dto.SceneDto;
import com.seequence.api.service.image.BillingCreditException;
import com.seequence.api.service.prompt.PromptSynthesizerService;
import com.seequence.api.service.scene.SceneSegmenterService;
import com.seequence.common.enums.PipelineEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.seequence.api.service.pipeline.PipelineTestDoubles.FakeImageGenerator;
import static com.seequence.api.service.pipeline.PipelineTestDoubles.scenes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImperativePipelineStrategyTest {

    private static final String TEXT = "six short sentences";

    @Mock
    private SceneSegmenterService segmenter;
    @Mock
    private PromptSynthesizerService promptSynthesizer;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        when(segmenter.segment(TEXT, 6)).thenReturn(scenes("one", "two", "three", "four", "five", "six"));
        when(promptSynthesizer.summarizeGlobalContext(anyString(), anyInt())).thenReturn("Summary");
        when(promptSynthesizer.generatePrompt(anyString(), any(), isNull(), anyList()))
                .thenAnswer(invocation -> "prompt:" + invocation.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ImperativePipelineStrategy strategy(FakeImageGenerator images, int maxConcurrency) {
        SeequenceProperties properties = new SeequenceProperties();
        properties.getPipeline().setMaxConcurrency(maxConcurrency);
        return new ImperativePipelineStrategy(new PipelineSteps(segmenter, promptSynthesizer, images), properties, executor);
    }

    @Test
    void inFlightImageGenerationsNeverExceedLimit() {
        FakeImageGenerator images = new FakeImageGenerator(Set.of(), false, 50);
        ImperativePipelineStrategy imperative = strategy(images, 2);

        PipelineRun run = imperative.run(TEXT, 6);

        assertThat(imperative.getEngine()).isEqualTo(PipelineEngine.IMPERATIVE);
        assertThat(images.calls.get()).isEqualTo(6);
        assertThat(images.maxInFlight.get()).isBetween(1, 2);
        assertThat(run.getScenes()).extracting(SceneDto.Scene::getSceneId).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(run.getScenes()).allSatisfy(scene -> assertThat(scene.getImageUrl()).isNotNull());
    }

    @Test
    void failedSceneKeepsNullImageAndSiblingsSucceed() {
        PipelineRun run = strategy(new FakeImageGenerator(Set.of("three"), false, 5), 4).run(TEXT, 6);

        assertThat(run.getScenes()).extracting(SceneDto.Scene::getImageUrl)
                .containsExactly("https://img.example/one.png", "https://img.example/two.png", null,
                        "https://img.example/four.png", "https://img.example/five.png", "https://img.example/six.png");
    }

    @Test
    void billingFailureAbortsScenesWaitingForSlot() {
        FakeImageGenerator images = new FakeImageGenerator(Set.of(), true, 0);

        assertThatThrownBy(() -> strategy(images, 1).run(TEXT, 6)).isInstanceOf(BillingCreditException.class);
        assertThat(images.calls.get()).isEqualTo(1);
    }
}
