package com.seequence.api.service.pipeline;

import com.seequence.api.dto.SceneDto;
import com.seequence.api.service.image.BillingCreditException;
import com.seequence.api.service.prompt.PromptSynthesizerService;
import com.seequence.api.service.scene.SceneSegmenterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static com.seequence.api.service.pipeline.PipelineTestDoubles.FakeImageGenerator;
import static com.seequence.api.service.pipeline.PipelineTestDoubles.scenes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GraphPipelineStrategyTest {

    private static final String TEXT = "Sam packed a bag. Sam took a train. Sam saw the sea.";

    @Mock
    private SceneSegmenterService segmenter;
    @Mock
    private PromptSynthesizerService promptSynthesizer;

    @BeforeEach
    void setUp() {
        when(segmenter.segment(TEXT, 3)).thenReturn(scenes("bag", "train", "sea"));
    }

    private GraphPipelineStrategy strategy(FakeImageGenerator images) {
        return new GraphPipelineStrategy(new PipelineSteps(segmenter, promptSynthesizer, images));
    }

    private void promptsEchoSummary() {
        when(promptSynthesizer.generatePrompt(anyString(), any(), isNull(), anyList()))
                .thenAnswer(invocation -> "prompt:" + invocation.getArgument(0));
    }

    @Test
    void runsStagesInFixedOrder() {
        when(promptSynthesizer.summarizeGlobalContext(eq(TEXT), anyInt())).thenReturn("A trip to the sea.");
        promptsEchoSummary();
        GraphPipelineStrategy graph = strategy(FakeImageGenerator.working());

        PipelineRun run = graph.run(TEXT, 3);

        assertThat(graph.getStageNames()).containsExactly("segment", "summarize", "prompts", "images");
        assertThat(run.getGlobalSummary().orElse(null)).isEqualTo("A trip to the sea.");
        assertThat(run.getScenes()).extracting(SceneDto.Scene::getPrompt)
                .containsExactly("prompt:bag", "prompt:train", "prompt:sea");
        assertThat(run.getScenes()).extracting(SceneDto.Scene::getImageUrl)
                .containsExactly("https://img.example/bag.png", "https://img.example/train.png",
                        "https://img.example/sea.png");
        verify(promptSynthesizer).generatePrompt(eq("bag"), eq("A trip to the sea."), isNull(), anyList());
    }

    @Test
    void summaryFailureDoesNotStopPipeline() {
        when(promptSynthesizer.summarizeGlobalContext(eq(TEXT), anyInt())).thenThrow(new IllegalStateException("down"));
        promptsEchoSummary();

        PipelineRun run = strategy(FakeImageGenerator.working()).run(TEXT, 3);

        assertThat(run.getGlobalSummary().isFailed()).isTrue();
        assertThat(run.getScenes()).hasSize(3);
        verify(promptSynthesizer).generatePrompt(eq("train"), isNull(), isNull(), anyList());
    }

    @Test
    void imageFailureIsIsolatedToItsScene() {
        when(promptSynthesizer.summarizeGlobalContext(eq(TEXT), anyInt())).thenReturn("Summary");
        promptsEchoSummary();

        PipelineRun run = strategy(new FakeImageGenerator(Set.of("train"), false, 0)).run(TEXT, 3);

        assertThat(run.getScenes()).extracting(SceneDto.Scene::getImageUrl)
                .containsExactly("https://img.example/bag.png", null, "https://img.example/sea.png");
        assertThat(run.getScenes().get(1).getPrompt()).isEqualTo("prompt:train");
    }

    @Test
    void billingFailureAbortsRemainingScenes() {
        when(promptSynthesizer.summarizeGlobalContext(eq(TEXT), anyInt())).thenReturn("Summary");
        promptsEchoSummary();
        FakeImageGenerator images = new FakeImageGenerator(Set.of(), true, 0);

        assertThatThrownBy(() -> strategy(images).run(TEXT, 3)).isInstanceOf(BillingCreditException.class);
        assertThat(images.calls.get()).isEqualTo(1);
    }
}
