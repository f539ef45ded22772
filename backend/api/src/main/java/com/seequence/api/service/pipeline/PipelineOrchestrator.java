package com.seequence.api.service.pipeline;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.config.ThreadPoolConfig;
import com.seequence.api.dto.SceneDto;
import com.seequence.api.dto.VisualsDto;
import com.seequence.api.service.image.ImageGeneratorService;
import com.seequence.api.service.narration.MergedNarration;
import com.seequence.api.service.narration.NarrationClip;
import com.seequence.api.service.narration.NarrationNotProducedException;
import com.seequence.api.service.narration.NarrationService;
import com.seequence.api.service.narration.SceneAudioFile;
import com.seequence.api.service.scene.SceneSegmenterService;
import com.seequence.common.enums.PipelineEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 요청 단위 진입점
 * 분할 → 요약 → 프롬프트 → 이미지 → 나레이션 → 병합 흐름을 조립한다.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final SceneSegmenterService sceneSegmenterService;
    private final ImageGeneratorService imageGeneratorService;
    private final NarrationService narrationService;
    private final PipelineSteps steps;
    private final Executor executor;
    private final PipelineStrategy strategy;

    public PipelineOrchestrator(SceneSegmenterService sceneSegmenterService,
                                ImageGeneratorService imageGeneratorService,
                                NarrationService narrationService,
                                PipelineSteps steps,
                                List<PipelineStrategy> strategies,
                                SeequenceProperties properties,
                                @Qualifier(ThreadPoolConfig.GENERATION_EXECUTOR) Executor executor) {
        this.sceneSegmenterService = sceneSegmenterService;
        this.imageGeneratorService = imageGeneratorService;
        this.narrationService = narrationService;
        this.steps = steps;
        this.executor = executor;
        this.strategy = selectStrategy(strategies, properties.getPipeline().getEngine());
        log.info("[PIPELINE] Engine: {} ({})", strategy.getEngine().getCode(), strategy.getClass().getSimpleName());
    }

    static PipelineStrategy selectStrategy(List<PipelineStrategy> strategies, String engineCode) {
        Map<PipelineEngine, PipelineStrategy> byEngine = new EnumMap<>(PipelineEngine.class);
        for (PipelineStrategy candidate : strategies) {
            byEngine.put(candidate.getEngine(), candidate);
        }
        PipelineEngine engine = PipelineEngine.fromCode(engineCode);
        PipelineStrategy selected = byEngine.get(engine);
        if (selected == null) {
            throw new IllegalStateException("No pipeline strategy registered for engine: " + engine.getCode());
        }
        return selected;
    }

    public PipelineEngine getEngine() {
        return strategy.getEngine();
    }

    // ========== 단일 단계 ==========

    public List<SceneDto.Scene> segment(String text, int maxScenes) {
        return sceneSegmenterService.segment(text, maxScenes);
    }

    public String generateImage(String prompt, Integer seed) {
        return imageGeneratorService.generate(prompt, seed);
    }

    // ========== 비주얼 ==========

    public VisualsDto.VisualsResponse generateVisuals(String text, int maxScenes) {
        PipelineRun run = runVisuals(text, maxScenes);
        return VisualsDto.VisualsResponse.builder()
                .title(run.getTitle().orElse(null))
                .scenes(run.getScenes())
                .build();
    }

    /**
     * 비주얼 + 장면별 나레이션 (장면 요약을 읽는다)
     * 나레이션 실패는 해당 장면의 audio_url = null 로만 남는다.
     */
    public VisualsDto.VisualsWithAudioResponse generateVisualsWithAudio(String text, int maxScenes) {
        PipelineRun run = runVisuals(text, maxScenes);
        List<NarrationClip> clips = narrateAll(run.getScenes());

        List<SceneDto.SceneWithAudio> scenes = new ArrayList<>();
        for (int i = 0; i < run.getScenes().size(); i++) {
            NarrationClip clip = clips.get(i);
            scenes.add(SceneDto.SceneWithAudio.of(run.getScenes().get(i), clip.getAudioUrl(), clip.getDurationSeconds()));
        }
        return VisualsDto.VisualsWithAudioResponse.builder()
                .title(run.getTitle().orElse(null))
                .scenes(scenes)
                .build();
    }

    /**
     * 비주얼 + 나레이션을 하나의 트랙으로 병합
     * @throws NarrationNotProducedException 모든 장면의 나레이션이 실패한 경우
     * @throws com.seequence.api.service.narration.AudioMergeException 병합 실패
     */
    public VisualsDto.SingleAudioResponse generateVisualsSingleAudio(String text, int maxScenes) {
        PipelineRun run = runVisuals(text, maxScenes);
        List<NarrationClip> clips = narrateAll(run.getScenes());
        MergedNarration merged = mergePresent(run.getScenes(), clips);

        return VisualsDto.SingleAudioResponse.builder()
                .title(run.getTitle().orElse(null))
                .audioUrl(merged.getAudioUrl())
                .durationSeconds(merged.getTotalDurationSeconds())
                .timeline(merged.getTimeline())
                .scenes(run.getScenes())
                .build();
    }

    /**
     * 존재하는 클립만 장면 순서대로 병합
     */
    MergedNarration mergePresent(List<SceneDto.Scene> scenes, List<NarrationClip> clips) {
        List<SceneAudioFile> present = new ArrayList<>();
        for (int i = 0; i < scenes.size(); i++) {
            NarrationClip clip = clips.get(i);
            if (clip.isPresent()) {
                present.add(new SceneAudioFile(scenes.get(i).getSceneId(), clip.getFilePath()));
            }
        }
        if (present.isEmpty()) {
            throw new NarrationNotProducedException(scenes.size());
        }
        log.info("[PIPELINE] Merging {} of {} narration clips", present.size(), scenes.size());
        return narrationService.merge(present);
    }

    private PipelineRun runVisuals(String text, int maxScenes) {
        long startedAt = System.currentTimeMillis();
        PipelineRun run = steps.title(strategy.run(text, maxScenes));
        log.info("[PIPELINE] Visuals done: {} scenes, {} with image, {}ms",
                run.getScenes().size(),
                run.getScenes().stream().filter(s -> s.getImageUrl() != null).count(),
                System.currentTimeMillis() - startedAt);
        return run;
    }

    /**
     * 장면별 나레이션을 동시에 생성. 결과는 장면 순서 그대로
     */
    private List<NarrationClip> narrateAll(List<SceneDto.Scene> scenes) {
        List<CompletableFuture<NarrationClip>> futures = new ArrayList<>();
        for (SceneDto.Scene scene : scenes) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> narrationService.synthesize(scene.getSceneId(), scene.getSceneSummary()), executor)
                    .exceptionally(e -> {
                        log.warn("[PIPELINE] Scene {} narration failed: {}", scene.getSceneId(), e.getMessage());
                        return NarrationClip.empty();
                    }));
        }
        List<NarrationClip> clips = new ArrayList<>();
        for (CompletableFuture<NarrationClip> future : futures) {
            clips.add(future.join());
        }
        return clips;
    }
}
