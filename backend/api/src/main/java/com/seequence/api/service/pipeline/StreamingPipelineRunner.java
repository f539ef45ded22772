package com.seequence.api.service.pipeline;

import com.seequence.api.dto.SceneDto;
import com.seequence.api.dto.VisualsDto;
import com.seequence.api.service.narration.MergedNarration;
import com.seequence.api.service.narration.NarrationClip;
import com.seequence.api.service.narration.NarrationNotProducedException;
import com.seequence.api.service.narration.NarrationService;
import com.seequence.api.service.narration.SceneAudioFile;
import com.seequence.common.enums.PipelineEventType;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 진행 이벤트를 내보내며 파이프라인을 장면 순서대로 실행
 *
 * 이벤트 순서: segmented → summarized → title → (장면마다 scene_prompt → scene_image_start →
 * scene_image_done → scene_audio_start → scene_audio_done) → merge_start → merge_done → complete
 * 실패 시 그 자리에서 error 하나로 끝난다. 장면 이미지 실패는 크레딧 부족이 아니어도 중단 사유다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamingPipelineRunner {

    private final PipelineSteps steps;
    private final NarrationService narrationService;

    public void run(String text, int maxScenes, PipelineEventListener listener) {
        Emitter emitter = new Emitter(listener);
        try {
            VisualsDto.SingleAudioResponse result = execute(text, maxScenes, emitter);
            emitter.emit(PipelineEvent.withPayload(PipelineEventType.COMPLETE, result));
        } catch (ListenerGoneException e) {
            log.warn("[STREAM] Client disconnected, stopping: {}", e.getMessage());
        } catch (ApiException e) {
            log.warn("[STREAM] Aborted with {}: {}", e.getErrorCode().getCode(), e.getMessage());
            emitError(emitter, e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[STREAM] Unexpected failure", e);
            emitError(emitter, ErrorCode.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private VisualsDto.SingleAudioResponse execute(String text, int maxScenes, Emitter emitter) {
        PipelineRun run = steps.segment(PipelineRun.start(text, maxScenes));
        emitter.emit(PipelineEvent.of(PipelineEventType.SEGMENTED, "scenes", run.getScenes()));

        run = steps.summarize(run);
        emitter.emit(PipelineEvent.of(PipelineEventType.SUMMARIZED,
                "global_summary", run.getGlobalSummary().orElse(null)));

        run = steps.title(run);
        emitter.emit(PipelineEvent.of(PipelineEventType.TITLE, "title", run.getTitle().orElse(null)));

        String globalSummary = run.getGlobalSummary().orElse(null);
        List<SceneDto.Scene> done = new ArrayList<>();
        List<SceneAudioFile> clips = new ArrayList<>();

        for (SceneDto.Scene segmented : run.getScenes()) {
            int sceneId = segmented.getSceneId();

            SceneDto.Scene scene = steps.writePrompt(segmented, globalSummary);
            emitter.emit(PipelineEvent.of(PipelineEventType.SCENE_PROMPT,
                    "scene_id", sceneId, "prompt", scene.getPrompt()));

            emitter.emit(PipelineEvent.of(PipelineEventType.SCENE_IMAGE_START, "scene_id", sceneId));
            scene = steps.renderImage(scene);
            emitter.emit(PipelineEvent.of(PipelineEventType.SCENE_IMAGE_DONE,
                    "scene_id", sceneId, "image_url", scene.getImageUrl()));

            emitter.emit(PipelineEvent.of(PipelineEventType.SCENE_AUDIO_START, "scene_id", sceneId));
            NarrationClip clip = narrationService.synthesize(sceneId, scene.getSceneSummary());
            emitter.emit(PipelineEvent.of(PipelineEventType.SCENE_AUDIO_DONE,
                    "scene_id", sceneId,
                    "audio_url", clip.getAudioUrl(),
                    "audio_duration_seconds", clip.getDurationSeconds()));

            if (clip.isPresent()) {
                clips.add(new SceneAudioFile(sceneId, clip.getFilePath()));
            }
            done.add(scene);
        }

        if (clips.isEmpty()) {
            throw new NarrationNotProducedException(done.size());
        }

        emitter.emit(PipelineEvent.of(PipelineEventType.MERGE_START, "clip_count", clips.size()));
        MergedNarration merged = narrationService.merge(clips);
        emitter.emit(PipelineEvent.of(PipelineEventType.MERGE_DONE,
                "audio_url", merged.getAudioUrl(),
                "duration_seconds", merged.getTotalDurationSeconds(),
                "timeline", merged.getTimeline()));

        return VisualsDto.SingleAudioResponse.builder()
                .title(run.getTitle().orElse(null))
                .audioUrl(merged.getAudioUrl())
                .durationSeconds(merged.getTotalDurationSeconds())
                .timeline(merged.getTimeline())
                .scenes(done)
                .build();
    }

    private void emitError(Emitter emitter, ErrorCode errorCode, String message) {
        try {
            emitter.emit(PipelineEvent.of(PipelineEventType.ERROR,
                    "code", errorCode.getCode(),
                    "message", message != null ? message : errorCode.getMessage()));
        } catch (ListenerGoneException e) {
            log.warn("[STREAM] Could not deliver error event: {}", e.getMessage());
        }
    }

    /**
     * 수신자 예외를 파이프라인 예외와 구분하기 위한 래퍼
     */
    private static final class Emitter {
        private final PipelineEventListener listener;

        private Emitter(PipelineEventListener listener) {
            this.listener = listener;
        }

        void emit(PipelineEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                throw new ListenerGoneException(event, e);
            }
        }
    }

    private static final class ListenerGoneException extends RuntimeException {
        private ListenerGoneException(PipelineEvent event, Throwable cause) {
            super("event '" + event.getName() + "' not delivered: " + cause.getMessage(), cause);
        }
    }
}
