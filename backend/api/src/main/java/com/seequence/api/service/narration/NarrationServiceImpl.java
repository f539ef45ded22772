package com.seequence.api.service.narration;

import com.seequence.api.dto.SceneDto;
import com.seequence.api.service.storage.StorageArea;
import com.seequence.api.service.storage.StorageService;
import com.seequence.api.util.FileNames;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class NarrationServiceImpl implements NarrationService {

    private final SpeechSynthesisClient speechSynthesisClient;
    private final StorageService storageService;
    private final AudioDurationProbe durationProbe;
    private final AudioConcatenator audioConcatenator;

    // ========== 장면 나레이션 ==========

    @Override
    public NarrationClip synthesize(int sceneId, String text) {
        if (text == null || text.isBlank()) {
            return NarrationClip.empty();
        }
        if (!speechSynthesisClient.isConfigured()) {
            log.error("[TTS] Speech provider not configured; scene {} has no audio", sceneId);
            return NarrationClip.empty();
        }

        String fileName = String.format("scene_%d_%s_%d_%s.mp3", sceneId,
                FileNames.sanitize(speechSynthesisClient.getVoice()), FileNames.epochNanos(), FileNames.shortRandom());
        try {
            byte[] audio = speechSynthesisClient.synthesize(text);
            if (audio == null || audio.length == 0) {
                log.error("[TTS] Scene {} returned no audio bytes", sceneId);
                return NarrationClip.empty();
            }
            String url = storageService.upload(StorageArea.AUDIO, fileName, audio);
            Path path = storageService.resolve(StorageArea.AUDIO, fileName);
            double duration = durationProbe.probe(path);
            log.info("[TTS] Scene {} narrated: {} ({}s)", sceneId, url, duration);
            return new NarrationClip(url, duration, path);
        } catch (RuntimeException e) {
            log.error("[TTS] Scene {} narration failed: {}", sceneId, e.getMessage());
            return NarrationClip.empty();
        }
    }

    // ========== 병합 ==========

    @Override
    public MergedNarration merge(List<SceneAudioFile> clips) {
        if (clips == null || clips.isEmpty()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "No input files to concatenate");
        }

        // 병합 실패 시에도 쓸 수 있도록 타임라인 먼저 계산
        List<SceneDto.TimelineEntry> timeline = new ArrayList<>();
        List<Path> inputs = new ArrayList<>();
        double cursor = 0.0;
        for (SceneAudioFile clip : clips) {
            double duration = durationProbe.probe(clip.getPath());
            timeline.add(SceneDto.TimelineEntry.builder()
                    .sceneId(clip.getSceneId())
                    .startSec(cursor)
                    .durationSec(duration)
                    .build());
            inputs.add(clip.getPath());
            cursor += duration;
        }

        if (!audioConcatenator.isAvailable()) {
            throw new AudioMergeException(audioConcatenator.getToolName()
                    + " not found on PATH. Install it (e.g. `apt-get install ffmpeg` or `brew install ffmpeg`).",
                    timeline, null);
        }

        String fileName = "sequence_" + FileNames.epochNanos() + "_" + FileNames.shortRandom() + ".mp3";
        Path output = storageService.resolve(StorageArea.AUDIO, fileName);
        log.info("[MERGE] Merging {} clips ({}s by parts) -> {}", clips.size(), cursor, fileName);

        try {
            audioConcatenator.concat(inputs, storageService.directory(StorageArea.AUDIO), output);
        } catch (IOException e) {
            log.error("[MERGE] Concat failed: {}", e.getMessage());
            throw new AudioMergeException("Audio merge failed: " + e.getMessage(), timeline, e);
        }

        double total = durationProbe.probe(output);
        log.info("[MERGE] Merged track {}s (parts sum {}s)", total, cursor);

        return MergedNarration.builder()
                .outputPath(output)
                .audioUrl(storageService.publicUrl(StorageArea.AUDIO, fileName))
                .totalDurationSeconds(total)
                .timeline(List.copyOf(timeline))
                .build();
    }
}
