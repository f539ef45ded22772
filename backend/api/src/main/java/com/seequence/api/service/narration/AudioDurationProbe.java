package com.seequence.api.service.narration;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.util.ProcessExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 오디오 파일 길이(초) 측정
 * - .wav: javax.sound.sampled (frame 수 / frame rate)
 * - 그 외(.mp3 등): ffprobe format=duration
 * 측정 실패 시 짧게 대기 후 재시도하고, 끝내 실패하면 0.0 (경고 로그)
 */
@Slf4j
@Component
public class AudioDurationProbe {

    private static final long FFPROBE_TIMEOUT_SECONDS = 30;

    private final int attempts;
    private final long delayMs;
    private final String ffprobePath;

    public AudioDurationProbe(SeequenceProperties properties) {
        SeequenceProperties.Narration config = properties.getNarration();
        this.attempts = Math.max(1, config.getProbeAttempts());
        this.delayMs = Math.max(0, config.getProbeDelayMs());
        this.ffprobePath = config.getFfprobePath();
    }

    public double probe(Path path) {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                Double duration = probeOnce(path);
                if (duration != null && duration > 0) {
                    return duration;
                }
            } catch (IOException | UnsupportedAudioFileException | TimeoutException e) {
                log.debug("[TTS] Duration read failed for {} (attempt {}): {}", path, attempt, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                // PathValidator 거부(SecurityException) 등도 길이 0.0 처리
                log.warn("[TTS] Duration read rejected for {} (attempt {}): {}", path, attempt, e.getMessage());
            }

            if (attempt < attempts && delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.warn("[TTS] Duration fallback 0.0 for {} (size={} bytes)", path, sizeOf(path));
        return 0.0;
    }

    Double probeOnce(Path path) throws IOException, UnsupportedAudioFileException,
            InterruptedException, TimeoutException {
        if (!Files.isRegularFile(path)) {
            return null;
        }
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".wav")) {
            return probeWav(path);
        }
        return probeWithFfprobe(path);
    }

    private Double probeWav(Path path) throws IOException, UnsupportedAudioFileException {
        try (AudioInputStream stream = AudioSystem.getAudioInputStream(path.toFile())) {
            AudioFormat format = stream.getFormat();
            long frames = stream.getFrameLength();
            if (format.getFrameRate() <= 0 || frames == AudioSystem.NOT_SPECIFIED) {
                return null;
            }
            return frames / (double) format.getFrameRate();
        }
    }

    private Double probeWithFfprobe(Path path) throws IOException, InterruptedException, TimeoutException {
        List<String> command = List.of(
                ffprobePath,
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                path.toAbsolutePath().toString()
        );
        ProcessExecutor.Result result = ProcessExecutor.execute(
                command, "ffprobe duration", FFPROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            return null;
        }
        String output = result.getOutput().trim();
        if (output.isEmpty() || "N/A".equals(output)) {
            return null;
        }
        try {
            return Double.parseDouble(output.lines().findFirst().orElse("").trim());
        } catch (NumberFormatException e) {
            log.debug("[TTS] Unparseable ffprobe output: {}", output);
            return null;
        }
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            return -1;
        }
    }
}
