package com.seequence.api.service.narration;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.util.FileNames;
import com.seequence.api.util.ProcessExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ffmpeg concat demuxer (-c copy)
 */
@Slf4j
@Component
public class FfmpegAudioConcatenator implements AudioConcatenator {

    private static final long VERSION_TIMEOUT_SECONDS = 10;
    private static final long CONCAT_TIMEOUT_MINUTES = 3;

    private final String ffmpegPath;

    public FfmpegAudioConcatenator(SeequenceProperties properties) {
        this.ffmpegPath = properties.getNarration().getFfmpegPath();
    }

    @Override
    public boolean isAvailable() {
        try {
            ProcessExecutor.Result result = ProcessExecutor.execute(
                    List.of(ffmpegPath, "-version"), "ffmpeg check", VERSION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return result.isSuccess();
        } catch (IOException | TimeoutException e) {
            log.debug("[MERGE] ffmpeg not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void concat(List<Path> inputs, Path workDir, Path output) throws IOException {
        Path listPath = workDir.resolve("concat_" + FileNames.epochNanos() + "_" + FileNames.shortRandom() + ".txt");

        StringBuilder listContent = new StringBuilder();
        for (Path input : inputs) {
            String escaped = input.toAbsolutePath().toString().replace("'", "'\\''");
            listContent.append("file '").append(escaped).append("'\n");
        }

        try {
            Files.writeString(listPath, listContent.toString(), StandardCharsets.UTF_8);

            List<String> command = List.of(
                    ffmpegPath, "-y",
                    "-f", "concat",
                    "-safe", "0",
                    "-i", listPath.toAbsolutePath().toString(),
                    "-c", "copy",
                    output.toAbsolutePath().toString()
            );
            ProcessExecutor.Result result = ProcessExecutor.execute(
                    command, "ffmpeg concat", CONCAT_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            if (!result.isSuccess()) {
                String out = result.getOutput();
                throw new IOException("ffmpeg concat failed: " + out.substring(Math.max(0, out.length() - 4000)));
            }
            log.info("[MERGE] {} clips merged: {}", inputs.size(), output);
        } catch (TimeoutException e) {
            throw new IOException("ffmpeg concat timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("ffmpeg concat interrupted", e);
        } finally {
            Files.deleteIfExists(listPath);
        }
    }

    @Override
    public String getToolName() {
        return "ffmpeg";
    }
}
