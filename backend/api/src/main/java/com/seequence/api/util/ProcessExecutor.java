package com.seequence.api.util;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 오디오 도구(ffmpeg, ffprobe) 프로세스 실행
 * stderr는 stdout에 합쳐 읽고, 제한 시간을 넘기면 강제 종료한다.
 */
@Slf4j
public final class ProcessExecutor {

    private static final int MAX_OUTPUT_LINES = 1000;

    private ProcessExecutor() {
    }

    /**
     * 명령어 실행 결과
     */
    @Getter
    @RequiredArgsConstructor
    public static class Result {
        private final int exitCode;
        private final String output;

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * ffmpeg / ffprobe 실행
     * 인자는 PathValidator로 먼저 검사하며, 위반 시 SecurityException
     * @param taskName 로그에 남길 작업 이름
     */
    public static Result execute(List<String> command, String taskName, long timeout, TimeUnit unit)
            throws IOException, InterruptedException, TimeoutException {
        PathValidator.validateCommandArgs(command);
        log.debug("[PROCESS] {} -> {}", taskName, command.get(0));

        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        String output = drain(process);

        if (!process.waitFor(timeout, unit)) {
            process.destroyForcibly();
            log.error("[PROCESS] {} timed out after {} {}", taskName, timeout, unit);
            throw new TimeoutException(taskName + " timed out after " + timeout + " " + unit);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.warn("[PROCESS] {} exited with {}: {}", taskName, exitCode, abbreviate(output, 300));
        }
        return new Result(exitCode, output);
    }

    // 출력은 끝까지 읽되 MAX_OUTPUT_LINES 줄까지만 보관
    private static String drain(Process process) throws IOException {
        StringBuilder kept = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            int lines = 0;
            for (String line = reader.readLine(); line != null; line = reader.readLine()) {
                if (lines++ < MAX_OUTPUT_LINES) {
                    kept.append(line).append('\n');
                }
            }
        }
        return kept.toString();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
