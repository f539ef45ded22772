package com.seequence.api.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessExecutorTest {

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void capturesOutputAndExitCode() throws Exception {
        ProcessExecutor.Result result = ProcessExecutor.execute(
                List.of("echo", "ffprobe_ok"), "echo", 10, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput().trim()).isEqualTo("ffprobe_ok");
    }

    @Test
    void unsafeArgumentIsRejectedBeforeLaunch() {
        assertThatThrownBy(() -> ProcessExecutor.execute(
                List.of("ffprobe", "/tmp/tom&jerry/scene_1.mp3"), "ffprobe duration", 10, TimeUnit.SECONDS))
                .isInstanceOf(SecurityException.class)
                .hasMessageStartingWith("Unsafe path detected");
    }
}
