package com.seequence.api.controller;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.config.ThreadPoolConfig;
import com.seequence.api.dto.VisualsDto;
import com.seequence.api.service.pipeline.PipelineEvent;
import com.seequence.api.service.pipeline.StreamingPipelineRunner;
import com.seequence.common.enums.PipelineEventType;
import com.seequence.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 진행 이벤트 스트리밍 (Server-Sent Events)
 * 요청 스레드는 SseEmitter 를 바로 반환하고 실행은 streamExecutor 에서 진행된다.
 * 풀이 가득 차면 error 이벤트(C003) 하나를 보내고 닫는다.
 */
@Slf4j
@RestController
@RequestMapping("${seequence.api-prefix:/api}")
@Tag(name = "Visuals Stream", description = "비주얼 생성 진행 상황 SSE")
public class StreamController {

    private static final long EMITTER_TIMEOUT_MS = 30 * 60 * 1000L;

    private final StreamingPipelineRunner streamingPipelineRunner;
    private final SeequenceProperties properties;
    private final Executor executor;

    public StreamController(StreamingPipelineRunner streamingPipelineRunner,
                            SeequenceProperties properties,
                            @Qualifier(ThreadPoolConfig.STREAM_EXECUTOR) Executor executor) {
        this.streamingPipelineRunner = streamingPipelineRunner;
        this.properties = properties;
        this.executor = executor;
    }

    @PostMapping(value = "/generate_visuals_stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "비주얼 생성 스트리밍", description = "단계별 진행 이벤트를 보내고 complete 또는 error 로 끝납니다.")
    public SseEmitter generateVisualsStream(@Valid @RequestBody VisualsDto.TextRequest request) {
        int maxScenes = request.getMaxScenes() != null
                ? request.getMaxScenes() : properties.getPipeline().getDefaultMaxScenes();
        log.info("[STREAM] Start - textLength: {}, maxScenes: {}", request.getText().length(), maxScenes);

        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        try {
            executor.execute(() -> {
                try {
                    streamingPipelineRunner.run(request.getText(), maxScenes, event -> send(emitter, event));
                } finally {
                    emitter.complete();
                }
            });
        } catch (RejectedExecutionException e) {
            ErrorCode errorCode = ErrorCode.STREAM_CAPACITY_EXCEEDED;
            log.warn("[STREAM] Rejected, stream pool is full: {}", e.getMessage());
            send(emitter, PipelineEvent.of(PipelineEventType.ERROR,
                    "code", errorCode.getCode(), "message", errorCode.getMessage()));
            emitter.complete();
        }
        return emitter;
    }

    private static void send(SseEmitter emitter, PipelineEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.getName())
                    .data(event.getData(), MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
