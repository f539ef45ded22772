package com.seequence.api.service.pipeline;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.config.ThreadPoolConfig;
import com.seequence.api.dto.SceneDto;
import com.seequence.api.service.image.BillingCreditException;
import com.seequence.common.enums.PipelineEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 순차 실행 + 이미지 병렬 생성
 *
 * 분할, 요약, 프롬프트는 순서대로 실행하고 이미지는 generationExecutor 에서
 * 요청별 Semaphore(max-concurrency) 안에서 동시에 생성한다.
 * 크레딧 부족이 하나라도 나오면 아직 시작하지 않은 장면은 건너뛰고 예외를 전파한다.
 */
@Slf4j
@Component
public class ImperativePipelineStrategy implements PipelineStrategy {

    private final PipelineSteps steps;
    private final Executor executor;
    private final int maxConcurrency;

    public ImperativePipelineStrategy(PipelineSteps steps,
                                      SeequenceProperties properties,
                                      @Qualifier(ThreadPoolConfig.GENERATION_EXECUTOR) Executor executor) {
        this.steps = steps;
        this.executor = executor;
        this.maxConcurrency = Math.max(1, properties.getPipeline().getMaxConcurrency());
    }

    @Override
    public PipelineEngine getEngine() {
        return PipelineEngine.IMPERATIVE;
    }

    @Override
    public PipelineRun run(String text, int maxScenes) {
        PipelineRun run = steps.segment(PipelineRun.start(text, maxScenes));
        run = steps.summarize(run);
        run = steps.writePrompts(run);
        return run.withScenes(renderAll(run.getScenes()));
    }

    private List<SceneDto.Scene> renderAll(List<SceneDto.Scene> scenes) {
        if (scenes.isEmpty()) {
            return scenes;
        }
        log.info("[PIPELINE] Rendering {} images (max concurrency {})", scenes.size(), maxConcurrency);

        Semaphore permits = new Semaphore(maxConcurrency);
        AtomicBoolean aborted = new AtomicBoolean(false);
        List<CompletableFuture<SceneDto.Scene>> futures = new ArrayList<>();

        for (SceneDto.Scene scene : scenes) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> renderWithPermit(scene, permits, aborted), executor));
        }

        // 하나라도 실패하면 aborted 플래그로 대기 중인 작업이 곧바로 끝나므로 전체 완료를 기다린다
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> null)
                .join();

        RuntimeException failure = null;
        List<SceneDto.Scene> rendered = new ArrayList<>();
        for (CompletableFuture<SceneDto.Scene> future : futures) {
            Throwable error = failureOf(future);
            if (error instanceof BillingCreditException billing) {
                log.error("[PIPELINE] Billing failure, remaining scenes aborted: {}", billing.getMessage());
                throw billing;
            }
            if (error != null) {
                if (failure == null) {
                    failure = error instanceof RuntimeException runtime
                            ? runtime : new CompletionException(error);
                }
                continue;
            }
            rendered.add(future.join());
        }
        if (failure != null) {
            throw failure;
        }
        return rendered;
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) {
            return null;
        }
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return e;
        }
    }

    private SceneDto.Scene renderWithPermit(SceneDto.Scene scene, Semaphore permits, AtomicBoolean aborted) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for image slot");
        }
        try {
            if (aborted.get()) {
                throw new CancellationException("Scene " + scene.getSceneId() + " skipped after billing failure");
            }
            try {
                return steps.renderImageIsolated(scene);
            } catch (BillingCreditException e) {
                aborted.set(true);
                throw e;
            }
        } finally {
            permits.release();
        }
    }
}
