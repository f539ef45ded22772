package com.seequence.api.service.pipeline;

import java.util.function.UnaryOperator;

/**
 * 파이프라인 단계 (PipelineRun → PipelineRun)
 */
public interface PipelineStage {

    String getName();

    PipelineRun apply(PipelineRun run);

    static PipelineStage of(String name, UnaryOperator<PipelineRun> transform) {
        return new PipelineStage() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public PipelineRun apply(PipelineRun run) {
                return transform.apply(run);
            }
        };
    }
}
