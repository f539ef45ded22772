package com.seequence.api.service.pipeline;

import com.seequence.common.enums.PipelineEngine;

/**
 * 분할 → 요약 → 프롬프트 → 이미지 실행 방식
 */
public interface PipelineStrategy {

    PipelineEngine getEngine();

    /**
     * @return 장면마다 prompt 와 image_url(실패 시 null)이 채워진 상태
     * @throws com.seequence.api.service.image.BillingCreditException 크레딧 부족 시 남은 작업 중단
     */
    PipelineRun run(String text, int maxScenes);
}
