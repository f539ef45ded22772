package com.seequence.api.service.prompt;

import com.seequence.api.util.BestEffort;

import java.util.List;

/**
 * 장면 → 이미지 생성 프롬프트, 전체 요약, 제목
 */
public interface PromptSynthesizerService {

    int DEFAULT_MAX_FACTS = 6;
    int DEFAULT_SUMMARY_CHARS = 400;
    int DEFAULT_TITLE_CHARS = 80;

    /**
     * 원문 인용에서 보존할 핵심 사실을 bullet 목록으로 추출 (실패해도 예외 없음)
     */
    BestEffort<String> extractKeyFacts(String sceneSummary, List<String> sourceSentences, int maxFacts);

    /**
     * 장면 하나에 대한 이미지 프롬프트 (한 문장, 현재 시제)
     * @param styleGuide null 또는 공백이면 설정된 기본 스타일 가이드 사용
     */
    String generatePrompt(String sceneSummary, String globalSummary, String styleGuide, List<String> sourceSentences);

    String summarizeGlobalContext(String text, int maxChars);

    String generateTitle(String text, int maxChars);
}
