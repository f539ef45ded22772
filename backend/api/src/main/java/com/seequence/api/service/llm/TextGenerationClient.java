package com.seequence.api.service.llm;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 텍스트 생성(LLM) 호출 인터페이스
 * 장면 분할, 요약, 핵심 사실 추출, 프롬프트 작성, 제목 생성이 모두 이 인터페이스만 사용한다.
 */
public interface TextGenerationClient {

    Pattern VARIABLE = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)}");

    /**
     * @param systemInstruction 시스템 지시문
     * @param userInstruction 사용자 지시문 ({name} 형태의 변수 포함 가능)
     * @param variables 지시문에 채워 넣을 값
     * @return 모델 응답 텍스트
     */
    String complete(String systemInstruction, String userInstruction, Map<String, ?> variables);

    /**
     * {name} 치환. 변수 맵에 없는 이름은 그대로 둔다 (JSON 예시의 중괄호 보존).
     */
    static String render(String template, Map<String, ?> variables) {
        if (template == null || variables == null || variables.isEmpty()) {
            return template;
        }
        Matcher matcher = VARIABLE.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = variables.containsKey(name)
                    ? String.valueOf(variables.get(name))
                    : matcher.group(0);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
