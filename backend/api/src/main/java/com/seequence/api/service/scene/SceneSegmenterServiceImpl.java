package com.seequence.api.service.scene;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seequence.api.dto.SceneDto;
import com.seequence.api.service.llm.TextGenerationClient;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM 기반 장면 분할
 *
 * 모델 응답은 그대로 믿지 않고 다시 검증한다.
 * - JSON 파싱 실패 시 응답 안에서 [ ... ] 구간을 찾아 재시도
 * - scene_id는 모델 값과 무관하게 1..N으로 재부여
 * - 필드 누락은 "" / [] 로 대체 (장면 단위로 보존)
 * - source_sentence_indices 와 source_sentences 길이는 짧은 쪽에 맞춘다
 * - 1 미만의 문장 번호는 해당 문장과 함께 제외
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SceneSegmenterServiceImpl implements SceneSegmenterService {

    private static final Pattern JSON_ARRAY = Pattern.compile("\\[[\\s\\S]*]");

    private static final String SYSTEM_INSTRUCTION =
            "You are a skilled story editor for visual learners. Split the user's text into at most {max_scenes} "
            + "clear story beats. Each beat should be a short, concrete scene that is visually depictable. "
            + "Preserve important factual details (names, dates, places, numbers, distinctive objects, colors, "
            + "and actions). Retain concrete nouns and attributes that help the illustrator stay accurate. "
            + "For each scene, list which original sentences (by 1-based index) you used and include their exact text.";

    private static final String USER_INSTRUCTION =
            "Text:\n\n{text}\n\n"
            + "Respond as a JSON array of objects with fields: scene_id (1-based), scene_summary (<= 30 words), "
            + "source_sentence_indices (array of 1-based integers), source_sentences (array of strings).";

    private final TextGenerationClient textGenerationClient;
    private final ObjectMapper objectMapper;

    @Override
    public List<SceneDto.Scene> segment(String text, int maxScenes) {
        if (text == null || text.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "text must not be empty");
        }
        if (maxScenes < 1) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "max_scenes must be >= 1");
        }

        log.info("[SEGMENT] Segmenting text - length: {}, maxScenes: {}", text.length(), maxScenes);
        String raw = textGenerationClient.complete(SYSTEM_INSTRUCTION, USER_INSTRUCTION,
                Map.of("text", text, "max_scenes", maxScenes));

        JsonNode items = parseSceneArray(raw);

        List<SceneDto.Scene> scenes = new ArrayList<>();
        for (JsonNode item : items) {
            if (scenes.size() >= maxScenes) {
                log.debug("[SEGMENT] Model over-produced ({} items), truncating to {}", items.size(), maxScenes);
                break;
            }
            scenes.add(toScene(scenes.size() + 1, item));
        }

        log.info("[SEGMENT] Produced {} scenes", scenes.size());
        return Collections.unmodifiableList(scenes);
    }

    // ========== 응답 파싱 ==========

    JsonNode parseSceneArray(String raw) {
        if (raw == null) {
            throw new MalformedModelOutputException("", null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            root = extractArray(raw, e);
        }

        if (root != null && root.isObject() && root.path("scenes").isArray()) {
            return root.get("scenes");
        }
        if (root == null || !root.isArray()) {
            root = extractArray(raw, null);
        }
        return root;
    }

    private JsonNode extractArray(String raw, Exception original) {
        Matcher matcher = JSON_ARRAY.matcher(raw);
        if (!matcher.find()) {
            log.warn("[SEGMENT] No JSON array found in model output");
            throw new MalformedModelOutputException(raw, original);
        }
        try {
            JsonNode node = objectMapper.readTree(matcher.group());
            if (!node.isArray()) {
                throw new MalformedModelOutputException(raw, original);
            }
            log.debug("[SEGMENT] Recovered JSON array from surrounding text");
            return node;
        } catch (JsonProcessingException e) {
            log.warn("[SEGMENT] Extracted substring is not valid JSON: {}", e.getOriginalMessage());
            throw new MalformedModelOutputException(raw, e);
        }
    }

    private SceneDto.Scene toScene(int sceneId, JsonNode item) {
        if (item.isTextual()) {
            return SceneDto.Scene.builder()
                    .sceneId(sceneId)
                    .sceneSummary(item.asText().trim())
                    .sourceSentenceIndices(List.of())
                    .sourceSentences(List.of())
                    .build();
        }

        String summary = firstText(item, "scene_summary", "summary");
        List<Integer> indices = readIndices(firstArray(item, "source_sentence_indices", "source_indices"));
        List<String> sentences = readSentences(firstArray(item, "source_sentences", "sources"));

        if (indices.size() != sentences.size()) {
            int aligned = Math.min(indices.size(), sentences.size());
            log.debug("[SEGMENT] Scene {} indices/sentences mismatch ({} vs {}), aligning to {}",
                    sceneId, indices.size(), sentences.size(), aligned);
            indices = indices.subList(0, aligned);
            sentences = sentences.subList(0, aligned);
        }

        // 문장 번호는 1부터. 0 이하는 짝이 되는 문장과 함께 버린다
        if (indices.stream().anyMatch(index -> index < 1)) {
            List<Integer> keptIndices = new ArrayList<>();
            List<String> keptSentences = new ArrayList<>();
            for (int i = 0; i < indices.size(); i++) {
                if (indices.get(i) >= 1) {
                    keptIndices.add(indices.get(i));
                    keptSentences.add(sentences.get(i));
                }
            }
            log.debug("[SEGMENT] Scene {} dropped {} non-positive sentence indices",
                    sceneId, indices.size() - keptIndices.size());
            indices = keptIndices;
            sentences = keptSentences;
        }

        return SceneDto.Scene.builder()
                .sceneId(sceneId)
                .sceneSummary(summary)
                .sourceSentenceIndices(List.copyOf(indices))
                .sourceSentences(List.copyOf(sentences))
                .build();
    }

    private String firstText(JsonNode item, String... keys) {
        for (String key : keys) {
            JsonNode value = item.get(key);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return "";
    }

    private JsonNode firstArray(JsonNode item, String... keys) {
        for (String key : keys) {
            JsonNode value = item.get(key);
            if (value != null && value.isArray() && value.size() > 0) {
                return value;
            }
        }
        return null;
    }

    private List<Integer> readIndices(JsonNode array) {
        List<Integer> indices = new ArrayList<>();
        if (array == null) {
            return indices;
        }
        for (JsonNode node : array) {
            if (node.canConvertToInt() && node.isIntegralNumber()) {
                indices.add(node.asInt());
            } else if (node.isTextual() && node.asText().trim().matches("\\d+")) {
                indices.add(Integer.parseInt(node.asText().trim()));
            }
        }
        return indices;
    }

    private List<String> readSentences(JsonNode array) {
        List<String> sentences = new ArrayList<>();
        if (array == null) {
            return sentences;
        }
        for (JsonNode node : array) {
            if (!node.isNull()) {
                sentences.add(node.asText());
            }
        }
        return sentences;
    }
}
