package com.seequence.api.service.prompt;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.service.llm.TextGenerationClient;
import com.seequence.api.util.BestEffort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PromptSynthesizerServiceImpl implements PromptSynthesizerService {

    static final String ELLIPSIS = "…";

    // ========== 지시문 ==========

    private static final String KEY_FACTS_SYSTEM =
            "Extract the most important concrete facts to preserve in an illustration. Prefer names, dates, "
            + "locations, quantities, colors, distinctive objects, and relationships.";
    private static final String KEY_FACTS_USER =
            "Scene summary: {scene}\n\nReference snippets (verbatim):\n{references}\n\n"
            + "Return {max_facts} bullets maximum. Keep each bullet under 12 words.";

    private static final String PROMPT_SYSTEM =
            "You are a prompt engineer creating concise, concrete prompts for an illustration model. "
            + "Never ask for text in images or watermarks. Keep critical details from the scene summary "
            + "(names, numbers, locations, distinctive items, colors, relationships) so the image stays informative.";
    private static final String PROMPT_USER =
            "Create a single-sentence image prompt for this scene (35-60 words, present tense).\n"
            + "Global context (for consistency across scenes): {global_context}\n"
            + "Style guide: {style_guide}\n"
            + "Reference snippets from the original text (verbatim, for factual fidelity):\n{references}\n"
            + "Scene: {scene}\n"
            + "Constraints: kid-friendly, dyslexia-friendly visuals, consistent characters/props; no text overlays; "
            + "include composition cues; preserve concrete facts and attributes from the scene.";

    private static final String SUMMARY_SYSTEM =
            "You write a single concise summary capturing overall narrative, recurring characters, setting, "
            + "and tone for consistent visuals.";
    private static final String SUMMARY_USER =
            "Summarize the following text into 1-2 sentences (hard limit {max_chars} characters) "
            + "for global visual context.\n\n{text}";

    private static final String TITLE_SYSTEM =
            "You craft concise, engaging educational titles that summarize the core topic precisely.";
    private static final String TITLE_USER =
            "Write a short textbook chapter title (max {max_chars} chars) for the following content. "
            + "Avoid quotes.\n\n{text}";

    private final TextGenerationClient textGenerationClient;
    private final SeequenceProperties properties;

    @Override
    public BestEffort<String> extractKeyFacts(String sceneSummary, List<String> sourceSentences, int maxFacts) {
        if (sourceSentences == null || sourceSentences.isEmpty()) {
            return BestEffort.empty();
        }
        return BestEffort.attempt("key facts", () -> {
            String facts = textGenerationClient.complete(KEY_FACTS_SYSTEM, KEY_FACTS_USER, Map.of(
                    "scene", nullToEmpty(sceneSummary),
                    "references", String.join("\n", sourceSentences),
                    "max_facts", maxFacts));
            return StringUtils.hasText(facts) ? facts.trim() : null;
        });
    }

    @Override
    public String generatePrompt(String sceneSummary, String globalSummary, String styleGuide,
                                 List<String> sourceSentences) {
        String effectiveStyle = StringUtils.hasText(styleGuide)
                ? styleGuide
                : properties.getPrompt().getStyleGuide();

        String references = sourceSentences == null ? "" : String.join("\n", sourceSentences);
        BestEffort<String> keyFacts = extractKeyFacts(sceneSummary, sourceSentences, DEFAULT_MAX_FACTS);
        String referenceBlock = keyFacts.map(facts -> "Key facts to preserve:\n" + facts + "\n\n").orElse("")
                + references;

        String prompt = textGenerationClient.complete(PROMPT_SYSTEM, PROMPT_USER, Map.of(
                "scene", nullToEmpty(sceneSummary),
                "global_context", nullToEmpty(globalSummary),
                "style_guide", nullToEmpty(effectiveStyle),
                "references", referenceBlock));
        return nullToEmpty(prompt).trim();
    }

    @Override
    public String summarizeGlobalContext(String text, int maxChars) {
        String summary = textGenerationClient.complete(SUMMARY_SYSTEM, SUMMARY_USER,
                Map.of("text", nullToEmpty(text), "max_chars", maxChars));
        return truncate(nullToEmpty(summary).trim(), maxChars);
    }

    @Override
    public String generateTitle(String text, int maxChars) {
        String title = textGenerationClient.complete(TITLE_SYSTEM, TITLE_USER,
                Map.of("text", nullToEmpty(text), "max_chars", maxChars));
        return truncate(stripWrappingQuotes(nullToEmpty(title).trim()), maxChars);
    }

    /**
     * 양 끝이 같은 따옴표로 감싸진 경우만 제거 ("The Sun" → The Sun, Sam's Trip 은 그대로)
     */
    static String stripWrappingQuotes(String title) {
        if (title.length() >= 2) {
            char first = title.charAt(0);
            char last = title.charAt(title.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return title.substring(1, title.length() - 1).trim();
            }
        }
        return title;
    }

    /**
     * maxChars 초과 시 maxChars-1 글자 + "…" (결과 길이는 maxChars 이하)
     */
    static String truncate(String value, int maxChars) {
        if (maxChars < 1) {
            return "";
        }
        if (value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars - 1) + ELLIPSIS;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
