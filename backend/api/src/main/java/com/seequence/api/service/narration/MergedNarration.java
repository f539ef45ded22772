package com.seequence.api.service.narration;

import com.seequence.api.dto.SceneDto;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;

/**
 * 병합된 나레이션 트랙
 * totalDurationSeconds 는 병합 파일에서 다시 측정한 값이고,
 * timeline 의 구간은 병합 전 개별 클립 길이의 누적합이다.
 */
@Getter
@Builder
public class MergedNarration {
    private final Path outputPath;
    private final String audioUrl;
    private final double totalDurationSeconds;
    private final List<SceneDto.TimelineEntry> timeline;
}
