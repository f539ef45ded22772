package com.seequence.api.service.narration;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 오디오 파일 무손실 이어붙이기
 */
public interface AudioConcatenator {

    /**
     * 외부 도구 사용 가능 여부
     */
    boolean isAvailable();

    /**
     * @param inputs 순서대로 이어붙일 파일
     * @param workDir concat 목록 등 임시 파일을 둘 디렉토리
     * @param output 결과 파일
     */
    void concat(List<Path> inputs, Path workDir, Path output) throws IOException;

    String getToolName();
}
