package com.seequence.api.controller;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.dto.SceneDto;
import com.seequence.api.dto.VisualsDto;
import com.seequence.api.service.image.ImageGeneratorService;
import com.seequence.api.service.pipeline.PipelineOrchestrator;
import com.seequence.common.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("${seequence.api-prefix:/api}")
@Tag(name = "Visuals", description = "장면 분할, 이미지, 나레이션 생성 API")
public class VisualsController {

    private final PipelineOrchestrator pipelineOrchestrator;
    private final ImageGeneratorService imageGeneratorService;
    private final SeequenceProperties properties;

    @GetMapping("/health")
    @Operation(summary = "상태 확인", description = "서버 상태와 이미지 생성 설정 여부를 반환합니다.")
    public ApiResponse<VisualsDto.HealthResponse> health() {
        return ApiResponse.success(VisualsDto.HealthResponse.builder()
                .status("ok")
                .imageProviderConfigured(imageGeneratorService.canGenerateImages())
                .pipelineEngine(pipelineOrchestrator.getEngine().getCode())
                .build());
    }

    // ========== 단일 단계 ==========

    @PostMapping("/segment")
    @Operation(summary = "장면 분할", description = "텍스트를 순서 있는 장면 목록으로 나눕니다.")
    public ApiResponse<VisualsDto.SegmentResponse> segment(@Valid @RequestBody VisualsDto.TextRequest request) {
        int maxScenes = resolveMaxScenes(request.getMaxScenes());
        log.info("[Visuals] Segment - textLength: {}, maxScenes: {}", request.getText().length(), maxScenes);
        List<SceneDto.Scene> scenes = pipelineOrchestrator.segment(request.getText(), maxScenes);
        return ApiResponse.success(VisualsDto.SegmentResponse.builder().scenes(scenes).build());
    }

    @PostMapping("/generate_image")
    @Operation(summary = "이미지 생성", description = "프롬프트 하나로 이미지 하나를 생성합니다.")
    public ApiResponse<VisualsDto.GenerateImageResponse> generateImage(
            @Valid @RequestBody VisualsDto.GenerateImageRequest request) {
        log.info("[Visuals] Generate image - seed: {}", request.getSeed());
        String imageUrl = pipelineOrchestrator.generateImage(request.getPrompt(), request.getSeed());
        return ApiResponse.success(VisualsDto.GenerateImageResponse.builder().imageUrl(imageUrl).build());
    }

    // ========== 비주얼 ==========

    @PostMapping("/generate_visuals")
    @Operation(summary = "비주얼 생성", description = "장면 분할부터 장면별 이미지까지 생성합니다.")
    public ApiResponse<VisualsDto.VisualsResponse> generateVisuals(@Valid @RequestBody VisualsDto.TextRequest request) {
        int maxScenes = resolveMaxScenes(request.getMaxScenes());
        log.info("[Visuals] Generate visuals - textLength: {}, maxScenes: {}", request.getText().length(), maxScenes);
        return ApiResponse.success(pipelineOrchestrator.generateVisuals(request.getText(), maxScenes));
    }

    @PostMapping("/generate_visuals_with_audio")
    @Operation(summary = "비주얼 + 장면별 나레이션", description = "장면마다 이미지와 나레이션 오디오를 생성합니다.")
    public ApiResponse<VisualsDto.VisualsWithAudioResponse> generateVisualsWithAudio(
            @Valid @RequestBody VisualsDto.TextRequest request) {
        int maxScenes = resolveMaxScenes(request.getMaxScenes());
        log.info("[Visuals] Generate visuals with audio - maxScenes: {}", maxScenes);
        return ApiResponse.success(pipelineOrchestrator.generateVisualsWithAudio(request.getText(), maxScenes));
    }

    @PostMapping("/generate_visuals_single_audio")
    @Operation(summary = "비주얼 + 단일 나레이션 트랙", description = "장면별 나레이션을 하나로 병합하고 타임라인을 반환합니다.")
    public ApiResponse<VisualsDto.SingleAudioResponse> generateVisualsSingleAudio(
            @Valid @RequestBody VisualsDto.TextRequest request) {
        int maxScenes = resolveMaxScenes(request.getMaxScenes());
        log.info("[Visuals] Generate visuals single audio - maxScenes: {}", maxScenes);
        return ApiResponse.success(pipelineOrchestrator.generateVisualsSingleAudio(request.getText(), maxScenes));
    }

    private int resolveMaxScenes(Integer requested) {
        return requested != null ? requested : properties.getPipeline().getDefaultMaxScenes();
    }
}
