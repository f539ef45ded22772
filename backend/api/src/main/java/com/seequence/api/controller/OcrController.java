package com.seequence.api.controller;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.dto.OcrDto;
import com.seequence.api.dto.VisualsDto;
import com.seequence.api.service.ocr.OcrService;
import com.seequence.api.service.pipeline.PipelineOrchestrator;
import com.seequence.common.dto.ApiResponse;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("${seequence.api-prefix:/api}")
@Tag(name = "OCR", description = "이미지 텍스트 추출 및 이미지 기반 비주얼 생성 API")
public class OcrController {

    private final OcrService ocrService;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final SeequenceProperties properties;

    // ========== 텍스트 추출 ==========

    @PostMapping("/ocr/from_image_url")
    @Operation(summary = "이미지 URL 텍스트 추출")
    public ApiResponse<OcrDto.TextResponse> ocrFromImageUrl(@Valid @RequestBody OcrDto.ImageUrlRequest request) {
        String text = ocrService.extractFromUrl(request.getImageUrl(), request.getPromptHint());
        return ApiResponse.success(OcrDto.TextResponse.builder().extractedText(text).build());
    }

    @PostMapping(value = "/ocr/from_image_upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "업로드 이미지 텍스트 추출")
    public ApiResponse<OcrDto.TextResponse> ocrFromImageUpload(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "prompt_hint", required = false) String promptHint) {
        String text = extractFromUpload(file, promptHint);
        return ApiResponse.success(OcrDto.TextResponse.builder().extractedText(text).build());
    }

    // ========== 이미지 → 비주얼 ==========

    @PostMapping("/generate_visuals_from_image_url")
    @Operation(summary = "이미지 URL 기반 비주얼 생성", description = "이미지에서 텍스트를 추출한 뒤 비주얼을 생성합니다.")
    public ApiResponse<OcrDto.VisualsFromImageResponse> generateVisualsFromImageUrl(
            @Valid @RequestBody OcrDto.VisualsFromImageUrlRequest request) {
        String text = ocrService.extractFromUrl(request.getImageUrl(), request.getPromptHint());
        return ApiResponse.success(visualsFor(text, request.getMaxScenes()));
    }

    @PostMapping(value = "/generate_visuals_from_image_upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "업로드 이미지 기반 비주얼 생성")
    public ApiResponse<OcrDto.VisualsFromImageResponse> generateVisualsFromImageUpload(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "max_scenes", required = false) Integer maxScenes,
            @RequestParam(value = "prompt_hint", required = false) String promptHint) {
        if (maxScenes != null && maxScenes < 1) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "max_scenes must be at least 1");
        }
        String text = extractFromUpload(file, promptHint);
        return ApiResponse.success(visualsFor(text, maxScenes));
    }

    private OcrDto.VisualsFromImageResponse visualsFor(String text, Integer maxScenes) {
        int resolved = maxScenes != null ? maxScenes : properties.getPipeline().getDefaultMaxScenes();
        log.info("[OCR] Generating visuals from {} extracted chars, maxScenes: {}", text.length(), resolved);
        VisualsDto.VisualsResponse result = pipelineOrchestrator.generateVisuals(text, resolved);
        return OcrDto.VisualsFromImageResponse.builder()
                .extractedText(text)
                .result(result)
                .build();
    }

    private String extractFromUpload(MultipartFile file, String promptHint) {
        if (file == null || file.isEmpty()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Uploaded image is empty");
        }
        try {
            return ocrService.extractFromBytes(file.getBytes(), file.getContentType(), promptHint);
        } catch (IOException e) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Failed to read uploaded image: " + e.getMessage(), e);
        }
    }
}
