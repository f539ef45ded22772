package com.seequence.api.controller;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.dto.VisualsDto;
import com.seequence.api.service.ocr.OcrService;
import com.seequence.api.service.pipeline.PipelineOrchestrator;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OcrController.class)
@Import(OcrControllerTest.PropertiesConfig.class)
class OcrControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(SeequenceProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OcrService ocrService;

    @MockitoBean
    private PipelineOrchestrator pipelineOrchestrator;

    @Test
    void ocrFromUrlReturnsExtractedText() throws Exception {
        when(ocrService.extractFromUrl("https://img.example/page.png", null)).thenReturn("The fox ran.");

        mockMvc.perform(post("/api/ocr/from_image_url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image_url\":\"https://img.example/page.png\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.extracted_text").value("The fox ran."));
    }

    @Test
    void uploadPassesBytesAndContentType() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "page.jpg", "image/jpeg", new byte[]{1, 2, 3});
        when(ocrService.extractFromBytes(any(byte[].class), eq("image/jpeg"), eq("Title only"))).thenReturn("Chapter One");

        mockMvc.perform(multipart("/api/ocr/from_image_upload").file(file).param("prompt_hint", "Title only"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.extracted_text").value("Chapter One"));
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "page.png", "image/png", new byte[0]);

        mockMvc.perform(multipart("/api/ocr/from_image_upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C002"));

        verifyNoInteractions(ocrService);
    }

    @Test
    void noTextFoundMapsToUnprocessableEntity() throws Exception {
        when(ocrService.extractFromUrl(anyString(), isNull())).thenThrow(new ApiException(ErrorCode.OCR_NO_TEXT));

        mockMvc.perform(post("/api/ocr/from_image_url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image_url\":\"https://img.example/blank.png\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("O001"));
    }

    @Test
    void visualsFromUploadCombinesTextAndResult() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "page.png", "image/png", new byte[]{9});
        when(ocrService.extractFromBytes(any(byte[].class), eq("image/png"), isNull())).thenReturn("Sam packs a red bag.");
        when(pipelineOrchestrator.generateVisuals("Sam packs a red bag.", 2)).thenReturn(
                VisualsDto.VisualsResponse.builder().title("Packing Day").scenes(List.of()).build());

        mockMvc.perform(multipart("/api/generate_visuals_from_image_upload").file(file).param("max_scenes", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.extracted_text").value("Sam packs a red bag."))
                .andExpect(jsonPath("$.data.result.title").value("Packing Day"));
    }

    @Test
    void visualsFromUploadRejectsZeroMaxScenes() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "page.png", "image/png", new byte[]{9});

        mockMvc.perform(multipart("/api/generate_visuals_from_image_upload").file(file).param("max_scenes", "0"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ocrService, pipelineOrchestrator);
    }
}
