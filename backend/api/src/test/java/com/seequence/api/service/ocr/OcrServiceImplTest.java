package com.seequence.api.service.ocr;

import com.seequence.api.service.llm.VisionTextExtractor;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OcrServiceImplTest {

    @Mock
    private VisionTextExtractor visionTextExtractor;

    private OcrServiceImpl ocrService;

    @BeforeEach
    void setUp() {
        ocrService = new OcrServiceImpl(visionTextExtractor);
    }

    @Test
    void blankHintFallsBackToDefaultInstruction() {
        when(visionTextExtractor.extractText("https://img.example/page.png", OcrService.DEFAULT_HINT))
                .thenReturn("  The fox ran.\nThe end.  ");

        String text = ocrService.extractFromUrl("https://img.example/page.png", "  ");

        assertThat(text).isEqualTo("The fox ran.\nThe end.");
    }

    @Test
    void customHintIsPassedThrough() {
        when(visionTextExtractor.extractText("https://img.example/page.png", "Only the title"))
                .thenReturn("Chapter One");

        assertThat(ocrService.extractFromUrl("https://img.example/page.png", "Only the title")).isEqualTo("Chapter One");
    }

    @Test
    void emptyExtractionIsReportedAsNoText() {
        when(visionTextExtractor.extractText(anyString(), anyString())).thenReturn("   ");

        assertThatThrownBy(() -> ocrService.extractFromUrl("https://img.example/blank.png", null))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getErrorCode()).isEqualTo(ErrorCode.OCR_NO_TEXT));
    }

    @Test
    void blankUrlIsRejected() {
        assertThatThrownBy(() -> ocrService.extractFromUrl(" ", null))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_REQUEST));
        verifyNoInteractions(visionTextExtractor);
    }

    @Test
    void uploadedBytesAreSentAsDataUrl() {
        byte[] data = "fake-jpeg".getBytes(StandardCharsets.UTF_8);
        when(visionTextExtractor.extractText("data:image/jpeg;base64,ZmFrZS1qcGVn", OcrService.DEFAULT_HINT))
                .thenReturn("Hello");

        assertThat(ocrService.extractFromBytes(data, "image/jpeg", null)).isEqualTo("Hello");
    }

    @Test
    void missingContentTypeDefaultsToPng() {
        assertThat(OcrServiceImpl.toDataUrl(new byte[]{1, 2, 3}, null)).isEqualTo("data:image/png;base64,AQID");
    }

    @Test
    void emptyUploadIsRejectedWithoutCallingExtractor() {
        assertThatThrownBy(() -> ocrService.extractFromBytes(new byte[0], "image/png", null))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_REQUEST));
        verify(visionTextExtractor, never()).extractText(anyString(), anyString());
    }
}
