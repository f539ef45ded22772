package com.seequence.api.service.storage;

import com.seequence.api.config.WebConfig;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 생성 파일 저장 영역과 공개 URL prefix
 */
@Getter
@RequiredArgsConstructor
public enum StorageArea {
    AUDIO(WebConfig.AUDIO_URL_PREFIX),
    IMAGE(WebConfig.IMAGE_URL_PREFIX);

    private final String urlPrefix;
}
