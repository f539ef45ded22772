package com.seequence.api.service.storage;

import java.nio.file.Path;

/**
 * 생성된 이미지/오디오 파일 저장소
 */
public interface StorageService {

    /**
     * 파일 저장 후 공개 URL 반환
     * 반환 시점에 파일 쓰기는 끝나 있다 (임시 파일 → rename).
     * @param area 저장 영역
     * @param fileName 파일 이름 (경로 구분자 불가)
     * @param data 파일 데이터
     * @return /static/audio/... 또는 /static/images/...
     */
    String upload(StorageArea area, String fileName, byte[] data);

    /**
     * 저장 영역 내 파일 경로 (존재 여부와 무관)
     */
    Path resolve(StorageArea area, String fileName);

    /**
     * 저장 영역 내 파일의 공개 URL
     */
    String publicUrl(StorageArea area, String fileName);

    Path directory(StorageArea area);
}
