package com.seequence.api.service.narration;

/**
 * 텍스트 → 음성(mp3) 바이트
 */
public interface SpeechSynthesisClient {

    /**
     * @return 오디오 바이트 (비어 있으면 실패로 간주)
     * @throws RuntimeException 호출 실패
     */
    byte[] synthesize(String text);

    /**
     * 설정상 음성 합성이 가능한지 (provider, API 키)
     */
    boolean isConfigured();

    String getVoice();
}
