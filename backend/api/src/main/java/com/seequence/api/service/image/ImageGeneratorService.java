package com.seequence.api.service.image;

/**
 * 이미지 생성 서비스
 * seequence.image.provider 설정에 따라 구현체가 하나만 등록된다.
 */
public interface ImageGeneratorService {

    /**
     * 프롬프트 하나로 이미지 하나 생성
     * @param prompt 이미지 프롬프트
     * @param seed 재현용 시드 (nullable)
     * @return 이미지 URL (원격 URL, /static/images/... 상대 경로, 또는 file://)
     * @throws BillingCreditException 크레딧 부족 (재시도 없음)
     * @throws UpstreamProviderException 재시도/폴백 후에도 실패
     * @throws UnrecognizedProviderResponseException 응답에서 URL을 찾지 못함
     */
    String generate(String prompt, Integer seed);

    /**
     * 유료 호출 없이 설정만 확인 (토큰/키 존재 여부)
     */
    boolean canGenerateImages();

    String getProviderName();
}
