package com.seequence.api.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * CORS 및 생성 파일 정적 서빙 설정
 * - /static/audio/** → 나레이션 출력 디렉토리
 * - /static/images/** → 이미지 출력 디렉토리
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    public static final String AUDIO_URL_PREFIX = "/static/audio/";
    public static final String IMAGE_URL_PREFIX = "/static/images/";

    private final SeequenceProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        SeequenceProperties.Cors cors = properties.getCors();
        CorsRegistration registration = registry.addMapping("/**")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600L);

        if (StringUtils.hasText(cors.getAllowedOriginPattern())) {
            registration.allowedOriginPatterns(cors.getAllowedOriginPattern().trim());
            log.info("[CORS] Origin pattern: {}", cors.getAllowedOriginPattern());
        } else if (cors.getAllowedOrigins().contains("*")) {
            registration.allowedOriginPatterns("*");
        } else {
            registration.allowedOrigins(cors.getAllowedOrigins().toArray(new String[0]));
            log.info("[CORS] Allowed origins: {}", cors.getAllowedOrigins());
        }
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler(AUDIO_URL_PREFIX + "**")
                .addResourceLocations(toLocation(properties.getNarration().getOutputDir()));
        registry.addResourceHandler(IMAGE_URL_PREFIX + "**")
                .addResourceLocations(toLocation(properties.getImage().getOutputDir()));
    }

    private String toLocation(String dir) {
        String uri = Paths.get(dir).toAbsolutePath().toUri().toString();
        return uri.endsWith("/") ? uri : uri + "/";
    }
}
