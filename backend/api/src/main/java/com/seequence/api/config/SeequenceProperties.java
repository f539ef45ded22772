package com.seequence.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * application.yml의 seequence.* 설정
 * 환경 변수(OPENAI_API_KEY, REPLICATE_API_TOKEN 등)는 application.yml에서 연결한다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "seequence")
public class SeequenceProperties {

    /** 컨트롤러 경로 prefix */
    private String apiPrefix = "/api";
    private Cors cors = new Cors();
    private Http http = new Http();
    private Llm llm = new Llm();
    private Image image = new Image();
    private Narration narration = new Narration();
    private Prompt prompt = new Prompt();
    private Pipeline pipeline = new Pipeline();
    private Executor executor = new Executor();

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        /** 지정하면 allowedOrigins 대신 사용 */
        private String allowedOriginPattern;
    }

    @Getter
    @Setter
    public static class Http {
        private int connectTimeoutMs = 30000;
        private int readTimeoutMs = 300000;
    }

    @Getter
    @Setter
    public static class Llm {
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private String visionModel = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private double temperature = 0.3;
    }

    @Getter
    @Setter
    public static class Image {
        /** replicate | openai */
        private String provider = "replicate";
        private String outputDir = "/tmp/seequence_images";
        private Replicate replicate = new Replicate();
        private OpenAi openai = new OpenAi();
    }

    @Getter
    @Setter
    public static class Replicate {
        private String apiToken;
        private String baseUrl = "https://api.replicate.com";
        private String model = "black-forest-labs/flux-1.1-pro";
        private int timeoutSeconds = 300;
        private String aspectRatio = "16:9";
        private Integer width;
        private Integer height;
        private int maxAttempts = 3;
        private long initialBackoffMs = 2000;
        private long maxBackoffMs = 20000;
        private long pollIntervalMs = 1000;
    }

    @Getter
    @Setter
    public static class OpenAi {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-image-1";
        private String size = "1536x1024";
        private List<String> fallbackSizes = new ArrayList<>(List.of("1792x1024", "1024x1024"));
    }

    @Getter
    @Setter
    public static class Narration {
        /** openai 이외의 값이면 나레이션을 생성하지 않는다 */
        private String provider = "openai";
        private String model = "gpt-4o-mini-tts";
        private String voice = "alloy";
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String outputDir = "/tmp/seequence_audio";
        private int probeAttempts = 5;
        private long probeDelayMs = 100;
        private String ffmpegPath = "ffmpeg";
        private String ffprobePath = "ffprobe";
    }

    @Getter
    @Setter
    public static class Prompt {
        public static final String DEFAULT_STYLE_GUIDE = "Friendly illustrated style; kid- and dyslexia-friendly; "
                + "gentle colors; clear primary subject; soft lighting; clean composition; "
                + "avoid text overlays and watermarks; maintain consistent characters/props across scenes.";

        private String styleGuide;

        /** 비어 있으면 DEFAULT_STYLE_GUIDE (STYLE_GUIDE="" 포함) */
        public String getStyleGuide() {
            return styleGuide == null || styleGuide.isBlank() ? DEFAULT_STYLE_GUIDE : styleGuide;
        }
    }

    @Getter
    @Setter
    public static class Pipeline {
        /** graph | imperative */
        private String engine = "graph";
        private int maxConcurrency = 4;
        private int defaultMaxScenes = 8;
    }

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 8;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        private String threadNamePrefix = "generation-";
        /** SSE 실행 전용 풀. 스트림 하나가 파이프라인 끝까지 스레드 하나를 점유한다. */
        private int streamPoolSize = 4;
        private int streamQueueCapacity = 8;
        private String streamThreadNamePrefix = "stream-";
    }
}
