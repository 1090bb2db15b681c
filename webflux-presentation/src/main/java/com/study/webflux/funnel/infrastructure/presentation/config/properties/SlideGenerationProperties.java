package com.study.webflux.funnel.infrastructure.presentation.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/** 슬라이드 스트리밍 생성 설정 ({@code funnel.presentation.*}) */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "funnel.presentation")
public class SlideGenerationProperties {

	private Stream stream = new Stream();
	private Text text = new Text();
	private Image image = new Image();
	private Retry retry = new Retry();
	private RateLimit rateLimit = new RateLimit();
	private Quota quota = new Quota();
	private Storage storage = new Storage();

	@Getter
	@Setter
	public static class Stream {
		/** 전체 생성 작업 제한 시간 */
		private Duration deadline = Duration.ofMinutes(75);
		private Duration heartbeatInterval = Duration.ofSeconds(20);
		/** 슬라이드 사이 대기 시간. 0이면 대기하지 않습니다. */
		private Duration interSlideDelay = Duration.ofMillis(200);
	}

	@Getter
	@Setter
	public static class Text {
		@NotBlank
		private String model = "gpt-4o-mini";
		private double temperature = 0.7;
		private int maxTokens = 1000;
		private Duration timeout = Duration.ofSeconds(60);
		@Min(1)
		private int maxAttempts = 2;
	}

	@Getter
	@Setter
	public static class Image {
		private boolean enabled = true;
		@NotBlank
		private String model = "dall-e-3";
		private String size = "1792x1024";
		private String quality = "standard";
		private String style = "natural";
		private Duration generationTimeout = Duration.ofSeconds(90);
		private Duration downloadTimeout = Duration.ofSeconds(30);
		@Min(1)
		private int maxAttempts = 2;
	}

	@Getter
	@Setter
	public static class Retry {
		private Duration baseDelay = Duration.ofSeconds(1);
		private Duration maxDelay = Duration.ofSeconds(10);
	}

	@Getter
	@Setter
	public static class RateLimit {
		private String keyPrefix = "presentation-generation";
		@Min(1)
		private int maxRequests = 10;
		private Duration window = Duration.ofSeconds(60);
	}

	@Getter
	@Setter
	public static class Quota {
		private boolean enabled = true;
		@Min(1)
		private int maxPerProject = 3;
	}

	@Getter
	@Setter
	public static class Storage {
		@NotBlank
		private String bucket = "presentation-assets";
		private String region = "us-east-1";
		/** S3 호환 저장소 엔드포인트. 비어 있으면 AWS 기본 엔드포인트를 사용합니다. */
		private String endpoint;
		/** 업로드된 객체의 공개 URL 접두어. 비어 있으면 버킷 기본 URL을 사용합니다. */
		private String publicBaseUrl;
		private String cacheControl = "public, max-age=31536000";
		private String pathPrefix = "presentations";
	}
}
