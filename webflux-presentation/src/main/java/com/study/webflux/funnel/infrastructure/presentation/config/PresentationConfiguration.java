package com.study.webflux.funnel.infrastructure.presentation.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.funnel.application.presentation.retry.ExponentialBackoffStrategy;
import com.study.webflux.funnel.application.presentation.retry.RetryPolicy;
import com.study.webflux.funnel.infrastructure.monitoring.config.SlideGenerationMetricsConfiguration;
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;

/** 슬라이드 생성 파이프라인 공통 빈을 제공합니다. */
@Configuration
@EnableConfigurationProperties(SlideGenerationProperties.class)
public class PresentationConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/** AI 호출 재시도 정책을 생성합니다. */
	@Bean
	public RetryPolicy retryPolicy(SlideGenerationProperties properties,
		SlideGenerationMetricsConfiguration metrics) {
		SlideGenerationProperties.Retry retry = properties.getRetry();
		return new RetryPolicy(new ExponentialBackoffStrategy(retry.getBaseDelay(), retry.getMaxDelay()),
			metrics);
	}
}
