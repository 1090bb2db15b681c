package com.study.webflux.funnel.infrastructure.monitoring.config;

import java.time.Duration;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * 슬라이드 생성 파이프라인 메트릭을 제공합니다.
 *
 * <p>
 * 작업 시작/종료 상태, 생성된 슬라이드 수, 이미지 성공/실패/생략, 진행 저장 실패, 재시도 횟수, 작업 소요 시간을 기록합니다.
 */
@Component
public class SlideGenerationMetricsConfiguration {

	private final MeterRegistry meterRegistry;

	// Counters
	private final Counter jobStartedCounter;
	private final Counter slidesGeneratedCounter;
	private final Counter imageSuccessCounter;
	private final Counter imageFailureCounter;
	private final Counter imageSkippedCounter;
	private final Counter persistenceFailureCounter;

	// Timer
	private final Timer jobDurationTimer;

	public SlideGenerationMetricsConfiguration(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		this.jobStartedCounter = Counter.builder("presentation.generation.started")
			.description("Number of generation jobs started")
			.register(meterRegistry);

		this.slidesGeneratedCounter = Counter.builder("presentation.slides.generated")
			.description("Number of slides generated")
			.register(meterRegistry);

		this.imageSuccessCounter = Counter.builder("presentation.image.success")
			.description("Number of slide images generated and stored")
			.register(meterRegistry);

		this.imageFailureCounter = Counter.builder("presentation.image.failure")
			.description("Number of slide images abandoned after retries")
			.register(meterRegistry);

		this.imageSkippedCounter = Counter.builder("presentation.image.skipped")
			.description("Number of slides without an image prompt")
			.register(meterRegistry);

		this.persistenceFailureCounter = Counter.builder("presentation.persistence.failure")
			.description("Number of slide appends that failed to persist")
			.register(meterRegistry);

		this.jobDurationTimer = Timer.builder("presentation.generation.duration")
			.description("Wall time of a generation job until its terminal state")
			.publishPercentiles(0.5, 0.9, 0.99)
			.register(meterRegistry);
	}

	public void recordJobStarted() {
		jobStartedCounter.increment();
	}

	/**
	 * 작업 종료 상태(completed, draft, failed, cancelled)를 기록합니다.
	 */
	public void recordJobFinished(String outcome, Duration elapsed) {
		Counter.builder("presentation.generation.finished")
			.tag("outcome", outcome)
			.description("Number of generation jobs by terminal outcome")
			.register(meterRegistry)
			.increment();
		jobDurationTimer.record(elapsed);
	}

	public void recordSlideGenerated() {
		slidesGeneratedCounter.increment();
	}

	public void recordImageSuccess() {
		imageSuccessCounter.increment();
	}

	public void recordImageFailure() {
		imageFailureCounter.increment();
	}

	public void recordImageSkipped() {
		imageSkippedCounter.increment();
	}

	public void recordPersistenceFailure() {
		persistenceFailureCounter.increment();
	}

	/**
	 * 재시도 한 번을 작업 이름별로 기록합니다.
	 */
	public void recordRetry(String operation) {
		Counter.builder("presentation.retry")
			.tag("operation", operation)
			.description("Number of retries by operation")
			.register(meterRegistry)
			.increment();
	}
}
