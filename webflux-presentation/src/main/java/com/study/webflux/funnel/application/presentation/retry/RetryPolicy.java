package com.study.webflux.funnel.application.presentation.retry;

import java.time.Duration;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.funnel.infrastructure.monitoring.config.SlideGenerationMetricsConfiguration;
import reactor.core.publisher.Mono;

/**
 * 분류 가능한 실패에 대한 제한 횟수 재시도 정책입니다.
 *
 * <p>
 * 시간 제한은 각 작업이 스스로 가져야 합니다. {@link FailureClass#TERMINAL} 실패는 즉시 전파하고, 재시도 가능한 실패는 남은 시도가 있는 동안
 * {@link ExponentialBackoffStrategy} 간격으로 다시 실행합니다. 시도를 모두 소진하면 마지막 실패를 그대로 전파합니다.
 */
@Slf4j
public class RetryPolicy {

	private final ExponentialBackoffStrategy backoffStrategy;
	private final SlideGenerationMetricsConfiguration metrics;

	public RetryPolicy(ExponentialBackoffStrategy backoffStrategy,
		SlideGenerationMetricsConfiguration metrics) {
		this.backoffStrategy = backoffStrategy;
		this.metrics = metrics;
	}

	public <T> Mono<T> withRetry(Supplier<Mono<T>> operation,
		int maxAttempts,
		FailureClassifier classifier,
		String operationName) {
		if (maxAttempts < 1) {
			return Mono.error(new IllegalArgumentException("maxAttempts must be at least 1"));
		}
		return attempt(operation, 1, maxAttempts, classifier, operationName);
	}

	private <T> Mono<T> attempt(Supplier<Mono<T>> operation,
		int attempt,
		int maxAttempts,
		FailureClassifier classifier,
		String operationName) {
		return Mono.defer(operation).onErrorResume(error -> {
			if (classifier.classify(error) == FailureClass.TERMINAL) {
				log.warn("{} 재시도 불가 실패 (시도 {}/{}): {}", operationName, attempt, maxAttempts,
					error.toString());
				return Mono.error(error);
			}
			if (attempt >= maxAttempts) {
				log.warn("{} 재시도 소진 (시도 {}/{}): {}", operationName, attempt, maxAttempts,
					error.toString());
				return Mono.error(error);
			}

			int nextAttempt = attempt + 1;
			Duration delay = backoffStrategy.calculateDelay(nextAttempt);
			log.info("{} 재시도 예정 - 시도 {}/{}, {}ms 후: {}", operationName, nextAttempt, maxAttempts,
				delay.toMillis(), error.toString());
			metrics.recordRetry(operationName);

			return Mono.delay(delay)
				.then(attempt(operation, nextAttempt, maxAttempts, classifier, operationName));
		});
	}
}
