package com.study.webflux.funnel.application.presentation.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 지터가 있는 지수 백오프 전략
 *
 * <p>
 * 재시도 시도 번호 {@code k} (두 번째 시도가 2)에 대해 {@code min(baseDelay * 2^(k - 2) * jitter, maxDelay)} 만큼 대기합니다.
 * {@code jitter}는 [0.7, 1.3] 구간의 균등 분포입니다.
 *
 * <p>
 * 예시 (baseDelay=1초, maxDelay=10초):
 * <ul>
 * <li>2번째 시도: 0.7~1.3초</li>
 * <li>3번째 시도: 1.4~2.6초</li>
 * <li>4번째 시도: 2.8~5.2초</li>
 * <li>6번째 시도 이상: 최대 10초</li>
 * </ul>
 */
public class ExponentialBackoffStrategy {

	public static final double MIN_JITTER = 0.7;
	public static final double MAX_JITTER = 1.3;

	private final Duration baseDelay;
	private final Duration maxDelay;
	private final DoubleSupplier randomSource;

	public ExponentialBackoffStrategy(Duration baseDelay, Duration maxDelay) {
		this(baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
	}

	/**
	 * @param randomSource
	 *            [0, 1) 구간의 난수 공급자. 테스트에서 지터를 고정할 때 사용합니다.
	 */
	public ExponentialBackoffStrategy(Duration baseDelay,
		Duration maxDelay,
		DoubleSupplier randomSource) {
		if (baseDelay.isNegative() || baseDelay.isZero()) {
			throw new IllegalArgumentException("baseDelay must be positive");
		}
		if (maxDelay.compareTo(baseDelay) < 0) {
			throw new IllegalArgumentException(
				"maxDelay must be greater than or equal to baseDelay");
		}
		this.baseDelay = baseDelay;
		this.maxDelay = maxDelay;
		this.randomSource = randomSource;
	}

	/**
	 * 시도 번호에 따른 대기 시간 계산
	 *
	 * @param attempt
	 *            곧 실행할 시도 번호 (첫 시도는 1)
	 * @return 대기 시간. 첫 시도는 대기하지 않습니다.
	 */
	public Duration calculateDelay(int attempt) {
		if (attempt <= 1) {
			return Duration.ZERO;
		}

		double multiplier = Math.pow(2, attempt - 2);
		double jitter = MIN_JITTER + (MAX_JITTER - MIN_JITTER) * randomSource.getAsDouble();
		double delayMillis = baseDelay.toMillis() * multiplier * jitter;

		return Duration.ofMillis((long) Math.min(delayMillis, maxDelay.toMillis()));
	}

	public Duration getBaseDelay() {
		return baseDelay;
	}

	public Duration getMaxDelay() {
		return maxDelay;
	}
}
