package com.study.webflux.funnel.domain.generation.port;

import java.time.Duration;

import reactor.core.publisher.Mono;

public interface RateLimitPort {

	/** 고정 윈도우 안에서 요청 한 건을 허용할지 판단합니다. */
	Mono<Boolean> tryAcquire(String identifier, int limit, Duration window);
}
