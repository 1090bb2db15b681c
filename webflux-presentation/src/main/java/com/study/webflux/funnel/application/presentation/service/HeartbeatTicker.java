package com.study.webflux.funnel.application.presentation.service;

import java.time.Clock;
import java.time.Duration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.generation.model.GenerationEvent;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;

/**
 * 생성이 느려도 프록시가 연결을 끊지 않도록 주기적으로 keep-alive 주석을 보냅니다.
 *
 * <p>
 * {@code stopSignal}이 값을 내거나 완료되면 멈춥니다. 자체 오류는 본 스트림으로 전파하지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeartbeatTicker {

	private final Clock clock;

	public Flux<GenerationEvent> ticks(Duration interval, Publisher<?> stopSignal) {
		return Flux.interval(interval)
			.map(tick -> GenerationEvent.heartbeat(clock.millis()))
			.takeUntilOther(stopSignal)
			.onErrorResume(error -> {
				log.debug("heartbeat 중단: {}", error.toString());
				return Flux.empty();
			});
	}
}
