package com.study.webflux.funnel.domain.generation.port;

import java.time.Duration;

import reactor.core.publisher.Mono;

public interface ImageDownloadPort {

	/** 제한 시간을 넘기면 진행 중인 요청을 취소하고 오류로 종료합니다. */
	Mono<byte[]> download(String url, Duration timeout);
}
