package com.study.webflux.funnel.domain.generation.port;

import reactor.core.publisher.Mono;

public interface ObjectStoragePort {

	/** 객체를 업로드하고 공개 URL을 반환합니다. */
	Mono<String> upload(String path, byte[] content, String contentType);
}
