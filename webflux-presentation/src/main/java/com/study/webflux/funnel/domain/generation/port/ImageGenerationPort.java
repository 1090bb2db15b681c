package com.study.webflux.funnel.domain.generation.port;

import com.study.webflux.funnel.domain.generation.model.ImageGenerationRequest;
import reactor.core.publisher.Mono;

public interface ImageGenerationPort {

	/**
	 * 이미지를 생성하고 임시 URL을 반환합니다. 공급자가 결과를 돌려주지 않으면 빈 {@link Mono}를 반환합니다.
	 */
	Mono<String> generate(ImageGenerationRequest request);
}
