package com.study.webflux.funnel.domain.generation.model;

import com.study.webflux.funnel.domain.presentation.model.Slide;
import reactor.core.publisher.Mono;

/**
 * 슬라이드 하나가 완성될 때마다 호출됩니다. 반환된 {@link Mono}가 완료되어야 다음 슬라이드 생성이 시작됩니다.
 */
@FunctionalInterface
public interface SlideCompletionCallback {

	Mono<Void> onSlideGenerated(Slide slide, int progress);

	static SlideCompletionCallback noop() {
		return (slide, progress) -> Mono.empty();
	}
}
