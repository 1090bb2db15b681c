package com.study.webflux.funnel.domain.presentation.port;

import com.study.webflux.funnel.domain.generation.model.GenerationCommand;
import com.study.webflux.funnel.domain.generation.model.GenerationEvent;
import com.study.webflux.funnel.domain.generation.model.GenerationJob;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface PresentationStreamUseCase {

	/** 입력 검증, 권한 확인, 레코드 생성 또는 재개를 수행합니다. 스트림 시작 전 오류는 여기서 발생합니다. */
	Mono<GenerationJob> prepare(GenerationCommand command);

	Flux<GenerationEvent> stream(GenerationJob job);
}
