package com.study.webflux.funnel.domain.presentation.port;

import java.util.List;

import com.study.webflux.funnel.domain.presentation.model.Presentation;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import reactor.core.publisher.Mono;

public interface PresentationRepository {

	Mono<Presentation> create(Presentation presentation);

	Mono<Presentation> findById(PresentationId id);

	/** 실패 상태를 제외한 프로젝트의 프레젠테이션 수 */
	Mono<Long> countActiveByProject(String funnelProjectId);

	/**
	 * 슬라이드 하나를 원자적으로 추가하고 진행률을 올립니다. 같은 번호의 슬라이드가 이미 있으면 아무것도 바꾸지 않고 {@code false}를
	 * 반환합니다. 진행률은 줄어들지 않습니다.
	 */
	Mono<Boolean> appendSlide(PresentationId id, Slide slide, int progress);

	/**
	 * 현재 상태가 대상 상태의 허용된 이전 상태일 때만 상태를 바꿉니다. 조건이 맞지 않으면
	 * {@link com.study.webflux.funnel.domain.presentation.model.InvalidStatusTransitionException}으로 종료합니다.
	 */
	Mono<Void> transitionStatus(PresentationId id, PresentationStatus target, String errorMessage);

	/** 전체 슬라이드 목록으로 교체하고 완료 상태로 전환합니다. */
	Mono<Void> complete(PresentationId id, List<Slide> slides);
}
