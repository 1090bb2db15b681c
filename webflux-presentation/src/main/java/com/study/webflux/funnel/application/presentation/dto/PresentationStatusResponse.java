package com.study.webflux.funnel.application.presentation.dto;

import com.study.webflux.funnel.domain.presentation.model.Presentation;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;

/**
 * 재개 여부와 재개 위치를 판단하기 위한 프레젠테이션 상태 요약입니다.
 */
public record PresentationStatusResponse(
	String presentationId,
	PresentationStatus status,
	int generationProgress,
	int slideCount,
	Integer totalExpectedSlides,
	String errorMessage,
	boolean resumable,
	int nextSlideNumber
) {
	public static PresentationStatusResponse from(Presentation presentation) {
		int persisted = presentation.contiguousSlideCount();
		return new PresentationStatusResponse(presentation.id().value(),
			presentation.status(),
			presentation.generationProgress(),
			presentation.slideCount(),
			presentation.totalExpectedSlides(),
			presentation.errorMessage(),
			presentation.status().canTransitionTo(PresentationStatus.GENERATING),
			persisted + 1);
	}
}
