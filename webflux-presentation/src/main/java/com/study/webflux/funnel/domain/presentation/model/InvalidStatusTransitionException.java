package com.study.webflux.funnel.domain.presentation.model;

/**
 * 허용되지 않은 프레젠테이션 상태 전이를 시도했을 때 발생합니다.
 */
public class InvalidStatusTransitionException extends RuntimeException {

	private final PresentationStatus from;
	private final PresentationStatus to;

	public InvalidStatusTransitionException(PresentationId presentationId,
		PresentationStatus from,
		PresentationStatus to) {
		super("Cannot transition presentation " + presentationId.value() + " from "
			+ (from == null ? "unknown" : from.getValue()) + " to " + to.getValue());
		this.from = from;
		this.to = to;
	}

	public PresentationStatus getFrom() {
		return from;
	}

	public PresentationStatus getTo() {
		return to;
	}
}
