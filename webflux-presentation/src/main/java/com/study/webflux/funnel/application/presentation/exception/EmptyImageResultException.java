package com.study.webflux.funnel.application.presentation.exception;

/** 이미지 공급자가 결과 URL 없이 응답했습니다. 재시도하지 않습니다. */
public class EmptyImageResultException extends RuntimeException {

	public EmptyImageResultException() {
		super("Image provider returned no image");
	}
}
