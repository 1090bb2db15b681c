package com.study.webflux.funnel.application.presentation.exception;

/**
 * 필수 텍스트 생성이 재시도 후에도 실패하여 작업이 중단되었음을 나타냅니다.
 */
public class SlideGenerationException extends RuntimeException {

	private final int slideNumber;
	private final int completedSlides;

	public SlideGenerationException(int slideNumber, int completedSlides, Throwable cause) {
		super("Failed to generate slide " + slideNumber + ": " + describe(cause), cause);
		this.slideNumber = slideNumber;
		this.completedSlides = completedSlides;
	}

	public int getSlideNumber() {
		return slideNumber;
	}

	/** 이번 실행에서 실패 전까지 완성된 슬라이드 수 */
	public int getCompletedSlides() {
		return completedSlides;
	}

	private static String describe(Throwable cause) {
		if (cause == null) {
			return "unknown error";
		}
		return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
	}
}
