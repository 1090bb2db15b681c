package com.study.webflux.funnel.application.presentation.exception;

import java.time.Duration;

/** 전체 생성 제한 시간을 넘겼습니다. */
public class GenerationTimeoutException extends RuntimeException {

	public GenerationTimeoutException(Duration deadline) {
		super("Generation exceeded deadline of " + deadline.toMinutes() + " minutes");
	}
}
