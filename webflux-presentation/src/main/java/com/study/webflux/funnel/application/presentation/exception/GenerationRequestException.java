package com.study.webflux.funnel.application.presentation.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 스트림 시작 전에 거부된 생성 요청입니다. HTTP 상태와 함께 클라이언트가 분기할 수 있는 오류 코드를 가집니다.
 */
public class GenerationRequestException extends ResponseStatusException {

	private final String code;

	public GenerationRequestException(HttpStatus status, String code, String reason) {
		super(status, reason);
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public static GenerationRequestException badRequest(String code, String reason) {
		return new GenerationRequestException(HttpStatus.BAD_REQUEST, code, reason);
	}

	public static GenerationRequestException unauthorized() {
		return new GenerationRequestException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED",
			"Unauthorized");
	}

	public static GenerationRequestException forbidden() {
		return new GenerationRequestException(HttpStatus.FORBIDDEN, "ACCESS_DENIED",
			"Access denied");
	}

	public static GenerationRequestException notFound(String code, String reason) {
		return new GenerationRequestException(HttpStatus.NOT_FOUND, code, reason);
	}

	public static GenerationRequestException tooManyRequests(String code, String reason) {
		return new GenerationRequestException(HttpStatus.TOO_MANY_REQUESTS, code, reason);
	}

	public static GenerationRequestException conflict(String code, String reason) {
		return new GenerationRequestException(HttpStatus.CONFLICT, code, reason);
	}
}
