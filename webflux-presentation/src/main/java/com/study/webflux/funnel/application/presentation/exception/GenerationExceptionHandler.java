package com.study.webflux.funnel.application.presentation.exception;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.funnel.application.presentation.dto.ErrorResponse;

/**
 * 스트림 시작 전 오류를 {@code {error, code}} JSON 으로 변환합니다. 스트림이 시작된 뒤의 오류는 SSE {@code error} 이벤트로 전달됩니다.
 */
@Slf4j
@RestControllerAdvice
public class GenerationExceptionHandler {

	@ExceptionHandler(GenerationRequestException.class)
	public ResponseEntity<ErrorResponse> handleGenerationRequest(GenerationRequestException ex) {
		log.warn("생성 요청 거부 - status={}, code={}, reason={}", ex.getStatusCode().value(),
			ex.getCode(), ex.getReason());
		return build(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getReason(), ex.getCode());
	}

	@ExceptionHandler(ResponseStatusException.class)
	public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
		HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
		return build(status, ex.getReason() != null ? ex.getReason() : status.getReasonPhrase(),
			status.name());
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
		log.error("예상하지 못한 오류: {}", ex.getMessage(), ex);
		return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
	}

	private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String code) {
		return ResponseEntity.status(status)
			.contentType(MediaType.APPLICATION_JSON)
			.body(new ErrorResponse(message, code));
	}
}
