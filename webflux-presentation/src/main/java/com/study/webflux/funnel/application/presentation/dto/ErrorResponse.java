package com.study.webflux.funnel.application.presentation.dto;

public record ErrorResponse(
	String error,
	String code
) {
}
