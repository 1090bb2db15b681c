package com.study.webflux.funnel.domain.generation.model;

public record ImageGenerationRequest(
	String prompt,
	String model,
	String size,
	String quality,
	String style
) {
	public ImageGenerationRequest {
		if (prompt == null || prompt.isBlank()) {
			throw new IllegalArgumentException("prompt cannot be blank");
		}
	}
}
