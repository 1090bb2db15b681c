package com.study.webflux.funnel.domain.presentation.model;

import java.util.UUID;

public record PresentationId(
	String value
) {
	public PresentationId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("presentationId cannot be null or blank");
		}
		if (value.length() > 128) {
			throw new IllegalArgumentException("presentationId too long");
		}
	}

	public static PresentationId of(String value) {
		return new PresentationId(value);
	}

	public static PresentationId generate() {
		return new PresentationId(UUID.randomUUID().toString());
	}
}
