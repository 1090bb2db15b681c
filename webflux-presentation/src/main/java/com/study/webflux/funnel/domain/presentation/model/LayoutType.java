package com.study.webflux.funnel.domain.presentation.model;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LayoutType {
	TITLE("title"),
	SECTION("section"),
	CONTENT_LEFT("content_left"),
	CONTENT_RIGHT("content_right"),
	BULLETS("bullets"),
	QUOTE("quote"),
	STATISTICS("statistics"),
	COMPARISON("comparison"),
	PROCESS("process"),
	CTA("cta");

	private final String value;

	LayoutType(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	@JsonCreator
	public static LayoutType fromValue(String value) {
		return Arrays.stream(values())
			.filter(type -> type.value.equalsIgnoreCase(value))
			.findFirst()
			.orElse(BULLETS);
	}
}
