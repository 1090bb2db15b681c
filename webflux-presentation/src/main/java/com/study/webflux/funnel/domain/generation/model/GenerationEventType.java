package com.study.webflux.funnel.domain.generation.model;

public enum GenerationEventType {
	CONNECTED("connected"),
	SLIDE_GENERATED("slide_generated"),
	PROGRESS("progress"),
	COMPLETED("completed"),
	ERROR("error"),
	/** 이름 없는 keep-alive 주석 이벤트 */
	HEARTBEAT("heartbeat");

	private final String value;

	GenerationEventType(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}
}
