package com.study.webflux.funnel.domain.generation.model;

import java.util.List;

/**
 * LLM 단발 완성 요청입니다. {@code jsonResponse}가 참이면 JSON 객체 응답 형식을 요구합니다.
 */
public record CompletionRequest(
	List<Message> messages,
	String model,
	Double temperature,
	Integer maxTokens,
	boolean jsonResponse
) {
	public CompletionRequest {
		if (messages == null || messages.isEmpty()) {
			throw new IllegalArgumentException("messages cannot be empty");
		}
		messages = List.copyOf(messages);
	}
}
