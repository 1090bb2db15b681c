package com.study.webflux.funnel.domain.generation.model;

public record Message(
	MessageRole role,
	String content
) {
	public Message {
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (content == null) {
			throw new IllegalArgumentException("content cannot be null");
		}
	}

	public static Message system(String content) {
		return new Message(MessageRole.SYSTEM, content);
	}

	public static Message user(String content) {
		return new Message(MessageRole.USER, content);
	}
}
