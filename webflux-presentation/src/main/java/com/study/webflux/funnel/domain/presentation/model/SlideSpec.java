package com.study.webflux.funnel.domain.presentation.model;

/**
 * AI 확장 전의 슬라이드 개요 한 장입니다.
 */
public record SlideSpec(
	int slideNumber,
	String title,
	String description,
	String section
) {
	public SlideSpec {
		if (slideNumber < 1) {
			throw new IllegalArgumentException("slideNumber must be positive");
		}
		if (title == null || title.isBlank()) {
			title = defaultTitle(slideNumber);
		}
		if (description == null) {
			description = "";
		}
		if (section == null) {
			section = "";
		}
	}

	public static SlideSpec of(int slideNumber, String title, String description, String section) {
		return new SlideSpec(slideNumber, title, description, section);
	}

	public static SlideSpec placeholder(int slideNumber) {
		return new SlideSpec(slideNumber, defaultTitle(slideNumber), "", "");
	}

	private static String defaultTitle(int slideNumber) {
		return "Slide " + slideNumber;
	}
}
