package com.study.webflux.funnel.domain.presentation.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 덱 구조(슬라이드 개요 목록)입니다. 원본 슬라이드 항목은 느슨한 형태로 저장되어 있으므로 {@link #toSlideSpecs()} 에서 정규화합니다.
 */
public record DeckStructure(
	String id,
	UserId userId,
	String title,
	List<Object> rawSlides
) {
	private static final String DEFAULT_TITLE = "Untitled Presentation";

	public DeckStructure {
		rawSlides = rawSlides == null ? List.of() : rawSlides;
		if (title == null || title.isBlank()) {
			title = DEFAULT_TITLE;
		}
	}

	public int slideCount() {
		return rawSlides.size();
	}

	/**
	 * 원본 항목을 1부터 번호가 매겨진 슬라이드 개요로 변환합니다. 형식이 잘못된 항목은 "Slide N" 자리표시 개요가 됩니다.
	 */
	public List<SlideSpec> toSlideSpecs() {
		List<SlideSpec> specs = new ArrayList<>(rawSlides.size());
		for (int i = 0; i < rawSlides.size(); i++) {
			specs.add(toSlideSpec(i + 1, rawSlides.get(i)));
		}
		return specs;
	}

	private SlideSpec toSlideSpec(int slideNumber, Object raw) {
		if (!(raw instanceof Map<?, ?> fields)) {
			return SlideSpec.placeholder(slideNumber);
		}
		Object title = fields.get("title");
		Object description = fields.get("description");
		Object section = fields.get("section");
		if (!isOptionalString(title) || !isOptionalString(description)
			|| !isOptionalString(section)) {
			return SlideSpec.placeholder(slideNumber);
		}
		return SlideSpec.of(slideNumber, (String) title, (String) description, (String) section);
	}

	private boolean isOptionalString(Object value) {
		return value == null || value instanceof String;
	}
}
