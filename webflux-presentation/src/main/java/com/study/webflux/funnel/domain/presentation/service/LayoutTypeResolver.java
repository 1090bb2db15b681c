package com.study.webflux.funnel.domain.presentation.service;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.presentation.model.LayoutType;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;

/**
 * 슬라이드 위치와 제목 키워드로 레이아웃을 결정합니다.
 *
 * <p>
 * 첫 슬라이드는 표지, 마지막 슬라이드는 CTA 이며 나머지는 제목 키워드 순서대로 판별합니다. 어느 규칙에도 맞지 않으면 글머리표 레이아웃입니다.
 */
@Component
public class LayoutTypeResolver {

	private static final List<String> SECTION_KEYWORDS = List.of("section", "part");
	private static final List<String> QUOTE_KEYWORDS = List.of("quote", "testimonial");
	private static final List<String> STATISTICS_KEYWORDS = List.of("statistic", "number", "data");
	private static final List<String> COMPARISON_KEYWORDS = List.of("vs", "comparison", "before",
		"after");
	private static final List<String> PROCESS_KEYWORDS = List.of("step", "process", "how to");

	public LayoutType resolve(SlideSpec spec, int totalSlides) {
		int index = spec.slideNumber() - 1;
		if (index == 0) {
			return LayoutType.TITLE;
		}
		if (index == totalSlides - 1) {
			return LayoutType.CTA;
		}

		String title = spec.title().toLowerCase(Locale.ROOT);
		String section = spec.section().toLowerCase(Locale.ROOT);

		if (containsAny(title, SECTION_KEYWORDS) || title.equals(section)) {
			return LayoutType.SECTION;
		}
		if (containsAny(title, QUOTE_KEYWORDS)) {
			return LayoutType.QUOTE;
		}
		if (containsAny(title, STATISTICS_KEYWORDS)) {
			return LayoutType.STATISTICS;
		}
		if (containsAny(title, COMPARISON_KEYWORDS)) {
			return LayoutType.COMPARISON;
		}
		if (containsAny(title, PROCESS_KEYWORDS)) {
			return LayoutType.PROCESS;
		}
		return LayoutType.BULLETS;
	}

	private boolean containsAny(String text, List<String> keywords) {
		return keywords.stream().anyMatch(text::contains);
	}
}
