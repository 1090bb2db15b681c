package com.study.webflux.funnel.fixture;

import java.util.List;
import java.util.stream.IntStream;

import com.study.webflux.funnel.domain.presentation.model.LayoutType;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;

public final class SlideFixture {

	private SlideFixture() {
	}

	public static Slide create(int slideNumber) {
		return new Slide(slideNumber,
			"Slide " + slideNumber,
			List.of("Point A", "Point B"),
			"Notes for slide " + slideNumber,
			LayoutType.BULLETS,
			"Intro",
			null,
			null,
			null);
	}

	public static Slide createWithImagePrompt(int slideNumber, String imagePrompt) {
		return new Slide(slideNumber,
			"Slide " + slideNumber,
			List.of("Point A"),
			"",
			LayoutType.BULLETS,
			"Intro",
			imagePrompt,
			null,
			null);
	}

	/** 1번부터 연속된 슬라이드 목록 */
	public static List<Slide> createRange(int count) {
		return IntStream.rangeClosed(1, count).mapToObj(SlideFixture::create).toList();
	}

	public static SlideSpec spec(int slideNumber) {
		return SlideSpec.of(slideNumber, "Slide " + slideNumber, "Description " + slideNumber,
			"Intro");
	}

	public static List<SlideSpec> specs(int fromInclusive, int toInclusive) {
		return IntStream.rangeClosed(fromInclusive, toInclusive).mapToObj(SlideFixture::spec)
			.toList();
	}
}
