package com.study.webflux.funnel.fixture;

import java.time.Instant;
import java.util.List;

import com.study.webflux.funnel.domain.presentation.model.Presentation;
import com.study.webflux.funnel.domain.presentation.model.PresentationCustomization;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;
import com.study.webflux.funnel.domain.presentation.model.Slide;

public final class PresentationFixture {

	public static final String DEFAULT_PRESENTATION_ID = "presentation-1";

	private PresentationFixture() {
	}

	public static PresentationId createId() {
		return PresentationId.of(DEFAULT_PRESENTATION_ID);
	}

	public static Presentation generating(int totalSlides) {
		return create(PresentationStatus.GENERATING, List.of(), totalSlides);
	}

	public static Presentation withSlides(PresentationStatus status,
		int persistedSlides,
		int totalSlides) {
		return create(status, SlideFixture.createRange(persistedSlides), totalSlides);
	}

	public static Presentation create(PresentationStatus status,
		List<Slide> slides,
		Integer totalSlides) {
		return new Presentation(createId(),
			UserIdFixture.create(),
			DeckStructureFixture.DEFAULT_PROJECT_ID,
			DeckStructureFixture.DEFAULT_DECK_ID,
			"Webinar Deck",
			PresentationCustomization.defaults(),
			status,
			slides,
			0,
			totalSlides,
			null,
			Instant.parse("2026-01-01T00:00:00Z"),
			null);
	}
}
