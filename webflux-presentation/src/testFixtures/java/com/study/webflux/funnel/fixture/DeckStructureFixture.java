package com.study.webflux.funnel.fixture;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import com.study.webflux.funnel.domain.presentation.model.DeckStructure;
import com.study.webflux.funnel.domain.presentation.model.FunnelProject;

public final class DeckStructureFixture {

	public static final String DEFAULT_DECK_ID = "deck-1";
	public static final String DEFAULT_PROJECT_ID = "project-1";

	private DeckStructureFixture() {
	}

	public static DeckStructure create(int slideCount) {
		List<Object> rawSlides = IntStream.rangeClosed(1, slideCount)
			.<Object>mapToObj(n -> Map.of("title", "Slide " + n,
				"description", "Description " + n,
				"section", "Intro"))
			.toList();
		return new DeckStructure(DEFAULT_DECK_ID, UserIdFixture.create(), "Webinar Deck",
			rawSlides);
	}

	public static FunnelProject project() {
		return new FunnelProject(DEFAULT_PROJECT_ID, UserIdFixture.create(), "Launch Funnel");
	}

	public static FunnelProject projectOwnedBy(String userId) {
		return new FunnelProject(DEFAULT_PROJECT_ID, UserIdFixture.create(userId),
			"Launch Funnel");
	}
}
