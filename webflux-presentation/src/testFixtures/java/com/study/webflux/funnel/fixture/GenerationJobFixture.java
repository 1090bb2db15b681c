package com.study.webflux.funnel.fixture;

import java.time.Instant;
import java.util.List;

import com.study.webflux.funnel.domain.generation.model.GenerationJob;
import com.study.webflux.funnel.domain.presentation.model.BusinessProfile;
import com.study.webflux.funnel.domain.presentation.model.PresentationCustomization;
import com.study.webflux.funnel.domain.presentation.model.Slide;

public final class GenerationJobFixture {

	private GenerationJobFixture() {
	}

	public static GenerationJob fresh(int totalSlides) {
		return new GenerationJob(PresentationFixture.createId(),
			UserIdFixture.create(),
			SlideFixture.specs(1, totalSlides),
			List.of(),
			List.of(),
			1,
			totalSlides,
			false,
			PresentationCustomization.defaults(),
			BusinessProfile.empty(),
			null,
			Instant.parse("2026-01-01T00:00:00Z"));
	}

	public static GenerationJob resumed(int persistedSlides, int totalSlides, List<Slide> replay) {
		return new GenerationJob(PresentationFixture.createId(),
			UserIdFixture.create(),
			SlideFixture.specs(persistedSlides + 1, totalSlides),
			SlideFixture.createRange(persistedSlides),
			replay,
			persistedSlides + 1,
			totalSlides,
			true,
			PresentationCustomization.defaults(),
			BusinessProfile.empty(),
			null,
			Instant.parse("2026-01-01T00:00:00Z"));
	}
}
