package com.study.webflux.funnel.domain.presentation.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

public record Presentation(
	PresentationId id,
	UserId userId,
	String funnelProjectId,
	String deckStructureId,
	String title,
	PresentationCustomization customization,
	PresentationStatus status,
	List<Slide> slides,
	int generationProgress,
	Integer totalExpectedSlides,
	String errorMessage,
	Instant createdAt,
	Instant completedAt
) {
	public Presentation {
		if (id == null) {
			throw new IllegalArgumentException("id cannot be null");
		}
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (status == null) {
			status = PresentationStatus.GENERATING;
		}
		slides = slides == null
			? List.of()
			: slides.stream().sorted(Comparator.comparingInt(Slide::slideNumber)).toList();
		if (createdAt == null) {
			createdAt = Instant.now();
		}
	}

	/**
	 * 새 생성 작업을 위한 빈 프레젠테이션을 만듭니다.
	 */
	public static Presentation start(UserId userId,
		String funnelProjectId,
		DeckStructure deckStructure,
		PresentationCustomization customization) {
		return new Presentation(PresentationId.generate(),
			userId,
			funnelProjectId,
			deckStructure.id(),
			deckStructure.title(),
			customization,
			PresentationStatus.GENERATING,
			List.of(),
			0,
			deckStructure.slideCount(),
			null,
			Instant.now(),
			null);
	}

	public boolean isOwnedBy(UserId candidate) {
		return userId.equals(candidate);
	}

	public int slideCount() {
		return slides.size();
	}

	/**
	 * 1번부터 끊김 없이 저장된 슬라이드 수를 반환합니다. 중간에 빈 번호가 있으면 그 앞까지만 셉니다.
	 */
	public int contiguousSlideCount() {
		int expected = 1;
		for (Slide slide : slides) {
			if (slide.slideNumber() != expected) {
				break;
			}
			expected++;
		}
		return expected - 1;
	}

	public int resolveTotalExpectedSlides(int fallback) {
		return totalExpectedSlides != null && totalExpectedSlides > 0
			? totalExpectedSlides
			: fallback;
	}
}
