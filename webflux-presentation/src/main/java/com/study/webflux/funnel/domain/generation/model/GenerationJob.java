package com.study.webflux.funnel.domain.generation.model;

import java.time.Instant;
import java.util.List;

import com.study.webflux.funnel.domain.presentation.model.BrandDesign;
import com.study.webflux.funnel.domain.presentation.model.BusinessProfile;
import com.study.webflux.funnel.domain.presentation.model.PresentationCustomization;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;
import com.study.webflux.funnel.domain.presentation.model.UserId;

/**
 * 준비가 끝난 생성 작업입니다. 스트림 구독 하나가 소유하며 저장되지 않습니다.
 *
 * @param pendingSpecs
 *            생성할 슬라이드 개요 ({@code startSlide}부터)
 * @param carryOverSlides
 *            이미 저장되어 다시 생성하지 않는 슬라이드 ({@code startSlide} 미만)
 * @param replaySlides
 *            클라이언트가 다시 요청한 저장 슬라이드. 재생성 없이 이벤트로만 다시 전송됩니다.
 */
public record GenerationJob(
	PresentationId presentationId,
	UserId userId,
	List<SlideSpec> pendingSpecs,
	List<Slide> carryOverSlides,
	List<Slide> replaySlides,
	int startSlide,
	int totalExpectedSlides,
	boolean resuming,
	PresentationCustomization customization,
	BusinessProfile businessProfile,
	BrandDesign brandDesign,
	Instant startedAt
) {
	public GenerationJob {
		pendingSpecs = pendingSpecs == null ? List.of() : List.copyOf(pendingSpecs);
		carryOverSlides = carryOverSlides == null ? List.of() : List.copyOf(carryOverSlides);
		replaySlides = replaySlides == null ? List.of() : List.copyOf(replaySlides);
		if (startedAt == null) {
			startedAt = Instant.now();
		}
	}

	public int alreadyCompleted() {
		return carryOverSlides.size();
	}

	public SlideGenerationRequest toSlideGenerationRequest() {
		return new SlideGenerationRequest(presentationId, pendingSpecs, customization,
			businessProfile, brandDesign, totalExpectedSlides, alreadyCompleted());
	}
}
