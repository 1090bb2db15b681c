package com.study.webflux.funnel.domain.generation.model;

import java.util.List;

import com.study.webflux.funnel.domain.presentation.model.BrandDesign;
import com.study.webflux.funnel.domain.presentation.model.BusinessProfile;
import com.study.webflux.funnel.domain.presentation.model.PresentationCustomization;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;

/**
 * 한 번의 생성 실행 입력입니다.
 *
 * @param specs
 *            이번 실행에서 생성할 슬라이드 개요 (번호 오름차순)
 * @param totalExpectedSlides
 *            덱 전체 슬라이드 수. 진행률과 레이아웃 결정에 사용됩니다.
 * @param alreadyCompleted
 *            이전 실행에서 이미 저장된 슬라이드 수
 */
public record SlideGenerationRequest(
	PresentationId presentationId,
	List<SlideSpec> specs,
	PresentationCustomization customization,
	BusinessProfile businessProfile,
	BrandDesign brandDesign,
	int totalExpectedSlides,
	int alreadyCompleted
) {
	public SlideGenerationRequest {
		specs = specs == null ? List.of() : List.copyOf(specs);
		if (totalExpectedSlides <= 0) {
			throw new IllegalArgumentException("totalExpectedSlides must be positive");
		}
		if (alreadyCompleted < 0) {
			throw new IllegalArgumentException("alreadyCompleted cannot be negative");
		}
		if (customization == null) {
			customization = PresentationCustomization.defaults();
		}
		if (businessProfile == null) {
			businessProfile = BusinessProfile.empty();
		}
	}

	/** 현재까지 완료된 슬라이드 수로 진행률(0~100)을 계산합니다. */
	public int progressAfter(int generatedThisRun) {
		long percent = Math.round((alreadyCompleted + generatedThisRun) * 100.0 / totalExpectedSlides);
		return (int) Math.max(0, Math.min(100, percent));
	}
}
