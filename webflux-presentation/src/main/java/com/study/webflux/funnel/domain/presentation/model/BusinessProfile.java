package com.study.webflux.funnel.domain.presentation.model;

public record BusinessProfile(
	String businessName,
	String targetAudience,
	String mainOffer,
	String uniqueMechanism,
	String brandVoice
) {
	public static BusinessProfile empty() {
		return new BusinessProfile(null, null, null, null, null);
	}
}
