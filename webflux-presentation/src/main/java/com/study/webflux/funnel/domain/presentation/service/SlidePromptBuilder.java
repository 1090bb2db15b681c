package com.study.webflux.funnel.domain.presentation.service;

import java.util.Map;

import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.presentation.model.BusinessProfile;
import com.study.webflux.funnel.domain.presentation.model.PresentationCustomization;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;
import com.study.webflux.funnel.infrastructure.common.template.FileBasedPromptTemplate;

@Component
public class SlidePromptBuilder {

	private static final String SYSTEM_TEMPLATE = "presentation/slide-system";
	private static final String USER_TEMPLATE = "presentation/slide-user";
	private static final String BUSINESS_TEMPLATE = "presentation/business-context";
	private static final String NOT_SPECIFIED = "Not specified";
	private static final String DEFAULT_BRAND_VOICE = "Professional and engaging";

	private final FileBasedPromptTemplate templateLoader;

	public SlidePromptBuilder(FileBasedPromptTemplate templateLoader) {
		this.templateLoader = templateLoader;
	}

	public String buildSystemPrompt() {
		return templateLoader.load(SYSTEM_TEMPLATE);
	}

	public String buildSlidePrompt(SlideSpec spec,
		PresentationCustomization customization,
		BusinessProfile businessProfile) {
		PresentationCustomization.TextDensity density = customization.textDensity();
		return templateLoader.load(USER_TEMPLATE,
			Map.of("businessContext", buildBusinessContext(businessProfile),
				"textDensity", density.getValue(),
				"minBullets", String.valueOf(density.getMinBullets()),
				"maxBullets", String.valueOf(density.getMaxBullets()),
				"visualStyle", customization.visualStyle().getValue(),
				"emphasis", customization.emphasisPreference().getGuidance(),
				"title", spec.title(),
				"description", spec.description(),
				"section", spec.section()));
	}

	/** 비즈니스 프로필이 비어 있으면 빈 문자열을 반환합니다. */
	String buildBusinessContext(BusinessProfile profile) {
		if (profile == null || profile.equals(BusinessProfile.empty())) {
			return "";
		}
		return templateLoader.load(BUSINESS_TEMPLATE,
			Map.of("businessName", orDefault(profile.businessName(), NOT_SPECIFIED),
				"targetAudience", orDefault(profile.targetAudience(), NOT_SPECIFIED),
				"mainOffer", orDefault(profile.mainOffer(), NOT_SPECIFIED),
				"uniqueMechanism", orDefault(profile.uniqueMechanism(), NOT_SPECIFIED),
				"brandVoice", orDefault(profile.brandVoice(), DEFAULT_BRAND_VOICE)));
	}

	private String orDefault(String value, String fallback) {
		return value == null || value.isBlank() ? fallback : value;
	}
}
