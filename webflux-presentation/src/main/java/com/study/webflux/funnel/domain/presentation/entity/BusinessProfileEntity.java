package com.study.webflux.funnel.domain.presentation.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "business_profiles")
public record BusinessProfileEntity(
	@Id String id,
	@Indexed String funnelProjectId,
	String businessName,
	String targetAudience,
	String mainOffer,
	String uniqueMechanism,
	String brandVoice
) {
}
