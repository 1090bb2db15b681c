package com.study.webflux.funnel.domain.presentation.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "brand_designs")
public record BrandDesignEntity(
	@Id String id,
	@Indexed String funnelProjectId,
	String brandName,
	String primaryColor,
	String secondaryColor,
	String accentColor,
	String backgroundColor,
	String textColor
) {
}
