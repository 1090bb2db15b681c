package com.study.webflux.funnel.domain.presentation.model;

public record BrandDesign(
	String brandName,
	String primaryColor,
	String secondaryColor,
	String accentColor,
	String backgroundColor,
	String textColor
) {
}
