package com.study.webflux.funnel.domain.presentation.entity;

import java.time.Instant;
import java.util.List;

public record SlideEntity(
	int slideNumber,
	String title,
	List<String> content,
	String speakerNotes,
	String layoutType,
	String section,
	String imagePrompt,
	String imageUrl,
	Instant imageGeneratedAt
) {
}
