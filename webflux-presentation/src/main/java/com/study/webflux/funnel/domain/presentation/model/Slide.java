package com.study.webflux.funnel.domain.presentation.model;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Slide(
	int slideNumber,
	String title,
	List<String> content,
	String speakerNotes,
	LayoutType layoutType,
	String section,
	String imagePrompt,
	String imageUrl,
	Instant imageGeneratedAt
) {
	public Slide {
		if (slideNumber < 1) {
			throw new IllegalArgumentException("slideNumber must be positive");
		}
		content = content == null ? List.of() : List.copyOf(content);
		if (speakerNotes == null) {
			speakerNotes = "";
		}
		if (layoutType == null) {
			layoutType = LayoutType.BULLETS;
		}
		if (section == null) {
			section = "";
		}
	}

	public boolean needsImage() {
		return imagePrompt != null && !imagePrompt.isBlank()
			&& (imageUrl == null || imageUrl.isBlank());
	}

	public boolean hasImage() {
		return imageUrl != null && !imageUrl.isBlank();
	}

	public Slide withImage(String imageUrl, Instant generatedAt) {
		return new Slide(slideNumber, title, content, speakerNotes, layoutType, section,
			imagePrompt, imageUrl, generatedAt);
	}
}
