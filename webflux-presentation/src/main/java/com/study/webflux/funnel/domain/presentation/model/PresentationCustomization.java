package com.study.webflux.funnel.domain.presentation.model;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 슬라이드 생성 스타일 옵션입니다. 모든 필드는 열거형으로 제한되며 빠진 항목은 기본값을 사용합니다.
 */
public record PresentationCustomization(
	TextDensity textDensity,
	VisualStyle visualStyle,
	EmphasisPreference emphasisPreference,
	AnimationLevel animationLevel,
	ImageStyle imageStyle
) {
	public PresentationCustomization {
		textDensity = textDensity == null ? TextDensity.BALANCED : textDensity;
		visualStyle = visualStyle == null ? VisualStyle.PROFESSIONAL : visualStyle;
		emphasisPreference = emphasisPreference == null
			? EmphasisPreference.BALANCED
			: emphasisPreference;
		animationLevel = animationLevel == null ? AnimationLevel.SUBTLE : animationLevel;
		imageStyle = imageStyle == null ? ImageStyle.PHOTOGRAPHY : imageStyle;
	}

	public static PresentationCustomization defaults() {
		return new PresentationCustomization(TextDensity.BALANCED,
			VisualStyle.PROFESSIONAL,
			EmphasisPreference.BALANCED,
			AnimationLevel.SUBTLE,
			ImageStyle.PHOTOGRAPHY);
	}

	public enum TextDensity {
		MINIMAL("minimal", 2, 3),
		BALANCED("balanced", 3, 5),
		DETAILED("detailed", 5, 7);

		private final String value;
		private final int minBullets;
		private final int maxBullets;

		TextDensity(String value, int minBullets, int maxBullets) {
			this.value = value;
			this.minBullets = minBullets;
			this.maxBullets = maxBullets;
		}

		@JsonValue
		public String getValue() {
			return value;
		}

		public int getMinBullets() {
			return minBullets;
		}

		public int getMaxBullets() {
			return maxBullets;
		}

		@JsonCreator
		public static TextDensity fromValue(String value) {
			return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown textDensity: " + value));
		}
	}

	public enum VisualStyle {
		PROFESSIONAL("professional"),
		CREATIVE("creative"),
		MINIMAL("minimal"),
		BOLD("bold");

		private final String value;

		VisualStyle(String value) {
			this.value = value;
		}

		@JsonValue
		public String getValue() {
			return value;
		}

		@JsonCreator
		public static VisualStyle fromValue(String value) {
			return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown visualStyle: " + value));
		}
	}

	public enum EmphasisPreference {
		TEXT("text", "Focus on clear, impactful text"),
		VISUALS("visuals", "Keep text minimal, suggest strong visuals"),
		BALANCED("balanced", "Balance text and visual elements");

		private final String value;
		private final String guidance;

		EmphasisPreference(String value, String guidance) {
			this.value = value;
			this.guidance = guidance;
		}

		@JsonValue
		public String getValue() {
			return value;
		}

		public String getGuidance() {
			return guidance;
		}

		@JsonCreator
		public static EmphasisPreference fromValue(String value) {
			return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst()
				.orElseThrow(
					() -> new IllegalArgumentException("Unknown emphasisPreference: " + value));
		}
	}

	public enum AnimationLevel {
		NONE("none"),
		SUBTLE("subtle"),
		MODERATE("moderate"),
		DYNAMIC("dynamic");

		private final String value;

		AnimationLevel(String value) {
			this.value = value;
		}

		@JsonValue
		public String getValue() {
			return value;
		}

		@JsonCreator
		public static AnimationLevel fromValue(String value) {
			return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown animationLevel: " + value));
		}
	}

	public enum ImageStyle {
		PHOTOGRAPHY("photography"),
		ILLUSTRATION("illustration"),
		ABSTRACT("abstract"),
		ICONS("icons");

		private final String value;

		ImageStyle(String value) {
			this.value = value;
		}

		@JsonValue
		public String getValue() {
			return value;
		}

		@JsonCreator
		public static ImageStyle fromValue(String value) {
			return Arrays.stream(values()).filter(v -> v.value.equals(value)).findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown imageStyle: " + value));
		}
	}
}
