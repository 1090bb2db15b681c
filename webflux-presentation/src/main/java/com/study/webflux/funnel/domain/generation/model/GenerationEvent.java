package com.study.webflux.funnel.domain.generation.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;
import com.study.webflux.funnel.domain.presentation.model.Slide;

/**
 * 클라이언트로 전송되는 생성 이벤트입니다. {@code data}는 이벤트 본문으로 그대로 직렬화됩니다.
 */
public record GenerationEvent(
	GenerationEventType type,
	Map<String, Object> data,
	String comment
) {
	public static GenerationEvent connected(PresentationId presentationId,
		int totalSlides,
		boolean resuming,
		int startFromSlide,
		int slidesToGenerate) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("presentationId", presentationId.value());
		data.put("totalSlides", totalSlides);
		data.put("isResuming", resuming);
		data.put("startFromSlide", startFromSlide);
		data.put("slidesToGenerate", slidesToGenerate);
		return new GenerationEvent(GenerationEventType.CONNECTED, data, null);
	}

	public static GenerationEvent slideGenerated(Slide slide, int progress) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("slide", slide);
		data.put("slideNumber", slide.slideNumber());
		data.put("progress", progress);
		return new GenerationEvent(GenerationEventType.SLIDE_GENERATED, data, null);
	}

	public static GenerationEvent progress(int progress, int currentSlide) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("progress", progress);
		data.put("currentSlide", currentSlide);
		return new GenerationEvent(GenerationEventType.PROGRESS, data, null);
	}

	public static GenerationEvent completed(PresentationId presentationId, List<Slide> slides) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("presentationId", presentationId.value());
		data.put("slides", slides);
		data.put("slideCount", slides.size());
		return new GenerationEvent(GenerationEventType.COMPLETED, data, null);
	}

	public static GenerationEvent error(String message,
		GenerationErrorReason reason,
		PresentationId presentationId,
		int slidesGenerated,
		PresentationStatus status) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("error", message);
		data.put("reason", reason.name());
		data.put("presentationId", presentationId.value());
		data.put("isTimeout", reason == GenerationErrorReason.TIMEOUT);
		data.put("slidesGenerated", slidesGenerated);
		data.put("status", status.getValue());
		return new GenerationEvent(GenerationEventType.ERROR, data, null);
	}

	public static GenerationEvent heartbeat(long epochMillis) {
		return new GenerationEvent(GenerationEventType.HEARTBEAT, Map.of(),
			"heartbeat " + epochMillis);
	}

	public boolean isHeartbeat() {
		return type == GenerationEventType.HEARTBEAT;
	}
}
