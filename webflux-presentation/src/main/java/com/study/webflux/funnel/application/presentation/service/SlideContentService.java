package com.study.webflux.funnel.application.presentation.service;

import java.util.ArrayList;
import java.util.List;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.funnel.application.presentation.retry.FailureClassifier;
import com.study.webflux.funnel.application.presentation.retry.RetryPolicy;
import com.study.webflux.funnel.domain.generation.model.CompletionRequest;
import com.study.webflux.funnel.domain.generation.model.Message;
import com.study.webflux.funnel.domain.generation.model.SlideGenerationRequest;
import com.study.webflux.funnel.domain.generation.port.LlmPort;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;
import com.study.webflux.funnel.domain.presentation.service.LayoutTypeResolver;
import com.study.webflux.funnel.domain.presentation.service.SlidePromptBuilder;
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import reactor.core.publisher.Mono;

/**
 * 슬라이드 개요 한 장을 LLM 으로 확장해 제목, 본문, 발표자 노트, 이미지 프롬프트를 만듭니다.
 *
 * <p>
 * 호출마다 시간 제한을 두고 재시도합니다. 응답이 비었거나 JSON 이 아니면 재시도 대상이며, 시도를 모두 소진하면 오류를 그대로 전파합니다.
 */
@Service
@RequiredArgsConstructor
public class SlideContentService {

	private final LlmPort llmPort;
	private final SlidePromptBuilder promptBuilder;
	private final LayoutTypeResolver layoutTypeResolver;
	private final RetryPolicy retryPolicy;
	private final ObjectMapper objectMapper;
	private final SlideGenerationProperties properties;

	public Mono<Slide> generate(SlideSpec spec, SlideGenerationRequest request) {
		SlideGenerationProperties.Text text = properties.getText();
		CompletionRequest completionRequest = new CompletionRequest(
			List.of(Message.system(promptBuilder.buildSystemPrompt()),
				Message.user(promptBuilder.buildSlidePrompt(spec,
					request.customization(),
					request.businessProfile()))),
			text.getModel(),
			text.getTemperature(),
			text.getMaxTokens(),
			true);

		return retryPolicy.withRetry(
			() -> llmPort.complete(completionRequest)
				.timeout(text.getTimeout())
				.map(raw -> parseSlide(raw, spec, request.totalExpectedSlides())),
			text.getMaxAttempts(),
			FailureClassifier.alwaysRetryable(),
			"slide-text");
	}

	/**
	 * LLM 응답 JSON 을 슬라이드로 변환합니다. 빠진 필드는 개요 값으로 채웁니다.
	 */
	Slide parseSlide(String raw, SlideSpec spec, int totalSlides) {
		if (raw == null || raw.isBlank()) {
			throw new IllegalStateException("No content generated for slide " + spec.slideNumber());
		}

		JsonNode root;
		try {
			root = objectMapper.readTree(raw);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException(
				"Invalid JSON content for slide " + spec.slideNumber(), e);
		}
		if (root == null || !root.isObject()) {
			throw new IllegalStateException(
				"Expected JSON object for slide " + spec.slideNumber());
		}

		String title = textOrNull(root, "title");
		List<String> content = readContent(root.get("content"));
		String speakerNotes = textOrNull(root, "speakerNotes");
		String imagePrompt = textOrNull(root, "imagePrompt");

		return new Slide(spec.slideNumber(),
			title != null ? title : spec.title(),
			content.isEmpty() ? List.of(spec.description()) : content,
			speakerNotes != null ? speakerNotes : "",
			layoutTypeResolver.resolve(spec, totalSlides),
			spec.section(),
			imagePrompt,
			null,
			null);
	}

	private List<String> readContent(JsonNode node) {
		if (node == null || !node.isArray()) {
			return List.of();
		}
		List<String> bullets = new ArrayList<>();
		node.forEach(item -> {
			if (item.isTextual() && !item.asText().isBlank()) {
				bullets.add(item.asText());
			}
		});
		return bullets;
	}

	private String textOrNull(JsonNode root, String field) {
		JsonNode node = root.get(field);
		if (node == null || !node.isTextual() || node.asText().isBlank()) {
			return null;
		}
		return node.asText();
	}
}
