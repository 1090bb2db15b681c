package com.study.webflux.funnel.infrastructure.presentation.adapter.image;

import lombok.extern.slf4j.Slf4j;

import org.springframework.ai.image.ImageGeneration;
import org.springframework.ai.image.ImageModel;
import org.springframework.ai.image.ImagePrompt;
import org.springframework.ai.image.ImageResponse;
import org.springframework.ai.openai.OpenAiImageOptions;
import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.generation.model.ImageGenerationRequest;
import com.study.webflux.funnel.domain.generation.port.ImageGenerationPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI {@link ImageModel} 기반 이미지 생성 어댑터입니다. 결과가 없으면 빈 {@link Mono}를 반환합니다.
 */
@Slf4j
@Component
public class SpringAiImageGenerationAdapter implements ImageGenerationPort {

	private static final String URL_RESPONSE_FORMAT = "url";

	private final ImageModel imageModel;

	public SpringAiImageGenerationAdapter(ImageModel imageModel) {
		this.imageModel = imageModel;
	}

	@Override
	public Mono<String> generate(ImageGenerationRequest request) {
		ImagePrompt prompt = new ImagePrompt(request.prompt(), buildOptions(request));

		return Mono.fromCallable(() -> imageModel.call(prompt))
			.subscribeOn(Schedulers.boundedElastic())
			.mapNotNull(this::extractUrl);
	}

	private String extractUrl(ImageResponse response) {
		if (response == null || response.getResults() == null || response.getResults().isEmpty()) {
			log.warn("이미지 생성 응답에 결과가 없습니다");
			return null;
		}
		ImageGeneration generation = response.getResults().get(0);
		if (generation == null || generation.getOutput() == null) {
			return null;
		}
		return generation.getOutput().getUrl();
	}

	private OpenAiImageOptions buildOptions(ImageGenerationRequest request) {
		OpenAiImageOptions.Builder builder = OpenAiImageOptions.builder()
			.model(request.model())
			.quality(request.quality())
			.style(request.style())
			.responseFormat(URL_RESPONSE_FORMAT);
		int[] dimensions = parseSize(request.size());
		if (dimensions != null) {
			builder.width(dimensions[0]).height(dimensions[1]);
		}
		return builder.build();
	}

	/** "1792x1024" 형식의 크기를 {너비, 높이}로 변환합니다. */
	static int[] parseSize(String size) {
		if (size == null) {
			return null;
		}
		String[] parts = size.toLowerCase().split("x");
		if (parts.length != 2) {
			return null;
		}
		try {
			return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
		} catch (NumberFormatException e) {
			return null;
		}
	}
}
