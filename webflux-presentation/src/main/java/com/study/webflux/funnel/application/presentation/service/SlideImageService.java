package com.study.webflux.funnel.application.presentation.service;

import java.time.Clock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.funnel.application.presentation.exception.EmptyImageResultException;
import com.study.webflux.funnel.application.presentation.retry.FailureClass;
import com.study.webflux.funnel.application.presentation.retry.RetryPolicy;
import com.study.webflux.funnel.domain.generation.model.ImageGenerationRequest;
import com.study.webflux.funnel.domain.generation.port.ImageDownloadPort;
import com.study.webflux.funnel.domain.generation.port.ImageGenerationPort;
import com.study.webflux.funnel.domain.generation.port.ObjectStoragePort;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.infrastructure.monitoring.config.SlideGenerationMetricsConfiguration;
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import reactor.core.publisher.Mono;

/**
 * 슬라이드 이미지를 생성해 영구 저장소에 올립니다.
 *
 * <p>
 * 생성 → 다운로드 → 업로드 전체를 하나의 재시도 단위로 실행합니다. 어떤 실패도 호출자에게 오류로 전달하지 않으며, 이미지를 얻지 못하면 빈 {@link Mono}를
 * 반환합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlideImageService {

	private static final String CONTENT_TYPE = "image/png";

	private final ImageGenerationPort imageGenerationPort;
	private final ImageDownloadPort imageDownloadPort;
	private final ObjectStoragePort objectStoragePort;
	private final RetryPolicy retryPolicy;
	private final SlideGenerationProperties properties;
	private final SlideGenerationMetricsConfiguration metrics;
	private final Clock clock;

	public Mono<String> generateImage(PresentationId presentationId,
		int slideNumber,
		String imagePrompt,
		String brandColor) {
		if (imagePrompt == null || imagePrompt.isBlank()) {
			metrics.recordImageSkipped();
			return Mono.empty();
		}

		SlideGenerationProperties.Image image = properties.getImage();
		ImageGenerationRequest request = new ImageGenerationRequest(
			buildStyledPrompt(imagePrompt, brandColor),
			image.getModel(),
			image.getSize(),
			image.getQuality(),
			image.getStyle());

		return retryPolicy
			.withRetry(() -> generateAndStore(presentationId, slideNumber, request),
				image.getMaxAttempts(),
				this::classify,
				"image-generation")
			.doOnNext(url -> {
				metrics.recordImageSuccess();
				log.info("슬라이드 이미지 저장 완료 - presentationId={}, slide={}", presentationId.value(),
					slideNumber);
			})
			.onErrorResume(error -> {
				metrics.recordImageFailure();
				log.error("슬라이드 이미지 생성 포기, 이미지 없이 진행 - presentationId={}, slide={}: {}",
					presentationId.value(), slideNumber, error.toString());
				return Mono.empty();
			});
	}

	/**
	 * 이미지 공급자에 전달할 프롬프트를 만듭니다. 브랜드 대표 색상이 있으면 색상 지시를 추가합니다.
	 */
	String buildStyledPrompt(String imagePrompt, String brandColor) {
		StringBuilder prompt = new StringBuilder("Professional business presentation slide image.");
		if (brandColor != null && !brandColor.isBlank()) {
			prompt.append(" Color scheme inspired by ").append(brandColor).append('.');
		}
		prompt.append(" Clean, modern design suitable for presentations.")
			.append(" High quality, no text overlays. ")
			.append(imagePrompt);
		return prompt.toString();
	}

	String storagePath(PresentationId presentationId, int slideNumber) {
		return properties.getStorage().getPathPrefix() + "/" + presentationId.value() + "/slide-"
			+ slideNumber + "-" + clock.millis() + ".png";
	}

	private Mono<String> generateAndStore(PresentationId presentationId,
		int slideNumber,
		ImageGenerationRequest request) {
		SlideGenerationProperties.Image image = properties.getImage();
		return imageGenerationPort.generate(request)
			.timeout(image.getGenerationTimeout())
			.filter(url -> !url.isBlank())
			.switchIfEmpty(Mono.error(EmptyImageResultException::new))
			.flatMap(url -> imageDownloadPort.download(url, image.getDownloadTimeout()))
			.flatMap(bytes -> objectStoragePort.upload(storagePath(presentationId, slideNumber),
				bytes,
				CONTENT_TYPE));
	}

	private FailureClass classify(Throwable error) {
		return error instanceof EmptyImageResultException
			? FailureClass.TERMINAL
			: FailureClass.RETRYABLE;
	}
}
