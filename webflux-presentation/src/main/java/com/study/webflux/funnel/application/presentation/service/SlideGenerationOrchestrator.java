package com.study.webflux.funnel.application.presentation.service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.funnel.application.presentation.exception.SlideGenerationException;
import com.study.webflux.funnel.domain.generation.model.SlideCompletionCallback;
import com.study.webflux.funnel.domain.generation.model.SlideGenerationRequest;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;
import com.study.webflux.funnel.infrastructure.monitoring.config.SlideGenerationMetricsConfiguration;
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 슬라이드를 번호 순서대로 하나씩 생성합니다.
 *
 * <p>
 * 각 슬라이드는 텍스트 생성(필수) 후 이미지 생성(선택)을 거쳐 콜백으로 전달되며, 콜백의 {@link Mono}가 끝나야 다음 슬라이드를 시작합니다. 텍스트 생성이
 * 재시도 후에도 실패하면 {@link SlideGenerationException}으로 전체 실행을 중단합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlideGenerationOrchestrator {

	private final SlideContentService contentService;
	private final SlideImageService imageService;
	private final SlideGenerationProperties properties;
	private final SlideGenerationMetricsConfiguration metrics;
	private final Clock clock;

	/**
	 * @return 이번 실행에서 생성된 슬라이드 목록 (번호 오름차순)
	 */
	public Mono<List<Slide>> generate(SlideGenerationRequest request,
		SlideCompletionCallback callback) {
		List<SlideSpec> specs = request.specs();
		AtomicInteger generated = new AtomicInteger();
		Duration pause = properties.getStream().getInterSlideDelay();

		log.info("슬라이드 생성 시작 - presentationId={}, 생성 대상={}, 기존 완료={}, 전체={}",
			request.presentationId().value(), specs.size(), request.alreadyCompleted(),
			request.totalExpectedSlides());

		return Flux.fromIterable(specs)
			.index()
			.concatMap(indexed -> {
				SlideSpec spec = indexed.getT2();
				boolean last = indexed.getT1() == specs.size() - 1;
				Mono<Slide> slide = generateSlide(spec, request, generated)
					.flatMap(completed -> {
						int progress = request.progressAfter(generated.incrementAndGet());
						metrics.recordSlideGenerated();
						log.info("슬라이드 생성 완료 - presentationId={}, slide={}, progress={}",
							request.presentationId().value(), completed.slideNumber(), progress);
						return callback.onSlideGenerated(completed, progress).thenReturn(completed);
					});
				return last || pause.isZero() || pause.isNegative()
					? slide
					: slide.delayUntil(completed -> Mono.delay(pause));
			})
			.collectList();
	}

	private Mono<Slide> generateSlide(SlideSpec spec,
		SlideGenerationRequest request,
		AtomicInteger generated) {
		return contentService.generate(spec, request)
			.onErrorMap(error -> !(error instanceof SlideGenerationException),
				error -> new SlideGenerationException(spec.slideNumber(), generated.get(), error))
			.flatMap(slide -> attachImage(slide, request));
	}

	private Mono<Slide> attachImage(Slide slide, SlideGenerationRequest request) {
		if (!properties.getImage().isEnabled() || !slide.needsImage()) {
			return Mono.just(slide);
		}
		String brandColor = request.brandDesign() != null
			? request.brandDesign().primaryColor()
			: null;
		return imageService
			.generateImage(request.presentationId(), slide.slideNumber(), slide.imagePrompt(),
				brandColor)
			.map(url -> slide.withImage(url, clock.instant()))
			.defaultIfEmpty(slide);
	}
}
