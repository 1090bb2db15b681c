package com.study.webflux.funnel.application.presentation.controller;

import java.util.Map;

import lombok.RequiredArgsConstructor;

import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.study.webflux.funnel.application.presentation.controller.docs.PresentationStreamApi;
import com.study.webflux.funnel.application.presentation.dto.PresentationStatusResponse;
import com.study.webflux.funnel.application.presentation.service.PresentationQueryService;
import com.study.webflux.funnel.domain.generation.model.GenerationCommand;
import com.study.webflux.funnel.domain.generation.model.GenerationEvent;
import com.study.webflux.funnel.domain.presentation.port.PresentationStreamUseCase;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/presentations")
public class PresentationStreamController implements PresentationStreamApi {

	public static final String USER_HEADER = "X-User-Id";

	private final PresentationStreamUseCase presentationStreamUseCase;
	private final PresentationQueryService presentationQueryService;

	/**
	 * 준비 단계 오류는 스트림을 열기 전에 JSON 오류 응답으로 반환됩니다.
	 */
	@GetMapping("/generate/stream")
	public Mono<ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>>> generateStream(
		@RequestHeader(name = USER_HEADER, required = false) String userId,
		@RequestParam(required = false) String projectId,
		@RequestParam(required = false) String deckStructureId,
		@RequestParam(required = false) String customization,
		@RequestParam(required = false) String resumePresentationId,
		@RequestParam(required = false) String resumeFromSlide) {
		GenerationCommand command = new GenerationCommand(userId, projectId, deckStructureId,
			customization, resumePresentationId, resumeFromSlide);

		return presentationStreamUseCase.prepare(command)
			.map(job -> ResponseEntity.ok()
				.contentType(MediaType.TEXT_EVENT_STREAM)
				.cacheControl(CacheControl.noCache().noTransform())
				.header("X-Accel-Buffering", "no")
				.header(HttpHeaders.CONNECTION, "keep-alive")
				.body(presentationStreamUseCase.stream(job).map(this::toServerSentEvent)));
	}

	@GetMapping("/{presentationId}")
	public Mono<PresentationStatusResponse> getStatus(
		@PathVariable String presentationId,
		@RequestHeader(name = USER_HEADER, required = false) String userId) {
		return presentationQueryService.getStatus(presentationId, userId);
	}

	private ServerSentEvent<Map<String, Object>> toServerSentEvent(GenerationEvent event) {
		if (event.isHeartbeat()) {
			return ServerSentEvent.<Map<String, Object>>builder().comment(event.comment()).build();
		}
		return ServerSentEvent.<Map<String, Object>>builder(event.data())
			.event(event.type().getValue())
			.build();
	}
}
