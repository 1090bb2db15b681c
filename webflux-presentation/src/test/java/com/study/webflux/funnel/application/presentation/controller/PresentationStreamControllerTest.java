package com.study.webflux.funnel.application.presentation.controller;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.study.webflux.funnel.application.presentation.dto.PresentationStatusResponse;
import com.study.webflux.funnel.application.presentation.exception.GenerationRequestException;
import com.study.webflux.funnel.application.presentation.service.PresentationQueryService;
import com.study.webflux.funnel.config.annotation.ControllerWebFluxTest;
import com.study.webflux.funnel.domain.generation.model.GenerationCommand;
import com.study.webflux.funnel.domain.generation.model.GenerationEvent;
import com.study.webflux.funnel.domain.generation.model.GenerationJob;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;
import com.study.webflux.funnel.domain.presentation.port.PresentationStreamUseCase;
import com.study.webflux.funnel.fixture.GenerationJobFixture;
import com.study.webflux.funnel.fixture.PresentationFixture;
import com.study.webflux.funnel.fixture.SlideFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ControllerWebFluxTest(PresentationStreamController.class)
class PresentationStreamControllerTest {

	private static final String STREAM_URI = "/api/presentations/generate/stream"
		+ "?projectId=project-1&deckStructureId=deck-1";

	@Autowired
	private WebTestClient webTestClient;

	@MockitoBean
	private PresentationStreamUseCase presentationStreamUseCase;

	@MockitoBean
	private PresentationQueryService presentationQueryService;

	@Test
	@DisplayName("준비가 끝나면 SSE 스트림으로 이벤트를 전송한다")
	void generateStream_streamsEvents() {
		GenerationJob job = GenerationJobFixture.fresh(1);
		when(presentationStreamUseCase.prepare(any(GenerationCommand.class)))
			.thenReturn(Mono.just(job));
		when(presentationStreamUseCase.stream(job)).thenReturn(Flux.just(
			GenerationEvent.connected(job.presentationId(), 1, false, 1, 1),
			GenerationEvent.heartbeat(1_000L),
			GenerationEvent.slideGenerated(SlideFixture.create(1), 100),
			GenerationEvent.completed(job.presentationId(), List.of(SlideFixture.create(1)))));

		Flux<ServerSentEvent<Map<String, Object>>> body = webTestClient.get()
			.uri(STREAM_URI)
			.header(PresentationStreamController.USER_HEADER, "user-1")
			.accept(MediaType.TEXT_EVENT_STREAM)
			.exchange()
			.expectStatus().isOk()
			.expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
			.expectHeader().valueEquals("X-Accel-Buffering", "no")
			.expectHeader().valueEquals("Cache-Control", "no-cache, no-transform")
			.returnResult(new ParameterizedTypeReference<ServerSentEvent<Map<String, Object>>>() {
			})
			.getResponseBody();

		StepVerifier.create(body.filter(event -> event.event() != null))
			.assertNext(event -> {
				assertThat(event.event()).isEqualTo("connected");
				assertThat(event.data()).containsEntry("presentationId", "presentation-1");
			})
			.assertNext(event -> assertThat(event.event()).isEqualTo("slide_generated"))
			.assertNext(event -> {
				assertThat(event.event()).isEqualTo("completed");
				assertThat(event.data()).containsEntry("slideCount", 1);
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("요청 파라미터와 사용자 헤더를 그대로 명령으로 전달한다")
	void generateStream_passesCommand() {
		GenerationJob job = GenerationJobFixture.fresh(1);
		GenerationCommand expected = new GenerationCommand("user-1", "project-1", "deck-1",
			null, "presentation-1", "3");
		when(presentationStreamUseCase.prepare(expected)).thenReturn(Mono.just(job));
		when(presentationStreamUseCase.stream(job)).thenReturn(Flux.empty());

		webTestClient.get()
			.uri(STREAM_URI + "&resumePresentationId=presentation-1&resumeFromSlide=3")
			.header(PresentationStreamController.USER_HEADER, "user-1")
			.accept(MediaType.TEXT_EVENT_STREAM)
			.exchange()
			.expectStatus().isOk();

		verify(presentationStreamUseCase).prepare(expected);
	}

	@Test
	@DisplayName("준비 단계 오류는 스트림을 열지 않고 JSON 오류로 응답한다")
	void generateStream_setupError_returnsJson() {
		when(presentationStreamUseCase.prepare(any(GenerationCommand.class))).thenReturn(Mono
			.error(GenerationRequestException.notFound("PROJECT_NOT_FOUND", "Project not found")));

		webTestClient.get()
			.uri(STREAM_URI)
			.header(PresentationStreamController.USER_HEADER, "user-1")
			.accept(MediaType.TEXT_EVENT_STREAM)
			.exchange()
			.expectStatus().isNotFound()
			.expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
			.expectBody()
			.jsonPath("$.error").isEqualTo("Project not found")
			.jsonPath("$.code").isEqualTo("PROJECT_NOT_FOUND");

		verify(presentationStreamUseCase, never()).stream(any());
	}

	@Test
	@DisplayName("요청 빈도 제한은 429 로 응답한다")
	void generateStream_rateLimited() {
		when(presentationStreamUseCase.prepare(any(GenerationCommand.class))).thenReturn(Mono
			.error(GenerationRequestException.tooManyRequests("RATE_LIMITED", "Too many requests")));

		webTestClient.get()
			.uri(STREAM_URI)
			.header(PresentationStreamController.USER_HEADER, "user-1")
			.exchange()
			.expectStatus().isEqualTo(429)
			.expectBody()
			.jsonPath("$.code").isEqualTo("RATE_LIMITED");
	}

	@Test
	@DisplayName("프레젠테이션 상태와 다음 재개 위치를 조회한다")
	void getStatus_success() {
		PresentationStatusResponse response = PresentationStatusResponse
			.from(PresentationFixture.withSlides(PresentationStatus.DRAFT, 3, 10));
		when(presentationQueryService.getStatus("presentation-1", "user-1"))
			.thenReturn(Mono.just(response));

		webTestClient.get()
			.uri("/api/presentations/presentation-1")
			.header(PresentationStreamController.USER_HEADER, "user-1")
			.accept(MediaType.APPLICATION_JSON)
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.status").isEqualTo("draft")
			.jsonPath("$.slideCount").isEqualTo(3)
			.jsonPath("$.resumable").isEqualTo(true)
			.jsonPath("$.nextSlideNumber").isEqualTo(4);
	}

	@Test
	@DisplayName("다른 사용자의 프레젠테이션 조회는 403")
	void getStatus_forbidden() {
		when(presentationQueryService.getStatus("presentation-1", "intruder"))
			.thenReturn(Mono.error(GenerationRequestException.forbidden()));

		webTestClient.get()
			.uri("/api/presentations/presentation-1")
			.header(PresentationStreamController.USER_HEADER, "intruder")
			.exchange()
			.expectStatus().isForbidden()
			.expectBody()
			.jsonPath("$.code").isEqualTo("ACCESS_DENIED");
	}
}
