package com.study.webflux.funnel.application.presentation.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.springframework.http.HttpStatus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.funnel.application.presentation.exception.GenerationRequestException;
import com.study.webflux.funnel.application.presentation.service.GenerationSetupService.GenerationContext;
import com.study.webflux.funnel.application.presentation.service.GenerationSetupService.ResumeTarget;
import com.study.webflux.funnel.domain.generation.model.GenerationCommand;
import com.study.webflux.funnel.domain.generation.model.GenerationJob;
import com.study.webflux.funnel.domain.generation.port.RateLimitPort;
import com.study.webflux.funnel.domain.presentation.model.BrandDesign;
import com.study.webflux.funnel.domain.presentation.model.BusinessProfile;
import com.study.webflux.funnel.domain.presentation.model.DeckStructure;
import com.study.webflux.funnel.domain.presentation.model.FunnelProject;
import com.study.webflux.funnel.domain.presentation.model.InvalidStatusTransitionException;
import com.study.webflux.funnel.domain.presentation.model.Presentation;
import com.study.webflux.funnel.domain.presentation.model.PresentationCustomization;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import com.study.webflux.funnel.domain.presentation.model.SlideSpec;
import com.study.webflux.funnel.domain.presentation.model.UserId;
import com.study.webflux.funnel.domain.presentation.port.GenerationContextRepository;
import com.study.webflux.funnel.domain.presentation.port.PresentationRepository;
import com.study.webflux.funnel.fixture.DeckStructureFixture;
import com.study.webflux.funnel.fixture.PresentationFixture;
import com.study.webflux.funnel.fixture.SlideFixture;
import com.study.webflux.funnel.fixture.UserIdFixture;
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationSetupServiceTest {

	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
	private static final String USER = UserIdFixture.DEFAULT_USER_ID;
	private static final String PROJECT = DeckStructureFixture.DEFAULT_PROJECT_ID;
	private static final String DECK = DeckStructureFixture.DEFAULT_DECK_ID;
	private static final String PRESENTATION = PresentationFixture.DEFAULT_PRESENTATION_ID;

	@Mock
	private PresentationRepository presentationRepository;

	@Mock
	private GenerationContextRepository contextRepository;

	@Mock
	private RateLimitPort rateLimitPort;

	private GenerationSetupService service;

	@BeforeEach
	void setUp() {
		service = new GenerationSetupService(presentationRepository,
			contextRepository,
			rateLimitPort,
			new ObjectMapper(),
			new SlideGenerationProperties(),
			Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Test
	@DisplayName("projectId 또는 deckStructureId 가 없으면 400 MISSING_PARAMETERS")
	void prepare_missingParameters() {
		StepVerifier.create(service.prepare(command(null, DECK, null, null, null)))
			.expectErrorSatisfies(error -> assertRejected(error, HttpStatus.BAD_REQUEST,
				"MISSING_PARAMETERS"))
			.verify();

		verifyNoInteractions(rateLimitPort, contextRepository, presentationRepository);
	}

	@Test
	@DisplayName("사용자 식별자가 없으면 401")
	void prepare_unauthenticated() {
		GenerationCommand command = new GenerationCommand(null, PROJECT, DECK, null, null, null);

		StepVerifier.create(service.prepare(command))
			.expectErrorSatisfies(
				error -> assertRejected(error, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"))
			.verify();
	}

	@Test
	@DisplayName("요청 빈도 제한을 넘으면 429 RATE_LIMITED")
	void prepare_rateLimited() {
		when(rateLimitPort.tryAcquire("presentation-generation:" + USER, 10,
			Duration.ofSeconds(60))).thenReturn(Mono.just(false));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, null, null)))
			.expectErrorSatisfies(
				error -> assertRejected(error, HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED"))
			.verify();

		verifyNoInteractions(contextRepository, presentationRepository);
	}

	@Test
	@DisplayName("알 수 없는 스타일 옵션은 400 INVALID_CUSTOMIZATION")
	void prepare_invalidCustomization() {
		allowRateLimit();

		StepVerifier.create(service.prepare(
			command(PROJECT, DECK, "{\"textDensity\":\"enormous\"}", null, null)))
			.expectErrorSatisfies(error -> assertRejected(error, HttpStatus.BAD_REQUEST,
				"INVALID_CUSTOMIZATION"))
			.verify();

		verifyNoInteractions(contextRepository, presentationRepository);
	}

	@Test
	@DisplayName("프로젝트가 없으면 404 PROJECT_NOT_FOUND")
	void prepare_projectNotFound() {
		allowRateLimit();
		stubContext(Mono.empty(), Mono.just(DeckStructureFixture.create(5)));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, null, null)))
			.expectErrorSatisfies(
				error -> assertRejected(error, HttpStatus.NOT_FOUND, "PROJECT_NOT_FOUND"))
			.verify();
	}

	@Test
	@DisplayName("다른 사용자의 프로젝트면 403 ACCESS_DENIED")
	void prepare_projectOwnedByOtherUser() {
		allowRateLimit();
		stubContext(Mono.just(DeckStructureFixture.projectOwnedBy("someone-else")),
			Mono.just(DeckStructureFixture.create(5)));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, null, null)))
			.expectErrorSatisfies(
				error -> assertRejected(error, HttpStatus.FORBIDDEN, "ACCESS_DENIED"))
			.verify();
	}

	@Test
	@DisplayName("덱 구조가 없으면 404 DECK_STRUCTURE_NOT_FOUND")
	void prepare_deckStructureNotFound() {
		allowRateLimit();
		stubContext(Mono.just(DeckStructureFixture.project()), Mono.empty());

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, null, null)))
			.expectErrorSatisfies(error -> assertRejected(error, HttpStatus.NOT_FOUND,
				"DECK_STRUCTURE_NOT_FOUND"))
			.verify();
	}

	@Test
	@DisplayName("프로젝트 생성 한도에 도달하면 429 PRESENTATION_LIMIT_REACHED")
	void prepare_quotaReached() {
		allowRateLimit();
		stubContext(Mono.just(DeckStructureFixture.project()),
			Mono.just(DeckStructureFixture.create(5)));
		when(presentationRepository.countActiveByProject(PROJECT)).thenReturn(Mono.just(3L));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, null, null)))
			.expectErrorSatisfies(error -> {
				assertRejected(error, HttpStatus.TOO_MANY_REQUESTS, "PRESENTATION_LIMIT_REACHED");
				assertThat(((GenerationRequestException) error).getReason())
					.isEqualTo("You have reached the limit of 3 presentations per funnel");
			})
			.verify();

		verify(presentationRepository, never()).create(any(Presentation.class));
	}

	@Test
	@DisplayName("새 작업은 프레젠테이션을 만들고 1번부터 모든 슬라이드를 생성 대상으로 한다")
	void prepare_freshJob() {
		allowRateLimit();
		stubContext(Mono.just(DeckStructureFixture.project()),
			Mono.just(DeckStructureFixture.create(5)));
		when(presentationRepository.countActiveByProject(PROJECT)).thenReturn(Mono.just(0L));
		when(presentationRepository.create(any(Presentation.class)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.prepare(
			command(PROJECT, DECK, "{\"textDensity\":\"detailed\"}", null, null)))
			.assertNext(job -> {
				assertThat(job.resuming()).isFalse();
				assertThat(job.startSlide()).isEqualTo(1);
				assertThat(job.totalExpectedSlides()).isEqualTo(5);
				assertThat(job.pendingSpecs()).extracting(SlideSpec::slideNumber)
					.containsExactly(1, 2, 3, 4, 5);
				assertThat(job.carryOverSlides()).isEmpty();
				assertThat(job.replaySlides()).isEmpty();
				assertThat(job.customization().textDensity())
					.isEqualTo(PresentationCustomization.TextDensity.DETAILED);
				assertThat(job.businessProfile()).isEqualTo(BusinessProfile.empty());
				assertThat(job.startedAt()).isEqualTo(NOW);
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("resumeFromSlide 가 0 이면 새 작업으로 처리하고 요청 빈도 제한을 적용한다")
	void prepare_resumeFromZero_isFresh() {
		allowRateLimit();
		stubContext(Mono.just(DeckStructureFixture.project()),
			Mono.just(DeckStructureFixture.create(3)));
		when(presentationRepository.countActiveByProject(PROJECT)).thenReturn(Mono.just(0L));
		when(presentationRepository.create(any(Presentation.class)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, PRESENTATION, "0")))
			.assertNext(job -> assertThat(job.resuming()).isFalse())
			.verifyComplete();

		verify(rateLimitPort).tryAcquire(anyString(), anyInt(), any(Duration.class));
		verify(presentationRepository, never()).findById(any(PresentationId.class));
	}

	@Test
	@DisplayName("재개 요청은 요청 빈도 제한과 생성 한도를 건너뛰고 마지막 저장 슬라이드 다음부터 생성한다")
	void prepare_resume() {
		stubContext(Mono.just(DeckStructureFixture.project()),
			Mono.just(DeckStructureFixture.create(10)));
		Presentation draft = PresentationFixture.withSlides(PresentationStatus.DRAFT, 3, 10);
		when(presentationRepository.findById(draft.id())).thenReturn(Mono.just(draft));
		when(presentationRepository.transitionStatus(draft.id(), PresentationStatus.GENERATING,
			null)).thenReturn(Mono.empty());

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, PRESENTATION, "4")))
			.assertNext(job -> {
				assertThat(job.resuming()).isTrue();
				assertThat(job.startSlide()).isEqualTo(4);
				assertThat(job.totalExpectedSlides()).isEqualTo(10);
				assertThat(job.pendingSpecs()).extracting(SlideSpec::slideNumber)
					.containsExactly(4, 5, 6, 7, 8, 9, 10);
				assertThat(job.carryOverSlides()).extracting(Slide::slideNumber)
					.containsExactly(1, 2, 3);
				assertThat(job.replaySlides()).isEmpty();
			})
			.verifyComplete();

		verifyNoInteractions(rateLimitPort);
		verify(presentationRepository, never()).countActiveByProject(anyString());
		verify(presentationRepository, never()).create(any(Presentation.class));
	}

	@Test
	@DisplayName("완료된 프레젠테이션은 재개할 수 없다 (409)")
	void prepare_resumeCompleted_conflict() {
		stubContext(Mono.just(DeckStructureFixture.project()),
			Mono.just(DeckStructureFixture.create(3)));
		Presentation completed = PresentationFixture.withSlides(PresentationStatus.COMPLETED, 3, 3);
		when(presentationRepository.findById(completed.id())).thenReturn(Mono.just(completed));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, PRESENTATION, "2")))
			.expectErrorSatisfies(error -> assertRejected(error, HttpStatus.CONFLICT,
				"INVALID_STATUS_TRANSITION"))
			.verify();

		verify(presentationRepository, never()).transitionStatus(any(), any(), any());
	}

	@Test
	@DisplayName("상태 전이 경합에서 밀리면 409")
	void prepare_resumeTransitionRejected() {
		stubContext(Mono.just(DeckStructureFixture.project()),
			Mono.just(DeckStructureFixture.create(3)));
		Presentation draft = PresentationFixture.withSlides(PresentationStatus.DRAFT, 1, 3);
		when(presentationRepository.findById(draft.id())).thenReturn(Mono.just(draft));
		when(presentationRepository.transitionStatus(draft.id(), PresentationStatus.GENERATING,
			null)).thenReturn(Mono.error(new InvalidStatusTransitionException(draft.id(),
				PresentationStatus.COMPLETED, PresentationStatus.GENERATING)));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, PRESENTATION, "2")))
			.expectErrorSatisfies(error -> assertRejected(error, HttpStatus.CONFLICT,
				"INVALID_STATUS_TRANSITION"))
			.verify();
	}

	@Test
	@DisplayName("재개 대상이 없으면 404, 다른 사용자 소유면 403")
	void prepare_resumeNotFoundOrForeign() {
		stubContext(Mono.just(DeckStructureFixture.project()),
			Mono.just(DeckStructureFixture.create(3)));
		when(presentationRepository.findById(eq(PresentationId.of("missing"))))
			.thenReturn(Mono.empty());
		Presentation foreign = new Presentation(PresentationId.of("foreign"),
			UserId.of("someone-else"), PROJECT, DECK, "Deck", null, PresentationStatus.DRAFT,
			SlideFixture.createRange(1), 0, 3, null, NOW, null);
		when(presentationRepository.findById(eq(foreign.id()))).thenReturn(Mono.just(foreign));

		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, "missing", "2")))
			.expectErrorSatisfies(
				error -> assertRejected(error, HttpStatus.NOT_FOUND, "PRESENTATION_NOT_FOUND"))
			.verify();
		StepVerifier.create(service.prepare(command(PROJECT, DECK, null, "foreign", "2")))
			.expectErrorSatisfies(
				error -> assertRejected(error, HttpStatus.FORBIDDEN, "ACCESS_DENIED"))
			.verify();
	}

	@Test
	@DisplayName("저장된 슬라이드보다 앞 번호로 재개하면 그 슬라이드들은 재생성 없이 다시 보낸다")
	void reconcile_earlierSlideReplaysPersisted() {
		Presentation draft = PresentationFixture.withSlides(PresentationStatus.DRAFT, 3, 5);

		GenerationJob job = service.reconcile(draft,
			new ResumeTarget(draft.id(), 2),
			UserIdFixture.create(),
			PresentationCustomization.defaults(),
			context(5));

		assertThat(job.startSlide()).isEqualTo(4);
		assertThat(job.replaySlides()).extracting(Slide::slideNumber).containsExactly(2, 3);
		assertThat(job.pendingSpecs()).extracting(SlideSpec::slideNumber).containsExactly(4, 5);
		assertThat(job.alreadyCompleted()).isEqualTo(3);
	}

	@Test
	@DisplayName("저장된 슬라이드보다 뒤 번호를 요청해도 빠진 슬라이드부터 생성한다")
	void reconcile_laterSlideFillsGap() {
		Presentation draft = PresentationFixture.withSlides(PresentationStatus.FAILED, 2, 6);

		GenerationJob job = service.reconcile(draft,
			new ResumeTarget(draft.id(), 5),
			UserIdFixture.create(),
			PresentationCustomization.defaults(),
			context(6));

		assertThat(job.startSlide()).isEqualTo(3);
		assertThat(job.pendingSpecs()).extracting(SlideSpec::slideNumber)
			.containsExactly(3, 4, 5, 6);
		assertThat(job.replaySlides()).isEmpty();
	}

	@Test
	@DisplayName("저장된 슬라이드 번호에 빈 곳이 있으면 그 번호부터 생성한다")
	void reconcile_gapInPersistedSlides() {
		List<Slide> slides = List.of(SlideFixture.create(1), SlideFixture.create(2),
			SlideFixture.create(4));
		Presentation draft = PresentationFixture.create(PresentationStatus.DRAFT, slides, 5);

		GenerationJob job = service.reconcile(draft,
			new ResumeTarget(draft.id(), 3),
			UserIdFixture.create(),
			PresentationCustomization.defaults(),
			context(5));

		assertThat(job.startSlide()).isEqualTo(3);
		assertThat(job.carryOverSlides()).extracting(Slide::slideNumber).containsExactly(1, 2);
		assertThat(job.pendingSpecs()).extracting(SlideSpec::slideNumber)
			.containsExactly(3, 4, 5);
	}

	@Test
	@DisplayName("resumeFromSlide 가 숫자가 아니거나 1 미만이면 재개로 보지 않는다")
	void parseResume_invalidValues() {
		assertThat(service.parseResume(command(PROJECT, DECK, null, PRESENTATION, "abc")))
			.isEmpty();
		assertThat(service.parseResume(command(PROJECT, DECK, null, PRESENTATION, "-1")))
			.isEmpty();
		assertThat(service.parseResume(command(PROJECT, DECK, null, null, "3"))).isEmpty();
		assertThat(service.parseResume(command(PROJECT, DECK, null, PRESENTATION, "3")))
			.isEqualTo(Optional.of(new ResumeTarget(PresentationId.of(PRESENTATION), 3)));
	}

	@Test
	@DisplayName("스타일 옵션이 비었거나 일부만 있으면 기본값을 채운다")
	void parseCustomization_defaults() {
		assertThat(service.parseCustomization(null)).isEqualTo(PresentationCustomization.defaults());

		PresentationCustomization partial = service
			.parseCustomization("{\"visualStyle\":\"bold\",\"imageStyle\":\"icons\"}");

		assertThat(partial.visualStyle()).isEqualTo(PresentationCustomization.VisualStyle.BOLD);
		assertThat(partial.imageStyle()).isEqualTo(PresentationCustomization.ImageStyle.ICONS);
		assertThat(partial.textDensity()).isEqualTo(PresentationCustomization.TextDensity.BALANCED);
		assertThatThrownBy(() -> service.parseCustomization("not-json"))
			.isInstanceOf(GenerationRequestException.class);
	}

	private void allowRateLimit() {
		when(rateLimitPort.tryAcquire(anyString(), anyInt(), any(Duration.class)))
			.thenReturn(Mono.just(true));
	}

	private void stubContext(Mono<FunnelProject> project, Mono<DeckStructure> deckStructure) {
		when(contextRepository.findProject(PROJECT)).thenReturn(project);
		when(contextRepository.findDeckStructure(DECK, UserIdFixture.create()))
			.thenReturn(deckStructure);
		when(contextRepository.findBrandDesign(PROJECT)).thenReturn(Mono.empty());
		when(contextRepository.findBusinessProfile(PROJECT)).thenReturn(Mono.empty());
	}

	private GenerationContext context(int slideCount) {
		return new GenerationContext(PROJECT,
			DeckStructureFixture.create(slideCount),
			new BrandDesign("Acme", "#FF5500", null, null, null, null),
			BusinessProfile.empty());
	}

	private GenerationCommand command(String projectId,
		String deckStructureId,
		String customization,
		String resumePresentationId,
		String resumeFromSlide) {
		return new GenerationCommand(USER, projectId, deckStructureId, customization,
			resumePresentationId, resumeFromSlide);
	}

	private void assertRejected(Throwable error, HttpStatus status, String code) {
		assertThat(error).isInstanceOf(GenerationRequestException.class);
		GenerationRequestException rejected = (GenerationRequestException) error;
		assertThat(rejected.getStatusCode()).isEqualTo(status);
		assertThat(rejected.getCode()).isEqualTo(code);
	}
}
