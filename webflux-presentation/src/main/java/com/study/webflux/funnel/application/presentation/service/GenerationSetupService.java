package com.study.webflux.funnel.application.presentation.service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.funnel.application.presentation.exception.GenerationRequestException;
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
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import reactor.core.publisher.Mono;

/**
 * 스트리밍 생성 세션을 준비합니다.
 *
 * <p>
 * 필수 파라미터 → 사용자 → 요청 빈도 제한(새 작업만) → 스타일 옵션 → 프로젝트/덱 구조 → 생성 한도(새 작업만) 순서로 검증한 뒤 새 프레젠테이션을 만들거나
 * 기존 프레젠테이션을 재개 상태로 전환합니다. 여기서 발생한 오류는 스트림 시작 전 HTTP 오류 응답이 됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationSetupService {

	private final PresentationRepository presentationRepository;
	private final GenerationContextRepository contextRepository;
	private final RateLimitPort rateLimitPort;
	private final ObjectMapper objectMapper;
	private final SlideGenerationProperties properties;
	private final Clock clock;

	public Mono<GenerationJob> prepare(GenerationCommand command) {
		return Mono.defer(() -> {
			if (isBlank(command.projectId()) || isBlank(command.deckStructureId())) {
				throw GenerationRequestException.badRequest("MISSING_PARAMETERS",
					"Missing projectId or deckStructureId");
			}
			if (isBlank(command.userId())) {
				throw GenerationRequestException.unauthorized();
			}
			UserId userId = UserId.of(command.userId());
			Optional<ResumeTarget> resume = parseResume(command);

			return checkRateLimit(userId, resume.isPresent())
				.then(Mono.fromCallable(() -> parseCustomization(command.customization())))
				.flatMap(customization -> loadContext(command, userId)
					.flatMap(context -> resume
						.map(target -> resumeJob(target, userId, customization, context))
						.orElseGet(() -> freshJob(command.projectId(), userId, customization,
							context))));
		});
	}

	/**
	 * 재개 요청은 프레젠테이션 ID 와 1 이상의 슬라이드 번호가 모두 있을 때만 인정합니다. 0, 음수, 숫자가 아닌 값은 새 작업으로 취급합니다.
	 */
	Optional<ResumeTarget> parseResume(GenerationCommand command) {
		if (isBlank(command.resumePresentationId()) || isBlank(command.resumeFromSlide())) {
			return Optional.empty();
		}
		try {
			int fromSlide = Integer.parseInt(command.resumeFromSlide().trim());
			if (fromSlide < 1) {
				return Optional.empty();
			}
			return Optional.of(new ResumeTarget(PresentationId.of(command.resumePresentationId()),
				fromSlide));
		} catch (IllegalArgumentException e) {
			log.debug("재개 파라미터 무시 - resumeFromSlide={}", command.resumeFromSlide());
			return Optional.empty();
		}
	}

	PresentationCustomization parseCustomization(String raw) {
		if (isBlank(raw)) {
			return PresentationCustomization.defaults();
		}
		try {
			PresentationCustomization customization = objectMapper.readValue(raw,
				PresentationCustomization.class);
			return customization != null ? customization : PresentationCustomization.defaults();
		} catch (JsonProcessingException | IllegalArgumentException e) {
			throw GenerationRequestException.badRequest("INVALID_CUSTOMIZATION",
				"Invalid customization parameters");
		}
	}

	private Mono<Void> checkRateLimit(UserId userId, boolean resuming) {
		if (resuming) {
			log.info("재개 요청은 요청 빈도 제한을 건너뜀 - userId={}", userId.value());
			return Mono.empty();
		}
		SlideGenerationProperties.RateLimit rateLimit = properties.getRateLimit();
		String identifier = rateLimit.getKeyPrefix() + ":" + userId.value();
		return rateLimitPort.tryAcquire(identifier, rateLimit.getMaxRequests(), rateLimit.getWindow())
			.flatMap(allowed -> {
				if (allowed) {
					return Mono.empty();
				}
				log.warn("요청 빈도 제한 초과 - userId={}", userId.value());
				return Mono.error(GenerationRequestException.tooManyRequests("RATE_LIMITED",
					"Too many requests"));
			});
	}

	private Mono<GenerationContext> loadContext(GenerationCommand command, UserId userId) {
		String projectId = command.projectId();
		Mono<FunnelProject> project = contextRepository.findProject(projectId)
			.switchIfEmpty(Mono.error(() -> GenerationRequestException.notFound("PROJECT_NOT_FOUND",
				"Project not found")))
			.flatMap(found -> found.isOwnedBy(userId)
				? Mono.just(found)
				: Mono.error(GenerationRequestException.forbidden()));
		Mono<DeckStructure> deckStructure = contextRepository
			.findDeckStructure(command.deckStructureId(), userId)
			.switchIfEmpty(Mono.error(() -> GenerationRequestException
				.notFound("DECK_STRUCTURE_NOT_FOUND", "Deck structure not found")));
		Mono<Optional<BrandDesign>> brandDesign = contextRepository.findBrandDesign(projectId)
			.map(Optional::of)
			.defaultIfEmpty(Optional.empty());
		Mono<BusinessProfile> businessProfile = contextRepository.findBusinessProfile(projectId)
			.defaultIfEmpty(BusinessProfile.empty());

		return project.then(Mono.zip(deckStructure, brandDesign, businessProfile))
			.map(tuple -> new GenerationContext(projectId, tuple.getT1(),
				tuple.getT2().orElse(null), tuple.getT3()));
	}

	private Mono<GenerationJob> freshJob(String projectId,
		UserId userId,
		PresentationCustomization customization,
		GenerationContext context) {
		return checkQuota(projectId)
			.then(Mono.defer(() -> presentationRepository.create(Presentation.start(userId,
				projectId,
				context.deckStructure(),
				customization))))
			.map(presentation -> {
				List<SlideSpec> specs = context.deckStructure().toSlideSpecs();
				log.info("새 프레젠테이션 생성 - presentationId={}, projectId={}, slides={}",
					presentation.id().value(), projectId, specs.size());
				return new GenerationJob(presentation.id(),
					userId,
					specs,
					List.of(),
					List.of(),
					1,
					Math.max(specs.size(), 1),
					false,
					customization,
					context.businessProfile(),
					context.brandDesign(),
					clock.instant());
			});
	}

	private Mono<Void> checkQuota(String projectId) {
		SlideGenerationProperties.Quota quota = properties.getQuota();
		if (!quota.isEnabled()) {
			return Mono.empty();
		}
		return presentationRepository.countActiveByProject(projectId)
			.defaultIfEmpty(0L)
			.flatMap(count -> {
				if (count < quota.getMaxPerProject()) {
					return Mono.empty();
				}
				log.warn("프로젝트 생성 한도 도달 - projectId={}, count={}, limit={}", projectId, count,
					quota.getMaxPerProject());
				return Mono.error(GenerationRequestException.tooManyRequests(
					"PRESENTATION_LIMIT_REACHED",
					"You have reached the limit of " + quota.getMaxPerProject()
						+ " presentations per funnel"));
			});
	}

	/**
	 * 저장된 슬라이드를 기준으로 재개 위치를 정합니다. 생성은 항상 연속으로 저장된 마지막 슬라이드 다음부터 시작하고, 클라이언트가 그보다 앞 번호를 요청하면 요청
	 * 번호부터 저장된 슬라이드를 다시 보내기만 합니다.
	 */
	private Mono<GenerationJob> resumeJob(ResumeTarget target,
		UserId userId,
		PresentationCustomization customization,
		GenerationContext context) {
		return presentationRepository.findById(target.presentationId())
			.switchIfEmpty(Mono.error(() -> GenerationRequestException.notFound(
				"PRESENTATION_NOT_FOUND", "Presentation not found for resume")))
			.flatMap(presentation -> {
				if (!presentation.isOwnedBy(userId)) {
					return Mono.error(GenerationRequestException.forbidden());
				}
				if (!presentation.status().canTransitionTo(PresentationStatus.GENERATING)) {
					return Mono.error(invalidTransition(presentation.status()));
				}
				return presentationRepository
					.transitionStatus(presentation.id(), PresentationStatus.GENERATING, null)
					.onErrorMap(InvalidStatusTransitionException.class,
						error -> invalidTransition(error.getFrom()))
					.then(Mono.fromCallable(
						() -> reconcile(presentation, target, userId, customization, context)));
			});
	}

	GenerationJob reconcile(Presentation presentation,
		ResumeTarget target,
		UserId userId,
		PresentationCustomization requested,
		GenerationContext context) {
		List<SlideSpec> specs = context.deckStructure().toSlideSpecs();
		int totalExpected = presentation.resolveTotalExpectedSlides(Math.max(specs.size(), 1));
		int persisted = presentation.contiguousSlideCount();
		int startSlide = persisted + 1;

		List<Slide> carryOver = presentation.slides().subList(0, persisted);
		List<Slide> replay = carryOver.stream()
			.filter(slide -> slide.slideNumber() >= target.fromSlide())
			.toList();
		List<SlideSpec> pending = specs.stream()
			.filter(spec -> spec.slideNumber() >= startSlide)
			.toList();

		if (target.fromSlide() != startSlide) {
			log.info("재개 위치 조정 - presentationId={}, 요청={}, 저장된 슬라이드={}, 생성 시작={}, 재전송={}",
				presentation.id().value(), target.fromSlide(), persisted, startSlide,
				replay.size());
		}

		PresentationCustomization customization = presentation.customization() != null
			? presentation.customization()
			: requested;
		return new GenerationJob(presentation.id(),
			userId,
			pending,
			carryOver,
			replay,
			startSlide,
			totalExpected,
			true,
			customization,
			context.businessProfile(),
			context.brandDesign(),
			clock.instant());
	}

	private GenerationRequestException invalidTransition(PresentationStatus from) {
		String status = from == null ? "unknown" : from.getValue();
		return GenerationRequestException.conflict("INVALID_STATUS_TRANSITION",
			"Cannot resume presentation in status " + status);
	}

	private boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	record ResumeTarget(
		PresentationId presentationId,
		int fromSlide
	) {
	}

	record GenerationContext(
		String projectId,
		DeckStructure deckStructure,
		BrandDesign brandDesign,
		BusinessProfile businessProfile
	) {
	}
}
