package com.study.webflux.funnel.application.presentation.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.funnel.application.presentation.exception.GenerationTimeoutException;
import com.study.webflux.funnel.domain.generation.model.GenerationCommand;
import com.study.webflux.funnel.domain.generation.model.GenerationErrorReason;
import com.study.webflux.funnel.domain.generation.model.GenerationEvent;
import com.study.webflux.funnel.domain.generation.model.GenerationJob;
import com.study.webflux.funnel.domain.generation.model.GenerationPhase;
import com.study.webflux.funnel.domain.generation.model.SlideCompletionCallback;
import com.study.webflux.funnel.domain.presentation.model.Presentation;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import com.study.webflux.funnel.domain.presentation.port.PresentationRepository;
import com.study.webflux.funnel.domain.presentation.port.PresentationStreamUseCase;
import com.study.webflux.funnel.infrastructure.monitoring.config.SlideGenerationMetricsConfiguration;
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 생성 작업 하나를 SSE 이벤트 스트림으로 실행합니다.
 *
 * <p>
 * 이벤트 순서: {@code connected} → (재전송 {@code slide_generated}) → 슬라이드마다 {@code slide_generated}, {@code progress} →
 * {@code completed} 또는 {@code error}. 실행 중에는 heartbeat 주석이 섞여 나가며, 종료 이벤트를 보내기 전에 멈춥니다.
 *
 * <p>
 * 실패, 전체 제한 시간 초과, 클라이언트 연결 종료 시에는 저장소의 슬라이드 수를 다시 읽어 1장 이상이면 draft, 없으면 failed 로 마무리합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresentationStreamService implements PresentationStreamUseCase {

	static final String TIMEOUT_REASON = "AI_PROVIDER_TIMEOUT";
	static final String DISCONNECT_REASON = "CLIENT_DISCONNECTED";

	private final GenerationSetupService setupService;
	private final SlideGenerationOrchestrator orchestrator;
	private final PresentationRepository presentationRepository;
	private final HeartbeatTicker heartbeatTicker;
	private final SlideGenerationProperties properties;
	private final SlideGenerationMetricsConfiguration metrics;
	private final Clock clock;

	@Override
	public Mono<GenerationJob> prepare(GenerationCommand command) {
		return setupService.prepare(command);
	}

	@Override
	public Flux<GenerationEvent> stream(GenerationJob job) {
		return Flux.defer(() -> {
			GenerationSession session = new GenerationSession(job);
			SlideGenerationProperties.Stream stream = properties.getStream();
			metrics.recordJobStarted();

			Flux<GenerationEvent> heartbeat = heartbeatTicker
				.ticks(stream.getHeartbeatInterval(), session.heartbeatStop.asMono());

			return Flux.merge(session.events.asFlux(), heartbeat, run(session).then(Mono.empty()));
		});
	}

	private Mono<Void> run(GenerationSession session) {
		GenerationJob job = session.job;
		Duration deadline = properties.getStream().getDeadline();

		return Mono.fromRunnable(() -> connect(session))
			.then(Mono.defer(() -> {
				session.moveTo(GenerationPhase.GENERATING);
				return orchestrator.generate(job.toSlideGenerationRequest(), callback(session));
			}))
			.timeout(deadline, Mono.error(() -> new GenerationTimeoutException(deadline)))
			.flatMap(generated -> complete(session, generated))
			.onErrorResume(error -> fail(session, error))
			.doOnCancel(() -> disconnect(session));
	}

	private void connect(GenerationSession session) {
		GenerationJob job = session.job;
		session.moveTo(GenerationPhase.CONNECTED);
		session.emit(GenerationEvent.connected(job.presentationId(),
			job.totalExpectedSlides(),
			job.resuming(),
			job.startSlide(),
			job.pendingSpecs().size()));

		for (Slide slide : job.replaySlides()) {
			int progress = progressOf(slide.slideNumber(), job.totalExpectedSlides());
			session.emit(GenerationEvent.slideGenerated(slide, progress));
		}
	}

	/**
	 * 슬라이드 이벤트를 먼저 보낸 뒤 저장합니다. 저장 실패는 기록만 하고 생성을 계속합니다.
	 */
	private SlideCompletionCallback callback(GenerationSession session) {
		GenerationJob job = session.job;
		return (slide, progress) -> {
			session.generated.add(slide);
			session.emit(GenerationEvent.slideGenerated(slide, progress));
			session.emit(GenerationEvent.progress(progress, slide.slideNumber()));
			return presentationRepository.appendSlide(job.presentationId(), slide, progress)
				.onErrorResume(error -> {
					metrics.recordPersistenceFailure();
					log.error("슬라이드 저장 실패, 생성은 계속 진행 - presentationId={}, slide={}: {}",
						job.presentationId().value(), slide.slideNumber(), error.toString());
					return Mono.empty();
				})
				.then();
		};
	}

	private Mono<Void> complete(GenerationSession session, List<Slide> generated) {
		GenerationJob job = session.job;
		List<Slide> allSlides = new ArrayList<>(job.carryOverSlides());
		allSlides.addAll(generated);

		return presentationRepository.complete(job.presentationId(), allSlides)
			.then(Mono.fromRunnable(() -> {
				session.finish(GenerationPhase.COMPLETED,
					GenerationEvent.completed(job.presentationId(), allSlides));
				recordFinished(session, PresentationStatus.COMPLETED.getValue());
				log.info("프레젠테이션 생성 완료 - presentationId={}, slides={}",
					job.presentationId().value(), allSlides.size());
			}));
	}

	private Mono<Void> fail(GenerationSession session, Throwable error) {
		GenerationJob job = session.job;
		boolean timeout = isTimeout(error);
		String reason = timeout ? TIMEOUT_REASON : describe(error);
		if (timeout) {
			log.error("프레젠테이션 생성 시간 초과 - presentationId={}: {}", job.presentationId().value(),
				error.toString());
		} else {
			log.error("프레젠테이션 생성 실패 - presentationId={}", job.presentationId().value(), error);
		}

		return finalizeStopped(session, reason).doOnNext(outcome -> {
			GenerationPhase phase = outcome.status() == PresentationStatus.DRAFT
				? GenerationPhase.DRAFT
				: GenerationPhase.FAILED;
			session.finish(phase, GenerationEvent.error(reason,
				timeout ? GenerationErrorReason.TIMEOUT : GenerationErrorReason.GENERATION_FAILED,
				job.presentationId(),
				outcome.slidesGenerated(),
				outcome.status()));
			recordFinished(session, outcome.status().getValue());
		}).then();
	}

	/**
	 * 클라이언트가 연결을 끊으면 진행 중인 생성은 취소되고 마무리 저장만 백그라운드에서 수행합니다.
	 */
	private void disconnect(GenerationSession session) {
		if (!session.finished.compareAndSet(false, true)) {
			return;
		}
		session.heartbeatStop.tryEmitEmpty();
		GenerationJob job = session.job;
		log.warn("클라이언트 연결 종료 - presentationId={}, phase={}", job.presentationId().value(),
			session.phase);

		finalizeStopped(session, DISCONNECT_REASON).subscribe(outcome -> {
			recordFinished(session, "cancelled");
			log.info("연결 종료 후 마무리 - presentationId={}, status={}, slides={}",
				job.presentationId().value(), outcome.status().getValue(),
				outcome.slidesGenerated());
		}, error -> log.error("연결 종료 후 마무리 실패 - presentationId={}", job.presentationId().value(),
			error));
	}

	/**
	 * 저장소에 남은 슬라이드 수로 draft/failed 를 정하고 상태와 오류 메시지를 기록합니다.
	 */
	private Mono<StoppedOutcome> finalizeStopped(GenerationSession session, String reason) {
		GenerationJob job = session.job;
		return presentationRepository.findById(job.presentationId())
			.map(Presentation::slideCount)
			.defaultIfEmpty(0)
			.onErrorResume(error -> {
				log.error("저장된 슬라이드 조회 실패 - presentationId={}: {}", job.presentationId().value(),
					error.toString());
				return Mono.just(job.alreadyCompleted() + session.generated.size());
			})
			.flatMap(slideCount -> {
				PresentationStatus status = slideCount > 0
					? PresentationStatus.DRAFT
					: PresentationStatus.FAILED;
				String message = slideCount > 0
					? "Generation stopped at slide " + slideCount + ". " + reason
					: reason;
				return presentationRepository.transitionStatus(job.presentationId(), status, message)
					.onErrorResume(error -> {
						log.error("중단 상태 저장 실패 - presentationId={}, status={}: {}",
							job.presentationId().value(), status.getValue(), error.toString());
						return Mono.empty();
					})
					.thenReturn(new StoppedOutcome(status, slideCount));
			});
	}

	private void recordFinished(GenerationSession session, String outcome) {
		metrics.recordJobFinished(outcome,
			Duration.between(session.job.startedAt(), clock.instant()));
	}

	private boolean isTimeout(Throwable error) {
		Throwable current = error;
		while (current != null) {
			if (current instanceof GenerationTimeoutException
				|| current instanceof TimeoutException) {
				return true;
			}
			current = current.getCause();
		}
		return false;
	}

	private String describe(Throwable error) {
		return error.getMessage() != null ? error.getMessage() : "Unknown error";
	}

	private int progressOf(int slideNumber, int totalSlides) {
		long percent = Math.round(slideNumber * 100.0 / totalSlides);
		return (int) Math.max(0, Math.min(100, percent));
	}

	record StoppedOutcome(
		PresentationStatus status,
		int slidesGenerated
	) {
	}

	/**
	 * 스트림 구독 하나의 상태입니다. 이벤트는 순차 생성 체인에서만 발행됩니다.
	 */
	private static final class GenerationSession {

		private final GenerationJob job;
		private final Sinks.Many<GenerationEvent> events = Sinks.many().unicast()
			.onBackpressureBuffer();
		private final Sinks.Empty<Void> heartbeatStop = Sinks.empty();
		private final AtomicBoolean finished = new AtomicBoolean();
		private final List<Slide> generated = new ArrayList<>();
		private volatile GenerationPhase phase = GenerationPhase.INITIALIZING;

		private GenerationSession(GenerationJob job) {
			this.job = job;
		}

		private void moveTo(GenerationPhase next) {
			log.debug("생성 단계 전환 - presentationId={}, {} -> {}", job.presentationId().value(), phase,
				next);
			phase = next;
		}

		private void emit(GenerationEvent event) {
			Sinks.EmitResult result = events.tryEmitNext(event);
			if (result.isFailure()) {
				log.debug("이벤트 전송 실패 - presentationId={}, type={}, result={}",
					job.presentationId().value(), event.type(), result);
			}
		}

		/** heartbeat 를 멈춘 뒤 종료 이벤트를 보내고 스트림을 닫습니다. 한 번만 동작합니다. */
		private void finish(GenerationPhase terminal, GenerationEvent event) {
			if (!finished.compareAndSet(false, true)) {
				return;
			}
			heartbeatStop.tryEmitEmpty();
			moveTo(terminal);
			emit(event);
			events.tryEmitComplete();
		}
	}
}
