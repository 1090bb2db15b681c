package com.study.webflux.funnel.infrastructure.presentation.adapter.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.presentation.entity.PresentationEntity;
import com.study.webflux.funnel.domain.presentation.entity.SlideEntity;
import com.study.webflux.funnel.domain.presentation.model.InvalidStatusTransitionException;
import com.study.webflux.funnel.domain.presentation.model.LayoutType;
import com.study.webflux.funnel.domain.presentation.model.Presentation;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.PresentationStatus;
import com.study.webflux.funnel.domain.presentation.model.Slide;
import com.study.webflux.funnel.domain.presentation.model.UserId;
import com.study.webflux.funnel.domain.presentation.port.PresentationRepository;
import com.study.webflux.funnel.infrastructure.presentation.repository.PresentationMongoRepository;
import reactor.core.publisher.Mono;

/**
 * MongoDB 기반 프레젠테이션 진행 저장소 어댑터입니다.
 *
 * <p>
 * 슬라이드 추가와 상태 전이는 조건부 단일 업데이트로 수행하여 동시에 여러 요청이 같은 문서를 갱신해도 중복 슬라이드나 잘못된 상태가 생기지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresentationMongoAdapter implements PresentationRepository {

	private static final String ID = "_id";
	private static final String SLIDE_NUMBER = "slideNumber";

	private final PresentationMongoRepository mongoRepository;
	private final ReactiveMongoTemplate mongoTemplate;

	@Override
	public Mono<Presentation> create(Presentation presentation) {
		return mongoRepository.insert(toEntity(presentation)).map(this::toPresentation);
	}

	@Override
	public Mono<Presentation> findById(PresentationId id) {
		return mongoRepository.findById(id.value()).map(this::toPresentation);
	}

	@Override
	public Mono<Long> countActiveByProject(String funnelProjectId) {
		return mongoRepository.countByFunnelProjectIdAndStatusNot(funnelProjectId,
			PresentationStatus.FAILED.getValue());
	}

	@Override
	public Mono<Boolean> appendSlide(PresentationId id, Slide slide, int progress) {
		Query query = Query.query(Criteria.where(ID)
			.is(id.value())
			.and(PresentationEntity.FIELD_SLIDE_NUMBER)
			.ne(slide.slideNumber()));
		Update update = new Update().push(PresentationEntity.FIELD_SLIDES)
			.sort(Sort.by(Sort.Direction.ASC, SLIDE_NUMBER))
			.each(toSlideEntity(slide))
			.max(PresentationEntity.FIELD_PROGRESS, progress)
			.set(PresentationEntity.FIELD_UPDATED_AT, Instant.now());

		return mongoTemplate.updateFirst(query, update, PresentationEntity.class)
			.map(result -> result.getModifiedCount() > 0)
			.doOnNext(appended -> {
				if (!appended) {
					log.debug("슬라이드 {} 이미 저장됨, 추가 생략 presentationId={}", slide.slideNumber(),
						id.value());
				}
			});
	}

	@Override
	public Mono<Void> transitionStatus(PresentationId id,
		PresentationStatus target,
		String errorMessage) {
		Update update = new Update().set(PresentationEntity.FIELD_STATUS, target.getValue())
			.set(PresentationEntity.FIELD_UPDATED_AT, Instant.now());
		if (errorMessage == null) {
			update.unset(PresentationEntity.FIELD_ERROR_MESSAGE);
		} else {
			update.set(PresentationEntity.FIELD_ERROR_MESSAGE, errorMessage);
		}
		return conditionalUpdate(id, target, update);
	}

	@Override
	public Mono<Void> complete(PresentationId id, List<Slide> slides) {
		Instant now = Instant.now();
		Update update = new Update()
			.set(PresentationEntity.FIELD_STATUS, PresentationStatus.COMPLETED.getValue())
			.set(PresentationEntity.FIELD_SLIDES, slides.stream().map(this::toSlideEntity).toList())
			.set(PresentationEntity.FIELD_PROGRESS, 100)
			.set(PresentationEntity.FIELD_COMPLETED_AT, now)
			.set(PresentationEntity.FIELD_UPDATED_AT, now)
			.unset(PresentationEntity.FIELD_ERROR_MESSAGE);
		return conditionalUpdate(id, PresentationStatus.COMPLETED, update);
	}

	private Mono<Void> conditionalUpdate(PresentationId id,
		PresentationStatus target,
		Update update) {
		List<String> priorStates = PresentationStatus.allowedPriorStates(target).stream()
			.map(PresentationStatus::getValue)
			.toList();
		Query query = Query.query(Criteria.where(ID)
			.is(id.value())
			.and(PresentationEntity.FIELD_STATUS)
			.in(priorStates));

		return mongoTemplate.updateFirst(query, update, PresentationEntity.class)
			.flatMap(result -> result.getMatchedCount() > 0
				? Mono.<Void>empty()
				: rejectTransition(id, target));
	}

	private Mono<Void> rejectTransition(PresentationId id, PresentationStatus target) {
		return findById(id).map(presentation -> Optional.of(presentation.status()))
			.defaultIfEmpty(Optional.empty())
			.flatMap(current -> Mono.error(
				new InvalidStatusTransitionException(id, current.orElse(null), target)));
	}

	private PresentationEntity toEntity(Presentation presentation) {
		return new PresentationEntity(presentation.id().value(),
			presentation.userId().value(),
			presentation.funnelProjectId(),
			presentation.deckStructureId(),
			presentation.title(),
			presentation.customization(),
			presentation.status().getValue(),
			presentation.slides().stream().map(this::toSlideEntity).toList(),
			presentation.generationProgress(),
			presentation.totalExpectedSlides(),
			presentation.errorMessage(),
			presentation.createdAt(),
			Instant.now(),
			presentation.completedAt());
	}

	private SlideEntity toSlideEntity(Slide slide) {
		return new SlideEntity(slide.slideNumber(),
			slide.title(),
			slide.content(),
			slide.speakerNotes(),
			slide.layoutType().getValue(),
			slide.section(),
			slide.imagePrompt(),
			slide.imageUrl(),
			slide.imageGeneratedAt());
	}

	private Presentation toPresentation(PresentationEntity entity) {
		List<Slide> slides = entity.slides() == null
			? List.of()
			: entity.slides().stream().map(this::toSlide).toList();
		return new Presentation(PresentationId.of(entity.id()),
			UserId.of(entity.userId()),
			entity.funnelProjectId(),
			entity.deckStructureId(),
			entity.title(),
			entity.customization(),
			PresentationStatus.fromValue(entity.status()),
			slides,
			entity.generationProgress(),
			entity.totalExpectedSlides(),
			entity.errorMessage(),
			entity.createdAt(),
			entity.completedAt());
	}

	private Slide toSlide(SlideEntity entity) {
		return new Slide(entity.slideNumber(),
			entity.title(),
			entity.content(),
			entity.speakerNotes(),
			LayoutType.fromValue(entity.layoutType()),
			entity.section(),
			entity.imagePrompt(),
			entity.imageUrl(),
			entity.imageGeneratedAt());
	}
}
