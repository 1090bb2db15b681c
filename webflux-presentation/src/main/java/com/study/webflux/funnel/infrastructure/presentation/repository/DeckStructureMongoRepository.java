package com.study.webflux.funnel.infrastructure.presentation.repository;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

import com.study.webflux.funnel.domain.presentation.entity.DeckStructureEntity;
import reactor.core.publisher.Mono;

public interface DeckStructureMongoRepository
	extends
		ReactiveMongoRepository<DeckStructureEntity, String> {
	Mono<DeckStructureEntity> findByIdAndUserId(String id, String userId);
}
