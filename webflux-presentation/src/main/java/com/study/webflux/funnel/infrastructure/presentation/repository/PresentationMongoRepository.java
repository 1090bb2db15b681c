package com.study.webflux.funnel.infrastructure.presentation.repository;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

import com.study.webflux.funnel.domain.presentation.entity.PresentationEntity;
import reactor.core.publisher.Mono;

public interface PresentationMongoRepository
	extends
		ReactiveMongoRepository<PresentationEntity, String> {
	Mono<Long> countByFunnelProjectIdAndStatusNot(String funnelProjectId, String status);
}
