package com.study.webflux.funnel.infrastructure.presentation.repository;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

import com.study.webflux.funnel.domain.presentation.entity.BusinessProfileEntity;
import reactor.core.publisher.Mono;

public interface BusinessProfileMongoRepository
	extends
		ReactiveMongoRepository<BusinessProfileEntity, String> {
	Mono<BusinessProfileEntity> findFirstByFunnelProjectId(String funnelProjectId);
}
