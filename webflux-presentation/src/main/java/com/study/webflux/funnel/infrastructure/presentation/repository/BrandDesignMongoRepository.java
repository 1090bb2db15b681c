package com.study.webflux.funnel.infrastructure.presentation.repository;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

import com.study.webflux.funnel.domain.presentation.entity.BrandDesignEntity;
import reactor.core.publisher.Mono;

public interface BrandDesignMongoRepository
	extends
		ReactiveMongoRepository<BrandDesignEntity, String> {
	Mono<BrandDesignEntity> findFirstByFunnelProjectId(String funnelProjectId);
}
