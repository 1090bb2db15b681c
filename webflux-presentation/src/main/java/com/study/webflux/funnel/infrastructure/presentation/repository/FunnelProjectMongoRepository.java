package com.study.webflux.funnel.infrastructure.presentation.repository;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

import com.study.webflux.funnel.domain.presentation.entity.FunnelProjectEntity;

public interface FunnelProjectMongoRepository
	extends
		ReactiveMongoRepository<FunnelProjectEntity, String> {
}
