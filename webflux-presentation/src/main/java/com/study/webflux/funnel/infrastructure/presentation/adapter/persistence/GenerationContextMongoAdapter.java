package com.study.webflux.funnel.infrastructure.presentation.adapter.persistence;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.presentation.entity.BrandDesignEntity;
import com.study.webflux.funnel.domain.presentation.entity.BusinessProfileEntity;
import com.study.webflux.funnel.domain.presentation.entity.DeckStructureEntity;
import com.study.webflux.funnel.domain.presentation.model.BrandDesign;
import com.study.webflux.funnel.domain.presentation.model.BusinessProfile;
import com.study.webflux.funnel.domain.presentation.model.DeckStructure;
import com.study.webflux.funnel.domain.presentation.model.FunnelProject;
import com.study.webflux.funnel.domain.presentation.model.UserId;
import com.study.webflux.funnel.domain.presentation.port.GenerationContextRepository;
import com.study.webflux.funnel.infrastructure.presentation.repository.BrandDesignMongoRepository;
import com.study.webflux.funnel.infrastructure.presentation.repository.BusinessProfileMongoRepository;
import com.study.webflux.funnel.infrastructure.presentation.repository.DeckStructureMongoRepository;
import com.study.webflux.funnel.infrastructure.presentation.repository.FunnelProjectMongoRepository;
import reactor.core.publisher.Mono;

/** 퍼널 프로젝트, 덱 구조, 브랜드, 비즈니스 프로필을 MongoDB에서 조회합니다. */
@Component
@RequiredArgsConstructor
public class GenerationContextMongoAdapter implements GenerationContextRepository {

	private final FunnelProjectMongoRepository projectRepository;
	private final DeckStructureMongoRepository deckStructureRepository;
	private final BrandDesignMongoRepository brandDesignRepository;
	private final BusinessProfileMongoRepository businessProfileRepository;

	@Override
	public Mono<FunnelProject> findProject(String projectId) {
		return projectRepository.findById(projectId)
			.map(entity -> new FunnelProject(entity.id(),
				entity.userId() == null ? null : UserId.of(entity.userId()),
				entity.name()));
	}

	@Override
	public Mono<DeckStructure> findDeckStructure(String deckStructureId, UserId userId) {
		return deckStructureRepository.findByIdAndUserId(deckStructureId, userId.value())
			.map(this::toDeckStructure);
	}

	@Override
	public Mono<BrandDesign> findBrandDesign(String projectId) {
		return brandDesignRepository.findFirstByFunnelProjectId(projectId)
			.map(this::toBrandDesign);
	}

	@Override
	public Mono<BusinessProfile> findBusinessProfile(String projectId) {
		return businessProfileRepository.findFirstByFunnelProjectId(projectId)
			.map(this::toBusinessProfile);
	}

	private DeckStructure toDeckStructure(DeckStructureEntity entity) {
		return new DeckStructure(entity.id(), UserId.of(entity.userId()), entity.title(),
			entity.slides());
	}

	private BrandDesign toBrandDesign(BrandDesignEntity entity) {
		return new BrandDesign(entity.brandName(),
			entity.primaryColor(),
			entity.secondaryColor(),
			entity.accentColor(),
			entity.backgroundColor(),
			entity.textColor());
	}

	private BusinessProfile toBusinessProfile(BusinessProfileEntity entity) {
		return new BusinessProfile(entity.businessName(),
			entity.targetAudience(),
			entity.mainOffer(),
			entity.uniqueMechanism(),
			entity.brandVoice());
	}
}
