package com.study.webflux.funnel.domain.presentation.port;

import com.study.webflux.funnel.domain.presentation.model.BrandDesign;
import com.study.webflux.funnel.domain.presentation.model.BusinessProfile;
import com.study.webflux.funnel.domain.presentation.model.DeckStructure;
import com.study.webflux.funnel.domain.presentation.model.FunnelProject;
import com.study.webflux.funnel.domain.presentation.model.UserId;
import reactor.core.publisher.Mono;

/** 생성에 필요한 읽기 전용 컨텍스트를 조회합니다. 없으면 빈 {@link Mono}를 반환합니다. */
public interface GenerationContextRepository {

	Mono<FunnelProject> findProject(String projectId);

	Mono<DeckStructure> findDeckStructure(String deckStructureId, UserId userId);

	Mono<BrandDesign> findBrandDesign(String projectId);

	Mono<BusinessProfile> findBusinessProfile(String projectId);
}
