package com.study.webflux.funnel.application.presentation.service;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Service;

import com.study.webflux.funnel.application.presentation.dto.PresentationStatusResponse;
import com.study.webflux.funnel.application.presentation.exception.GenerationRequestException;
import com.study.webflux.funnel.domain.presentation.model.PresentationId;
import com.study.webflux.funnel.domain.presentation.model.UserId;
import com.study.webflux.funnel.domain.presentation.port.PresentationRepository;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class PresentationQueryService {

	private final PresentationRepository presentationRepository;

	/** 소유자에게만 생성 상태와 다음 재개 위치를 반환합니다. */
	public Mono<PresentationStatusResponse> getStatus(String presentationId, String userId) {
		return Mono.defer(() -> {
			if (userId == null || userId.isBlank()) {
				throw GenerationRequestException.unauthorized();
			}
			UserId owner = UserId.of(userId);
			return presentationRepository.findById(PresentationId.of(presentationId))
				.switchIfEmpty(Mono.error(() -> GenerationRequestException
					.notFound("PRESENTATION_NOT_FOUND", "Presentation not found")))
				.flatMap(presentation -> presentation.isOwnedBy(owner)
					? Mono.just(PresentationStatusResponse.from(presentation))
					: Mono.error(GenerationRequestException.forbidden()));
		});
	}
}
