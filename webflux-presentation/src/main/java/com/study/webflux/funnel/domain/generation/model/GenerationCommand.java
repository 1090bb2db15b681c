package com.study.webflux.funnel.domain.generation.model;

/**
 * 스트리밍 생성 요청의 원본 입력입니다. 검증과 해석은 세션 준비 단계에서 수행합니다.
 */
public record GenerationCommand(
	String userId,
	String projectId,
	String deckStructureId,
	String customization,
	String resumePresentationId,
	String resumeFromSlide
) {
}
