package com.study.webflux.funnel.domain.generation.model;

/**
 * 스트리밍 생성 세션의 진행 단계입니다.
 *
 * <p>
 * {@code INITIALIZING → CONNECTED → GENERATING → (COMPLETED | DRAFT | FAILED)}
 */
public enum GenerationPhase {
	INITIALIZING,
	CONNECTED,
	GENERATING,
	COMPLETED,
	DRAFT,
	FAILED;

	public boolean isTerminal() {
		return this == COMPLETED || this == DRAFT || this == FAILED;
	}
}
