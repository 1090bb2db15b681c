package com.study.webflux.funnel.domain.generation.model;

public enum GenerationErrorReason {
	TIMEOUT,
	GENERATION_FAILED
}
