package com.study.webflux.funnel.domain.generation.port;

import com.study.webflux.funnel.domain.generation.model.CompletionRequest;
import reactor.core.publisher.Mono;

public interface LlmPort {
	Mono<String> complete(CompletionRequest request);
}
