package com.study.webflux.funnel.infrastructure.presentation.adapter.image;

import java.net.URI;
import java.time.Duration;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.funnel.domain.generation.port.ImageDownloadPort;
import reactor.core.publisher.Mono;

/**
 * 생성된 이미지의 임시 URL 에서 바이트를 내려받습니다. 제한 시간을 넘기면 구독이 취소되어 HTTP 요청도 함께 중단됩니다.
 *
 * <p>
 * 공급자 URL 은 서명된 쿼리를 포함하므로 URI 템플릿으로 다시 인코딩하지 않고 그대로 요청합니다.
 */
@Component
public class WebClientImageDownloadAdapter implements ImageDownloadPort {

	private final WebClient webClient;

	public WebClientImageDownloadAdapter(WebClient.Builder webClientBuilder) {
		this.webClient = webClientBuilder
			.codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024))
			.build();
	}

	@Override
	public Mono<byte[]> download(String url, Duration timeout) {
		return webClient.get()
			.uri(URI.create(url))
			.retrieve()
			.bodyToMono(byte[].class)
			.timeout(timeout);
	}
}
