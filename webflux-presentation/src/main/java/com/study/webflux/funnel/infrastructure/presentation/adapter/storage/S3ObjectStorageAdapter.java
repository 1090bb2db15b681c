package com.study.webflux.funnel.infrastructure.presentation.adapter.storage;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.generation.port.ObjectStoragePort;
import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** S3 호환 객체 저장소에 슬라이드 이미지를 업로드합니다. */
@Slf4j
@Component
public class S3ObjectStorageAdapter implements ObjectStoragePort {

	private final S3AsyncClient s3Client;
	private final SlideGenerationProperties.Storage storage;

	public S3ObjectStorageAdapter(S3AsyncClient s3Client, SlideGenerationProperties properties) {
		this.s3Client = s3Client;
		this.storage = properties.getStorage();
	}

	@Override
	public Mono<String> upload(String path, byte[] content, String contentType) {
		PutObjectRequest request = PutObjectRequest.builder()
			.bucket(storage.getBucket())
			.key(path)
			.contentType(contentType)
			.cacheControl(storage.getCacheControl())
			.build();

		return Mono.fromFuture(() -> s3Client.putObject(request, AsyncRequestBody.fromBytes(content)))
			.doOnNext(response -> log.debug("객체 업로드 완료 - key={}, etag={}", path, response.eTag()))
			.thenReturn(publicUrl(path));
	}

	String publicUrl(String path) {
		String base = storage.getPublicBaseUrl();
		if (base == null || base.isBlank()) {
			base = "https://" + storage.getBucket() + ".s3." + storage.getRegion() + ".amazonaws.com";
		}
		return base.endsWith("/") ? base + path : base + "/" + path;
	}
}
