package com.study.webflux.funnel.infrastructure.presentation.config;

import java.net.URI;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;

/** 이미지 저장용 S3 비동기 클라이언트를 구성합니다. 자격 증명은 AWS 기본 제공자 체인을 따릅니다. */
@Configuration
public class StorageConfiguration {

	@Bean(destroyMethod = "close")
	public S3AsyncClient s3AsyncClient(SlideGenerationProperties properties) {
		SlideGenerationProperties.Storage storage = properties.getStorage();
		S3AsyncClientBuilder builder = S3AsyncClient.builder()
			.region(Region.of(storage.getRegion()));
		if (storage.getEndpoint() != null && !storage.getEndpoint().isBlank()) {
			builder.endpointOverride(URI.create(storage.getEndpoint())).forcePathStyle(true);
		}
		return builder.build();
	}
}
