package com.study.webflux.funnel.infrastructure.presentation.adapter.storage;

import java.util.concurrent.CompletableFuture;

import com.study.webflux.funnel.infrastructure.presentation.config.properties.SlideGenerationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3ObjectStorageAdapterTest {

	@Mock
	private S3AsyncClient s3Client;

	private SlideGenerationProperties properties;

	@BeforeEach
	void setUp() {
		properties = new SlideGenerationProperties();
		properties.getStorage().setBucket("presentation-media");
		properties.getStorage().setRegion("ap-northeast-2");
	}

	@Test
	@DisplayName("업로드 후 버킷 기본 URL 을 반환한다")
	void upload_returnsBucketUrl() {
		S3ObjectStorageAdapter adapter = new S3ObjectStorageAdapter(s3Client, properties);
		when(s3Client.putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class)))
			.thenReturn(CompletableFuture.completedFuture(PutObjectResponse.builder().eTag("e1")
				.build()));

		StepVerifier.create(adapter.upload("presentations/p-1/slide-1-1.png", new byte[] {1},
			"image/png"))
			.expectNext("https://presentation-media.s3.ap-northeast-2.amazonaws.com/"
				+ "presentations/p-1/slide-1-1.png")
			.verifyComplete();

		ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
		verify(s3Client).putObject(captor.capture(), any(AsyncRequestBody.class));
		assertThat(captor.getValue().bucket()).isEqualTo("presentation-media");
		assertThat(captor.getValue().contentType()).isEqualTo("image/png");
		assertThat(captor.getValue().cacheControl()).isEqualTo("public, max-age=31536000");
	}

	@Test
	@DisplayName("공개 URL 접두어가 있으면 그것을 사용한다")
	void publicUrl_customBase() {
		properties.getStorage().setPublicBaseUrl("https://cdn.example.com/");
		S3ObjectStorageAdapter adapter = new S3ObjectStorageAdapter(s3Client, properties);

		assertThat(adapter.publicUrl("presentations/a.png"))
			.isEqualTo("https://cdn.example.com/presentations/a.png");
	}
}
