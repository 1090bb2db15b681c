package com.study.webflux.funnel.application.presentation.controller.docs;

import java.util.Map;

import com.study.webflux.funnel.application.presentation.dto.ErrorResponse;
import com.study.webflux.funnel.application.presentation.dto.PresentationStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Tag(
	name = "프레젠테이션 생성 API",
	description = "덱 구조로부터 슬라이드를 한 장씩 생성해 SSE 로 전달하고, 끊긴 생성을 이어서 진행합니다"
)
public interface PresentationStreamApi {

	@Operation(
		summary = "프레젠테이션 스트리밍 생성",
		description = "connected, slide_generated, progress, completed, error 이벤트와 heartbeat 주석을 전송합니다. "
			+ "resumePresentationId 와 1 이상의 resumeFromSlide 를 함께 보내면 저장된 슬라이드 다음부터 이어서 생성합니다"
	)
	@ApiResponse(
		responseCode = "200",
		description = "생성 이벤트 스트림",
		content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE)
	)
	@ApiResponse(
		responseCode = "400",
		description = "필수 파라미터 누락 또는 잘못된 스타일 옵션",
		content = @Content(schema = @Schema(implementation = ErrorResponse.class))
	)
	@ApiResponse(
		responseCode = "429",
		description = "요청 빈도 제한 또는 프로젝트 생성 한도 초과",
		content = @Content(schema = @Schema(implementation = ErrorResponse.class))
	)
	Mono<ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>>> generateStream(
		@Parameter(description = "요청 사용자 ID") String userId,
		@Parameter(description = "퍼널 프로젝트 ID") String projectId,
		@Parameter(description = "덱 구조 ID") String deckStructureId,
		@Parameter(description = "스타일 옵션 JSON") String customization,
		@Parameter(description = "재개할 프레젠테이션 ID") String resumePresentationId,
		@Parameter(description = "재개 시작 슬라이드 번호 (1부터)") String resumeFromSlide
	);

	@Operation(
		summary = "프레젠테이션 생성 상태 조회",
		description = "현재 상태, 진행률, 저장된 슬라이드 수와 재개 가능 여부를 반환합니다"
	)
	Mono<PresentationStatusResponse> getStatus(
		@Parameter(description = "프레젠테이션 ID") String presentationId,
		@Parameter(description = "요청 사용자 ID") String userId
	);
}
