package com.study.webflux.funnel.domain.presentation.entity;

import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/** 슬라이드 항목은 작성 도구가 남긴 형태 그대로 보관합니다. */
@Document(collection = "deck_structures")
public record DeckStructureEntity(
	@Id String id,
	@Indexed String userId,
	String funnelProjectId,
	String title,
	List<Object> slides
) {
}
