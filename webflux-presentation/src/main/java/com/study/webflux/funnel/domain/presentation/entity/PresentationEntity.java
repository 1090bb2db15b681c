package com.study.webflux.funnel.domain.presentation.entity;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import com.study.webflux.funnel.domain.presentation.model.PresentationCustomization;

@Document(collection = "presentations")
@CompoundIndexes({
	@CompoundIndex(name = "project_status_idx", def = "{'funnelProjectId': 1, 'status': 1}")
})
public record PresentationEntity(
	@Id String id,
	@Indexed String userId,
	String funnelProjectId,
	String deckStructureId,
	String title,
	PresentationCustomization customization,
	String status,
	List<SlideEntity> slides,
	int generationProgress,
	Integer totalExpectedSlides,
	String errorMessage,
	Instant createdAt,
	Instant updatedAt,
	Instant completedAt
) {
	public static final String FIELD_STATUS = "status";
	public static final String FIELD_SLIDES = "slides";
	public static final String FIELD_SLIDE_NUMBER = "slides.slideNumber";
	public static final String FIELD_PROGRESS = "generationProgress";
	public static final String FIELD_ERROR_MESSAGE = "errorMessage";
	public static final String FIELD_UPDATED_AT = "updatedAt";
	public static final String FIELD_COMPLETED_AT = "completedAt";
	public static final String FIELD_PROJECT_ID = "funnelProjectId";
}
