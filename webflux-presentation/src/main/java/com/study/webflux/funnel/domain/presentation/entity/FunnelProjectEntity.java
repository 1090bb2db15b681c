package com.study.webflux.funnel.domain.presentation.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "funnel_projects")
public record FunnelProjectEntity(
	@Id String id,
	@Indexed String userId,
	String name
) {
}
