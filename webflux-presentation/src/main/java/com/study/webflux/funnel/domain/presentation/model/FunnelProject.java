package com.study.webflux.funnel.domain.presentation.model;

public record FunnelProject(
	String id,
	UserId userId,
	String name
) {
	public boolean isOwnedBy(UserId candidate) {
		return userId != null && userId.equals(candidate);
	}
}
