package com.study.webflux.funnel.fixture;

import com.study.webflux.funnel.domain.presentation.model.UserId;

public final class UserIdFixture {

	public static final String DEFAULT_USER_ID = "user-1";

	private UserIdFixture() {
	}

	public static UserId create() {
		return UserId.of(DEFAULT_USER_ID);
	}

	public static UserId create(String userId) {
		return UserId.of(userId);
	}
}
