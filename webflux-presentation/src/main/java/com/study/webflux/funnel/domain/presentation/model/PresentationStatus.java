package com.study.webflux.funnel.domain.presentation.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 프레젠테이션 생성 상태
 *
 * <p>
 * 허용되는 상태 전이:
 * <ul>
 * <li>GENERATING → COMPLETED: 모든 슬라이드 생성 완료</li>
 * <li>GENERATING → DRAFT: 1장 이상 생성 후 중단 (재개 가능)</li>
 * <li>GENERATING → FAILED: 생성된 슬라이드 없이 중단</li>
 * <li>GENERATING → GENERATING: 끊긴 연결의 재개</li>
 * <li>DRAFT / FAILED → GENERATING: 재개</li>
 * </ul>
 * COMPLETED 는 종료 상태이며 다시 GENERATING 으로 돌아갈 수 없습니다.
 */
public enum PresentationStatus {
	GENERATING("generating"),
	COMPLETED("completed"),
	DRAFT("draft"),
	FAILED("failed");

	private final String value;

	PresentationStatus(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}

	@JsonCreator
	public static PresentationStatus fromValue(String value) {
		return Arrays.stream(values())
			.filter(status -> status.value.equalsIgnoreCase(value))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Unknown presentation status: " + value));
	}

	public boolean canTransitionTo(PresentationStatus target) {
		return allowedPriorStates(target).contains(this);
	}

	/**
	 * 대상 상태로 전이할 수 있는 이전 상태 목록을 반환합니다.
	 */
	public static Set<PresentationStatus> allowedPriorStates(PresentationStatus target) {
		return switch (target) {
			case GENERATING -> EnumSet.of(GENERATING, DRAFT, FAILED);
			case COMPLETED, DRAFT, FAILED -> EnumSet.of(GENERATING);
		};
	}

	public boolean isTerminal() {
		return this == COMPLETED;
	}
}
