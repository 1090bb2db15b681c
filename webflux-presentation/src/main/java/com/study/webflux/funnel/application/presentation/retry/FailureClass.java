package com.study.webflux.funnel.application.presentation.retry;

public enum FailureClass {
	/** 다시 시도하면 성공할 수 있는 실패 (시간 초과, 네트워크, 공급자 일시 오류) */
	RETRYABLE,
	/** 다시 시도해도 같은 결과가 예상되는 실패 */
	TERMINAL
}
