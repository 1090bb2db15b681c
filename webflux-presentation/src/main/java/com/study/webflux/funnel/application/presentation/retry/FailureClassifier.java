package com.study.webflux.funnel.application.presentation.retry;

@FunctionalInterface
public interface FailureClassifier {

	FailureClass classify(Throwable error);

	static FailureClassifier alwaysRetryable() {
		return error -> FailureClass.RETRYABLE;
	}
}
