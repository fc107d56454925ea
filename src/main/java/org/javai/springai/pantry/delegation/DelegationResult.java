package org.javai.springai.pantry.delegation;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a delegated call. Collaborator errors always arrive as a {@link Failure}; the router
 * never throws them.
 *
 * @param <T> the value type
 */
public sealed interface DelegationResult<T> {

	record Success<T>(T value, Duration elapsed) implements DelegationResult<T> {
		public Success {
			Objects.requireNonNull(value, "value must not be null");
			elapsed = elapsed != null ? elapsed : Duration.ZERO;
		}
	}

	record Failure<T>(FailureKind kind, String detail) implements DelegationResult<T> {
		public Failure {
			Objects.requireNonNull(kind, "kind must not be null");
			detail = detail != null ? detail : "";
		}
	}

	static <T> DelegationResult<T> success(T value, Duration elapsed) {
		return new Success<>(value, elapsed);
	}

	static <T> DelegationResult<T> failure(FailureKind kind, String detail) {
		return new Failure<>(kind, detail);
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}

	default Optional<T> optional() {
		return this instanceof Success<T> success ? Optional.of(success.value()) : Optional.empty();
	}

	default T orElse(T fallback) {
		return optional().orElse(fallback);
	}

	default Optional<FailureKind> failureKind() {
		return this instanceof Failure<T> failure ? Optional.of(failure.kind()) : Optional.empty();
	}

	default <R> DelegationResult<R> map(Function<T, R> mapper) {
		if (this instanceof Success<T> success) {
			return new Success<>(mapper.apply(success.value()), success.elapsed());
		}
		Failure<T> failure = (Failure<T>) this;
		return new Failure<>(failure.kind(), failure.detail());
	}
}
