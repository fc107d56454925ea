package org.javai.springai.pantry.delegation;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted request whose result has not been awaited yet.
 */
public final class PendingDelegation<T> {

	private final DelegationRequest<T> request;
	private final CompletableFuture<T> future;
	private final DispatchScope scope;
	private final long startNanos;
	private final long timeoutNanos;

	PendingDelegation(DelegationRequest<T> request, CompletableFuture<T> future, DispatchScope scope,
			long startNanos, long timeoutNanos) {
		this.request = request;
		this.future = future;
		this.scope = scope;
		this.startNanos = startNanos;
		this.timeoutNanos = timeoutNanos;
	}

	public DelegationRequest<T> request() {
		return request;
	}

	CompletableFuture<T> future() {
		return future;
	}

	/**
	 * Abandons the request, interrupting the collaborator call if it is running.
	 */
	public void cancel() {
		future.cancel(true);
	}

	DispatchScope scope() {
		return scope;
	}

	long startNanos() {
		return startNanos;
	}

	long remainingNanos(long now) {
		return Math.max(0L, timeoutNanos - (now - startNanos));
	}
}
