package org.javai.springai.pantry.delegation;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.javai.springai.pantry.model.InventoryDeltaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches typed requests to collaborators with per-collaborator timeouts.
 *
 * <p>Independent requests are {@link #submit submitted} first and {@link #await awaited} later,
 * so they run concurrently on the router's executor. Every failure mode (timeout, exception,
 * rejection, schema mismatch, missing collaborator, cancellation) is returned as a
 * {@link DelegationResult.Failure}; nothing is thrown to the caller.</p>
 */
public class DelegationRouter implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(DelegationRouter.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

	private final Collaborators collaborators;
	private final ExecutorService executor;
	private final boolean ownsExecutor;
	private final Duration defaultTimeout;
	private final Map<Collaborator, Duration> timeouts;

	/**
	 * Creates a router with its own cached thread pool and the default timeout for every collaborator.
	 */
	public DelegationRouter(Collaborators collaborators) {
		this(collaborators, Executors.newCachedThreadPool(), true, DEFAULT_TIMEOUT, Map.of());
	}

	/**
	 * Creates a router with its own cached thread pool.
	 */
	public DelegationRouter(Collaborators collaborators, Duration defaultTimeout, Map<Collaborator, Duration> timeouts) {
		this(collaborators, Executors.newCachedThreadPool(), true, defaultTimeout, timeouts);
	}

	/**
	 * @param executor executor for collaborator calls; not shut down by {@link #close()}
	 * @param defaultTimeout timeout for collaborators without an override
	 * @param timeouts per-collaborator overrides
	 */
	public DelegationRouter(Collaborators collaborators, ExecutorService executor, Duration defaultTimeout,
			Map<Collaborator, Duration> timeouts) {
		this(collaborators, executor, false, defaultTimeout, timeouts);
	}

	private DelegationRouter(Collaborators collaborators, ExecutorService executor, boolean ownsExecutor,
			Duration defaultTimeout, Map<Collaborator, Duration> timeouts) {
		this.collaborators = Objects.requireNonNull(collaborators, "collaborators must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.ownsExecutor = ownsExecutor;
		this.defaultTimeout = defaultTimeout != null ? defaultTimeout : DEFAULT_TIMEOUT;
		this.timeouts = new EnumMap<>(Collaborator.class);
		if (timeouts != null) {
			this.timeouts.putAll(timeouts);
		}
	}

	public boolean isAvailable(Collaborator collaborator) {
		return collaborators.has(collaborator);
	}

	public Duration timeoutFor(Collaborator collaborator) {
		return timeouts.getOrDefault(collaborator, defaultTimeout);
	}

	/**
	 * Starts a request without waiting for it.
	 */
	public <T> PendingDelegation<T> submit(DelegationRequest<T> request, DispatchScope scope) {
		DispatchScope effectiveScope = scope != null ? scope : DispatchScope.NONE;
		long start = System.nanoTime();
		long timeoutNanos = timeoutFor(request.collaborator()).toNanos();
		CompletableFuture<T> future;
		if (effectiveScope.isCancelled()) {
			future = new CompletableFuture<>();
			future.cancel(false);
		}
		else if (!collaborators.has(request.collaborator())) {
			future = CompletableFuture.failedFuture(new CollaboratorUnavailableException(request.collaborator()));
		}
		else {
			future = CompletableFuture.supplyAsync(() -> request.invoke(collaborators), executor);
			effectiveScope.track(future);
		}
		return new PendingDelegation<>(request, future, effectiveScope, start, timeoutNanos);
	}

	/**
	 * Waits for a submitted request, bounded by what is left of its timeout.
	 */
	public <T> DelegationResult<T> await(PendingDelegation<T> pending) {
		DelegationRequest<T> request = pending.request();
		DelegationResult<T> result;
		try {
			T value = pending.future().get(pending.remainingNanos(System.nanoTime()), TimeUnit.NANOSECONDS);
			result = DelegationResult.success(value, Duration.ofNanos(System.nanoTime() - pending.startNanos()));
		}
		catch (TimeoutException e) {
			pending.future().cancel(true);
			result = DelegationResult.failure(FailureKind.TIMEOUT,
					request.collaborator() + " exceeded " + timeoutFor(request.collaborator()).toMillis() + " ms");
		}
		catch (CancellationException e) {
			result = DelegationResult.failure(FailureKind.CANCELLED, "turn superseded");
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			pending.future().cancel(true);
			result = DelegationResult.failure(FailureKind.CANCELLED, "interrupted");
		}
		catch (ExecutionException e) {
			result = classify(e.getCause());
		}
		recordOutcome(pending, result);
		return result;
	}

	/**
	 * Submits and awaits in one step, for dependent calls.
	 */
	public <T> DelegationResult<T> call(DelegationRequest<T> request, DispatchScope scope) {
		return await(submit(request, scope));
	}

	public <T> DelegationResult<T> call(DelegationRequest<T> request) {
		return call(request, DispatchScope.NONE);
	}

	private static <T> DelegationResult<T> classify(Throwable cause) {
		Throwable error = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
		if (error instanceof InventoryDeltaException) {
			return DelegationResult.failure(FailureKind.REJECTED, error.getMessage());
		}
		if (error instanceof SchemaViolationException) {
			return DelegationResult.failure(FailureKind.SCHEMA_INVALID, error.getMessage());
		}
		if (error instanceof CollaboratorUnavailableException) {
			return DelegationResult.failure(FailureKind.UNAVAILABLE, error.getMessage());
		}
		if (error instanceof CancellationException) {
			return DelegationResult.failure(FailureKind.CANCELLED, "turn superseded");
		}
		String detail = error != null ? error.getClass().getSimpleName() + ": " + error.getMessage() : "unknown error";
		return DelegationResult.failure(FailureKind.COLLABORATOR_ERROR, detail);
	}

	private <T> void recordOutcome(PendingDelegation<T> pending, DelegationResult<T> result) {
		DelegationRequest<T> request = pending.request();
		long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - pending.startNanos());
		DelegationRecord record;
		if (result instanceof DelegationResult.Failure<T> failure) {
			record = new DelegationRecord(request.collaborator(), request.describe(), failure.kind(), millis, failure.detail());
			if (failure.kind() == FailureKind.CANCELLED) {
				logger.debug("{} cancelled: {}", request.collaborator(), request.describe());
			}
			else {
				logger.warn("{} failed ({}) after {} ms: {}", request.collaborator(), failure.kind(), millis, failure.detail());
			}
		}
		else {
			record = new DelegationRecord(request.collaborator(), request.describe(), null, millis, null);
			logger.debug("{} completed in {} ms: {}", request.collaborator(), millis, request.describe());
		}
		pending.scope().record(record);
	}

	@Override
	public void close() {
		if (ownsExecutor) {
			executor.shutdownNow();
		}
	}
}
