package org.javai.springai.pantry.conversation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.javai.springai.pantry.delegation.DelegationRecord;
import org.javai.springai.pantry.delegation.DispatchScope;

/**
 * One in-flight turn. Cancelling the ticket cancels every collaborator call it tracks; a cancelled
 * turn never commits.
 */
public final class TurnTicket implements DispatchScope {

	private final String sessionId;
	private final long sequence;
	private final AtomicBoolean cancelled = new AtomicBoolean();
	private final List<Future<?>> futures = new ArrayList<>();
	private final List<DelegationRecord> records = new ArrayList<>();

	TurnTicket(String sessionId, long sequence) {
		this.sessionId = sessionId;
		this.sequence = sequence;
	}

	public String sessionId() {
		return sessionId;
	}

	public long sequence() {
		return sequence;
	}

	@Override
	public void track(Future<?> future) {
		synchronized (futures) {
			futures.add(future);
		}
		if (cancelled.get()) {
			future.cancel(true);
		}
	}

	@Override
	public void record(DelegationRecord record) {
		synchronized (records) {
			records.add(record);
		}
	}

	@Override
	public boolean isCancelled() {
		return cancelled.get();
	}

	/**
	 * Cancels the turn and its in-flight calls. Idempotent.
	 */
	public void cancel() {
		if (cancelled.compareAndSet(false, true)) {
			List<Future<?>> inFlight;
			synchronized (futures) {
				inFlight = List.copyOf(futures);
			}
			inFlight.forEach(f -> f.cancel(true));
		}
	}

	/**
	 * The audit log of this turn's collaborator calls, in completion order.
	 */
	public List<DelegationRecord> records() {
		synchronized (records) {
			return List.copyOf(records);
		}
	}

	@Override
	public String toString() {
		return sessionId + "#" + sequence + (cancelled.get() ? " (cancelled)" : "");
	}
}
