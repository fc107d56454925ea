package org.javai.springai.pantry.conversation;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * At most one in-flight turn per session; the last message wins.
 *
 * <p>{@link #begin} and {@link #commitIfCurrent} are atomic per session, so a commit can never
 * interleave with the start of a newer turn for the same session.</p>
 */
public class TurnRegistry {

	private static final Logger logger = LoggerFactory.getLogger(TurnRegistry.class);

	private final Map<String, TurnTicket> current = new ConcurrentHashMap<>();
	private final AtomicLong sequence = new AtomicLong();

	/**
	 * Starts a turn, cancelling the session's previous turn if it is still in flight.
	 */
	public TurnTicket begin(String sessionId) {
		TurnTicket ticket = new TurnTicket(sessionId, sequence.incrementAndGet());
		current.compute(sessionId, (id, previous) -> {
			if (previous != null) {
				logger.debug("Turn {} superseded by {}", previous, ticket);
				previous.cancel();
			}
			return ticket;
		});
		return ticket;
	}

	/**
	 * Runs {@code commit} only if the ticket is still the session's current, uncancelled turn.
	 * The turn is finished either way.
	 *
	 * @return true when the commit ran
	 */
	public boolean commitIfCurrent(TurnTicket ticket, Runnable commit) {
		AtomicBoolean committed = new AtomicBoolean();
		current.compute(ticket.sessionId(), (id, active) -> {
			if (active != ticket || ticket.isCancelled()) {
				return active;
			}
			commit.run();
			committed.set(true);
			return null;
		});
		return committed.get();
	}

	/**
	 * Ends a turn without committing.
	 */
	public void finish(TurnTicket ticket) {
		current.remove(ticket.sessionId(), ticket);
	}

	public boolean isCurrent(TurnTicket ticket) {
		return current.get(ticket.sessionId()) == ticket && !ticket.isCancelled();
	}
}
