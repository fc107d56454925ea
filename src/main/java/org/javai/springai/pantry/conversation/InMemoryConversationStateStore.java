package org.javai.springai.pantry.conversation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store with idle eviction. A session untouched for longer than the idle timeout is
 * dropped; expired sessions are swept lazily on access.
 */
public class InMemoryConversationStateStore implements ConversationStateStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryConversationStateStore.class);

	public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(30);

	private final Map<String, Entry> store = new ConcurrentHashMap<>();
	private final Clock clock;
	private final Duration idleTimeout;

	public InMemoryConversationStateStore() {
		this(Clock.systemUTC(), DEFAULT_IDLE_TIMEOUT);
	}

	public InMemoryConversationStateStore(Clock clock, Duration idleTimeout) {
		this.clock = clock;
		this.idleTimeout = idleTimeout;
	}

	@Override
	public Optional<ConversationState> load(String sessionId) {
		sweep();
		Instant now = clock.instant();
		Entry touched = store.computeIfPresent(sessionId, (id, entry) -> new Entry(entry.state(), now));
		return Optional.ofNullable(touched).map(Entry::state);
	}

	@Override
	public void save(ConversationState state) {
		store.put(state.sessionId(), new Entry(state, clock.instant()));
	}

	@Override
	public boolean evict(String sessionId) {
		boolean removed = store.remove(sessionId) != null;
		if (removed) {
			logger.debug("Evicted session {}", sessionId);
		}
		return removed;
	}

	/**
	 * Drops every session idle for longer than the timeout.
	 *
	 * @return number of sessions dropped
	 */
	public int sweep() {
		Instant cutoff = clock.instant().minus(idleTimeout);
		int[] evicted = {0};
		store.entrySet().removeIf(e -> {
			boolean expired = e.getValue().lastAccess().isBefore(cutoff);
			if (expired) {
				evicted[0]++;
				logger.debug("Session {} idle since {}; evicting", e.getKey(), e.getValue().lastAccess());
			}
			return expired;
		});
		return evicted[0];
	}

	public int size() {
		return store.size();
	}

	private record Entry(ConversationState state, Instant lastAccess) {
	}
}
