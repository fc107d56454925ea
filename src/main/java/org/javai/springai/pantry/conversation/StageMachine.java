package org.javai.springai.pantry.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tracks the stages one turn passes through and rejects any transition not in the table.
 */
public final class StageMachine {

	private static final Map<ConversationStage, Set<ConversationStage>> ALLOWED = new EnumMap<>(ConversationStage.class);

	static {
		allow(ConversationStage.INITIAL, ConversationStage.COLLECTING_PREFS);
		allow(ConversationStage.COLLECTING_PREFS, ConversationStage.PANTRY_OP, ConversationStage.SEARCHING,
				ConversationStage.GENERAL, ConversationStage.COLLECTING_PREFS);
		allow(ConversationStage.PANTRY_OP, ConversationStage.SEARCHING, ConversationStage.DONE);
		allow(ConversationStage.SEARCHING, ConversationStage.PRESENTING_OPTIONS, ConversationStage.DONE);
		allow(ConversationStage.GENERAL, ConversationStage.DONE, ConversationStage.AWAITING_SELECTION);
		allow(ConversationStage.PRESENTING_OPTIONS, ConversationStage.AWAITING_SELECTION);
		allow(ConversationStage.AWAITING_SELECTION, ConversationStage.ADAPTING, ConversationStage.PANTRY_OP,
				ConversationStage.SEARCHING, ConversationStage.GENERAL, ConversationStage.AWAITING_SELECTION,
				ConversationStage.COLLECTING_PREFS);
		allow(ConversationStage.ADAPTING, ConversationStage.DONE, ConversationStage.AWAITING_SELECTION);
		allow(ConversationStage.DONE, ConversationStage.COLLECTING_PREFS);
		allow(ConversationStage.ERROR, ConversationStage.COLLECTING_PREFS);
	}

	private static void allow(ConversationStage from, ConversationStage... to) {
		Set<ConversationStage> targets = EnumSet.of(ConversationStage.ERROR);
		Collections.addAll(targets, to);
		ALLOWED.put(from, Collections.unmodifiableSet(targets));
	}

	public static boolean isAllowed(ConversationStage from, ConversationStage to) {
		return ALLOWED.getOrDefault(from, Set.of()).contains(to);
	}

	private final String sessionId;
	private final List<ConversationStage> trail = new ArrayList<>();

	public StageMachine(String sessionId, ConversationStage start) {
		this.sessionId = sessionId;
		this.trail.add(start);
	}

	public ConversationStage current() {
		return trail.get(trail.size() - 1);
	}

	/**
	 * @throws SessionStateCorruptException when the transition is not allowed
	 */
	public StageMachine advance(ConversationStage next) {
		ConversationStage from = current();
		if (!isAllowed(from, next)) {
			throw new SessionStateCorruptException(sessionId, "Illegal stage transition " + from + " -> " + next);
		}
		trail.add(next);
		return this;
	}

	/**
	 * Completes the turn: from {@link ConversationStage#DONE} the session returns to collecting
	 * preferences, any other stage is where the session rests.
	 */
	public ConversationStage settle() {
		if (current() == ConversationStage.DONE) {
			advance(ConversationStage.COLLECTING_PREFS);
		}
		return current();
	}

	public List<ConversationStage> trail() {
		return List.copyOf(trail);
	}

	@Override
	public String toString() {
		return trail.stream().map(Enum::name).collect(Collectors.joining(" -> "));
	}
}
