package eu.virtualparadox.docassist.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered (speaker, utterance) history of one session.
 * <p>
 * Append-only while the session lives; it can only be cleared as a whole. Each document session
 * and each agent session owns its own instance. Not thread-safe.
 */
public final class ConversationMemory {

    private final List<Turn> turns = new ArrayList<>();

    public void append(final ESpeaker speaker, final String utterance) {
        turns.add(new Turn(speaker, utterance));
    }

    /**
     * Records one question/answer exchange.
     */
    public void appendExchange(final String question, final String answer) {
        append(ESpeaker.USER, question);
        append(ESpeaker.ASSISTANT, answer);
    }

    /**
     * @return an unmodifiable snapshot of the turns, oldest first
     */
    public List<Turn> turns() {
        return Collections.unmodifiableList(new ArrayList<>(turns));
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public void clear() {
        turns.clear();
    }

    /**
     * Renders the history as {@code Human: ...} / {@code AI: ...} lines for text prompts.
     */
    public String asTranscript() {
        final StringBuilder sb = new StringBuilder();
        for (final Turn turn : turns) {
            sb.append(turn.speaker() == ESpeaker.USER ? "Human: " : "AI: ")
                    .append(turn.utterance())
                    .append("\n");
        }
        return sb.toString();
    }
}
