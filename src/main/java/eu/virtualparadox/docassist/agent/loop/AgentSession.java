package eu.virtualparadox.docassist.agent.loop;

import eu.virtualparadox.docassist.memory.ConversationMemory;
import lombok.Getter;

import java.util.Objects;

/**
 * Conversation state of one research agent user. Calls on a session must be serialized.
 */
@Getter
public final class AgentSession {

    private final String id;
    private final ConversationMemory memory = new ConversationMemory();

    public AgentSession(final String id) {
        this.id = Objects.requireNonNull(id, "id");
    }
}
