package eu.virtualparadox.docassist.session;

import eu.virtualparadox.docassist.agent.loop.AgentSession;
import eu.virtualparadox.docassist.rag.chat.DocumentSession;

import java.time.Instant;

/**
 * Server-side handle pairing a document chat with an agent conversation.
 * The two share nothing but the id.
 */
public record UserSession(String id, Instant createdAt, DocumentSession documents, AgentSession agent)
        implements AutoCloseable {

    @Override
    public void close() {
        documents.close();
    }
}
