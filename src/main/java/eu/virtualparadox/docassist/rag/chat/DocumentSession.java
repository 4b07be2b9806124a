package eu.virtualparadox.docassist.rag.chat;

import eu.virtualparadox.docassist.exception.NotReadyException;
import eu.virtualparadox.docassist.ingest.model.Document;
import eu.virtualparadox.docassist.memory.ConversationMemory;
import eu.virtualparadox.docassist.rag.index.VectorIndex;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * Explicit handle for one document conversation.
 * <p>
 * Owns its {@link VectorIndex} and {@link ConversationMemory} exclusively; nothing is shared
 * with other sessions. Operations on one session must not run concurrently, callers serialize
 * them (the REST layer locks on the session).
 */
@Getter
public final class DocumentSession implements AutoCloseable {

    private final String id;
    private final Instant createdAt;
    private final VectorIndex index;
    private final ConversationMemory memory = new ConversationMemory();

    private volatile ESessionState state = ESessionState.EMPTY;
    private Document document;
    private int chunkCount;

    public DocumentSession(final String id, final VectorIndex index) {
        this.id = Objects.requireNonNull(id, "id");
        this.index = Objects.requireNonNull(index, "index");
        this.createdAt = Instant.now();
    }

    public boolean isReady() {
        return state != ESessionState.EMPTY;
    }

    void requireIndexed() {
        if (state != ESessionState.INDEXED) {
            throw new NotReadyException("No document has been processed. Please upload a document first.");
        }
    }

    void markIndexed(final Document indexed, final int chunks) {
        this.document = indexed;
        this.chunkCount = chunks;
        this.state = ESessionState.INDEXED;
    }

    void markAnswering() {
        this.state = ESessionState.ANSWERING;
    }

    void markAnswered() {
        this.state = ESessionState.INDEXED;
    }

    void reset() {
        index.clear();
        memory.clear();
        this.document = null;
        this.chunkCount = 0;
        this.state = ESessionState.EMPTY;
    }

    @Override
    public void close() {
        reset();
        index.close();
    }
}
