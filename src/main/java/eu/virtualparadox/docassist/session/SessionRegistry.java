package eu.virtualparadox.docassist.session;

import eu.virtualparadox.docassist.agent.loop.AgentSession;
import eu.virtualparadox.docassist.exception.SessionNotFoundException;
import eu.virtualparadox.docassist.rag.chat.DocumentSession;
import eu.virtualparadox.docassist.rag.index.VectorIndexFactory;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of live sessions, keyed by a server-generated id.
 * <p>
 * Thread-safe. Operations on a single session are not; callers lock on the
 * {@link DocumentSession} or {@link AgentSession} they use.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    private final Map<String, UserSession> sessions = new ConcurrentHashMap<>();
    private final VectorIndexFactory vectorIndexFactory;

    public UserSession create() {
        final String id = UUID.randomUUID().toString().replace("-", "");
        final UserSession session = new UserSession(id, Instant.now(),
                new DocumentSession(id, vectorIndexFactory.create()), new AgentSession(id));
        sessions.put(id, session);
        log.info("Session {} created ({} live)", id, sessions.size());
        return session;
    }

    /**
     * @throws SessionNotFoundException if no session has this id
     */
    public UserSession get(final String id) {
        final UserSession session = id == null ? null : sessions.get(id);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + id);
        }
        return session;
    }

    /**
     * Closes and forgets the session; its index and memories are released.
     *
     * @throws SessionNotFoundException if no session has this id
     */
    public void remove(final String id) {
        final UserSession session = id == null ? null : sessions.remove(id);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + id);
        }
        synchronized (session.documents()) {
            session.close();
        }
        log.info("Session {} closed ({} live)", id, sessions.size());
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        for (final String id : sessions.keySet()) {
            final UserSession session = sessions.remove(id);
            if (session != null) {
                session.close();
            }
        }
    }
}
