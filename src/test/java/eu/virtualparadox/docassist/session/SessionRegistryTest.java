package eu.virtualparadox.docassist.session;

import eu.virtualparadox.docassist.exception.SessionNotFoundException;
import eu.virtualparadox.docassist.rag.index.InMemoryVectorIndex;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry(InMemoryVectorIndex::new);

    @Test
    void createdSessionsOwnTheirState() {
        UserSession first = registry.create();
        UserSession second = registry.create();

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.documents().getIndex()).isNotSameAs(second.documents().getIndex());
        assertThat(first.documents().getMemory()).isNotSameAs(first.agent().getMemory());
        assertThat(first.agent().getMemory()).isNotSameAs(second.agent().getMemory());
        assertThat(registry.get(first.id())).isSameAs(first);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void unknownSessionsAreReported() {
        assertThatThrownBy(() -> registry.get("missing"))
                .isInstanceOf(SessionNotFoundException.class)
                .hasMessage("Session not found: missing");
        assertThatThrownBy(() -> registry.remove("missing")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void removeForgetsTheSession() {
        UserSession session = registry.create();

        registry.remove(session.id());

        assertThat(registry.size()).isZero();
        assertThatThrownBy(() -> registry.get(session.id())).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void closeAllEmptiesTheRegistry() {
        registry.create();
        registry.create();

        registry.closeAll();

        assertThat(registry.size()).isZero();
    }
}
