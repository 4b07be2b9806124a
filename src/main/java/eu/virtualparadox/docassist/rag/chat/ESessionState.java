package eu.virtualparadox.docassist.rag.chat;

/**
 * Lifecycle of a document session: {@code EMPTY -> INDEXED -> ANSWERING -> INDEXED}.
 * {@code ANSWERING} only lasts for the duration of one question.
 */
public enum ESessionState {
    EMPTY,
    INDEXED,
    ANSWERING
}
