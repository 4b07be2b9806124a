package eu.virtualparadox.docassist.memory;

public enum ESpeaker {
    USER,
    ASSISTANT
}
