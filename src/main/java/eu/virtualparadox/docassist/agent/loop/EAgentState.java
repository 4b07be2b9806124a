package eu.virtualparadox.docassist.agent.loop;

public enum EAgentState {
    THINKING,
    ACTING_ON_TOOL,
    OBSERVING,
    FINISHED
}
