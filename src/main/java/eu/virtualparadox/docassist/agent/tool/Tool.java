package eu.virtualparadox.docassist.agent.tool;

/**
 * A named capability the research agent can invoke by name.
 * <p>
 * Implementations are deterministic apart from clock reads, bounded in side effects, and
 * never throw from {@link #run(String)}: faults come back as a readable message.
 */
public interface Tool {

    /**
     * @return stable unique key the model uses to select this tool
     */
    String name();

    /**
     * @return description shown to the model to decide when the tool applies
     */
    String description();

    /**
     * @param input free-text tool input chosen by the model
     * @return the observation; an error description if the tool failed
     */
    String run(final String input);
}
