package eu.virtualparadox.docassist.agent.model;

/**
 * One think/act/observe cycle.
 *
 * @param iteration   1-based cycle number
 * @param thought     model reasoning preceding the action, may be empty
 * @param toolName    tool the model asked for
 * @param toolInput   input passed to the tool
 * @param observation tool output, or the reason the tool could not run
 */
public record AgentStep(int iteration,
                        String thought,
                        String toolName,
                        String toolInput,
                        String observation) {
}
