package eu.virtualparadox.docassist.agent.loop;

/**
 * What the model decided in one reasoning turn: call a tool, or answer.
 */
public record AgentDecision(boolean finished,
                            String thought,
                            String toolName,
                            String toolInput,
                            String answer) {

    public static AgentDecision useTool(final String thought, final String toolName, final String toolInput) {
        return new AgentDecision(false, thought, toolName, toolInput, null);
    }

    public static AgentDecision finish(final String thought, final String answer) {
        return new AgentDecision(true, thought, null, null, answer);
    }
}
