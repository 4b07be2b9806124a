package eu.virtualparadox.docassist.agent.model;

import java.util.List;

/**
 * Outcome of a research query.
 *
 * @param success   {@code false} when the language model could not be reached
 * @param response  final answer, or a human-readable failure message
 * @param toolsUsed names of the tools registered with the agent
 * @param error     failure detail, {@code null} on success
 * @param steps     the steps actually taken, possibly partial on failure
 */
public record AgentResult(boolean success,
                          String response,
                          List<String> toolsUsed,
                          String error,
                          List<AgentStep> steps) {

    public AgentResult {
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static AgentResult success(final String response, final List<String> toolsUsed,
                                      final AgentTrace trace) {
        return new AgentResult(true, response, toolsUsed, null, trace.steps());
    }

    public static AgentResult failure(final String error, final List<String> toolsUsed,
                                      final AgentTrace trace) {
        return new AgentResult(false, "I encountered an error while researching: " + error,
                toolsUsed, error, trace.steps());
    }
}
