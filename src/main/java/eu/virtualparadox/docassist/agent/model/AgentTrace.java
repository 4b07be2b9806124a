package eu.virtualparadox.docassist.agent.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered steps taken while answering one query. Not thread-safe.
 */
public final class AgentTrace {

    private final List<AgentStep> steps = new ArrayList<>();

    public void append(final AgentStep step) {
        steps.add(step);
    }

    public List<AgentStep> steps() {
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public int size() {
        return steps.size();
    }

    /**
     * @return names of the tools actually invoked, in first-use order
     */
    public List<String> toolsInvoked() {
        final LinkedHashSet<String> names = new LinkedHashSet<>();
        for (final AgentStep step : steps) {
            names.add(step.toolName());
        }
        return List.copyOf(names);
    }

    /**
     * Renders the steps in the Thought / Action / Action Input / Observation layout the model
     * is prompted with.
     */
    public String asScratchpad() {
        final StringBuilder sb = new StringBuilder();
        for (final AgentStep step : steps) {
            sb.append("Thought: ").append(step.thought()).append('\n')
                    .append("Action: ").append(step.toolName()).append('\n')
                    .append("Action Input: ").append(step.toolInput()).append('\n')
                    .append("Observation: ").append(step.observation()).append('\n');
        }
        return sb.toString();
    }
}
