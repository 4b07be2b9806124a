package eu.virtualparadox.docassist.agent.loop;

import eu.virtualparadox.docassist.agent.model.AgentResult;
import eu.virtualparadox.docassist.agent.model.AgentStep;
import eu.virtualparadox.docassist.agent.model.AgentTrace;
import eu.virtualparadox.docassist.agent.tool.Tool;
import eu.virtualparadox.docassist.agent.tool.ToolDescriptor;
import eu.virtualparadox.docassist.agent.tool.ToolRegistry;
import eu.virtualparadox.docassist.application.config.ApplicationConfig;
import eu.virtualparadox.docassist.exception.AgentException;
import eu.virtualparadox.docassist.exception.GatewayException;
import eu.virtualparadox.docassist.rag.answer.GenerationGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded reason/act/observe loop over the tools in {@link ToolRegistry}.
 * <p>
 * Each cycle the model sees the tool descriptions, the session's conversation, the question and
 * the steps taken so far, and either names a tool with its input or answers. After
 * {@code maxIterations} tool calls without an answer the model is asked once more for a
 * best-effort answer from the steps it has. A gateway failure ends the query with an
 * unsuccessful {@link AgentResult}; it is never thrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResearchAgent {

    static final String FINALIZE_INSTRUCTION = "I now need to return a final answer based on the previous steps:";

    private final ToolRegistry toolRegistry;
    private final GenerationGateway generationGateway;
    private final AgentOutputParser outputParser;
    private final ApplicationConfig config;

    public AgentResult research(final AgentSession session, final String query) {
        return research(session, query, config.getAgentMaxIterations());
    }

    /**
     * @param maxIterations tool calls allowed before the forced final answer, at least 1
     */
    public AgentResult research(final AgentSession session, final String query, final int maxIterations) {
        Objects.requireNonNull(session, "session must not be null");
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }

        final List<String> registered = toolRegistry.names();
        final AgentTrace trace = new AgentTrace();
        EAgentState state = EAgentState.THINKING;

        try {
            String answer = null;
            for (int iteration = 1; iteration <= maxIterations; iteration++) {
                final AgentDecision decision = outputParser.parse(
                        generationGateway.generate(buildPrompt(session, query, trace)));

                if (decision.finished()) {
                    answer = decision.answer();
                    break;
                }

                state = EAgentState.ACTING_ON_TOOL;
                final String observation = invoke(decision);
                state = EAgentState.OBSERVING;
                trace.append(new AgentStep(iteration, decision.thought(), decision.toolName(),
                        decision.toolInput(), observation));
                log.debug("Session {} step {}: {}({}) -> {}", session.getId(), iteration,
                        decision.toolName(), decision.toolInput(), observation);
                state = EAgentState.THINKING;
            }

            if (answer == null) {
                log.info("Session {}: iteration cap {} reached, requesting final answer", session.getId(), maxIterations);
                answer = finalizeFromTrace(session, query, trace);
            }

            if (answer.isBlank()) {
                throw new AgentException("the model returned an empty final answer");
            }

            state = EAgentState.FINISHED;
            session.getMemory().appendExchange(query, answer);
            log.info("Session {}: research finished after {} tool call(s), tools {}",
                    session.getId(), trace.size(), trace.toolsInvoked());
            return AgentResult.success(answer, registered, trace);
        } catch (final GatewayException | AgentException e) {
            log.error("Session {}: research failed in state {}", session.getId(), state, e);
            return AgentResult.failure(e.getMessage(), registered, trace);
        }
    }

    public List<ToolDescriptor> getAvailableTools() {
        return toolRegistry.describe();
    }

    public void clearMemory(final AgentSession session) {
        session.getMemory().clear();
        log.info("Session {}: agent memory cleared", session.getId());
    }

    private String invoke(final AgentDecision decision) {
        final Optional<Tool> tool = toolRegistry.get(decision.toolName());
        if (tool.isEmpty()) {
            return decision.toolName() + " is not a valid tool, try one of " + toolRegistry.names() + ".";
        }
        return tool.get().run(decision.toolInput());
    }

    private String finalizeFromTrace(final AgentSession session, final String query, final AgentTrace trace) {
        final String prompt = buildPrompt(session, query, trace) + "\n" + FINALIZE_INSTRUCTION + "\n";
        final String reply = generationGateway.generate(prompt);
        final AgentDecision decision = outputParser.parse(reply);
        if (decision.finished()) {
            return decision.answer();
        }
        // still asking for a tool: answer with whatever the model wrote besides the request
        final String prose = outputParser.stripScaffolding(reply);
        if (prose.isBlank()) {
            log.warn("Session {}: final reply only requested another tool", session.getId());
            return "I could not reach a final answer within " + trace.size() + " steps.";
        }
        return prose;
    }

    String buildPrompt(final AgentSession session, final String query, final AgentTrace trace) {
        final StringBuilder tools = new StringBuilder();
        for (final ToolDescriptor descriptor : toolRegistry.describe()) {
            tools.append("> ").append(descriptor.name()).append(": ").append(descriptor.description()).append('\n');
        }

        return String.join("\n",
                "Assistant is a research assistant that answers questions and uses tools when they help.",
                "",
                "TOOLS:",
                "------",
                "Assistant has access to the following tools:",
                "",
                tools.toString(),
                "To use a tool, please use the following format:",
                "",
                "Thought: Do I need to use a tool? Yes",
                "Action: the action to take, should be one of [" + String.join(", ", toolRegistry.names()) + "]",
                "Action Input: the input to the action",
                "Observation: the result of the action",
                "",
                "When you have a response to say to the Human, or if you do not need to use a tool, you MUST use the format:",
                "",
                "Thought: Do I need to use a tool? No",
                "AI: [your response here]",
                "",
                "Begin!",
                "",
                "Previous conversation history:",
                session.getMemory().asTranscript(),
                "New input: " + query,
                trace.asScratchpad());
    }
}
