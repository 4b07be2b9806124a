package eu.virtualparadox.docassist.agent.loop;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a model reply written in the Thought / Action / Action Input layout.
 * <p>
 * A reply carrying {@code AI:} or {@code Final Answer:} finishes the loop; a reply with an
 * {@code Action} and {@code Action Input} pair requests a tool. Anything else is taken as the
 * final answer as-is.
 */
@Slf4j
@Component
public class AgentOutputParser {

    static final String AI_PREFIX = "AI:";
    static final String FINAL_ANSWER_PREFIX = "Final Answer:";

    private static final Pattern ACTION = Pattern.compile(
            "Action\\s*:\\s*(.*?)\\s*\\n\\s*Action\\s*Input\\s*:\\s*(.*)", Pattern.DOTALL);
    private static final Pattern FINAL = Pattern.compile(
            "(?m)^\\s*(?:AI|Final Answer)\\s*:\\s*");
    private static final Pattern THOUGHT_PREFIX = Pattern.compile("^\\s*Thought\\s*:\\s*");
    private static final Pattern SCAFFOLDING_LINE = Pattern.compile(
            "(?m)^\\s*(?:Thought|Action|Action\\s*Input|Observation)\\s*:.*$");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");

    public AgentDecision parse(final String reply) {
        final String text = stripHallucinatedObservation(Objects.toString(reply, "")).trim();

        final Matcher finalMatcher = FINAL.matcher(text);
        if (finalMatcher.find()) {
            final String thought = thoughtOf(text.substring(0, finalMatcher.start()));
            return AgentDecision.finish(thought, text.substring(finalMatcher.end()).trim());
        }

        final Matcher actionMatcher = ACTION.matcher(text);
        if (actionMatcher.find()) {
            final String thought = thoughtOf(text.substring(0, actionMatcher.start()));
            final String tool = actionMatcher.group(1).trim();
            final String input = StringUtils.strip(actionMatcher.group(2).trim(), "\"`'").trim();
            return AgentDecision.useTool(thought, tool, input);
        }

        log.warn("Model reply did not follow the action format, using it as the final answer");
        return AgentDecision.finish("", text);
    }

    /**
     * Removes the Thought / Action / Action Input / Observation lines from a reply, keeping any
     * prose the model wrote around them.
     *
     * @return the remaining text, trimmed; empty if the reply was nothing but scaffolding
     */
    public String stripScaffolding(final String reply) {
        final String text = stripHallucinatedObservation(Objects.toString(reply, ""));
        final String prose = SCAFFOLDING_LINE.matcher(text).replaceAll("");
        return BLANK_LINES.matcher(prose).replaceAll("\n").trim();
    }

    /**
     * Models sometimes continue past their action and invent the tool output; keep only
     * what precedes it.
     */
    private static String stripHallucinatedObservation(final String text) {
        final int idx = text.indexOf("\nObservation:");
        return idx >= 0 ? text.substring(0, idx) : text;
    }

    private static String thoughtOf(final String preamble) {
        return THOUGHT_PREFIX.matcher(preamble.trim()).replaceFirst("").trim();
    }
}
