package eu.virtualparadox.docassist.agent.tool;

import lombok.extern.slf4j.Slf4j;

/**
 * Base class turning every internal fault into an observation string.
 */
@Slf4j
public abstract class AbstractTool implements Tool {

    @Override
    public final String run(final String input) {
        try {
            return execute(input == null ? "" : input);
        } catch (final Exception e) {
            log.warn("Tool {} failed on input '{}': {}", name(), input, e.toString());
            return describeFailure(e);
        }
    }

    /**
     * Tool body; may throw, the caller only ever sees {@link #describeFailure(Exception)}.
     */
    protected abstract String execute(final String input) throws Exception;

    protected abstract String describeFailure(final Exception e);

    protected static String messageOf(final Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
