package eu.virtualparadox.docassist.rag.answer;

import eu.virtualparadox.docassist.exception.GatewayException;
import eu.virtualparadox.docassist.memory.ConversationMemory;

/**
 * Sends a prompt, optionally preceded by conversation history, to the language model.
 */
public interface GenerationGateway {

    /**
     * @param prompt  the prompt for this turn (non-blank)
     * @param history prior turns to condition on; may be {@code null} or empty
     * @return the generated text, never blank
     * @throws GatewayException on transport, auth or rate-limit failure, or an empty reply
     */
    String generate(final String prompt, final ConversationMemory history);

    default String generate(final String prompt) {
        return generate(prompt, null);
    }
}
