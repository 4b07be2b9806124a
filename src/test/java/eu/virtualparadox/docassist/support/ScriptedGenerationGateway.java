package eu.virtualparadox.docassist.support;

import eu.virtualparadox.docassist.exception.GatewayException;
import eu.virtualparadox.docassist.memory.ConversationMemory;
import eu.virtualparadox.docassist.memory.Turn;
import eu.virtualparadox.docassist.rag.answer.GenerationGateway;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays queued replies and records every prompt. When the queue runs dry the last reply is
 * repeated; {@link #failing()} makes every call throw {@link GatewayException}.
 */
public class ScriptedGenerationGateway implements GenerationGateway {

    private final Deque<String> replies = new ArrayDeque<>();
    private final List<String> prompts = new ArrayList<>();
    private final List<List<Turn>> histories = new ArrayList<>();
    private String lastReply = "ok";
    private boolean failing;

    public ScriptedGenerationGateway reply(String... texts) {
        for (String text : texts) {
            replies.addLast(text);
        }
        return this;
    }

    public ScriptedGenerationGateway failing() {
        this.failing = true;
        return this;
    }

    @Override
    public String generate(String prompt, ConversationMemory history) {
        prompts.add(prompt);
        histories.add(history == null ? List.of() : history.turns());
        if (failing) {
            throw new GatewayException("model endpoint unreachable");
        }
        if (!replies.isEmpty()) {
            lastReply = replies.removeFirst();
        }
        return lastReply;
    }

    public List<String> prompts() {
        return prompts;
    }

    public String lastPrompt() {
        return prompts.get(prompts.size() - 1);
    }

    public List<List<Turn>> histories() {
        return histories;
    }

    public int calls() {
        return prompts.size();
    }
}
