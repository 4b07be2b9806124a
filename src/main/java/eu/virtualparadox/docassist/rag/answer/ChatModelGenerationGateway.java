package eu.virtualparadox.docassist.rag.answer;

import eu.virtualparadox.docassist.exception.GatewayException;
import eu.virtualparadox.docassist.memory.ConversationMemory;
import eu.virtualparadox.docassist.memory.ESpeaker;
import eu.virtualparadox.docassist.memory.Turn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link GenerationGateway} on top of a Spring AI {@link ChatModel}.
 * <p>History turns are replayed as user/assistant messages ahead of the prompt.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatModelGenerationGateway implements GenerationGateway {

    private final ChatModel chatModel;

    @Override
    public String generate(final String prompt, final ConversationMemory history) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }

        final List<Message> messages = new ArrayList<>();
        if (history != null) {
            for (final Turn turn : history.turns()) {
                messages.add(turn.speaker() == ESpeaker.USER
                        ? new UserMessage(turn.utterance())
                        : new AssistantMessage(turn.utterance()));
            }
        }
        messages.add(new UserMessage(prompt));

        log.debug("Prompt ({} history messages):\n{}", messages.size() - 1, prompt);

        final ChatResponse response;
        try {
            response = chatModel.call(new Prompt(messages));
        } catch (final RuntimeException e) {
            log.error("Generation call failed", e);
            throw new GatewayException("Language model call failed: " + e.getMessage(), e);
        }

        final String text = response == null || response.getResult() == null || response.getResult().getOutput() == null
                ? null
                : response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new GatewayException("Language model returned an empty response");
        }
        return text;
    }
}
