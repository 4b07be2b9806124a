package eu.virtualparadox.docassist.rag.answer;

import eu.virtualparadox.docassist.exception.GatewayException;
import eu.virtualparadox.docassist.memory.ConversationMemory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelGenerationGatewayTest {

    @Mock
    private ChatModel chatModel;

    @InjectMocks
    private ChatModelGenerationGateway gateway;

    private static ChatResponse responseOf(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void replaysHistoryBeforePrompt() {
        when(chatModel.call(any(Prompt.class))).thenReturn(responseOf("Paris."));
        ConversationMemory history = new ConversationMemory();
        history.appendExchange("What is the capital of France?", "Paris.");

        String answer = gateway.generate("And of Italy?", history);

        assertThat(answer).isEqualTo("Paris.");
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        List<Message> messages = captor.getValue().getInstructions();
        assertThat(messages).extracting(Message::getMessageType)
                .containsExactly(MessageType.USER, MessageType.ASSISTANT, MessageType.USER);
        assertThat(messages.get(2).getText()).isEqualTo("And of Italy?");
    }

    @Test
    void wrapsTransportFailures() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("403 Forbidden"));

        assertThatThrownBy(() -> gateway.generate("hi"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("403 Forbidden");
    }

    @Test
    void rejectsBlankReplies() {
        when(chatModel.call(any(Prompt.class))).thenReturn(responseOf("   "));

        assertThatThrownBy(() -> gateway.generate("hi")).isInstanceOf(GatewayException.class);
    }
}
