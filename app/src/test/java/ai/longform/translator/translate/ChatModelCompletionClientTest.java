package ai.longform.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelCompletionClientTest {

    @Test
    @DisplayName("Returns the raw model response unchanged")
    void returnsRawResponse() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return "```xml\n<seg id=\"p1\">你好</seg>\n```";
            }
        };
        ChatModelCompletionClient client = new ChatModelCompletionClient(stubModel, "TestProvider", "test-model");

        assertThat(client.complete("prompt")).isEqualTo("```xml\n<seg id=\"p1\">你好</seg>\n```");
    }

    @Test
    @DisplayName("Reports a missing model with provider and model name")
    void wrapsMissingModel() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new ModelNotFoundException("not found");
            }
        };
        ChatModelCompletionClient client = new ChatModelCompletionClient(stubModel, "OLLAMA", "qwen");

        assertThatThrownBy(() -> client.complete("prompt"))
                .isInstanceOf(TranslationException.class)
                .hasMessage("OLLAMA model 'qwen' is not available.")
                .hasCauseInstanceOf(ModelNotFoundException.class);
    }

    @Test
    @DisplayName("Wraps other failures and keeps the cause for retry decisions")
    void wrapsOtherFailures() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new IllegalStateException("HTTP 429 RESOURCE_EXHAUSTED");
            }
        };
        ChatModelCompletionClient client = new ChatModelCompletionClient(stubModel, "GEMINI", "gemini-2.5-flash");

        assertThatThrownBy(() -> client.complete("prompt"))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("RESOURCE_EXHAUSTED")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
