package ai.longform.translator.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the chat model behind the production completion client.
 */
public record TranslatorConfig(LlmProvider provider, String modelName, Optional<String> baseUrl, Duration timeout) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        if (modelName == null || modelName.isBlank()) {
            throw new ConfigurationException("modelName must not be blank");
        }
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }
}
