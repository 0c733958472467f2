package ai.longform.translator.config;

import ai.longform.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path input,
        Path output,
        Optional<Path> responseLog,
        Optional<Path> report,
        Optional<Path> glossary,
        Optional<String> sourceLanguage,
        String targetLanguage,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        EngineSettings engineSettings
) {

    public Config {
        input = Objects.requireNonNull(input, "input");
        output = Objects.requireNonNull(output, "output");
        responseLog = responseLog == null ? Optional.empty() : responseLog;
        report = report == null ? Optional.empty() : report;
        glossary = glossary == null ? Optional.empty() : glossary;
        sourceLanguage = sourceLanguage == null ? Optional.empty() : sourceLanguage.filter(value -> !value.isBlank());
        if (targetLanguage == null || targetLanguage.isBlank()) {
            throw new ConfigurationException("targetLanguage must not be blank");
        }
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
        engineSettings = Objects.requireNonNull(engineSettings, "engineSettings");
        if (input.normalize().equals(output.normalize())) {
            throw new ConfigurationException("output must not overwrite the input document");
        }
    }
}
