package ai.longform.translator.translate;

import ai.longform.translator.exchange.Glossary;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-document parameters of a translation run.
 *
 * @param sourceLanguage overrides the document's own source language when present
 */
public record TranslationRequest(Optional<String> sourceLanguage, String targetLanguage, Glossary glossary) {

    public TranslationRequest {
        sourceLanguage = sourceLanguage == null ? Optional.empty() : sourceLanguage.filter(value -> !value.isBlank());
        Objects.requireNonNull(targetLanguage, "targetLanguage");
        if (targetLanguage.isBlank()) {
            throw new IllegalArgumentException("targetLanguage must not be blank");
        }
        glossary = glossary == null ? Glossary.empty() : glossary;
    }

    public static TranslationRequest to(String targetLanguage) {
        return new TranslationRequest(Optional.empty(), targetLanguage, Glossary.empty());
    }
}
