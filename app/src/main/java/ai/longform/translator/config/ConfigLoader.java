package ai.longform.translator.config;

import ai.longform.translator.cli.CliArguments;
import ai.longform.translator.repair.UnresolvedUnitPolicy;
import ai.longform.translator.translate.TranslationMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values.
 */
public class ConfigLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_SOURCE_LANGUAGE = "SOURCE_LANGUAGE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_TOKEN_BUDGET = "TOKEN_BUDGET";
    static final String ENV_LANGUAGE_EXPANSION_FACTOR = "LANGUAGE_EXPANSION_FACTOR";
    static final String ENV_TOKEN_SAFETY_MARGIN = "TOKEN_SAFETY_MARGIN";
    static final String ENV_TRANSLATION_CONCURRENCY = "TRANSLATION_CONCURRENCY";
    static final String ENV_MAX_REPAIR_ROUNDS = "MAX_REPAIR_ROUNDS";
    static final String ENV_LLM_REQUEST_TIMEOUT_SECONDS = "LLM_REQUEST_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_UNRESOLVED_UNIT_POLICY = "UNRESOLVED_UNIT_POLICY";
    static final String ENV_MISSED_TRANSLATION_CHECK = "MISSED_TRANSLATION_CHECK";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_TARGET_LANGUAGE = "zh-CN";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .orElseGet(() -> parse(ENV_LOG_FORMAT, LogFormat::from).orElse(LogFormat.TEXT));

        LlmProvider provider = parse(ENV_LLM_PROVIDER, LlmProvider::from).orElse(LlmProvider.OLLAMA);
        String modelName = firstNonBlank(arguments.model(), ENV_LLM_MODEL, provider.defaultModel());
        Optional<String> baseUrl = provider == LlmProvider.OLLAMA
                ? Optional.of(environmentReader.nonBlank(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL))
                : Optional.empty();
        Secrets secrets = new Secrets(environmentReader.nonBlank(ENV_GEMINI_API_KEY));
        if (translationMode == TranslationMode.PRODUCTION && provider == LlmProvider.GEMINI
                && secrets.geminiApiKey().isEmpty()) {
            throw new ConfigurationException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini");
        }

        EngineSettings engineSettings = loadEngineSettings(arguments, translationMode);
        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl,
                engineSettings.requestTimeout());

        Optional<String> sourceLanguage = Optional.ofNullable(arguments.sourceLanguage())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.nonBlank(ENV_SOURCE_LANGUAGE));
        String targetLanguage = firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANGUAGE, DEFAULT_TARGET_LANGUAGE);

        if (arguments.input() == null || arguments.output() == null) {
            throw new ConfigurationException("--input and --output must be provided");
        }
        return new Config(arguments.input(), arguments.output(),
                Optional.ofNullable(arguments.responseLog()),
                Optional.ofNullable(arguments.report()),
                Optional.ofNullable(arguments.glossary()),
                sourceLanguage, targetLanguage, translationMode, logFormat, translatorConfig, secrets,
                engineSettings);
    }

    EngineSettings loadEngineSettings(CliArguments arguments, TranslationMode translationMode) {
        int tokenBudget = Optional.ofNullable(arguments.tokenBudget())
                .orElseGet(() -> parse(ENV_TOKEN_BUDGET, ConfigLoader::parseInteger)
                        .orElse(EngineSettings.DEFAULT_TOKEN_BUDGET));
        double expansionFactor = parse(ENV_LANGUAGE_EXPANSION_FACTOR, ConfigLoader::parseDouble)
                .orElse(EngineSettings.DEFAULT_LANGUAGE_EXPANSION_FACTOR);
        double safetyMargin = parse(ENV_TOKEN_SAFETY_MARGIN, ConfigLoader::parseDouble)
                .orElse(EngineSettings.DEFAULT_TOKEN_SAFETY_MARGIN);
        int concurrency = Optional.ofNullable(arguments.concurrency())
                .orElseGet(() -> parse(ENV_TRANSLATION_CONCURRENCY, ConfigLoader::parseInteger)
                        .orElse(EngineSettings.DEFAULT_CONCURRENCY_LIMIT));
        int maxRounds = Optional.ofNullable(arguments.maxRounds())
                .orElseGet(() -> parse(ENV_MAX_REPAIR_ROUNDS, ConfigLoader::parseInteger)
                        .orElse(EngineSettings.DEFAULT_MAX_REPAIR_ROUNDS));
        Duration requestTimeout = parse(ENV_LLM_REQUEST_TIMEOUT_SECONDS, ConfigLoader::parseSeconds)
                .orElse(EngineSettings.DEFAULT_REQUEST_TIMEOUT);
        int maxRetryAttempts = parse(ENV_LLM_MAX_RETRY_ATTEMPTS, ConfigLoader::parseInteger)
                .orElse(EngineSettings.DEFAULT_MAX_RETRY_ATTEMPTS);
        Duration initialBackoff = parse(ENV_LLM_INITIAL_BACKOFF_SECONDS, ConfigLoader::parseSeconds)
                .orElse(EngineSettings.DEFAULT_INITIAL_BACKOFF);
        Duration maxBackoff = parse(ENV_LLM_MAX_BACKOFF_SECONDS, ConfigLoader::parseSeconds)
                .orElse(EngineSettings.DEFAULT_MAX_BACKOFF);
        double jitterFactor = parse(ENV_LLM_RETRY_JITTER_FACTOR, ConfigLoader::parseDouble)
                .orElse(EngineSettings.DEFAULT_RETRY_JITTER_FACTOR);
        UnresolvedUnitPolicy policy = parse(ENV_UNRESOLVED_UNIT_POLICY, UnresolvedUnitPolicy::from)
                .orElse(UnresolvedUnitPolicy.FALL_BACK_TO_SOURCE);
        boolean missedCheck = parse(ENV_MISSED_TRANSLATION_CHECK, ConfigLoader::parseBoolean).orElse(true);

        EngineSettings settings = new EngineSettings(tokenBudget, expansionFactor, safetyMargin, concurrency, maxRounds,
                requestTimeout, maxRetryAttempts, initialBackoff, maxBackoff, jitterFactor, policy, missedCheck);
        // dry-run echoes the source, so every unit would look untranslated
        return translationMode == TranslationMode.DRY_RUN ? settings.withMissedTranslationCheck(false) : settings;
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return parse(ENV_TRANSLATION_MODE, TranslationMode::from).orElse(TranslationMode.PRODUCTION);
    }

    private <T> Optional<T> parse(String envKey, Function<String, T> parser) {
        Optional<String> raw = environmentReader.nonBlank(envKey);
        try {
            return raw.map(parser);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Invalid value for " + envKey + ": " + raw.orElse(""), ex);
        }
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue.trim();
        }
        return environmentReader.nonBlank(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInteger(String raw) {
        return Integer.parseInt(raw);
    }

    private static double parseDouble(String raw) {
        return Double.parseDouble(raw);
    }

    private static Duration parseSeconds(String raw) {
        return Duration.ofMillis(Math.round(Double.parseDouble(raw) * 1000));
    }

    private static boolean parseBoolean(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Not a boolean: " + raw);
        };
    }
}
