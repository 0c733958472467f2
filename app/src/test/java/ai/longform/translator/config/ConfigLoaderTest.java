package ai.longform.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.longform.translator.cli.CliArguments;
import ai.longform.translator.repair.UnresolvedUnitPolicy;
import ai.longform.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "book.json",
                "--output", "book.zh.json",
                "--response-log", "responses.jsonl",
                "--translation-mode", "mock",
                "--model", "qwen3:8b",
                "--source-lang", "en",
                "--target-lang", "ja",
                "--token-budget", "32000",
                "--concurrency", "4",
                "--max-rounds", "5",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.input()).isEqualTo(Path.of("book.json"));
        assertThat(config.output()).isEqualTo(Path.of("book.zh.json"));
        assertThat(config.responseLog()).contains(Path.of("responses.jsonl"));
        assertThat(config.report()).isEmpty();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.sourceLanguage()).contains("en");
        assertThat(config.targetLanguage()).isEqualTo("ja");
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.translatorConfig().modelName()).isEqualTo("qwen3:8b");
        assertThat(config.translatorConfig().baseUrl()).contains("http://localhost:11434");
        assertThat(config.engineSettings().tokenBudget()).isEqualTo(32000);
        assertThat(config.engineSettings().concurrencyLimit()).isEqualTo(4);
        assertThat(config.engineSettings().maxRepairRounds()).isEqualTo(5);
        assertThat(config.engineSettings().missedTranslationCheck()).isTrue();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_LLM_PROVIDER, "gemini");
        envValues.put(ConfigLoader.ENV_GEMINI_API_KEY, "gemini-key");
        envValues.put(ConfigLoader.ENV_TARGET_LANGUAGE, "ko");
        envValues.put(ConfigLoader.ENV_TOKEN_BUDGET, "16000");
        envValues.put(ConfigLoader.ENV_LANGUAGE_EXPANSION_FACTOR, "2.5");
        envValues.put(ConfigLoader.ENV_LLM_REQUEST_TIMEOUT_SECONDS, "1.5");
        envValues.put(ConfigLoader.ENV_UNRESOLVED_UNIT_POLICY, "keep-last-text");
        envValues.put(ConfigLoader.ENV_MISSED_TRANSLATION_CHECK, "off");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)))
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "in.json", "--output", "out.json"));

        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.translatorConfig().modelName()).isEqualTo("gemini-2.5-flash");
        assertThat(config.translatorConfig().baseUrl()).isEmpty();
        assertThat(config.translatorConfig().timeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(config.secrets().geminiApiKey()).contains("gemini-key");
        assertThat(config.secrets().toString()).doesNotContain("gemini-key");
        assertThat(config.targetLanguage()).isEqualTo("ko");
        assertThat(config.sourceLanguage()).isEmpty();
        EngineSettings settings = config.engineSettings();
        assertThat(settings.tokenBudget()).isEqualTo(16000);
        assertThat(settings.languageExpansionFactor()).isEqualTo(2.5);
        assertThat(settings.tokenSafetyMargin()).isEqualTo(EngineSettings.DEFAULT_TOKEN_SAFETY_MARGIN);
        assertThat(settings.unresolvedUnitPolicy()).isEqualTo(UnresolvedUnitPolicy.KEEP_LAST_TEXT);
        assertThat(settings.missedTranslationCheck()).isFalse();
    }

    @Test
    void cliValuesWinOverEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_TRANSLATION_MODE, "mock",
                ConfigLoader.ENV_TARGET_LANGUAGE, "ko",
                ConfigLoader.ENV_TOKEN_BUDGET, "16000");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)))
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "in.json", "--output", "out.json",
                        "--target-lang", "fr", "--token-budget", "1000", "--translation-mode", "dry-run"));

        assertThat(config.targetLanguage()).isEqualTo("fr");
        assertThat(config.engineSettings().tokenBudget()).isEqualTo(1000);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
    }

    @Test
    void dryRunDisablesMissedTranslationCheck() {
        Config config = new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "in.json", "--output", "out.json",
                        "--translation-mode", "dry-run"));

        assertThat(config.engineSettings().missedTranslationCheck()).isFalse();
        assertThat(config.targetLanguage()).isEqualTo("zh-CN");
    }

    @Test
    void requiresGeminiApiKeyInProduction() {
        Map<String, String> envValues = Map.of(ConfigLoader.ENV_LLM_PROVIDER, "gemini");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)))
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "in.json", "--output", "out.json")));

        assertThat(thrown).isInstanceOf(ConfigurationException.class).hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void reportsInvalidEnvironmentValuesByKey() {
        Map<String, String> envValues = Map.of(ConfigLoader.ENV_TRANSLATION_CONCURRENCY, "many");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)))
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "in.json", "--output", "out.json")));

        assertThat(thrown).isInstanceOf(ConfigurationException.class)
                .hasMessage("Invalid value for TRANSLATION_CONCURRENCY: many");
    }

    @Test
    void rejectsOutOfRangeSettings() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "in.json", "--output", "out.json",
                        "--max-rounds", "0")));

        assertThat(thrown).isInstanceOf(ConfigurationException.class).hasMessageContaining("max repair rounds");
    }

    @Test
    void rejectsOutputThatOverwritesInput() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "book.json", "--output",
                        "./book.json")));

        assertThat(thrown).isInstanceOf(ConfigurationException.class).hasMessageContaining("overwrite");
    }
}
