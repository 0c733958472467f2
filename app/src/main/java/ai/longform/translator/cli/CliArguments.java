package ai.longform.translator.cli;

import ai.longform.translator.config.LogFormat;
import ai.longform.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-longform-translator", mixinStandardHelpOptions = true,
        description = "Translates long-form documents (books, subtitle tracks) through an LLM")
public class CliArguments {

    @CommandLine.Option(names = "--input", required = true, description = "Source document (JSON)", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = "--output", required = true, description = "Translated document (JSON)", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--response-log", description = "Write every raw model response as JSON Lines", paramLabel = "FILE")
    private Path responseLog;

    @CommandLine.Option(names = "--report", description = "Write round statistics and unresolved units", paramLabel = "FILE")
    private Path report;

    @CommandLine.Option(names = "--glossary", description = "JSON object of fixed term translations", paramLabel = "FILE")
    private Path glossary;

    @CommandLine.Option(names = "--model", description = "Model name for the configured provider", paramLabel = "NAME")
    private String model;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--source-lang", description = "Source language, defaults to the document's", paramLabel = "LANG")
    private String sourceLanguage;

    @CommandLine.Option(names = "--target-lang", description = "Target language", paramLabel = "LANG")
    private String targetLanguage;

    @CommandLine.Option(names = "--token-budget", description = "Output token limit of the model", paramLabel = "TOKENS")
    private Integer tokenBudget;

    @CommandLine.Option(names = "--concurrency", description = "Maximum requests in flight", paramLabel = "COUNT")
    private Integer concurrency;

    @CommandLine.Option(names = "--max-rounds", description = "Translation rounds including repairs", paramLabel = "COUNT")
    private Integer maxRounds;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log at debug level")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public Path responseLog() {
        return responseLog;
    }

    public Path report() {
        return report;
    }

    public Path glossary() {
        return glossary;
    }

    public String model() {
        return model;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public String sourceLanguage() {
        return sourceLanguage;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public Integer tokenBudget() {
        return tokenBudget;
    }

    public Integer concurrency() {
        return concurrency;
    }

    public Integer maxRounds() {
        return maxRounds;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
