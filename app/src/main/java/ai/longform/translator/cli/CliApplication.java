package ai.longform.translator.cli;

import ai.longform.translator.config.Config;
import ai.longform.translator.config.ConfigLoader;
import ai.longform.translator.config.ConfigurationException;
import ai.longform.translator.config.Secrets;
import ai.longform.translator.config.SystemEnvironmentReader;
import ai.longform.translator.config.TranslatorConfig;
import ai.longform.translator.document.Document;
import ai.longform.translator.exchange.Glossary;
import ai.longform.translator.exchange.PromptTemplates;
import ai.longform.translator.logging.LoggingConfigurator;
import ai.longform.translator.plan.CharacterRatioTokenEstimator;
import ai.longform.translator.translate.ChatModelCompletionClient;
import ai.longform.translator.translate.CompletionClient;
import ai.longform.translator.translate.CompletionClientFactory;
import ai.longform.translator.translate.EngineResult;
import ai.longform.translator.translate.MockCompletionClient;
import ai.longform.translator.translate.PassThroughCompletionClient;
import ai.longform.translator.translate.TranslationMode;
import ai.longform.translator.translate.TranslationRequest;
import ai.longform.translator.translate.TranslationService;
import ai.longform.translator.writer.DocumentReader;
import ai.longform.translator.writer.DocumentWriter;
import ai.longform.translator.writer.ResponseLogWriter;
import ai.longform.translator.writer.TranslationReportWriter;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration and the translation engine.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_UNRESOLVED = 1;
    static final int EXIT_CONFIGURATION = 2;

    private final ConfigLoader configLoader;
    private final Function<Config, CompletionClient> productionClientFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createProductionClient);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, CompletionClient> productionClientFactory) {
        this.configLoader = configLoader;
        this.productionClientFactory = productionClientFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        Document document;
        Glossary glossary;
        CompletionClient client;
        try {
            config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
            document = new DocumentReader().read(config.input());
            glossary = config.glossary().isPresent() ? Glossary.read(config.glossary().get()) : Glossary.empty();
            client = selectClient(config);
        } catch (ConfigurationException | IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_CONFIGURATION;
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.error("Failed to read input: {}", ex.getMessage());
            return EXIT_CONFIGURATION;
        }
        LOGGER.info("Running in {} mode with {} model '{}'", config.translationMode(),
                config.translatorConfig().provider(), config.translatorConfig().modelName());

        TranslationService service = new TranslationService(config.engineSettings(), client,
                PromptTemplates.loadDefaults(), new CharacterRatioTokenEstimator());
        EngineResult result = service.translate(document,
                new TranslationRequest(config.sourceLanguage(), config.targetLanguage(), glossary));

        new DocumentWriter().write(config.output(), result.document());
        config.responseLog().ifPresent(path -> new ResponseLogWriter().write(path, result.responseLog()));
        config.report().ifPresent(path -> new TranslationReportWriter().write(path, result));
        LOGGER.info("Wrote translated document to {}", config.output());

        if (!result.isComplete()) {
            LOGGER.warn("{} units could not be translated", result.unresolved().size());
            return EXIT_UNRESOLVED;
        }
        return 0;
    }

    private CompletionClient selectClient(Config config) {
        // the production client is only built when it is used, so offline modes need no provider
        CompletionClient production = config.translationMode() == TranslationMode.PRODUCTION
                ? productionClientFactory.apply(config)
                : new PassThroughCompletionClient();
        CompletionClientFactory factory = new CompletionClientFactory(production, new PassThroughCompletionClient(),
                new MockCompletionClient());
        return factory.select(config.translationMode());
    }

    private static CompletionClient createProductionClient(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
        return new ChatModelCompletionClient(chatModel, translatorConfig.provider().name(), translatorConfig.modelName());
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new ConfigurationException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new ConfigurationException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
