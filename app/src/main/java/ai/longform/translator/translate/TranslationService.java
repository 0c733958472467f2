package ai.longform.translator.translate;

import ai.longform.translator.assemble.NavigationPatcher;
import ai.longform.translator.assemble.Reassembler;
import ai.longform.translator.config.EngineSettings;
import ai.longform.translator.document.Document;
import ai.longform.translator.exchange.FragmentCodec;
import ai.longform.translator.exchange.PromptRenderer;
import ai.longform.translator.exchange.PromptTemplates;
import ai.longform.translator.plan.TokenEstimator;
import ai.longform.translator.plan.TranslationPlan;
import ai.longform.translator.plan.TranslationPlanner;
import ai.longform.translator.quality.QualityAssessor;
import ai.longform.translator.quality.QualityClassifier;
import ai.longform.translator.repair.RepairLoop;
import ai.longform.translator.repair.RepairOutcome;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates one document end to end: plan, execute, repair, reassemble.
 */
public class TranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);

    private final EngineSettings settings;
    private final CompletionClient client;
    private final PromptTemplates templates;
    private final TokenEstimator estimator;
    private final RetryPolicy retryPolicy;

    public TranslationService(EngineSettings settings, CompletionClient client, PromptTemplates templates,
                              TokenEstimator estimator) {
        this(settings, client, templates, estimator, new ExponentialBackoffRetryPolicy(settings.maxRetryAttempts(),
                settings.initialBackoff(), settings.maxBackoff(), settings.retryJitterFactor()));
    }

    public TranslationService(EngineSettings settings, CompletionClient client, PromptTemplates templates,
                              TokenEstimator estimator, RetryPolicy retryPolicy) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.client = Objects.requireNonNull(client, "client");
        this.templates = Objects.requireNonNull(templates, "templates");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public EngineResult translate(Document document, TranslationRequest request) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(request, "request");
        FragmentCodec codec = new FragmentCodec();
        TranslationPlanner planner = new TranslationPlanner(estimator, codec, settings.budget());
        TranslationPlan plan = planner.plan(document);
        LOGGER.info("Translating '{}' into {}: {} containers, {} units, {} tasks", document.title(),
                request.targetLanguage(), document.containers().size(), document.unitCount(), plan.tasks().size());

        String sourceLanguage = request.sourceLanguage().or(document::sourceLanguage).orElse(null);
        PromptRenderer renderer = new PromptRenderer(templates, codec, sourceLanguage, request.targetLanguage(),
                document.title(), request.glossary());
        QualityAssessor assessor = new QualityAssessor(new QualityClassifier(), settings.missedTranslationCheck());
        ResponseLog responseLog = new ResponseLog();

        RepairOutcome outcome;
        try (TranslationExecutor executor = new TranslationExecutor(client, codec, retryPolicy,
                settings.concurrencyLimit(), settings.requestTimeout())) {
            outcome = new RepairLoop(planner, executor, assessor, settings.maxRepairRounds())
                    .run(plan, renderer, responseLog);
        }

        Reassembler reassembler = new Reassembler(new NavigationPatcher(), settings.unresolvedUnitPolicy());
        Document translated = reassembler.reassemble(document, plan, outcome, request.targetLanguage());
        LOGGER.info("Finished '{}' after {} rounds: {} responses logged, {} unresolved units", document.title(),
                outcome.rounds().size(), responseLog.size(), outcome.unresolved().size());
        return new EngineResult(translated, responseLog, outcome.unresolved(), outcome.rounds(), plan.tasks().size());
    }
}
