package ai.longform.translator.exchange;

import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.plan.FixReason;
import ai.longform.translator.plan.FixTask;
import ai.longform.translator.plan.TranslationTask;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the prompt for a task: serialized payload plus document-level context.
 */
public class PromptRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private final PromptTemplates templates;
    private final FragmentCodec codec;
    private final Map<String, String> context;

    public PromptRenderer(PromptTemplates templates,
                          FragmentCodec codec,
                          String sourceLanguage,
                          String targetLanguage,
                          String title,
                          Glossary glossary) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.context = Map.of(
                "source_language", sourceLanguage == null || sourceLanguage.isBlank() ? "the source language" : sourceLanguage,
                "target_language", Objects.requireNonNull(targetLanguage, "targetLanguage"),
                "title", title == null ? "" : title,
                "glossary", glossary == null ? Glossary.empty().render() : glossary.render());
    }

    public String render(TranslationTask task, Map<String, ContentUnit> units) {
        List<ContentUnit> payloadUnits = new ArrayList<>(task.unitIds().size());
        for (String id : task.unitIds()) {
            ContentUnit unit = units.get(id);
            if (unit == null) {
                throw new IllegalArgumentException("Task " + task.taskId() + " references unknown unit " + id);
            }
            payloadUnits.add(unit);
        }
        String payload = codec.serialize(task.variant(), payloadUnits);
        String reason = task instanceof FixTask fix ? describe(fix.reason()) : null;
        return interpolate(templates.forVariant(task.variant()), payload, reason);
    }

    private static String describe(FixReason reason) {
        return switch (reason) {
            case HARD_ERROR -> "it contained garbled or repeated text, or gave up on the segment";
            case MISSED_TRANSLATION -> "it was left untranslated";
        };
    }

    /**
     * Unknown placeholders are left as they are; {@code reason} is only filled for fix tasks.
     */
    String interpolate(String template, String payload, String reason) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = switch (name) {
                case "payload" -> payload;
                case "reason" -> reason;
                default -> context.get(name);
            };
            if (value != null) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(value));
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
