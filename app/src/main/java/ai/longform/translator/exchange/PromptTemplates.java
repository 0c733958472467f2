package ai.longform.translator.exchange;

import ai.longform.translator.plan.TaskVariant;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Prompt text per task variant. Placeholders: {@code {{payload}}}, {@code {{glossary}}},
 * {@code {{source_language}}}, {@code {{target_language}}}, {@code {{title}}}.
 */
public record PromptTemplates(String batch, String split, String fix) {

    private static final String PROMPTS_PATH = "prompts/";

    public PromptTemplates {
        batch = requireTemplate(batch, "batch");
        split = requireTemplate(split, "split");
        fix = requireTemplate(fix, "fix");
    }

    public static PromptTemplates loadDefaults() {
        return new PromptTemplates(load("batch.txt"), load("split.txt"), load("fix.txt"));
    }

    public String forVariant(TaskVariant variant) {
        return switch (variant) {
            case BATCH -> batch;
            case SPLIT -> split;
            case FIX -> fix;
        };
    }

    private static String load(String name) {
        String resource = PROMPTS_PATH + name;
        try (InputStream in = PromptTemplates.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Prompt template not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read prompt template: " + resource, ex);
        }
    }

    private static String requireTemplate(String template, String name) {
        if (template == null || !template.contains("{{payload}}")) {
            throw new IllegalArgumentException(name + " template must contain {{payload}}");
        }
        return template;
    }
}
