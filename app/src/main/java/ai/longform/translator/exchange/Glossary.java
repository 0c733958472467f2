package ai.longform.translator.exchange;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fixed term translations handed to the model with every request.
 */
public record Glossary(Map<String, String> terms) {

    private static final String NONE = "(none)";

    public Glossary {
        terms = terms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(terms));
    }

    public static Glossary empty() {
        return new Glossary(Map.of());
    }

    /**
     * Reads a flat JSON object of {@code "source term": "target term"} pairs.
     */
    public static Glossary read(Path path) throws IOException {
        Map<String, String> terms = new ObjectMapper().readValue(Files.readAllBytes(path),
                new TypeReference<LinkedHashMap<String, String>>() { });
        return new Glossary(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public String render() {
        if (terms.isEmpty()) {
            return NONE;
        }
        return terms.entrySet().stream()
                .map(entry -> "- " + entry.getKey() + " => " + entry.getValue())
                .collect(Collectors.joining("\n"));
    }
}
