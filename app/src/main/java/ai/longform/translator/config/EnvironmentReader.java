package ai.longform.translator.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value, treating blank values as unset.
     */
    default Optional<String> nonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
