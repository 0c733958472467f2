package ai.longform.translator.writer;

import ai.longform.translator.document.Document;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes translated documents as JSON.
 */
public class DocumentWriter {

    private final ObjectMapper mapper = JsonSupport.prettyMapper();

    public void write(Path target, Document document) {
        if (target == null || document == null) {
            throw new IllegalArgumentException("target and document must be provided");
        }
        try {
            createParent(target);
            mapper.writeValue(target.toFile(), DocumentJson.from(document));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write translated document: " + target, ex);
        }
    }

    static void createParent(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
