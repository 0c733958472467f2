package ai.longform.translator.writer;

import ai.longform.translator.document.Document;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a document from its JSON form.
 */
public class DocumentReader {

    private final ObjectMapper mapper = JsonSupport.mapper();

    public Document read(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("source must be provided");
        }
        try {
            return mapper.readValue(Files.readAllBytes(source), DocumentJson.class).toDocument();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document: " + source, ex);
        }
    }
}
