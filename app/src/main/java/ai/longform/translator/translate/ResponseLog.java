package ai.longform.translator.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only record of every raw response of a run, in completion order. Owned by the caller
 * of the engine and safe to append to from executor threads.
 */
public class ResponseLog {

    private final List<ResponseLogEntry> entries = new ArrayList<>();

    public synchronized void append(ResponseLogEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
    }

    public synchronized List<ResponseLogEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
