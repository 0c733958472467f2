package ai.longform.translator.translate;

/**
 * Low-level text completion call: one rendered prompt in, one raw response out.
 */
public interface CompletionClient {

    String complete(String prompt);
}
