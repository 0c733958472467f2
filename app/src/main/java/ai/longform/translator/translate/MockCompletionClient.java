package ai.longform.translator.translate;

/**
 * Mock client used for offline runs: answers every fragment of the prompt with its text
 * prefixed by {@code [MOCK] }.
 */
public class MockCompletionClient extends PassThroughCompletionClient {

    static final String MOCK_PREFIX = "[MOCK] ";

    public MockCompletionClient() {
        super(MOCK_PREFIX);
    }
}
