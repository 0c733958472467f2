package ai.longform.translator.translate;

import java.util.Objects;

/**
 * Provides completion clients based on the desired execution mode.
 */
public class CompletionClientFactory {

    private final CompletionClient productionClient;
    private final CompletionClient dryRunClient;
    private final CompletionClient mockClient;

    public CompletionClientFactory(CompletionClient productionClient,
                                   CompletionClient dryRunClient,
                                   CompletionClient mockClient) {
        this.productionClient = Objects.requireNonNull(productionClient, "productionClient");
        this.dryRunClient = Objects.requireNonNull(dryRunClient, "dryRunClient");
        this.mockClient = Objects.requireNonNull(mockClient, "mockClient");
    }

    public CompletionClient select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> productionClient;
            case DRY_RUN -> dryRunClient;
            case MOCK -> mockClient;
        };
    }
}
