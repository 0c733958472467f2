package ai.longform.translator.translate;

/**
 * A single completion call did not answer within the configured request timeout.
 */
public class RequestTimeoutException extends TranslationException {

    public RequestTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
