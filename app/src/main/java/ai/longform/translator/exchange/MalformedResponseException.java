package ai.longform.translator.exchange;

/**
 * Raised when a completion cannot be parsed back into tagged fragments. The whole task fails.
 */
public class MalformedResponseException extends Exception {

    public MalformedResponseException(String message) {
        super(message);
    }
}
