package ai.longform.translator.assemble;

/**
 * The results cannot be put back together without losing or reordering content.
 */
public class ReassemblyException extends RuntimeException {

    public ReassemblyException(String message) {
        super(message);
    }
}
