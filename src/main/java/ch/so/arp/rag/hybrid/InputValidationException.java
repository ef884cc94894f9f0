package ch.so.arp.rag.hybrid;

/**
 * Raised for malformed input such as incomplete feedback identifiers or scores
 * outside of [0,1]. The rejected input is never partially applied.
 */
public class InputValidationException extends HybridRetrievalException {

    public InputValidationException(String message) {
        super(message);
    }
}
