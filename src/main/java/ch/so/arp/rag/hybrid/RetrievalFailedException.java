package ch.so.arp.rag.hybrid;

/**
 * Raised when every strategy of a query failed or timed out, so that callers
 * never mistake a total failure for an empty result.
 */
public class RetrievalFailedException extends HybridRetrievalException {

    public RetrievalFailedException(String message) {
        super(message);
    }

    public RetrievalFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
