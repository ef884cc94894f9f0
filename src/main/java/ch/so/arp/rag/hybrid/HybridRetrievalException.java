package ch.so.arp.rag.hybrid;

/**
 * Base type of all failures raised by the hybrid retrieval and learning core.
 */
public class HybridRetrievalException extends RuntimeException {

    public HybridRetrievalException(String message) {
        super(message);
    }

    public HybridRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
