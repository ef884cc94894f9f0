package ch.so.arp.rag.hybrid;

/**
 * Raised when a bridge link points to a chunk or graph node that the content
 * catalog does not know.
 */
public class DanglingReferenceException extends HybridRetrievalException {

    public DanglingReferenceException(String message) {
        super(message);
    }
}
