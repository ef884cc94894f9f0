package ch.so.arp.rag.hybrid;

/**
 * Raised when an update targets a mapping, parameter or record that does not
 * exist. Updates never create the missing entry implicitly.
 */
public class NotFoundException extends HybridRetrievalException {

    public NotFoundException(String message) {
        super(message);
    }
}
