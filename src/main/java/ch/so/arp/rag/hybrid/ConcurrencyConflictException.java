package ch.so.arp.rag.hybrid;

/**
 * Signals that a compare-and-swap on a parameter key lost against a concurrent
 * writer. Callers retry; the exception only escapes once retries are exhausted.
 */
public class ConcurrencyConflictException extends HybridRetrievalException {

    private final String key;

    public ConcurrencyConflictException(String key, long expectedVersion, long actualVersion) {
        super("Version conflict on '" + key + "': expected " + expectedVersion + " but found " + actualVersion);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
