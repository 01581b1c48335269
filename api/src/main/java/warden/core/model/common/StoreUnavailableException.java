package warden.core.model.common;

/**
 * A shared store (relational, registry, cache or counter) could not complete an operation.
 *
 * <p>Adapters wrap their transport failures in this type so the core can apply
 * bounded retry and then fail closed without knowing which backend failed.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String store;

    public StoreUnavailableException(String store, String message) {
        super(message);
        this.store = store;
    }

    public StoreUnavailableException(String store, String message, Throwable cause) {
        super(message, cause);
        this.store = store;
    }

    /** Returns the logical name of the store that failed. */
    public String store() {
        return store;
    }
}
