package jobstream.broker.repository;

/**
 * The durable store could not complete an append or a read.
 * Producers must see this: the event was not (or may not have been) persisted.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreUnavailableException(String message) {
        super(message);
    }
}
