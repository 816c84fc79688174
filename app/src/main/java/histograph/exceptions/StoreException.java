package histograph.exceptions;

/**
 * Base class of all failures raised by the graph store.
 */
public class StoreException extends Exception {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
