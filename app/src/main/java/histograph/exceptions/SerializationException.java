package histograph.exceptions;

/**
 * Raised when stored bytes cannot be decoded: they are truncated, malformed,
 * belong to a different object kind, or do not match their content hash.
 */
public class SerializationException extends StoreException {
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
