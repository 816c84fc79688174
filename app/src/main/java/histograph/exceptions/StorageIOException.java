package histograph.exceptions;

/**
 * Raised when the file system refuses an operation: permissions, a full disk,
 * a missing file or directory.
 */
public class StorageIOException extends StoreException {
    public StorageIOException(String message) {
        super(message);
    }

    public StorageIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
