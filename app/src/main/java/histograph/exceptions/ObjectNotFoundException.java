package histograph.exceptions;

import java.nio.file.Path;

/**
 * Raised when a hash-addressed object or a named snapshot does not exist.
 */
public class ObjectNotFoundException extends StorageIOException {
    private final Path path;

    public ObjectNotFoundException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public ObjectNotFoundException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * The path that was expected to hold the object.
     */
    public Path getPath() {
        return path;
    }
}
