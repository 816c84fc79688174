package histograph.utils.io;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility class for file operations.
 */
public class FileUtils {

    private static final String TEMP_PREFIX = ".";
    private static final String TEMP_SUFFIX = ".tmp";

    /**
     * Creates directories for the given path if they do not exist. Safe to call
     * concurrently for the same path.
     */
    public static void createDirectories(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            Files.createDirectories(path);
        }
    }

    /**
     * Replaces the file at the given path with the given content. The content is
     * written to a sibling temporary file first and then moved into place, so a
     * concurrent reader sees either the old or the new content, never a partial
     * write. Temporary files start with a dot and never share a name with a
     * stored object. The parent directory must exist.
     */
    public static void writeFile(Path path, byte[] content) throws IOException {
        Path temp = Files.createTempFile(path.getParent(), TEMP_PREFIX + path.getFileName(), TEMP_SUFFIX);
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Reads the content of a file as a byte array.
     */
    public static byte[] readFile(Path path) throws IOException {
        return Files.readAllBytes(path);
    }
}
