package histograph.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings of the command line front end, read from
 * {@value #RESOURCE} on the classpath. Missing keys fall back to defaults.
 *
 * <pre>
 * store.dir            directory holding the objects          (.store)
 * store.snapshot       snapshot name used by default          (current)
 * store.io-threads     size of the I/O thread pool            (4)
 * store.verify-hashes  check content hashes on every read     (true)
 * </pre>
 */
public final class StoreConfig {
    public static final String RESOURCE = "/histo-graph.properties";

    public static final String STORE_DIR = "store.dir";
    public static final String SNAPSHOT = "store.snapshot";
    public static final String IO_THREADS = "store.io-threads";
    public static final String VERIFY_HASHES = "store.verify-hashes";

    private static final String DEFAULT_STORE_DIR = ".store";
    private static final String DEFAULT_SNAPSHOT = "current";
    private static final int DEFAULT_IO_THREADS = 4;
    private static final boolean DEFAULT_VERIFY_HASHES = true;

    private final Path storeDir;
    private final String snapshotName;
    private final int ioThreads;
    private final boolean verifyHashes;

    public StoreConfig(Path storeDir, String snapshotName, int ioThreads, boolean verifyHashes) {
        if (ioThreads < 1) {
            throw new IllegalArgumentException(
                    "Configuration key '" + IO_THREADS + "' must be positive, was " + ioThreads);
        }
        this.storeDir = storeDir;
        this.snapshotName = snapshotName;
        this.ioThreads = ioThreads;
        this.verifyHashes = verifyHashes;
    }

    public static StoreConfig defaults() {
        return new StoreConfig(Paths.get(DEFAULT_STORE_DIR), DEFAULT_SNAPSHOT, DEFAULT_IO_THREADS,
                DEFAULT_VERIFY_HASHES);
    }

    /**
     * Reads {@value #RESOURCE}, or returns the defaults if it is absent.
     */
    public static StoreConfig load() {
        Properties props = new Properties();
        try (InputStream is = StoreConfig.class.getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static StoreConfig fromProperties(Properties props) {
        return new StoreConfig(
                Paths.get(props.getProperty(STORE_DIR, DEFAULT_STORE_DIR).trim()),
                props.getProperty(SNAPSHOT, DEFAULT_SNAPSHOT).trim(),
                intVal(props, IO_THREADS, DEFAULT_IO_THREADS),
                boolVal(props, VERIFY_HASHES, DEFAULT_VERIFY_HASHES));
    }

    public Path getStoreDir() {
        return storeDir;
    }

    public String getSnapshotName() {
        return snapshotName;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public boolean isVerifyHashes() {
        return verifyHashes;
    }

    public StoreConfig withStoreDir(Path storeDir) {
        return new StoreConfig(storeDir, snapshotName, ioThreads, verifyHashes);
    }

    public StoreConfig withSnapshotName(String snapshotName) {
        return new StoreConfig(storeDir, snapshotName, ioThreads, verifyHashes);
    }

    public StoreConfig withIoThreads(int ioThreads) {
        return new StoreConfig(storeDir, snapshotName, ioThreads, verifyHashes);
    }

    public StoreConfig withVerifyHashes(boolean verifyHashes) {
        return new StoreConfig(storeDir, snapshotName, ioThreads, verifyHashes);
    }

    private static int intVal(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key), e);
        }
    }

    private static boolean boolVal(Properties props, String key, boolean defaultValue) {
        String val = props.getProperty(key);
        if (val == null) {
            return defaultValue;
        }
        String trimmed = val.trim();
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("yes"))
            return true;
        if (trimmed.equalsIgnoreCase("false") || trimmed.equalsIgnoreCase("no"))
            return false;
        throw new IllegalArgumentException(String.format(
                "Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key));
    }

    @Override
    public String toString() {
        return "StoreConfig{storeDir=" + storeDir + ", snapshotName=" + snapshotName + ", ioThreads=" + ioThreads
                + ", verifyHashes=" + verifyHashes + "}";
    }
}
