package histograph.cli.mixins;

import java.nio.file.Path;

import histograph.cli.utils.StoreSession;
import histograph.config.StoreConfig;
import picocli.CommandLine.Option;

/**
 * Mixin for commands that read or write a graph snapshot.
 *
 * Options left out fall back to the values in the configuration file.
 */
public class StoreMixin {

    @Option(names = { "-s", "--store" }, paramLabel = "<dir>", description = "Directory holding the stored objects")
    private Path storeDir;

    @Option(names = { "-n", "--name" }, paramLabel = "<snapshot>", description = "Name of the graph snapshot")
    private String snapshotName;

    @Option(names = { "--io-threads" }, paramLabel = "<count>", description = "Number of threads for file I/O")
    private Integer ioThreads;

    @Option(names = { "--no-verify" }, description = "Skip checking object content against its hash on read")
    private boolean noVerify;

    public StoreConfig getConfig() {
        StoreConfig config = StoreConfig.load();
        if (storeDir != null) {
            config = config.withStoreDir(storeDir);
        }
        if (snapshotName != null) {
            config = config.withSnapshotName(snapshotName);
        }
        if (ioThreads != null) {
            config = config.withIoThreads(ioThreads);
        }
        if (noVerify) {
            config = config.withVerifyHashes(false);
        }
        return config;
    }

    public StoreSession openSession() {
        return new StoreSession(getConfig());
    }
}
