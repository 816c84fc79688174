package histograph.cli.utils;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

import histograph.config.StoreConfig;
import histograph.core.graph.GraphStore;
import histograph.core.graph.impl.FileGraphStore;
import histograph.core.objects.impl.FileObjectStore;
import histograph.exceptions.StoreException;
import histograph.graph.DirectedGraph;
import histograph.utils.concurrent.Futures;
import histograph.utils.concurrent.IoExecutors;

/**
 * Blocking access to one snapshot for the duration of a command. Owns the I/O
 * thread pool, which is shut down on {@link #close()}.
 */
public final class StoreSession implements AutoCloseable {
    private final StoreConfig config;
    private final ExecutorService executor;
    private final GraphStore graphStore;

    public StoreSession(StoreConfig config) {
        this.config = config;
        this.executor = IoExecutors.newIoExecutor(config.getIoThreads());
        this.graphStore = new FileGraphStore(new FileObjectStore(executor, config.isVerifyHashes()));
    }

    public DirectedGraph load() throws StoreException {
        return Futures.await(graphStore.loadGraph(getStoreDir(), getSnapshotName()));
    }

    public void save(DirectedGraph graph) throws StoreException {
        Futures.await(graphStore.saveGraphAs(getStoreDir(), getSnapshotName(), graph));
    }

    public Path getStoreDir() {
        return config.getStoreDir();
    }

    public String getSnapshotName() {
        return config.getSnapshotName();
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
