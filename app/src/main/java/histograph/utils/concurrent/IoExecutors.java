package histograph.utils.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Factory for the thread pools that run object reads and writes.
 */
public final class IoExecutors {

    private IoExecutors() {
    }

    public static ExecutorService newIoExecutor(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("I/O thread count must be positive, was " + threads);
        }
        return Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                .setNameFormat("histo-graph-io-%d")
                .setDaemon(true)
                .build());
    }
}
