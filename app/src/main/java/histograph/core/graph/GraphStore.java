package histograph.core.graph;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import histograph.core.objects.GraphHash;
import histograph.graph.DirectedGraph;

public interface GraphStore {
    /**
     * Store {@code graph} and point the snapshot {@code name} at it, replacing
     * whatever the name pointed to before.
     */
    CompletableFuture<Void> saveGraphAs(Path basePath, String name, DirectedGraph graph);

    /**
     * Load the graph the snapshot {@code name} points to. Fails if the name or
     * any object reachable from it is missing or corrupt; a partial graph is
     * never returned.
     */
    CompletableFuture<DirectedGraph> loadGraph(Path basePath, String name);

    /**
     * Store the vertices and edges of {@code graph} without naming the result.
     */
    CompletableFuture<GraphHash> writeGraph(Path basePath, DirectedGraph graph);

    /**
     * Load the graph rooted at {@code graphHash}.
     */
    CompletableFuture<DirectedGraph> readGraph(Path basePath, GraphHash graphHash);
}
