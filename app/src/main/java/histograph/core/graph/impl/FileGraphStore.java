package histograph.core.graph.impl;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import histograph.core.graph.GraphStore;
import histograph.core.hash.Hash;
import histograph.core.objects.GraphHash;
import histograph.core.objects.HashEdge;
import histograph.core.objects.ObjectCodecs;
import histograph.core.objects.ObjectFile;
import histograph.core.objects.ObjectStore;
import histograph.core.objects.ObjectType;
import histograph.graph.DirectedGraph;
import histograph.graph.Edge;
import histograph.graph.VertexId;
import histograph.utils.concurrent.Futures;

/**
 * Stores a graph as a tree of hash-linked objects.
 *
 * <pre>
 * graph/&lt;name&gt; ─┬─► vertexvec/&lt;hash&gt; ──► vertex/&lt;hash&gt; ...
 *                └─► edgevec/&lt;hash&gt; ──► edge/&lt;hash&gt; ... ──► vertex/&lt;hash&gt;
 * </pre>
 *
 * Saving writes the vertex branch and the edge branch concurrently, then the
 * named root. Since every object but the root is content-addressed, a save
 * that failed half way can simply be repeated.
 */
public class FileGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(FileGraphStore.class);

    private final ObjectStore objectStore;

    public FileGraphStore(ObjectStore objectStore) {
        this.objectStore = objectStore;
    }

    @Override
    public CompletableFuture<Void> saveGraphAs(Path basePath, String name, DirectedGraph graph) {
        ObjectFile.validateName(name);
        int vertexCount = graph.vertexCount();
        int edgeCount = graph.edgeCount();

        return writeGraph(basePath, graph)
                .thenCompose(graphHash -> objectStore.createDirectory(basePath, ObjectType.GRAPH)
                        .thenCompose(ignored -> objectStore.writeNamedObject(
                                basePath, ObjectCodecs.GRAPH, name, graphHash)))
                .thenRun(() -> log.info("Saved graph '{}' ({} vertices, {} edges) to {}",
                        name, vertexCount, edgeCount, basePath));
    }

    @Override
    public CompletableFuture<DirectedGraph> loadGraph(Path basePath, String name) {
        ObjectFile.validateName(name);

        return objectStore.readNamedObject(basePath, ObjectCodecs.GRAPH, name)
                .thenCompose(graphHash -> readGraph(basePath, graphHash))
                .thenApply(graph -> {
                    log.info("Loaded graph '{}' ({} vertices, {} edges) from {}",
                            name, graph.vertexCount(), graph.edgeCount(), basePath);
                    return graph;
                });
    }

    @Override
    public CompletableFuture<GraphHash> writeGraph(Path basePath, DirectedGraph graph) {
        // Copied up front: the graph is not safe to iterate from I/O threads.
        List<VertexId> vertices = new ArrayList<>(graph.vertices());
        List<HashEdge> edges = new ArrayList<>(graph.edgeCount());
        for (Edge edge : graph.edges()) {
            edges.add(HashEdge.of(edge));
        }

        return Futures.combine(
                writeVertices(basePath, vertices),
                writeEdges(basePath, edges),
                GraphHash::new);
    }

    @Override
    public CompletableFuture<DirectedGraph> readGraph(Path basePath, GraphHash graphHash) {
        return Futures.combine(
                readVertices(basePath, graphHash.getVertexVecHash()),
                readEdges(basePath, graphHash.getEdgeVecHash()),
                (vertices, edges) -> {
                    DirectedGraph graph = new DirectedGraph();
                    for (VertexId vertex : vertices) {
                        graph.addVertex(vertex);
                    }
                    for (Edge edge : edges) {
                        graph.addEdge(edge);
                    }
                    return graph;
                });
    }

    /**
     * @return the hash of the stored vertex list
     */
    private CompletableFuture<Hash> writeVertices(Path basePath, List<VertexId> vertices) {
        return objectStore.writeAll(basePath, ObjectCodecs.VERTEX, vertices)
                .thenCompose(hashVec -> objectStore.createDirectory(basePath, ObjectType.VERTEX_VEC)
                        .thenCompose(ignored -> objectStore.writeObject(basePath, ObjectCodecs.VERTEX_VEC, hashVec)));
    }

    /**
     * @return the hash of the stored edge list
     */
    private CompletableFuture<Hash> writeEdges(Path basePath, List<HashEdge> edges) {
        return objectStore.writeAll(basePath, ObjectCodecs.EDGE, edges)
                .thenCompose(hashVec -> objectStore.createDirectory(basePath, ObjectType.EDGE_VEC)
                        .thenCompose(ignored -> objectStore.writeObject(basePath, ObjectCodecs.EDGE_VEC, hashVec)));
    }

    private CompletableFuture<List<VertexId>> readVertices(Path basePath, Hash vertexVecHash) {
        return objectStore.readObject(basePath, ObjectCodecs.VERTEX_VEC, vertexVecHash)
                .thenCompose(hashVec -> objectStore.readAll(basePath, ObjectCodecs.VERTEX, hashVec.getHashes()));
    }

    private CompletableFuture<List<Edge>> readEdges(Path basePath, Hash edgeVecHash) {
        return objectStore.readObject(basePath, ObjectCodecs.EDGE_VEC, edgeVecHash)
                .thenCompose(hashVec -> {
                    List<CompletableFuture<Edge>> reads = new ArrayList<>(hashVec.size());
                    for (Hash hash : hashVec.getHashes()) {
                        reads.add(readEdge(basePath, hash));
                    }
                    return Futures.allAsList(reads);
                });
    }

    /**
     * Reads a stored edge and resolves both endpoint hashes to vertices.
     */
    private CompletableFuture<Edge> readEdge(Path basePath, Hash hash) {
        return objectStore.readObject(basePath, ObjectCodecs.EDGE, hash)
                .thenCompose(hashEdge -> Futures.combine(
                        objectStore.readObject(basePath, ObjectCodecs.VERTEX, hashEdge.getFrom()),
                        objectStore.readObject(basePath, ObjectCodecs.VERTEX, hashEdge.getTo()),
                        Edge::new));
    }
}
