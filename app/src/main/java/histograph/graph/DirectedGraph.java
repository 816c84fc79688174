package histograph.graph;

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.graph.ElementOrder;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

/**
 * In-memory directed graph of {@link VertexId}s, backed by a Guava
 * {@link MutableGraph}. Self loops are allowed; parallel edges are not.
 *
 * Vertices enumerate in insertion order and edges in a stable order derived
 * from it. Adding an edge adds its endpoints as vertices.
 *
 * Instances are not thread-safe.
 */
public final class DirectedGraph {
    private final MutableGraph<VertexId> graph;

    public DirectedGraph() {
        this.graph = GraphBuilder.directed()
                .allowsSelfLoops(true)
                .incidentEdgeOrder(ElementOrder.stable())
                .build();
    }

    /**
     * @return true if the vertex was not yet part of the graph
     */
    public boolean addVertex(VertexId vertex) {
        return graph.addNode(vertex);
    }

    /**
     * @return true if the edge was not yet part of the graph
     */
    public boolean addEdge(Edge edge) {
        return graph.putEdge(edge.getFrom(), edge.getTo());
    }

    public boolean containsVertex(VertexId vertex) {
        return graph.nodes().contains(vertex);
    }

    public boolean containsEdge(Edge edge) {
        return graph.hasEdgeConnecting(edge.getFrom(), edge.getTo());
    }

    /**
     * Unmodifiable live view of the vertices.
     */
    public Set<VertexId> vertices() {
        return graph.nodes();
    }

    /**
     * Snapshot of the edges.
     */
    public Set<Edge> edges() {
        Set<Edge> edges = new LinkedHashSet<>();
        for (EndpointPair<VertexId> pair : graph.edges()) {
            edges.add(new Edge(pair.source(), pair.target()));
        }
        return edges;
    }

    public int vertexCount() {
        return graph.nodes().size();
    }

    public int edgeCount() {
        return graph.edges().size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return graph.equals(((DirectedGraph) o).graph);
    }

    @Override
    public int hashCode() {
        return graph.hashCode();
    }

    @Override
    public String toString() {
        return "DirectedGraph{vertices=" + graph.nodes() + ", edges=" + edges() + "}";
    }
}
