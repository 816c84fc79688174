package histograph.graph;

import java.util.Objects;

/**
 * A directed edge between two vertices.
 */
public final class Edge {
    private final VertexId from;
    private final VertexId to;

    public Edge(VertexId from, VertexId to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public static Edge of(long from, long to) {
        return new Edge(VertexId.of(from), VertexId.of(to));
    }

    public VertexId getFrom() {
        return from;
    }

    public VertexId getTo() {
        return to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Edge edge = (Edge) o;
        return from.equals(edge.from) && to.equals(edge.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
