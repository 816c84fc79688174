package histograph.core.objects;

import java.util.Objects;

import histograph.core.hash.Hash;
import histograph.graph.Edge;

/**
 * Stored form of an {@link Edge}: the hashes of its two endpoint vertices.
 */
public final class HashEdge {
    private final Hash from;
    private final Hash to;

    public HashEdge(Hash from, Hash to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    /**
     * Computes the endpoint hashes from the serialized vertices. Whether the
     * vertices themselves are stored is not checked.
     */
    public static HashEdge of(Edge edge) {
        return new HashEdge(ObjectCodecs.vertexHash(edge.getFrom()), ObjectCodecs.vertexHash(edge.getTo()));
    }

    public Hash getFrom() {
        return from;
    }

    public Hash getTo() {
        return to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        HashEdge other = (HashEdge) o;
        return from.equals(other.from) && to.equals(other.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return "HashEdge{" + from + " -> " + to + "}";
    }
}
