package histograph.core.objects;

import java.util.Objects;

import histograph.core.hash.Hash;

/**
 * Root of a stored graph snapshot.
 */
public final class GraphHash {

    /** Hash of the {@link HashVec} of the vertices. */
    private final Hash vertexVecHash;

    /** Hash of the {@link HashVec} of the edges. */
    private final Hash edgeVecHash;

    public GraphHash(Hash vertexVecHash, Hash edgeVecHash) {
        this.vertexVecHash = Objects.requireNonNull(vertexVecHash, "vertexVecHash");
        this.edgeVecHash = Objects.requireNonNull(edgeVecHash, "edgeVecHash");
    }

    public Hash getVertexVecHash() {
        return vertexVecHash;
    }

    public Hash getEdgeVecHash() {
        return edgeVecHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        GraphHash other = (GraphHash) o;
        return vertexVecHash.equals(other.vertexVecHash) && edgeVecHash.equals(other.edgeVecHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vertexVecHash, edgeVecHash);
    }

    @Override
    public String toString() {
        return "GraphHash{vertices=" + vertexVecHash + ", edges=" + edgeVecHash + "}";
    }
}
