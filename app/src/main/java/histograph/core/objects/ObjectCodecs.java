package histograph.core.objects;

import histograph.core.codec.BinaryCodec;
import histograph.core.hash.Hash;
import histograph.exceptions.SerializationException;
import histograph.graph.VertexId;

/**
 * The codec of every stored kind.
 */
public final class ObjectCodecs {

    public static final ObjectCodec<VertexId> VERTEX = new VertexCodec();

    public static final ObjectCodec<HashEdge> EDGE = new HashEdgeCodec();

    public static final ObjectCodec<HashVec<VertexId>> VERTEX_VEC = new HashVecCodec<>(ObjectType.VERTEX_VEC);

    public static final ObjectCodec<HashVec<HashEdge>> EDGE_VEC = new HashVecCodec<>(ObjectType.EDGE_VEC);

    public static final NamedObjectCodec<GraphHash> GRAPH = new GraphHashCodec();

    private ObjectCodecs() {
    }

    /**
     * Hash under which {@code vertex} is stored.
     */
    public static Hash vertexHash(VertexId vertex) {
        return Hash.of(BinaryCodec.encodeU64(vertex.getValue()));
    }

    private static final class VertexCodec implements ObjectCodec<VertexId> {
        @Override
        public ObjectType getType() {
            return ObjectType.VERTEX;
        }

        @Override
        public byte[] encode(VertexId value) {
            return BinaryCodec.encodeU64(value.getValue());
        }

        @Override
        public VertexId decode(byte[] content) throws SerializationException {
            return VertexId.of(BinaryCodec.decodeU64(content));
        }
    }

    private static final class HashEdgeCodec implements ObjectCodec<HashEdge> {
        @Override
        public ObjectType getType() {
            return ObjectType.EDGE;
        }

        @Override
        public byte[] encode(HashEdge value) {
            return BinaryCodec.encodeHashPair(value.getFrom(), value.getTo());
        }

        @Override
        public HashEdge decode(byte[] content) throws SerializationException {
            Hash[] pair = BinaryCodec.decodeHashPair(content);
            return new HashEdge(pair[0], pair[1]);
        }
    }

    private static final class HashVecCodec<T> implements ObjectCodec<HashVec<T>> {
        private final ObjectType type;

        HashVecCodec(ObjectType type) {
            this.type = type;
        }

        @Override
        public ObjectType getType() {
            return type;
        }

        @Override
        public byte[] encode(HashVec<T> value) {
            return BinaryCodec.encodeHashList(value.getHashes());
        }

        @Override
        public HashVec<T> decode(byte[] content) throws SerializationException {
            return new HashVec<>(BinaryCodec.decodeHashList(content));
        }
    }

    private static final class GraphHashCodec implements NamedObjectCodec<GraphHash> {
        @Override
        public ObjectType getType() {
            return ObjectType.GRAPH;
        }

        @Override
        public byte[] encode(GraphHash value) {
            return BinaryCodec.encodeHashPair(value.getVertexVecHash(), value.getEdgeVecHash());
        }

        @Override
        public GraphHash decode(byte[] content) throws SerializationException {
            Hash[] pair = BinaryCodec.decodeHashPair(content);
            return new GraphHash(pair[0], pair[1]);
        }
    }
}
