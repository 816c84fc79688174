package histograph.core.codec;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import histograph.core.hash.Hash;
import histograph.exceptions.SerializationException;

// @formatter:off
/**
 * Fixed binary encoding of stored objects. All integers are little-endian and
 * fixed width; hashes are written as their 32 raw bytes without a length.
 *
 * ┌──────────────┬──────────────────────────────────────────────┐
 * │ u64          │ 8 bytes                                      │
 * │ hash pair    │ first (32) │ second (32)                     │
 * │ hash list    │ count (u64) │ count × hash (32)              │
 * └──────────────┴──────────────────────────────────────────────┘
 *
 * Decoding is strict: the input must have exactly the encoded length.
 */
// @formatter:on
public final class BinaryCodec {
    public static final int U64_BYTES = Long.BYTES;
    public static final int HASH_PAIR_BYTES = 2 * Hash.LENGTH;

    private BinaryCodec() {
    }

    public static byte[] encodeU64(long value) {
        return ByteBuffer.allocate(U64_BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(value)
                .array();
    }

    public static long decodeU64(byte[] content) throws SerializationException {
        requireLength(content, U64_BYTES, "u64");
        return ByteBuffer.wrap(content).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }

    public static byte[] encodeHashPair(Hash first, Hash second) {
        return ByteBuffer.allocate(HASH_PAIR_BYTES)
                .put(first.toBytes())
                .put(second.toBytes())
                .array();
    }

    /**
     * @return the two hashes, in encoding order
     */
    public static Hash[] decodeHashPair(byte[] content) throws SerializationException {
        requireLength(content, HASH_PAIR_BYTES, "hash pair");
        ByteBuffer buffer = ByteBuffer.wrap(content);
        return new Hash[] { readHash(buffer), readHash(buffer) };
    }

    public static byte[] encodeHashList(List<Hash> hashes) {
        ByteBuffer buffer = ByteBuffer.allocate(U64_BYTES + hashes.size() * Hash.LENGTH)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.putLong(hashes.size());
        for (Hash hash : hashes) {
            buffer.put(hash.toBytes());
        }
        return buffer.array();
    }

    public static List<Hash> decodeHashList(byte[] content) throws SerializationException {
        if (content.length < U64_BYTES) {
            throw new SerializationException("Truncated hash list: " + content.length + " bytes");
        }

        ByteBuffer buffer = ByteBuffer.wrap(content).order(ByteOrder.LITTLE_ENDIAN);
        long count = buffer.getLong();
        long available = (content.length - U64_BYTES) / Hash.LENGTH;
        if (count < 0 || count != available || (content.length - U64_BYTES) % Hash.LENGTH != 0) {
            throw new SerializationException("Hash list declares " + Long.toUnsignedString(count)
                    + " entries but holds " + (content.length - U64_BYTES) + " bytes");
        }

        List<Hash> hashes = new ArrayList<>((int) count);
        try {
            for (long i = 0; i < count; i++) {
                hashes.add(readHash(buffer));
            }
        } catch (BufferUnderflowException e) {
            throw new SerializationException("Truncated hash list", e);
        }
        return Collections.unmodifiableList(hashes);
    }

    private static Hash readHash(ByteBuffer buffer) {
        byte[] digest = new byte[Hash.LENGTH];
        buffer.get(digest);
        return Hash.fromBytes(digest);
    }

    private static void requireLength(byte[] content, int expected, String what) throws SerializationException {
        if (content.length != expected) {
            throw new SerializationException(
                    "Invalid " + what + " encoding: expected " + expected + " bytes, got " + content.length);
        }
    }
}
