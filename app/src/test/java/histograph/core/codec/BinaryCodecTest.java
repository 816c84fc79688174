package histograph.core.codec;

import histograph.core.hash.Hash;
import histograph.exceptions.SerializationException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BinaryCodecTest {

    @Test
    void u64_is_eight_bytes_little_endian() throws Exception {
        byte[] bytes = BinaryCodec.encodeU64(0x0102L);

        assertArrayEquals(new byte[] { 0x02, 0x01, 0, 0, 0, 0, 0, 0 }, bytes);
        assertEquals(0x0102L, BinaryCodec.decodeU64(bytes));
        assertEquals(-1L, BinaryCodec.decodeU64(BinaryCodec.encodeU64(-1L)));
    }

    @Test
    void u64_rejects_wrong_length() {
        assertThrows(SerializationException.class, () -> BinaryCodec.decodeU64(new byte[7]));
        assertThrows(SerializationException.class, () -> BinaryCodec.decodeU64(new byte[9]));
    }

    @Test
    void hash_pair_is_the_two_raw_digests() throws Exception {
        Hash a = Hash.of(new byte[] { 1 });
        Hash b = Hash.of(new byte[] { 2 });

        byte[] bytes = BinaryCodec.encodeHashPair(a, b);

        assertEquals(64, bytes.length);
        assertArrayEquals(a.toBytes(), Arrays.copyOfRange(bytes, 0, 32));
        assertArrayEquals(b.toBytes(), Arrays.copyOfRange(bytes, 32, 64));

        Hash[] pair = BinaryCodec.decodeHashPair(bytes);
        assertEquals(a, pair[0]);
        assertEquals(b, pair[1]);
    }

    @Test
    void hash_list_has_count_prefix() {
        List<Hash> hashes = List.of(Hash.of(new byte[] { 1 }), Hash.of(new byte[] { 2 }), Hash.of(new byte[] { 3 }));

        byte[] bytes = BinaryCodec.encodeHashList(hashes);

        assertEquals(8 + 3 * 32, bytes.length);
        assertEquals(3L, ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getLong());
        assertArrayEquals(hashes.get(2).toBytes(), Arrays.copyOfRange(bytes, 8 + 64, 8 + 96));
    }

    @Test
    void empty_hash_list_is_just_the_count() throws Exception {
        byte[] bytes = BinaryCodec.encodeHashList(List.of());

        assertArrayEquals(new byte[8], bytes);
        assertTrue(BinaryCodec.decodeHashList(bytes).isEmpty());
    }

    @Test
    void hash_list_rejects_truncated_or_inconsistent_input() {
        byte[] valid = BinaryCodec.encodeHashList(List.of(Hash.of(new byte[] { 1 }), Hash.of(new byte[] { 2 })));

        assertThrows(SerializationException.class, () -> BinaryCodec.decodeHashList(new byte[5]));
        assertThrows(SerializationException.class,
                () -> BinaryCodec.decodeHashList(Arrays.copyOf(valid, valid.length - 1)));
        assertThrows(SerializationException.class,
                () -> BinaryCodec.decodeHashList(Arrays.copyOf(valid, valid.length + 32)));

        byte[] hugeCount = valid.clone();
        hugeCount[7] = (byte) 0x80;
        assertThrows(SerializationException.class, () -> BinaryCodec.decodeHashList(hugeCount));
    }
}
