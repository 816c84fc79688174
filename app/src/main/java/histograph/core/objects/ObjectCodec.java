package histograph.core.objects;

import histograph.exceptions.SerializationException;

/**
 * Converts values of one stored kind to and from their exact on-disk bytes.
 *
 * Encoding must be deterministic: equal values always produce equal bytes,
 * and therefore the same hash.
 */
public interface ObjectCodec<T> {
    /**
     * The kind of object, which selects the storage subdirectory.
     */
    ObjectType getType();

    byte[] encode(T value) throws SerializationException;

    T decode(byte[] content) throws SerializationException;
}
