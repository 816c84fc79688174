package histograph.core.objects;

import java.nio.file.Path;

import histograph.core.hash.Hash;
import histograph.exceptions.SerializationException;

/**
 * Holds the data needed to store or load one object: its exact bytes, the
 * hash of those bytes, and the codec of its kind. Only the content reaches
 * the disk.
 *
 * Directory Structure:
 * ┌─ <base>/
 * │ ├─ vertex/<hex-hash>      ← encoded vertex id
 * │ ├─ edge/<hex-hash>        ← encoded pair of endpoint hashes
 * │ ├─ vertexvec/<hex-hash>   ← encoded list of vertex hashes
 * │ ├─ edgevec/<hex-hash>     ← encoded list of edge hashes
 * │ └─ graph/<name>           ← encoded pair of list hashes
 */
public final class ObjectFile<T> {
    private final ObjectCodec<T> codec;
    private final byte[] content;
    private final Hash hash;

    private ObjectFile(ObjectCodec<T> codec, byte[] content, Hash hash) {
        this.codec = codec;
        this.content = content;
        this.hash = hash;
    }

    /**
     * Serializes {@code value} and hashes the result.
     */
    public static <T> ObjectFile<T> of(ObjectCodec<T> codec, T value) throws SerializationException {
        byte[] content = codec.encode(value);
        return new ObjectFile<>(codec, content, Hash.of(content));
    }

    /**
     * Wraps content read from a hash-addressed file. The hash is the one the
     * file is named after; {@link #verify()} checks it against the content.
     */
    public static <T> ObjectFile<T> fromContent(ObjectCodec<T> codec, byte[] content, Hash hash) {
        return new ObjectFile<>(codec, content, hash);
    }

    /**
     * Wraps content read from a named file, whose name says nothing about its
     * hash.
     */
    public static <T> ObjectFile<T> fromNamedContent(NamedObjectCodec<T> codec, byte[] content) {
        return new ObjectFile<>(codec, content, Hash.of(content));
    }

    public byte[] getContent() {
        return content.clone();
    }

    public Hash getHash() {
        return hash;
    }

    public ObjectType getType() {
        return codec.getType();
    }

    public T decode() throws SerializationException {
        return codec.decode(content);
    }

    /**
     * Checks that the content still hashes to the hash this file is known by.
     */
    public void verify() throws SerializationException {
        Hash actual = Hash.of(content);
        if (!actual.equals(hash)) {
            throw new SerializationException("Corrupt " + getType().getStorageName() + " object " + hash
                    + ": content hashes to " + actual);
        }
    }

    /**
     * Path of this file in the hash-addressed layout under {@code basePath}.
     */
    public Path resolvePath(Path basePath) {
        return resolvePath(basePath, getType(), hash);
    }

    /**
     * Directory holding the objects of {@code type} under {@code basePath}.
     */
    public static Path resolveDirectory(Path basePath, ObjectType type) {
        return basePath.resolve(type.getStorageName());
    }

    public static Path resolvePath(Path basePath, ObjectType type, Hash hash) {
        if (type.isNamed()) {
            throw new IllegalArgumentException(type.getStorageName() + " objects are stored by name, not by hash");
        }
        return resolveDirectory(basePath, type).resolve(hash.toHex());
    }

    public static Path resolveNamedPath(Path basePath, ObjectType type, String name) {
        if (!type.isNamed()) {
            throw new IllegalArgumentException(type.getStorageName() + " objects are stored by hash, not by name");
        }
        return resolveDirectory(basePath, type).resolve(validateName(name));
    }

    /**
     * A name must be a single, non-empty path segment.
     */
    public static String validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Snapshot name must not be empty");
        }
        if (name.equals(".") || name.equals("..") || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0
                || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid snapshot name: '" + name + "'");
        }
        return name;
    }
}
