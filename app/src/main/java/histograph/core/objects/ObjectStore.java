package histograph.core.objects;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import histograph.core.hash.Hash;

/**
 * Asynchronous access to stored objects. Every call names the base directory
 * of the store; implementations keep no state about it between calls.
 *
 * Returned futures fail with a {@link histograph.exceptions.StoreException}:
 * {@link histograph.exceptions.ObjectNotFoundException} for a missing object,
 * {@link histograph.exceptions.SerializationException} for undecodable or
 * corrupt content, {@link histograph.exceptions.StorageIOException} for other
 * file system failures.
 */
public interface ObjectStore {
    /**
     * Create the subdirectory for objects of {@code type}, if missing.
     */
    CompletableFuture<Void> createDirectory(Path basePath, ObjectType type);

    /**
     * Write one hash-addressed object. The directory of its kind must exist.
     * Writing an object that is already stored rewrites identical bytes.
     *
     * @return the hash of the stored object
     */
    <T> CompletableFuture<Hash> writeObject(Path basePath, ObjectCodec<T> codec, T object);

    /**
     * Create the directory of the kind, then write all objects concurrently.
     * Fails with the first failing write; writes already done stay on disk.
     *
     * @return the hashes of the objects, in iteration order of {@code objects}
     */
    <T> CompletableFuture<HashVec<T>> writeAll(Path basePath, ObjectCodec<T> codec, Collection<? extends T> objects);

    /**
     * Read and decode one hash-addressed object.
     */
    <T> CompletableFuture<T> readObject(Path basePath, ObjectCodec<T> codec, Hash hash);

    /**
     * Read all objects concurrently. Fails with the first failing read.
     *
     * @return the objects, in the order of {@code hashes}
     */
    <T> CompletableFuture<List<T>> readAll(Path basePath, ObjectCodec<T> codec, List<Hash> hashes);

    /**
     * Write an object under {@code name}, replacing what was stored there.
     * The directory of its kind must exist.
     */
    <T> CompletableFuture<Void> writeNamedObject(Path basePath, NamedObjectCodec<T> codec, String name, T object);

    /**
     * Read and decode the object stored under {@code name}.
     */
    <T> CompletableFuture<T> readNamedObject(Path basePath, NamedObjectCodec<T> codec, String name);
}
