package histograph.core.objects.impl;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import histograph.core.hash.Hash;
import histograph.core.objects.HashVec;
import histograph.core.objects.NamedObjectCodec;
import histograph.core.objects.ObjectCodec;
import histograph.core.objects.ObjectFile;
import histograph.core.objects.ObjectStore;
import histograph.core.objects.ObjectType;
import histograph.exceptions.ObjectNotFoundException;
import histograph.exceptions.StorageIOException;
import histograph.exceptions.StoreException;
import histograph.utils.concurrent.Futures;
import histograph.utils.io.FileUtils;

/**
 * File-based implementation of the object store, with one file per object.
 *
 * Each object is:
 * 1. Serialized by the codec of its kind
 * 2. Hashed with SHA-256
 * 3. Stored in the subdirectory of its kind, in a file named by its hash
 *    (or, for the named kind, by a caller-chosen name)
 *
 * Reads and writes run as tasks on the given executor. Each task touches a
 * single path, so tasks need no locking among themselves.
 */
public class FileObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(FileObjectStore.class);

    private final Executor executor;
    private final boolean verifyHashes;

    public FileObjectStore(Executor executor) {
        this(executor, true);
    }

    /**
     * @param verifyHashes whether hash-addressed reads check the content
     *                     against the hash in the file name
     */
    public FileObjectStore(Executor executor, boolean verifyHashes) {
        this.executor = executor;
        this.verifyHashes = verifyHashes;
    }

    @Override
    public CompletableFuture<Void> createDirectory(Path basePath, ObjectType type) {
        Path directory = ObjectFile.resolveDirectory(basePath, type);
        return submit(() -> {
            FileUtils.createDirectories(directory);
            return null;
        }, "create directory " + directory);
    }

    @Override
    public <T> CompletableFuture<Hash> writeObject(Path basePath, ObjectCodec<T> codec, T object) {
        requireHashAddressed(codec.getType());
        return submit(() -> {
            ObjectFile<T> file = ObjectFile.of(codec, object);
            FileUtils.writeFile(file.resolvePath(basePath), file.getContent());
            log.debug("Wrote {} object {}", file.getType().getStorageName(), file.getHash());
            return file.getHash();
        }, "write " + codec.getType().getStorageName() + " object");
    }

    @Override
    public <T> CompletableFuture<HashVec<T>> writeAll(Path basePath, ObjectCodec<T> codec,
            Collection<? extends T> objects) {
        requireHashAddressed(codec.getType());
        List<T> snapshot = new ArrayList<>(objects);

        return createDirectory(basePath, codec.getType())
                .thenCompose(ignored -> {
                    List<CompletableFuture<Hash>> writes = new ArrayList<>(snapshot.size());
                    for (T object : snapshot) {
                        writes.add(writeObject(basePath, codec, object));
                    }
                    return Futures.allAsList(writes);
                })
                .thenApply(hashes -> new HashVec<T>(hashes));
    }

    @Override
    public <T> CompletableFuture<T> readObject(Path basePath, ObjectCodec<T> codec, Hash hash) {
        Path path = ObjectFile.resolvePath(basePath, codec.getType(), hash);
        return submit(() -> {
            ObjectFile<T> file = ObjectFile.fromContent(codec, readExisting(path, codec.getType()), hash);
            if (verifyHashes) {
                file.verify();
            }
            log.debug("Read {} object {}", file.getType().getStorageName(), hash);
            return file.decode();
        }, "read " + codec.getType().getStorageName() + " object " + hash);
    }

    @Override
    public <T> CompletableFuture<List<T>> readAll(Path basePath, ObjectCodec<T> codec, List<Hash> hashes) {
        List<CompletableFuture<T>> reads = new ArrayList<>(hashes.size());
        for (Hash hash : hashes) {
            reads.add(readObject(basePath, codec, hash));
        }
        return Futures.allAsList(reads);
    }

    @Override
    public <T> CompletableFuture<Void> writeNamedObject(Path basePath, NamedObjectCodec<T> codec, String name,
            T object) {
        Path path = ObjectFile.resolveNamedPath(basePath, codec.getType(), name);
        return submit(() -> {
            ObjectFile<T> file = ObjectFile.of(codec, object);
            FileUtils.writeFile(path, file.getContent());
            log.debug("Wrote {} object '{}' ({})", file.getType().getStorageName(), name, file.getHash());
            return null;
        }, "write " + codec.getType().getStorageName() + " '" + name + "'");
    }

    @Override
    public <T> CompletableFuture<T> readNamedObject(Path basePath, NamedObjectCodec<T> codec, String name) {
        Path path = ObjectFile.resolveNamedPath(basePath, codec.getType(), name);
        return submit(() -> {
            ObjectFile<T> file = ObjectFile.fromNamedContent(codec, readExisting(path, codec.getType()));
            log.debug("Read {} object '{}' ({})", file.getType().getStorageName(), name, file.getHash());
            return file.decode();
        }, "read " + codec.getType().getStorageName() + " '" + name + "'");
    }

    private static byte[] readExisting(Path path, ObjectType type) throws IOException, ObjectNotFoundException {
        try {
            return FileUtils.readFile(path);
        } catch (NoSuchFileException e) {
            throw new ObjectNotFoundException(
                    "No " + type.getStorageName() + " object at " + path, path, e);
        }
    }

    private static void requireHashAddressed(ObjectType type) {
        if (type.isNamed()) {
            throw new IllegalArgumentException(type.getStorageName() + " objects are stored by name, not by hash");
        }
    }

    /**
     * Runs {@code task} on the executor. Checked failures complete the future
     * exceptionally, I/O failures as {@link StorageIOException}.
     */
    private <R> CompletableFuture<R> submit(IoTask<R> task, String description) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.run();
            } catch (StoreException e) {
                throw new CompletionException(e);
            } catch (IOException e) {
                throw new CompletionException(new StorageIOException("Failed to " + description, e));
            }
        }, executor);
    }

    @FunctionalInterface
    private interface IoTask<R> {
        R run() throws StoreException, IOException;
    }
}
