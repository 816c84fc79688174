package histograph.core.objects.impl;

import histograph.core.hash.Hash;
import histograph.core.objects.GraphHash;
import histograph.core.objects.HashVec;
import histograph.core.objects.ObjectCodecs;
import histograph.core.objects.ObjectFile;
import histograph.core.objects.ObjectType;
import histograph.exceptions.ObjectNotFoundException;
import histograph.exceptions.SerializationException;
import histograph.exceptions.StorageIOException;
import histograph.graph.VertexId;
import histograph.utils.concurrent.Futures;
import histograph.utils.concurrent.IoExecutors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileObjectStoreTest {

    @TempDir Path base;

    private ExecutorService executor;
    private FileObjectStore store;

    @BeforeEach
    void setUp() {
        executor = IoExecutors.newIoExecutor(4);
        store = new FileObjectStore(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void write_then_read_vertex() throws Exception {
        Futures.await(store.createDirectory(base, ObjectType.VERTEX));

        Hash hash = Futures.await(store.writeObject(base, ObjectCodecs.VERTEX, VertexId.of(27)));

        assertEquals("4d159113222bfeb85fbe717cc2393ee8a6a85b7ce5ac1791c4eade5e3dd6de41", hash.toHex());
        assertTrue(Files.isRegularFile(base.resolve("vertex").resolve(hash.toHex())));
        assertEquals(VertexId.of(27), Futures.await(store.readObject(base, ObjectCodecs.VERTEX, hash)));
    }

    @Test
    void writing_the_same_vertex_twice_leaves_one_file() throws Exception {
        Futures.await(store.createDirectory(base, ObjectType.VERTEX));

        Hash first = Futures.await(store.writeObject(base, ObjectCodecs.VERTEX, VertexId.of(8)));
        Hash second = Futures.await(store.writeObject(base, ObjectCodecs.VERTEX, VertexId.of(8)));

        assertEquals(first, second);
        assertEquals(1, countFiles(base.resolve("vertex")));
        assertArrayEquals(ObjectFile.of(ObjectCodecs.VERTEX, VertexId.of(8)).getContent(),
                Files.readAllBytes(base.resolve("vertex").resolve(first.toHex())));
    }

    @Test
    void write_all_creates_the_directory_and_keeps_input_order() throws Exception {
        List<VertexId> vertices = List.of(VertexId.of(5), VertexId.of(1), VertexId.of(3));

        HashVec<VertexId> hashVec = Futures.await(store.writeAll(base, ObjectCodecs.VERTEX, vertices));

        assertEquals(List.of(
                ObjectCodecs.vertexHash(VertexId.of(5)),
                ObjectCodecs.vertexHash(VertexId.of(1)),
                ObjectCodecs.vertexHash(VertexId.of(3))), hashVec.getHashes());
        assertEquals(vertices, Futures.await(store.readAll(base, ObjectCodecs.VERTEX, hashVec.getHashes())));
    }

    @Test
    void write_all_of_nothing_gives_an_empty_hash_vec() throws Exception {
        HashVec<VertexId> hashVec = Futures.await(store.writeAll(base, ObjectCodecs.VERTEX, List.of()));

        assertEquals(0, hashVec.size());
        assertTrue(Files.isDirectory(base.resolve("vertex")));
    }

    @Test
    void reading_a_missing_object_fails_not_found() {
        Hash hash = ObjectCodecs.vertexHash(VertexId.of(99));

        ObjectNotFoundException e = assertThrows(ObjectNotFoundException.class,
                () -> Futures.await(store.readObject(base, ObjectCodecs.VERTEX, hash)));
        assertEquals(base.resolve("vertex").resolve(hash.toHex()), e.getPath());
    }

    @Test
    void reading_tampered_content_fails_verification() throws Exception {
        Futures.await(store.createDirectory(base, ObjectType.VERTEX));
        Hash hash = Futures.await(store.writeObject(base, ObjectCodecs.VERTEX, VertexId.of(1)));
        Files.write(base.resolve("vertex").resolve(hash.toHex()), ObjectCodecs.VERTEX.encode(VertexId.of(2)));

        assertThrows(SerializationException.class,
                () -> Futures.await(store.readObject(base, ObjectCodecs.VERTEX, hash)));

        FileObjectStore trusting = new FileObjectStore(executor, false);
        assertEquals(VertexId.of(2), Futures.await(trusting.readObject(base, ObjectCodecs.VERTEX, hash)));
    }

    @Test
    void reading_truncated_content_fails_to_deserialize() throws Exception {
        Futures.await(store.createDirectory(base, ObjectType.VERTEX));
        Hash hash = Futures.await(store.writeObject(base, ObjectCodecs.VERTEX, VertexId.of(1)));
        Files.write(base.resolve("vertex").resolve(hash.toHex()), new byte[] { 1, 0, 0 });

        FileObjectStore trusting = new FileObjectStore(executor, false);
        assertThrows(SerializationException.class,
                () -> Futures.await(trusting.readObject(base, ObjectCodecs.VERTEX, hash)));
    }

    @Test
    void read_all_fails_if_any_object_is_missing() throws Exception {
        HashVec<VertexId> stored = Futures.await(store.writeAll(base, ObjectCodecs.VERTEX,
                List.of(VertexId.of(1), VertexId.of(2))));
        Hash missing = ObjectCodecs.vertexHash(VertexId.of(3));

        assertThrows(ObjectNotFoundException.class, () -> Futures.await(store.readAll(base, ObjectCodecs.VERTEX,
                List.of(stored.getHashes().get(0), missing, stored.getHashes().get(1)))));
    }

    @Test
    void named_object_is_overwritten_by_the_last_write() throws Exception {
        GraphHash first = new GraphHash(Hash.of(new byte[] { 1 }), Hash.of(new byte[] { 2 }));
        GraphHash second = new GraphHash(Hash.of(new byte[] { 3 }), Hash.of(new byte[] { 4 }));
        Futures.await(store.createDirectory(base, ObjectType.GRAPH));

        Futures.await(store.writeNamedObject(base, ObjectCodecs.GRAPH, "current", first));
        assertEquals(first, Futures.await(store.readNamedObject(base, ObjectCodecs.GRAPH, "current")));

        Futures.await(store.writeNamedObject(base, ObjectCodecs.GRAPH, "current", second));
        assertEquals(second, Futures.await(store.readNamedObject(base, ObjectCodecs.GRAPH, "current")));
        assertEquals(1, countFiles(base.resolve("graph")));
    }

    @Test
    void reading_a_missing_name_fails_not_found() {
        assertThrows(ObjectNotFoundException.class,
                () -> Futures.await(store.readNamedObject(base, ObjectCodecs.GRAPH, "nope")));
    }

    @Test
    void writing_into_a_missing_directory_fails_with_an_io_error() {
        assertThrows(StorageIOException.class,
                () -> Futures.await(store.writeObject(base, ObjectCodecs.VERTEX, VertexId.of(1))));
    }

    @Test
    void the_named_kind_cannot_be_stored_by_hash() {
        GraphHash graphHash = new GraphHash(Hash.of(new byte[] { 1 }), Hash.of(new byte[] { 2 }));

        assertThrows(IllegalArgumentException.class,
                () -> store.writeObject(base, ObjectCodecs.GRAPH, graphHash));
        assertThrows(IllegalArgumentException.class,
                () -> store.readObject(base, ObjectCodecs.GRAPH, Hash.of(new byte[0])));
    }

    private static long countFiles(Path directory) throws Exception {
        try (Stream<Path> files = Files.list(directory)) {
            return files.count();
        }
    }
}
