package histograph.core.objects;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ObjectTypeTest {

    @Test
    void storage_names_are_distinct() {
        Set<String> names = Arrays.stream(ObjectType.values())
                .map(ObjectType::getStorageName)
                .collect(Collectors.toSet());

        assertEquals(new HashSet<>(Arrays.asList("vertex", "edge", "vertexvec", "edgevec", "graph")), names);
    }

    @Test
    void only_the_graph_root_is_named() {
        for (ObjectType type : ObjectType.values()) {
            assertEquals(type == ObjectType.GRAPH, type.isNamed(), type.name());
        }
    }

    @Test
    void codecs_report_their_kind() {
        assertEquals(ObjectType.VERTEX, ObjectCodecs.VERTEX.getType());
        assertEquals(ObjectType.EDGE, ObjectCodecs.EDGE.getType());
        assertEquals(ObjectType.VERTEX_VEC, ObjectCodecs.VERTEX_VEC.getType());
        assertEquals(ObjectType.EDGE_VEC, ObjectCodecs.EDGE_VEC.getType());
        assertEquals(ObjectType.GRAPH, ObjectCodecs.GRAPH.getType());
    }
}
