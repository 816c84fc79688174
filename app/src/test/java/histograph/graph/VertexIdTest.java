package histograph.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VertexIdTest {

    @Test
    void parse_accepts_the_printed_form() {
        assertEquals(VertexId.of(0), VertexId.parse("0"));
        assertEquals(VertexId.of(-1L), VertexId.parse("18446744073709551615"));
        assertEquals("18446744073709551615", VertexId.parse("18446744073709551615").toString());
    }

    @Test
    void parse_rejects_signs_and_overflow() {
        assertThrows(NumberFormatException.class, () -> VertexId.parse("-1"));
        assertThrows(NumberFormatException.class, () -> VertexId.parse("+1"));
        assertThrows(NumberFormatException.class, () -> VertexId.parse("18446744073709551616"));
        assertThrows(NumberFormatException.class, () -> VertexId.parse(""));
    }

    @Test
    void ordering_is_unsigned() {
        assertTrue(VertexId.of(-1L).compareTo(VertexId.of(1)) > 0);
    }
}
