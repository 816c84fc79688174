package histograph.graph;

/**
 * Identity of a vertex: an unsigned 64-bit number chosen by the caller.
 */
public final class VertexId implements Comparable<VertexId> {
    private final long value;

    public VertexId(long value) {
        this.value = value;
    }

    public static VertexId of(long value) {
        return new VertexId(value);
    }

    /**
     * Parses the decimal form printed by {@link #toString()}, from 0 up to
     * 18446744073709551615.
     *
     * @throws NumberFormatException if the text is signed, out of range or not
     *                               a number
     */
    public static VertexId parse(String text) {
        if (text.startsWith("-") || text.startsWith("+")) {
            throw new NumberFormatException("Vertex id must be unsigned: '" + text + "'");
        }
        return new VertexId(Long.parseUnsignedLong(text));
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(VertexId other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return value == ((VertexId) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
