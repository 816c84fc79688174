package histograph.core.objects;

/**
 * Enum representing the kinds of stored objects. Each kind lives in its own
 * subdirectory of the store.
 *
 * All kinds except {@link #GRAPH} are hash-addressed: their files are named by
 * the hex form of their content hash. {@link #GRAPH} is the only named kind;
 * its files are named by a caller-chosen snapshot name and are never
 * hash-addressed, so the two naming schemes cannot collide.
 */
public enum ObjectType {
    VERTEX("vertex", false),
    EDGE("edge", false),
    VERTEX_VEC("vertexvec", false),
    EDGE_VEC("edgevec", false),
    GRAPH("graph", true);

    private final String storageName;
    private final boolean named;

    ObjectType(String storageName, boolean named) {
        this.storageName = storageName;
        this.named = named;
    }

    /**
     * Name of the subdirectory holding objects of this kind.
     */
    public String getStorageName() {
        return storageName;
    }

    public boolean isNamed() {
        return named;
    }
}
