package histograph.core.objects;

/**
 * Codec of a kind that is stored under a caller-chosen name rather than under
 * its hash.
 */
public interface NamedObjectCodec<T> extends ObjectCodec<T> {
}
