package histograph.core.objects;

import java.util.List;

import histograph.core.hash.Hash;

/**
 * Ordered list of the hashes of stored objects of kind {@code T}. The order is
 * the order in which the objects were written.
 */
public final class HashVec<T> {
    private final List<Hash> hashes;

    public HashVec(List<Hash> hashes) {
        this.hashes = List.copyOf(hashes);
    }

    public List<Hash> getHashes() {
        return hashes;
    }

    public int size() {
        return hashes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return hashes.equals(((HashVec<?>) o).hashes);
    }

    @Override
    public int hashCode() {
        return hashes.hashCode();
    }

    @Override
    public String toString() {
        return "HashVec" + hashes;
    }
}
