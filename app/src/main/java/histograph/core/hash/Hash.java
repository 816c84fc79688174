package histograph.core.hash;

import java.util.Arrays;

import histograph.utils.crypto.HashUtils;

/**
 * SHA-256 digest of a serialized object. Two hashes are equal when their bytes
 * are equal; the 64 character lowercase hex form is used as a file name.
 *
 * <pre>
 * Hash.of(new byte[] {27, 0, 0, 0, 0, 0, 0, 0}).toHex()
 *   = "4d159113222bfeb85fbe717cc2393ee8a6a85b7ce5ac1791c4eade5e3dd6de41"
 * </pre>
 */
public final class Hash {
    public static final int LENGTH = HashUtils.SHA256_LENGTH;
    public static final int HEX_LENGTH = LENGTH * 2;

    private final byte[] bytes;

    private Hash(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Hashes the exact given content.
     */
    public static Hash of(byte[] content) {
        return new Hash(HashUtils.sha256(content));
    }

    /**
     * Wraps an existing 32 byte digest.
     */
    public static Hash fromBytes(byte[] digest) {
        if (digest.length != LENGTH) {
            throw new IllegalArgumentException("A hash has " + LENGTH + " bytes, got " + digest.length);
        }
        return new Hash(digest.clone());
    }

    /**
     * Parses the 64 character lowercase hex form produced by {@link #toHex()}.
     */
    public static Hash fromHex(String hex) {
        if (hex.length() != HEX_LENGTH) {
            throw new IllegalArgumentException("A hash has " + HEX_LENGTH + " hex characters, got " + hex.length());
        }
        return new Hash(HashUtils.hexToBytes(hex));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HashUtils.bytesToHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Arrays.equals(bytes, ((Hash) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
