package dao.tron.anchor.util;

import org.tron.trident.utils.Numeric;

import java.util.regex.Pattern;

/**
 * Hex conversions for digests and roots.
 *
 * Stored and logged values are lowercase hex without a 0x prefix; input accepts either.
 */
public final class HexUtil {
    private HexUtil() {}

    public static final int DIGEST_LENGTH = 32;

    private static final Pattern HEX = Pattern.compile("^(0[xX])?[0-9a-fA-F]*$");

    public static String toHex(byte[] bytes) {
        return Numeric.toHexStringNoPrefix(bytes);
    }

    public static byte[] fromHex(String value) {
        if (value == null || !HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a hex string: " + value);
        }
        return Numeric.hexStringToByteArray(value);
    }

    /**
     * Hex of a 32-byte digest; rejects anything of another length.
     */
    public static String digestHex(byte[] digest) {
        if (digest == null || digest.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException("Digest must be " + DIGEST_LENGTH + " bytes, got "
                    + (digest == null ? "null" : digest.length));
        }
        return toHex(digest);
    }

    public static byte[] digestBytes(String hex) {
        byte[] bytes = fromHex(hex);
        if (bytes.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException("Digest must be " + DIGEST_LENGTH + " bytes: " + hex);
        }
        return bytes;
    }
}
