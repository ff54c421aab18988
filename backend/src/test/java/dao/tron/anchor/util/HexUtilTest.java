package dao.tron.anchor.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HexUtilTest {

    private static final String DIGEST = "ab".repeat(32);

    @Test
    @DisplayName("Digest parsing accepts 0x prefix and uppercase hex")
    void acceptsPrefixedAndUppercaseInput() {
        assertArrayEquals(HexUtil.digestBytes(DIGEST), HexUtil.digestBytes("0x" + DIGEST.toUpperCase()));
    }

    @Test
    @DisplayName("Hex output is lowercase without prefix")
    void writesLowercaseWithoutPrefix() {
        assertEquals(DIGEST, HexUtil.digestHex(HexUtil.digestBytes("0X" + DIGEST.toUpperCase())));
    }

    @Test
    @DisplayName("Non-hex input and wrong lengths are rejected")
    void rejectsNonHexAndWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> HexUtil.fromHex("xyz"));
        assertThrows(IllegalArgumentException.class, () -> HexUtil.digestBytes("abcd"));
        assertThrows(IllegalArgumentException.class, () -> HexUtil.digestHex(new byte[33]));
        assertThrows(IllegalArgumentException.class, () -> HexUtil.digestHex(null));
    }
}
