package win.ixuni.nimbus.client.util;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HashingUtilsTest {

    private static final byte[] TEST_OBJECT = "Test Object".getBytes(StandardCharsets.UTF_8);

    @Test
    void streamAndArrayDigestsAgree() {
        assertArrayEquals(HashingUtils.calculateMd5(TEST_OBJECT),
                HashingUtils.calculateMd5(new ByteArrayInputStream(TEST_OBJECT)));
    }

    @Test
    void hexAndBase64RoundTrip() {
        byte[] md5 = HashingUtils.calculateMd5(TEST_OBJECT);

        assertArrayEquals(md5, HashingUtils.hexDecode(HashingUtils.hexEncode(md5)));
        assertArrayEquals(md5, HashingUtils.base64Decode(HashingUtils.contentMd5(TEST_OBJECT)));
    }

    @Test
    void quotedEtagIsQuotedHexMd5() {
        assertEquals("\"" + HashingUtils.hexEncode(HashingUtils.calculateMd5(TEST_OBJECT)) + "\"",
                HashingUtils.quotedEtag(TEST_OBJECT));
        assertEquals("\"d41d8cd98f00b204e9800998ecf8427e\"", HashingUtils.quotedEtag(new byte[0]));
    }
}
