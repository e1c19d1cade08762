package win.ixuni.nimbus.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EtagUtilsTest {

    @Test
    void md5HexOfKnownInput() {
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", EtagUtils.md5Hex(new byte[0]));
        assertEquals("5eb63bbbe01eeed093cb22bb8f5acdc3",
                EtagUtils.md5Hex("hello world".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void quoteAndUnquote() {
        assertEquals("\"abc\"", EtagUtils.quote("abc"));
        assertEquals("\"abc\"", EtagUtils.quote("\"abc\""));
        assertEquals("abc", EtagUtils.unquote("\"abc\""));
        assertEquals("abc", EtagUtils.unquote("abc"));
        assertNull(EtagUtils.quote(null));
    }

    @Test
    @DisplayName("分片 ETag 为各分片二进制 MD5 拼接后的 MD5 加分片数")
    void multipartEtagDigestsBinaryPartDigests() {
        byte[] a = "part-one".getBytes(StandardCharsets.UTF_8);
        byte[] b = "part-two".getBytes(StandardCharsets.UTF_8);
        byte[] joined = new byte[32];
        System.arraycopy(EtagUtils.md5(a), 0, joined, 0, 16);
        System.arraycopy(EtagUtils.md5(b), 0, joined, 16, 16);

        String etag = EtagUtils.multipartEtag(List.of(EtagUtils.md5Hex(a), EtagUtils.quote(EtagUtils.md5Hex(b))));

        assertEquals(EtagUtils.md5Hex(joined) + "-2", etag);
    }

    @Test
    void contentMd5Matching() {
        byte[] data = "Test Object".getBytes(StandardCharsets.UTF_8);
        byte[] digest = EtagUtils.md5(data);

        assertTrue(EtagUtils.matchesContentMd5(EtagUtils.md5Base64(data), digest));
        assertTrue(EtagUtils.matchesContentMd5(null, digest));
        assertFalse(EtagUtils.matchesContentMd5(Base64.getEncoder().encodeToString(new byte[16]), digest));
        assertFalse(EtagUtils.matchesContentMd5("not base64!", digest));
    }

    @Test
    void concatLeavesBufferPositionsUntouched() {
        ByteBuffer first = ByteBuffer.wrap("ab".getBytes(StandardCharsets.UTF_8));
        ByteBuffer second = ByteBuffer.wrap("cd".getBytes(StandardCharsets.UTF_8));

        assertEquals("abcd", new String(EtagUtils.concat(List.of(first, second)), StandardCharsets.UTF_8));
        assertEquals(0, first.position());
    }
}
