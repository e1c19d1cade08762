package win.ixuni.nimbus.core.util;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

/**
 * ETag / MD5 工具类
 * <p>
 * ETags are kept as bare lowercase hex digests and quoted only on the wire.
 */
public final class EtagUtils {

    private static final HexFormat HEX = HexFormat.of();

    private EtagUtils() {
    }

    public static MessageDigest newMd5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }

    public static byte[] md5(byte[] data) {
        return newMd5().digest(data);
    }

    public static String md5Hex(byte[] data) {
        return HEX.formatHex(md5(data));
    }

    public static String md5Base64(byte[] data) {
        return Base64.getEncoder().encodeToString(md5(data));
    }

    /**
     * Multipart ETag: MD5 over the concatenated binary part digests, suffixed with the part count
     *
     * @param partEtags hex part ETags in completion order, quoted or bare
     * @return bare multipart ETag such as {@code 9b2cf535f27731c974343645a3985328-3}
     */
    public static String multipartEtag(List<String> partEtags) {
        MessageDigest digest = newMd5();
        for (String etag : partEtags) {
            digest.update(HEX.parseHex(unquote(etag)));
        }
        return HEX.formatHex(digest.digest()) + "-" + partEtags.size();
    }

    public static String quote(String etag) {
        if (etag == null) {
            return null;
        }
        return etag.startsWith("\"") ? etag : "\"" + etag + "\"";
    }

    public static String unquote(String etag) {
        if (etag == null) {
            return null;
        }
        String trimmed = etag.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Check a computed digest against a Content-MD5 header value
     *
     * @param contentMd5 base64 MD5 from the request, may be null
     * @param digest     digest of the received bytes
     * @return true when no Content-MD5 was sent or it matches
     */
    public static boolean matchesContentMd5(String contentMd5, byte[] digest) {
        if (contentMd5 == null || contentMd5.isBlank()) {
            return true;
        }
        try {
            return MessageDigest.isEqual(Base64.getDecoder().decode(contentMd5.trim()), digest);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Copy buffers into one array without disturbing their positions
     */
    public static byte[] concat(List<ByteBuffer> buffers) {
        int total = buffers.stream().mapToInt(ByteBuffer::remaining).sum();
        byte[] out = new byte[total];
        int offset = 0;
        for (ByteBuffer buffer : buffers) {
            int length = buffer.remaining();
            buffer.duplicate().get(out, offset, length);
            offset += length;
        }
        return out;
    }
}
