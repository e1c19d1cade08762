package win.ixuni.nimbus.client.util;

import win.ixuni.nimbus.core.util.EtagUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * MD5 / hex / base64 helpers for Content-MD5 headers and ETag checks
 */
public final class HashingUtils {

    private static final HexFormat HEX = HexFormat.of();

    private HashingUtils() {
    }

    public static byte[] calculateMd5(byte[] data) {
        return EtagUtils.md5(data);
    }

    /**
     * Digest a stream to its end; the stream is not closed
     */
    public static byte[] calculateMd5(InputStream in) {
        MessageDigest digest = EtagUtils.newMd5();
        byte[] buffer = new byte[8192];
        try {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stream for MD5", e);
        }
        return digest.digest();
    }

    public static String hexEncode(byte[] data) {
        return HEX.formatHex(data);
    }

    public static byte[] hexDecode(String hex) {
        return HEX.parseHex(hex);
    }

    public static String base64Encode(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    public static byte[] base64Decode(String value) {
        return Base64.getDecoder().decode(value);
    }

    /**
     * @return base64 MD5 suitable for the Content-MD5 header
     */
    public static String contentMd5(byte[] data) {
        return base64Encode(calculateMd5(data));
    }

    /**
     * @return the ETag a service reports for these bytes, quoted
     */
    public static String quotedEtag(byte[] data) {
        return EtagUtils.quote(hexEncode(calculateMd5(data)));
    }
}
