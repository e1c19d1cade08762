package win.ixuni.nimbus.client.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class S3PathsTest {

    @Test
    @DisplayName("按段编码 key，保留 / 分隔符")
    void encodesKeyPerSegment() {
        assertEquals("docs/my%20file.txt", S3Paths.encodeKey("docs/my file.txt"));
        assertEquals("a/b/c", S3Paths.encodeKey("a/b/c"));
        assertEquals("dir/", S3Paths.encodeKey("dir/"));
        assertEquals("100%25", S3Paths.encodeKey("100%"));
    }

    @Test
    void objectPathJoinsBucketAndKey() {
        assertEquals("/bucket/docs/test.txt", S3Paths.objectPath("bucket", "docs/test.txt"));
        assertEquals("/bucket", S3Paths.bucketPath("bucket"));
    }

    @Test
    void queryWritesBareNamesAndSkipsNulls() {
        Map<String, String> query = S3Paths.query();
        query.put("uploads", "");
        query.put("prefix", null);
        query.put("marker", "a&b");

        assertEquals("/b/k?uploads&marker=a%26b", S3Paths.withQuery("/b/k", query));
    }

    @Test
    @DisplayName("查询参数中的 + 编码为 %2B")
    void plusInQueryIsPercentEncoded() {
        Map<String, String> query = S3Paths.query();
        query.put("prefix", "a+b/");
        query.put("marker", "a+b/one two");

        assertEquals("/b?prefix=a%2Bb/&marker=a%2Bb/one%20two", S3Paths.withQuery("/b", query));
    }

    @Test
    void emptyQueryLeavesPathAlone() {
        assertEquals("/b", S3Paths.withQuery("/b", S3Paths.query()));
    }
}
