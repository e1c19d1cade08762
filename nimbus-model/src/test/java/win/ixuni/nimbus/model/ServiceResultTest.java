package win.ixuni.nimbus.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServiceResultTest {

    @Test
    void headersAreCaseInsensitive() {
        ServiceResult<String> result = new ServiceResult<>("{}", Map.of("x-amzn-RequestId", "abc"), 200);

        assertEquals("abc", result.getHeader("X-AMZN-REQUESTID"));
        assertEquals(200, result.getStatusCode());
        assertThrows(UnsupportedOperationException.class, () -> result.getHeaders().put("a", "b"));
    }

    @Test
    void ofUsesOkStatusAndNoHeaders() {
        ServiceResult<String> result = ServiceResult.of("payload");

        assertEquals("payload", result.getPayload());
        assertTrue(result.getHeaders().isEmpty());
        assertEquals(200, result.getStatusCode());
    }
}
