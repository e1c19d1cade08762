package win.ixuni.nimbus.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.nimbus.client.error.StorageError;
import win.ixuni.nimbus.client.error.StorageErrorException;
import win.ixuni.nimbus.client.error.StorageErrorType;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    private static final StorageError NO_SUCH_KEY =
            StorageError.fromResponse(404, "NoSuchKey", "The specified key does not exist.", "REQ1");

    @Test
    void successExposesResult() {
        Outcome<String> outcome = Outcome.success("etag");

        assertTrue(outcome.isSuccess());
        assertEquals("etag", outcome.getResult());
        assertEquals("etag", outcome.orElseThrow());
        assertThrows(IllegalStateException.class, outcome::getError);
    }

    @Test
    @DisplayName("失败结果访问 result 抛出 IllegalStateException")
    void failureExposesError() {
        Outcome<String> outcome = Outcome.failure(NO_SUCH_KEY);

        assertFalse(outcome.isSuccess());
        assertEquals(StorageErrorType.NO_SUCH_KEY, outcome.getError().getErrorType());
        assertThrows(IllegalStateException.class, outcome::getResult);
        StorageErrorException thrown = assertThrows(StorageErrorException.class, outcome::orElseThrow);
        assertSame(NO_SUCH_KEY, thrown.getError());
    }

    @Test
    void mapKeepsFailure() {
        assertEquals(4, Outcome.success("etag").map(String::length).getResult());

        Outcome<Integer> mapped = Outcome.<String>failure(NO_SUCH_KEY).map(String::length);
        assertSame(NO_SUCH_KEY, mapped.getError());
    }

    @Test
    void successMayHoldNoResult() {
        Outcome<Void> outcome = Outcome.success(null);

        assertTrue(outcome.isSuccess());
        assertNull(outcome.getResult());
    }

    @Test
    void failureRequiresError() {
        assertThrows(IllegalArgumentException.class, () -> Outcome.failure(null));
    }
}
