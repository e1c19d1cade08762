package win.ixuni.nimbus.client;

import win.ixuni.nimbus.client.error.StorageError;
import win.ixuni.nimbus.client.error.StorageErrorException;

import java.util.function.Function;

/**
 * Result of a client call: either a result or a {@link StorageError}
 * <p>
 * A successful outcome of an operation without a response document holds a null result.
 *
 * @param <R> result type
 */
public final class Outcome<R> {

    private final R result;
    private final StorageError error;

    private Outcome(R result, StorageError error) {
        this.result = result;
        this.error = error;
    }

    public static <R> Outcome<R> success(R result) {
        return new Outcome<>(result, null);
    }

    public static <R> Outcome<R> failure(StorageError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new Outcome<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException when the call failed
     */
    public R getResult() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure: " + error.getExceptionName() + " - " + error.getMessage());
        }
        return result;
    }

    /**
     * @throws IllegalStateException when the call succeeded
     */
    public StorageError getError() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return error;
    }

    public <T> Outcome<T> map(Function<? super R, ? extends T> mapper) {
        if (error != null) {
            return new Outcome<>(null, error);
        }
        return new Outcome<>(mapper.apply(result), null);
    }

    /**
     * @return the result
     * @throws StorageErrorException when the call failed
     */
    public R orElseThrow() {
        if (error != null) {
            throw new StorageErrorException(error);
        }
        return result;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome[success: " + result + "]" : "Outcome[failure: " + error + "]";
    }
}
