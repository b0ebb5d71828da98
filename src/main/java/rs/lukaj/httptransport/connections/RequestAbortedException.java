package rs.lukaj.httptransport.connections;

/**
 * Delivered to the request callback (or delivery sink) when the request's {@link Abortable} fires.
 */
public class RequestAbortedException extends RuntimeException {
    public RequestAbortedException() {
        super("Request aborted");
    }
    public RequestAbortedException(String message) {
        super(message);
    }
}
