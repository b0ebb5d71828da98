package rs.lukaj.httptransport.connections;

/**
 * Delivered to the request callback when response headers aren't received in time.
 */
public class RequestTimeoutException extends RuntimeException {
    public RequestTimeoutException() {
        super("Request timed out");
    }
    public RequestTimeoutException(long timeoutMillis) {
        super("Request timed out after " + timeoutMillis + "ms");
    }
}
