package rs.lukaj.httptransport.connections;

/**
 * Delivered to every request which was queued or in flight when the connection was closed or dropped.
 */
public class ConnectionClosedException extends RuntimeException {
    public ConnectionClosedException(String message) {
        super(message);
    }
    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
