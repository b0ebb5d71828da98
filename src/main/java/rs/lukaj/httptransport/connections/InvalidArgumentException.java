package rs.lukaj.httptransport.connections;

/**
 * Thrown when a request descriptor is malformed (e.g. path not starting with '/', or a content-length which
 * isn't a number). Always thrown synchronously, before anything is queued or written.
 */
public class InvalidArgumentException extends RuntimeException {
    public InvalidArgumentException(String message) {
        super(message);
    }
    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
