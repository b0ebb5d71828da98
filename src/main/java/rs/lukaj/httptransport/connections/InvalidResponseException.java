package rs.lukaj.httptransport.connections;

/**
 * Thrown when response is unexpected (e.g. it isn't valid HTTP/1.x, or arrives when no request is in flight)
 */
public class InvalidResponseException extends RuntimeException {
    public InvalidResponseException(String message) {
        super(message);
    }
    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
