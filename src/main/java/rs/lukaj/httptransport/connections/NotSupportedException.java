package rs.lukaj.httptransport.connections;

/**
 * Thrown when a request asks for something this transport deliberately doesn't do (CONNECT method, pipelining).
 */
public class NotSupportedException extends RuntimeException {
    public NotSupportedException(String message) {
        super(message);
    }
}
