package rs.lukaj.httptransport.connections;

/**
 * Thrown if configuration parameters are invalid (e.g. a negative timeout, or zero max header size)
 */
public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super(message);
    }
}
