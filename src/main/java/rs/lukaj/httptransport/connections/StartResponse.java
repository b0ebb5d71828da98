package rs.lukaj.httptransport.connections;

/**
 * Passed to the request callback once response headers arrive: status code, headers, the opaque token given
 * with the request and the backpressure hook.
 */
public class StartResponse {
    private final int statusCode;
    private final ResponseHeaders headers;
    private final Object opaque;
    private final Runnable resume;

    public StartResponse(int statusCode, ResponseHeaders headers, Object opaque, Runnable resume) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.opaque = opaque;
        this.resume = resume;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ResponseHeaders getHeaders() {
        return headers;
    }

    /**
     * @return whatever was passed as opaque with the request, untouched
     */
    public Object getOpaque() {
        return opaque;
    }

    /**
     * Hook the caller can run to signal it's ready for more data. The connection never pauses reading, so the
     * hook it hands out does nothing.
     * @return resume hook, never null
     */
    public Runnable getResume() {
        return resume;
    }

    /**
     * Shortcut for {@code getResume().run()}.
     */
    public void resume() {
        resume.run();
    }
}
