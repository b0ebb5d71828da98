package rs.lukaj.httptransport.client;

import rs.lukaj.httptransport.connections.ResponseHeaders;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Whole response, with body read into memory. Returned by {@link HttpClient#request}.
 */
public class HttpResponse {
    private final int statusCode;
    private final ResponseHeaders headers;
    private final List<String> trailers;
    private final byte[] body;
    private final Object opaque;

    public HttpResponse(int statusCode, ResponseHeaders headers, List<String> trailers, byte[] body, Object opaque) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.trailers = trailers == null ? Collections.emptyList() : Collections.unmodifiableList(trailers);
        this.body = body;
        this.opaque = opaque;
    }

    public int getStatusCode() {
        return statusCode;
    }
    public ResponseHeaders getHeaders() {
        return headers;
    }

    /**
     * @return alternating trailer names and values, empty if there were none
     */
    public List<String> getTrailers() {
        return trailers;
    }

    /**
     * @return body bytes, empty array if there's no body
     */
    public byte[] getBody() {
        return body;
    }

    /**
     * Decode body using charset from Content-Type header. If it isn't set, or isn't known, UTF-8 is used.
     * @return body as string
     */
    public String getBodyString() {
        Charset charset = UTF_8;
        String name = headers.getCharset();
        if(name != null) {
            try {
                charset = Charset.forName(name);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                System.err.println("Warning: unknown charset " + name + ", decoding body as UTF-8");
            }
        }
        return new String(body, charset);
    }

    /**
     * @return opaque token given with the request
     */
    public Object getOpaque() {
        return opaque;
    }

    /**
     * @return true if status code is 4xx or 5xx (or something unknown above it)
     */
    public boolean isError() {
        return statusCode >= 400;
    }
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    @Override
    public String toString() {
        return "HttpResponse(" + statusCode + ", " + body.length + " bytes)";
    }
}
