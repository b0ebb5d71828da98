package rs.lukaj.httptransport.connections;

import java.util.Collections;
import java.util.List;

/**
 * Something {@link ResponseParser} recognised in the response stream. For every message the parser emits one
 * {@link HeadersComplete} (more if informational responses precede the final one), zero or more
 * {@link BodyChunk}s and exactly one {@link MessageComplete}, in that order.
 */
public abstract class ParseEvent {

    public enum Type {
        HEADERS_COMPLETE,
        BODY_CHUNK,
        MESSAGE_COMPLETE
    }

    private ParseEvent() {
    }

    public abstract Type getType();

    /**
     * Status line and header section have been read.
     */
    public static final class HeadersComplete extends ParseEvent {
        private final int statusCode;
        private final String reasonPhrase;
        private final ResponseHeaders headers;
        private final boolean keepAlive;

        public HeadersComplete(int statusCode, String reasonPhrase, ResponseHeaders headers, boolean keepAlive) {
            this.statusCode = statusCode;
            this.reasonPhrase = reasonPhrase;
            this.headers = headers;
            this.keepAlive = keepAlive;
        }

        public int getStatusCode() {
            return statusCode;
        }
        public String getReasonPhrase() {
            return reasonPhrase;
        }
        public ResponseHeaders getHeaders() {
            return headers;
        }

        /**
         * @return false if the server asked for the connection to be closed after this message, or if the body
         * is delimited by closing the connection
         */
        public boolean isKeepAlive() {
            return keepAlive;
        }

        @Override
        public Type getType() {
            return Type.HEADERS_COMPLETE;
        }

        @Override
        public String toString() {
            return "HeadersComplete(" + statusCode + ")";
        }
    }

    /**
     * A piece of the response body, already stripped of chunked framing.
     */
    public static final class BodyChunk extends ParseEvent {
        private final byte[] data;

        public BodyChunk(byte[] data) {
            this.data = data;
        }

        public byte[] getData() {
            return data;
        }

        @Override
        public Type getType() {
            return Type.BODY_CHUNK;
        }

        @Override
        public String toString() {
            return "BodyChunk(" + data.length + " bytes)";
        }
    }

    /**
     * The message is over. Trailers are passed along untouched.
     */
    public static final class MessageComplete extends ParseEvent {
        private final List<String> trailers;

        public MessageComplete(List<String> trailers) {
            this.trailers = trailers == null ? Collections.emptyList() : Collections.unmodifiableList(trailers);
        }

        /**
         * @return alternating trailer names and values; empty unless the body was chunked and had trailers
         */
        public List<String> getTrailers() {
            return trailers;
        }

        @Override
        public Type getType() {
            return Type.MESSAGE_COMPLETE;
        }

        @Override
        public String toString() {
            return "MessageComplete";
        }
    }
}
