package rs.lukaj.httptransport.connections;

/**
 * Wrapper class for HTTP properties.
 */
public class Http {

    /**
     * Denotes a well-known request method (i.e. "http verb"). Requests carry their method as a plain string, so
     * any token can be sent; this enum only records how the transport treats the ones it knows about.
     */
    public enum Verb {
        GET("GET", true, P.IDEMPOTENT | P.BODY_DESYNCS),
        HEAD("HEAD", true, P.IDEMPOTENT | P.BODY_DESYNCS | P.NO_RESPONSE_BODY),
        POST("POST", true, 0),
        PUT("PUT", true, 0),
        DELETE("DELETE", true, 0),
        OPTIONS("OPTIONS", true, 0),
        TRACE("TRACE", true, 0),
        PATCH("PATCH", true, 0),
        //tunnels take over the socket, which doesn't fit a keep-alive pipeline
        CONNECT("CONNECT", false, 0);

        private static class P { //hack around illegal forward reference
            //idempotent unless the caller says otherwise (PUT and DELETE deliberately aren't, callers opt in)
            private static final long IDEMPOTENT = 1;
            //some servers parse a body on these as a second request, desynchronizing the response stream
            private static final long BODY_DESYNCS = 1 << 1;
            private static final long NO_RESPONSE_BODY = 1 << 2;
        }

        private final String text;
        private final boolean supported;
        private final long properties;

        Verb(String text, boolean supported, long properties) {
            this.text = text;
            this.supported = supported;
            this.properties = properties;
        }

        /**
         * Look up a verb by its exact (case-sensitive) name, as methods are case-sensitive tokens.
         * @param method method as sent on the wire
         * @return matching verb, or null if the method isn't a well-known one
         */
        public static Verb of(String method) {
            if(method == null) return null;
            for(Verb verb : values()) {
                if(verb.text.equals(method)) return verb;
            }
            return null;
        }

        /**
         * Returns false for methods this transport refuses to send.
         * @return whether this method is supported
         */
        public boolean isSupported() {
            return supported;
        }

        /**
         * Whether requests with this method are considered idempotent when the caller doesn't say.
         * @return whether method is idempotent by default
         */
        public boolean isIdempotentByDefault() {
            return (properties & P.IDEMPOTENT) != 0;
        }

        /**
         * Whether sending a body with this method means the connection shouldn't be reused afterwards.
         * @return whether body on this method resets the connection
         */
        public boolean bodyResetsConnection() {
            return (properties & P.BODY_DESYNCS) != 0;
        }

        /**
         * Whether a response to this method never has a body, regardless of its headers.
         * @return true if response has no body
         */
        public boolean responseHasNoBody() {
            return (properties & P.NO_RESPONSE_BODY) != 0;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * @param method request method
     * @return true if method is GET or HEAD
     */
    public static boolean isIdempotentByDefault(String method) {
        Verb verb = Verb.of(method);
        return verb != null && verb.isIdempotentByDefault();
    }

    /**
     * @param method request method
     * @return true if a body sent with this method means connection must not be reused
     */
    public static boolean bodyResetsConnection(String method) {
        Verb verb = Verb.of(method);
        return verb != null && verb.bodyResetsConnection();
    }

    /**
     * @param method request method
     * @return false only for methods known to be unsupported; unknown methods are let through
     */
    public static boolean isSupported(String method) {
        Verb verb = Verb.of(method);
        return verb == null || verb.isSupported();
    }

    /**
     * @param method request method
     * @return true if response to this method can't carry a body (HEAD)
     */
    public static boolean responseHasNoBody(String method) {
        Verb verb = Verb.of(method);
        return verb != null && verb.responseHasNoBody();
    }

    /**
     * HTTP versions this client recognizes in responses. Requests are always sent as HTTP/1.1.
     */
    public enum Version {
        HTTP10("HTTP/1.0", false),
        HTTP11("HTTP/1.1", true);
        //HTTP/2 frames aren't text, so a response claiming it over this transport is garbage anyway

        private final String text;
        private final boolean supported;

        Version(String text, boolean supported) {
            this.text = text;
            this.supported = supported;
        }

        public static Version of(String text) {
            for(Version version : values()) {
                if(version.text.equals(text)) return version;
            }
            return null;
        }

        public boolean isSupported() {
            return supported;
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
