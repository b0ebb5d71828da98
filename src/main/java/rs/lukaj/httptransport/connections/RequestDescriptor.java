package rs.lukaj.httptransport.connections;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to make one request: what to send, how to cancel it and who to tell about the response.
 * Descriptors are immutable; build them using {@link #builder()}. Nothing is validated here; that happens when
 * the request is submitted (see {@link RequestState}), so that an invalid descriptor is rejected before it's
 * queued.
 */
public class RequestDescriptor {
    private final String path;
    private final String method;
    private final Map<String, String> headers;
    private final Object body;
    private final Boolean idempotent;
    private final Object opaque;
    private final String servername;
    private final Abortable signal;
    private final Long timeout;
    private final RequestContext context;
    private final RequestState.Callback callback;

    private RequestDescriptor(Builder builder) {
        this.path = builder.path;
        this.method = builder.method;
        this.headers = builder.headers == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.idempotent = builder.idempotent;
        this.opaque = builder.opaque;
        this.servername = builder.servername;
        this.signal = builder.signal;
        this.timeout = builder.timeout;
        this.context = builder.context;
        this.callback = builder.callback;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return builder initialized with values from this descriptor
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .path(path)
                .method(method)
                .body(body)
                .idempotent(idempotent)
                .opaque(opaque)
                .servername(servername)
                .signal(signal)
                .timeout(timeout)
                .context(context)
                .callback(callback);
        builder.headers = headers == null ? null : new Headers(headers);
        return builder;
    }

    public String getPath() {
        return path;
    }
    public String getMethod() {
        return method;
    }

    /**
     * @return headers in insertion order, or null if none were set
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return null, byte[], ByteBuffer, String or {@link StreamingBody}
     */
    public Object getBody() {
        return body;
    }
    public Boolean getIdempotent() {
        return idempotent;
    }
    public Object getOpaque() {
        return opaque;
    }
    public String getServername() {
        return servername;
    }
    public Abortable getSignal() {
        return signal;
    }

    /**
     * @return timeout in milliseconds, or null if request can wait forever
     */
    public Long getTimeout() {
        return timeout;
    }
    public RequestContext getContext() {
        return context;
    }
    public RequestState.Callback getCallback() {
        return callback;
    }

    /**
     * All methods return the builder, to allow chaining.
     */
    public static class Builder {
        private String path = "/";
        private String method = "GET";
        private Headers headers;
        private Object body;
        private Boolean idempotent;
        private Object opaque;
        private String servername;
        private Abortable signal;
        private Long timeout;
        private RequestContext context;
        private RequestState.Callback callback;

        private Builder() {
        }

        /**
         * @param path request target, must begin with '/'. Defaults to "/".
         */
        public Builder path(String path) {
            this.path = path;
            return this;
        }

        /**
         * @param method request method, sent as-is. Defaults to GET.
         */
        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder method(Http.Verb verb) {
            this.method = verb.toString();
            return this;
        }

        /**
         * Add a header. Setting a header with the same name (ignoring case) replaces the value, keeping the
         * header's position.
         */
        public Builder header(String name, String value) {
            if(headers == null) headers = new Headers();
            headers.setHeader(name, value);
            return this;
        }

        /**
         * Replace all headers. Insertion order of the given map is kept.
         */
        public Builder headers(Map<String, String> headers) {
            this.headers = headers == null ? null : new Headers(headers);
            return this;
        }

        /**
         * @param body byte[], ByteBuffer, String (sent as UTF-8), {@link StreamingBody} or null for no body
         */
        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        /**
         * @param idempotent overrides the default (true only for GET and HEAD); null restores the default
         */
        public Builder idempotent(Boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        /**
         * @param opaque anything; handed back untouched in {@link StartResponse#getOpaque()}
         */
        public Builder opaque(Object opaque) {
            this.opaque = opaque;
            return this;
        }

        /**
         * @param servername name used for certificate checks instead of Host header or connection hostname
         */
        public Builder servername(String servername) {
            this.servername = servername;
            return this;
        }

        public Builder signal(Abortable signal) {
            this.signal = signal;
            return this;
        }

        /**
         * @param timeout how long to wait for response headers, in milliseconds; 0 or null waits forever
         */
        public Builder timeout(Long timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeout(long timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * @param context tracing context; if null, the one current on the submitting thread is used (or a new one)
         */
        public Builder context(RequestContext context) {
            this.context = context;
            return this;
        }

        public Builder callback(RequestState.Callback callback) {
            this.callback = callback;
            return this;
        }

        public RequestDescriptor build() {
            return new RequestDescriptor(this);
        }
    }
}
