package rs.lukaj.httptransport.client;

import rs.lukaj.httptransport.connections.*;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.net.MalformedURLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Top-level class for making HTTP requests to a single server. Every client owns one {@link Connection}, over which
 * requests are sent one by one, in order they're submitted.
 * <br/>
 * Example with default values:
 * <br/>
 * <pre>
 *     HttpClient client = HttpClient.create("http://example.com");
 *     HttpResponse response = client.request(RequestDescriptor.builder().path("/").build()).get();
 * </pre>
 * <br/>
 * More customized example:
 * <br/>
 * <pre>
 *     HttpClient.Config config = new HttpClient.Config();
 *     config.setRequestTimeout(Duration.ofSeconds(5));
 *     HttpClient client = HttpClient.create("https://example.com:8443", config);
 *     client.stream(RequestDescriptor.builder().path("/large").build(), callbacks);
 *     //...
 *     client.close();
 * </pre>
 */
public class HttpClient implements Closeable {
    private final Connection connection;
    private final Config config;

    private HttpClient(Connection connection, Config config) {
        this.connection = connection;
        this.config = config;
    }

    /**
     * Create a client with default parameters. Only protocol, host and port of the URL are used.
     * @param url address of the server
     * @return a new {@link HttpClient} instance
     * @throws MalformedURLException if URL is malformed or its protocol isn't http or https
     */
    public static HttpClient create(String url) throws MalformedURLException {
        return create(url, new Config());
    }

    /**
     * Create a client with given parameters. Only protocol, host and port of the URL are used.
     * @param url address of the server
     * @param config client configuration
     * @return a new {@link HttpClient} instance
     * @throws MalformedURLException if URL is malformed or its protocol isn't http or https
     */
    public static HttpClient create(String url, Config config) throws MalformedURLException {
        return create(Endpoint.fromUrl(url), SocketTransport.factory(config.getConnectTimeout()), config);
    }

    /**
     * Create a client using a custom transport.
     * @param endpoint server to connect to
     * @param transportFactory opens transports to the server
     * @param config client configuration
     * @return a new {@link HttpClient} instance
     */
    public static HttpClient create(Endpoint endpoint, Transport.Factory transportFactory, Config config) {
        return new HttpClient(new Connection(endpoint, transportFactory, config.getMaxHeaderSize()), config);
    }

    /**
     * Submit a request as-is, applying the default timeout if the request doesn't have one.
     * @param descriptor request to make; its callback is invoked once the response starts or the request fails
     * @throws InvalidArgumentException if the request is malformed
     * @throws NotSupportedException if the method isn't supported
     */
    public void submit(RequestDescriptor descriptor) {
        connection.submit(withDefaults(descriptor).build());
    }

    /**
     * Make a request and read the whole response into memory. Callback of the descriptor is ignored.
     * @param descriptor request to make
     * @return future completed with the response, or exceptionally if the request fails
     * @throws InvalidArgumentException if the request is malformed
     * @throws NotSupportedException if the method isn't supported
     */
    public CompletableFuture<HttpResponse> request(RequestDescriptor descriptor) {
        CompletableFuture<HttpResponse> future = new CompletableFuture<>();
        connection.submit(withDefaults(descriptor).callback((error, start) -> {
            if(error != null) {
                future.completeExceptionally(error);
                return null;
            }
            return new Aggregator(start, future);
        }).build());
        return future;
    }

    /**
     * Make a request and receive the body in pieces, as it arrives. Callback of the descriptor is ignored.
     * Callbacks are executed on the connection's thread, so they shouldn't block.
     * @param descriptor request to make
     * @param callbacks callbacks used to report back about the progress
     * @throws InvalidArgumentException if the request is malformed
     * @throws NotSupportedException if the method isn't supported
     */
    public void stream(RequestDescriptor descriptor, StreamCallbacks callbacks) {
        connection.submit(withDefaults(descriptor).callback((error, start) -> {
            if(error != null) {
                callbacks.onExceptionThrown(error);
                return null;
            }
            callbacks.onResponse(start);
            List<String> trailers = new ArrayList<>();
            return new RequestState.DeliverySink() {
                @Override
                public void deliver(Throwable err, byte[] chunk) {
                    if(err != null) callbacks.onExceptionThrown(err);
                    else if(chunk != null) callbacks.onChunkReceived(chunk);
                    else callbacks.onEndTransfer(trailers);
                }

                @Override
                public void onTrailers(List<String> received) {
                    trailers.addAll(received);
                }
            };
        }).build());
    }

    private RequestDescriptor.Builder withDefaults(RequestDescriptor descriptor) {
        RequestDescriptor.Builder builder = descriptor.toBuilder();
        if(descriptor.getTimeout() == null && !config.getRequestTimeout().isZero())
            builder.timeout(config.getRequestTimeout().toMillis());
        return builder;
    }

    public Connection getConnection() {
        return connection;
    }

    /**
     * Get config of this client. Changing the timeout affects requests submitted afterwards; other parameters
     * are used only when the client is created.
     * @return config of this client
     */
    public Config getConfig() {
        return config;
    }

    /**
     * Close the connection. Requests which haven't completed fail with {@link ConnectionClosedException}.
     */
    @Override
    public void close() {
        connection.close();
    }

    /**
     * Collects the body of a response.
     */
    private static class Aggregator implements RequestState.DeliverySink {
        private final StartResponse start;
        private final CompletableFuture<HttpResponse> future;
        private final ByteArrayOutputStream body = new ByteArrayOutputStream();
        private final List<String> trailers = new ArrayList<>();

        private Aggregator(StartResponse start, CompletableFuture<HttpResponse> future) {
            this.start = start;
            this.future = future;
        }

        @Override
        public void deliver(Throwable error, byte[] chunk) {
            if(error != null) {
                future.completeExceptionally(error);
            } else if(chunk != null) {
                body.write(chunk, 0, chunk.length);
            } else {
                future.complete(new HttpResponse(start.getStatusCode(), start.getHeaders(), trailers,
                        body.toByteArray(), start.getOpaque()));
            }
        }

        @Override
        public void onTrailers(List<String> received) {
            trailers.addAll(received);
        }
    }

    /**
     * Callbacks used to inform caller about response progress.
     */
    public interface StreamCallbacks {
        /**
         * Called once status and headers are received.
         * @param response status, headers and opaque token
         */
        void onResponse(StartResponse response);

        /**
         * Called every time a piece of body is received.
         * @param chunk data
         */
        void onChunkReceived(byte[] chunk);

        /**
         * Called after the whole body is read.
         * @param trailers alternating trailer names and values, empty if there were none
         */
        void onEndTransfer(List<String> trailers);

        /**
         * Called if request fails, either before or after {@link #onResponse(StartResponse)}.
         * @param ex cause of the failure
         */
        void onExceptionThrown(Throwable ex);
    }

    public static class Config {
        private Duration requestTimeout = Duration.ZERO;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private int maxHeaderSize = ResponseParser.DEFAULT_MAX_HEADER_SIZE;
        private int pipelining = Connection.PIPELINING;

        public Config() {
        }

        /**
         * Sets how long a request can wait for response headers, counting from submission. Applied to requests
         * which don't set their own timeout. Zero means requests can wait forever.
         * @param requestTimeout default request timeout
         */
        public void setRequestTimeout(Duration requestTimeout) {
            if(requestTimeout.isNegative()) throw new InvalidConfigException("requestTimeout can't be negative!");
            this.requestTimeout = requestTimeout;
        }

        /**
         * Sets how long to wait for the connection to be established. Zero means forever.
         * @param connectTimeout connection timeout
         */
        public void setConnectTimeout(Duration connectTimeout) {
            if(connectTimeout.isNegative()) throw new InvalidConfigException("connectTimeout can't be negative!");
            if(connectTimeout.toMillis() > Integer.MAX_VALUE)
                throw new InvalidConfigException("connectTimeout is too large!");
            this.connectTimeout = connectTimeout;
        }

        /**
         * Sets maximum size of response status line and headers, in bytes. Larger responses fail.
         * @param maxHeaderSize maximum header size
         */
        public void setMaxHeaderSize(int maxHeaderSize) {
            if(maxHeaderSize < 1) throw new InvalidConfigException("maxHeaderSize must be positive!");
            this.maxHeaderSize = maxHeaderSize;
        }

        /**
         * Sets maximum number of requests in flight. Only 1 is supported.
         * @param pipelining maximum requests in flight
         */
        public void setPipelining(int pipelining) {
            if(pipelining < 1) throw new InvalidConfigException("pipelining must be positive!");
            if(pipelining != Connection.PIPELINING) throw new NotSupportedException("Pipelining is not supported");
            this.pipelining = pipelining;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }
        public Duration getConnectTimeout() {
            return connectTimeout;
        }
        public int getMaxHeaderSize() {
            return maxHeaderSize;
        }
        public int getPipelining() {
            return pipelining;
        }
    }
}
