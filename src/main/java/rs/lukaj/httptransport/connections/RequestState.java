package rs.lukaj.httptransport.connections;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Lifecycle of a single request, from submission until the response is fully delivered or the request fails.
 * <br/>
 * Callback is invoked exactly once: either with the response status and headers (by
 * {@link #headers(int, ResponseHeaders, Runnable)}) or with an error (by {@link #error(Throwable)}). If the callback
 * returns a {@link DeliverySink}, it receives body chunks and then exactly one terminal delivery: (null, null) when
 * the response is complete, or (error, null) if the request fails midway.
 * <br/>
 * Operations aren't synchronized and should be called from one thread; timeout, abort and body errors are handed to
 * the executor given on construction, which should be that thread.
 */
public class RequestState {

    /**
     * Called once, when response headers arrive or when the request fails before that.
     */
    public interface Callback {
        /**
         * @param error cause of the failure, or null if response has started
         * @param response status, headers and opaque token; null if request failed
         * @return sink for the body, or null if body isn't needed
         */
        DeliverySink onStart(Throwable error, StartResponse response);
    }

    /**
     * Receives response body.
     */
    public interface DeliverySink {
        /**
         * Called with (null, chunk) for every body chunk, then once with (null, null) when the body is over or
         * with (error, null) if the request has failed.
         */
        void deliver(Throwable error, byte[] chunk);

        /**
         * Called before the terminal delivery if the response had trailers. Names and values alternate.
         */
        default void onTrailers(List<String> trailers) {
        }
    }

    private final String path;
    private final String method;
    private final Object opaque;
    private final String servername;
    private final boolean idempotent;
    private final boolean reset;
    private final WireSerializer.HeaderBlock headerBlock;
    private final byte[] bufferedBody;
    private final boolean streaming;
    private final long timeout;
    private final RequestContext context;
    private final Callback callback;

    private StreamingBody streamingBody;
    private boolean finished = false;
    private Throwable failure;
    private TimerTask timer;
    private Abortable.Subscription abortSubscription;
    private Abortable.Subscription bodyErrorSubscription;
    private DeliverySink sink;
    private Consumer<Throwable> errorListener;

    /**
     * Validate the request and set up its timeout and cancellation. Nothing is subscribed to unless the request
     * is valid.
     * @param descriptor request to make
     * @param hostname hostname of the server, used for Host header and server name if they aren't given
     * @param executor executor on which timeouts, aborts and body errors are handled
     * @param timer timer used to schedule the timeout
     * @throws InvalidArgumentException if the descriptor is malformed
     * @throws NotSupportedException if the method is CONNECT
     * @throws ConnectionClosedException if the timer has already been cancelled
     */
    public RequestState(RequestDescriptor descriptor, String hostname, Executor executor, Timer timer) {
        this.path = descriptor.getPath();
        this.method = descriptor.getMethod();
        if(path == null || path.isEmpty() || path.charAt(0) != '/')
            throw new InvalidArgumentException("Path must begin with '/': " + path);
        if(method == null)
            throw new InvalidArgumentException("Method must be set");
        if(!Http.isSupported(method))
            throw new NotSupportedException(method + " is not supported");
        Long requestedTimeout = descriptor.getTimeout();
        if(requestedTimeout != null && requestedTimeout < 0)
            throw new InvalidArgumentException("Timeout must be a non-negative number: " + requestedTimeout);
        this.timeout = requestedTimeout == null ? 0 : requestedTimeout;

        Object body = descriptor.getBody();
        if(body == null) {
            bufferedBody = null;
            streamingBody = null;
        } else if(body instanceof byte[]) {
            byte[] bytes = (byte[]) body;
            bufferedBody = bytes.length == 0 ? null : bytes;
            streamingBody = null;
        } else if(body instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) body).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            bufferedBody = bytes.length == 0 ? null : bytes;
            streamingBody = null;
        } else if(body instanceof String) {
            String text = (String) body;
            bufferedBody = text.isEmpty() ? null : text.getBytes(UTF_8);
            streamingBody = null;
        } else if(body instanceof StreamingBody) {
            bufferedBody = null;
            streamingBody = (StreamingBody) body;
        } else {
            throw new InvalidArgumentException("Invalid body type: " + body.getClass().getName());
        }
        this.streaming = streamingBody != null;

        Map<String, String> headers = descriptor.getHeaders();
        this.headerBlock = WireSerializer.headerBlock(method, path, headers, hostname);

        boolean hasBody = bufferedBody != null || streaming;
        this.reset = hasBody && Http.bodyResetsConnection(method);
        this.idempotent = descriptor.getIdempotent() != null ? descriptor.getIdempotent()
                : Http.isIdempotentByDefault(method);
        this.servername = resolveServername(descriptor.getServername(), headers, hostname);
        this.opaque = descriptor.getOpaque();
        this.callback = descriptor.getCallback() != null ? descriptor.getCallback() : (err, response) -> null;
        this.context = descriptor.getContext() != null ? descriptor.getContext() : RequestContext.currentOrCreate();

        //valid from here on. Timer goes first: an already aborted signal fails the request as soon as it's
        //subscribed to, and the failure has to find the timer in order to cancel it
        if(timeout > 0) {
            TimerTask task = new TimerTask() {
                @Override
                public void run() {
                    executor.execute(() -> error(new RequestTimeoutException(timeout)));
                }
            };
            try {
                timer.schedule(task, timeout);
            } catch (IllegalStateException e) {
                throw new ConnectionClosedException("Connection has been closed", e);
            }
            this.timer = task;
        }
        if(streaming)
            bodyErrorSubscription = streamingBody.onError(err -> executor.execute(() -> error(err)));
        if(descriptor.getSignal() != null)
            abortSubscription = descriptor.getSignal().subscribe(Abortable.ABORT,
                    () -> executor.execute(() -> error(new RequestAbortedException())));
    }

    private static String resolveServername(String override, Map<String, String> headers, String hostname) {
        String name = override;
        if(name == null && headers != null) {
            for(Map.Entry<String, String> header : headers.entrySet()) {
                if("host".equalsIgnoreCase(header.getKey())) {
                    name = header.getValue();
                    break;
                }
            }
        }
        if(name == null) name = hostname;
        if(name == null || Endpoint.isIpLiteral(name)) return null;
        return Endpoint.stripPort(name); //certificates and SNI carry names without ports
    }

    /**
     * Response headers have arrived. Informational (1xx) responses are ignored. Otherwise the callback is invoked
     * and the sink it returns is kept for the body.
     * @param statusCode response status
     * @param headers response headers
     * @param resume hook the caller can use to signal it's ready for more data
     */
    public void headers(int statusCode, ResponseHeaders headers, Runnable resume) {
        if(statusCode < 200 || finished) return;
        finished = true;
        clearTimer();
        StartResponse response = new StartResponse(statusCode, headers, opaque, resume);
        DeliverySink returned = context.call(() -> callback.onStart(null, response));
        if(failure == null) {
            sink = returned;
        } else if(returned != null) { //failed from within the callback, e.g. connection was closed
            Throwable err = failure;
            context.run(() -> returned.deliver(err, null));
        }
    }

    /**
     * Pass a body chunk to the sink. Dropped if there's no sink.
     * @param chunk body data
     */
    public void pushBody(byte[] chunk) {
        DeliverySink target = sink;
        if(target != null) context.run(() -> target.deliver(null, chunk));
    }

    /**
     * Response is over. Sink gets trailers, if there are any, and the terminal delivery.
     * @param trailers alternating trailer names and values, may be empty
     */
    public void complete(List<String> trailers) {
        releaseSubscriptions();
        clearTimer();
        DeliverySink target = sink;
        if(target == null) return;
        sink = null;
        context.run(() -> {
            if(trailers != null && !trailers.isEmpty()) target.onTrailers(trailers);
            target.deliver(null, null);
        });
    }

    /**
     * Fail the request. Safe to call from any state and more than once: the error reaches the caller only once,
     * through the callback if headers haven't arrived yet, through the sink otherwise.
     * @param err cause of the failure
     */
    public void error(Throwable err) {
        if(failure == null) {
            failure = err;
            if(errorListener != null) errorListener.accept(err);
        }

        StreamingBody body = streamingBody;
        streamingBody = null;
        if(body != null && !body.isDestroyed()) body.destroy(err);

        DeliverySink target = sink;
        if(target != null) {
            sink = null;
            context.run(() -> target.deliver(err, null));
        }
        releaseSubscriptions();

        if(!finished) {
            finished = true;
            clearTimer();
            context.call(() -> callback.onStart(err, null));
        }
    }

    /**
     * Set listener notified the first time this request fails, before the caller is told.
     */
    void setErrorListener(Consumer<Throwable> listener) {
        this.errorListener = listener;
    }

    private void clearTimer() {
        if(timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    private void releaseSubscriptions() {
        if(abortSubscription != null) {
            abortSubscription.unsubscribe();
            abortSubscription = null;
        }
        if(bodyErrorSubscription != null) {
            bodyErrorSubscription.unsubscribe();
            bodyErrorSubscription = null;
        }
    }

    public String getPath() {
        return path;
    }
    public String getMethod() {
        return method;
    }

    /**
     * @return name to verify the server certificate against, or null if the server is addressed by IP
     */
    public String getServername() {
        return servername;
    }
    public boolean isIdempotent() {
        return idempotent;
    }

    /**
     * @return true if connection can't be reused after this request
     */
    public boolean isReset() {
        return reset;
    }
    public Long getContentLength() {
        return headerBlock.getContentLength();
    }
    public WireSerializer.HeaderBlock getHeaderBlock() {
        return headerBlock;
    }

    /**
     * @return body sent right after the headers, or null if there's none (or it's streamed)
     */
    public byte[] getBufferedBody() {
        return bufferedBody;
    }

    /**
     * @return streaming body, or null if there's none or it has been detached after a failure
     */
    public StreamingBody getStreamingBody() {
        return streamingBody;
    }
    public boolean isStreaming() {
        return streaming;
    }
    public boolean isFinished() {
        return finished;
    }
    public boolean isTimerArmed() {
        return timer != null;
    }
    public boolean hasDeliverySink() {
        return sink != null;
    }
    public Object getOpaque() {
        return opaque;
    }
    public RequestContext getContext() {
        return context;
    }

    /**
     * @return timeout in milliseconds, 0 if there's none
     */
    public long getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
