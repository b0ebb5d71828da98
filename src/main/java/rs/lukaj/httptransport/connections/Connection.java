package rs.lukaj.httptransport.connections;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Timer;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single persistent connection to a server, over which requests are sent one at a time. Requests are queued and
 * dispatched in submission order; the next one is sent only after the response to the previous one has been
 * fully read, so responses are always matched to requests in order.
 * <br/>
 * All the work is done on the connection's own thread. A separate thread blocks reading from the transport and
 * hands whatever it reads over; streaming request bodies are copied to the transport on a thread of their own.
 * Callbacks and delivery sinks are called on the connection's thread, so they must not block.
 * <br/>
 * For https, the transport checks the server's identity against the server name of the request being sent. If a
 * request asks for a different name than the one the open transport was checked against, the transport is
 * reopened.
 * <br/>
 * If the server closes the connection, or a request leaves it in an unknown state, it's reopened for the next
 * queued request.
 */
public class Connection implements Closeable {
    /**
     * Maximum number of requests in flight. Pipelining isn't supported.
     */
    public static final int PIPELINING = 1;
    private static final int BUFFER_SIZE = 8192;
    //reader never pauses, so there's never anything to resume
    private static final Runnable RESUME = () -> {};

    public enum State {
        CONNECTING,
        READY,
        BUSY,
        /**
         * Transport isn't open; it'll be opened for the next request.
         */
        DISCONNECTED,
        CLOSED
    }

    private final Endpoint endpoint;
    private final Transport.Factory transportFactory;
    private final ResponseParser parser;
    private final ExecutorService loop;
    private final Timer timer;
    private final String defaultServername;
    private volatile Thread loopThread;
    private volatile State state;

    //everything below is touched only from the loop
    private final Deque<RequestState> queue = new ArrayDeque<>();
    private Transport transport;
    private String transportServername;
    private RequestState current;
    private RequestState sendingBody;
    private boolean currentKeepAlive;
    private boolean dispatchScheduled;

    /**
     * Connect to the endpoint over a socket.
     * @param endpoint server to connect to
     */
    public Connection(Endpoint endpoint) {
        this(endpoint, SocketTransport.factory(Duration.ZERO), ResponseParser.DEFAULT_MAX_HEADER_SIZE);
    }

    /**
     * Create a connection and start connecting. Connecting happens in background: if it fails, the connection
     * tries again when a request is submitted.
     * @param endpoint server to connect to
     * @param transportFactory opens transports to the server
     * @param maxHeaderSize maximum size of the response head, in bytes
     */
    public Connection(Endpoint endpoint, Transport.Factory transportFactory, int maxHeaderSize) {
        this.endpoint = endpoint;
        this.transportFactory = transportFactory;
        this.parser = new ResponseParser(maxHeaderSize);
        this.defaultServername = Endpoint.isIpLiteral(endpoint.getHost()) ? null : endpoint.getHost();
        this.timer = new Timer("http-timeouts-" + endpoint.getAuthority(), true);
        this.loop = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "http-connection-" + endpoint.getAuthority());
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.state = State.CONNECTING;
        runOnLoop(() -> connect(defaultServername));
    }

    /**
     * Submit a request. The request is validated right away; if it's valid it's queued, and the descriptor's
     * callback is invoked once the response starts or the request fails.
     * @param descriptor request to make
     * @throws InvalidArgumentException if the request is malformed; nothing is queued in that case
     * @throws NotSupportedException if the request method isn't supported
     */
    public void submit(RequestDescriptor descriptor) {
        RequestState request;
        try {
            request = new RequestState(descriptor, endpoint.getAuthority(), this::runOnLoop, timer);
        } catch (ConnectionClosedException e) {
            RequestState.Callback callback = descriptor.getCallback();
            RequestContext context = descriptor.getContext() != null ? descriptor.getContext()
                    : RequestContext.currentOrCreate();
            if(callback != null) context.run(() -> callback.onStart(e, null));
            return;
        }
        runOnLoop(() -> enqueue(request));
    }

    private void enqueue(RequestState request) {
        if(state == State.CLOSED) {
            fail(request, new ConnectionClosedException("Connection has been closed"));
            return;
        }
        queue.add(request);
        dispatch();
    }

    private void connect(String servername) {
        if(state == State.CLOSED) return;
        state = State.CONNECTING;
        Transport opened;
        try {
            opened = endpoint.isHttps() ? transportFactory.open(endpoint, servername)
                    : transportFactory.open(endpoint);
        } catch (IOException | RuntimeException e) {
            state = State.DISCONNECTED;
            if(queue.isEmpty())
                System.err.println("Warning: failed to connect to " + endpoint + ": " + e.getMessage());
            failQueued(e);
            return;
        }
        transport = opened;
        transportServername = servername;
        state = State.READY;
        startReading(opened);
        dispatch();
    }

    private void dispatch() {
        if(state == State.CLOSED || current != null) return;
        while(!queue.isEmpty() && queue.peek().isFinished()) queue.poll(); //aborted or timed out while waiting
        if(queue.isEmpty()) return;
        String servername = queue.peek().getServername();
        if(transport != null && endpoint.isHttps() && !sameName(servername, transportServername))
            disconnect(); //server's identity has to be checked against a different name
        if(transport == null) {
            connect(servername); //dispatches again once connected
            return;
        }

        RequestState request = queue.poll();
        current = request;
        currentKeepAlive = true;
        state = State.BUSY;
        request.setErrorListener(err -> onRequestFailed(request));
        parser.expectResponse(!Http.responseHasNoBody(request.getMethod()));

        Transport target = transport;
        try {
            target.write(WireSerializer.serialize(request));
        } catch (IOException e) {
            onTransportError(target, e);
            return;
        }
        if(request.isStreaming()) startSendingBody(target, request);
    }

    private static boolean sameName(String a, String b) {
        return a == null ? b == null : a.equalsIgnoreCase(b);
    }

    private void startSendingBody(Transport target, RequestState request) {
        StreamingBody body = request.getStreamingBody();
        sendingBody = request;
        Thread sender = new Thread(() -> sendBody(target, request, body), "http-body-" + endpoint.getAuthority());
        sender.setDaemon(true);
        sender.start();
    }

    //own thread, so that a stalled body doesn't hold up timeouts, aborts or the response. Once the request is
    //over, whatever this thread reports is ignored
    private void sendBody(Transport target, RequestState request, StreamingBody body) {
        byte[] buf = new byte[BUFFER_SIZE];
        while(true) {
            int read;
            try {
                read = body.read(buf);
            } catch (IOException e) {
                runOnLoop(() -> onBodyFailed(request, e));
                return;
            }
            if(read < 0) break;
            if(read == 0) continue;
            try {
                target.write(Arrays.copyOf(buf, read));
            } catch (IOException e) {
                runOnLoop(() -> onTransportError(target, e));
                return;
            }
        }
        runOnLoop(() -> {
            if(sendingBody == request) sendingBody = null;
        });
    }

    private void onBodyFailed(RequestState request, IOException e) {
        if(sendingBody != request) return; //request is already over, body was destroyed because of it
        sendingBody = null;
        if(current == request) fail(request, e);
    }

    private void scheduleDispatch() {
        if(dispatchScheduled) return;
        dispatchScheduled = true;
        runOnLoop(() -> {
            dispatchScheduled = false;
            dispatch();
        });
    }

    private void startReading(Transport source) {
        Thread reader = new Thread(() -> readLoop(source), "http-reader-" + endpoint.getAuthority());
        reader.setDaemon(true);
        reader.start();
    }

    //the only place where we block waiting for the server
    private void readLoop(Transport source) {
        byte[] buf = new byte[BUFFER_SIZE];
        try {
            while(true) {
                int read = source.read(buf);
                if(read < 0) {
                    runOnLoop(() -> onEnd(source));
                    return;
                }
                byte[] data = Arrays.copyOf(buf, read);
                runOnLoop(() -> onData(source, data));
            }
        } catch (IOException e) {
            runOnLoop(() -> onTransportError(source, e));
        }
    }

    private void onData(Transport source, byte[] data) {
        if(source != transport) return;
        try {
            parser.execute(data, 0, data.length, this::onParseEvent);
        } catch (RuntimeException e) {
            onExchangeBroken(source, e);
        }
        scheduleDispatch();
    }

    private void onEnd(Transport source) {
        if(source != transport) return;
        if(parser.isIdle() && current == null) {
            disconnect();
            scheduleDispatch();
            return;
        }
        try {
            parser.finish(this::onParseEvent);
        } catch (InvalidResponseException e) {
            onTransportError(source, new ConnectionClosedException(e.getMessage(), e));
            return;
        } catch (RuntimeException e) {
            onExchangeBroken(source, e);
        }
        if(source == transport) disconnect(); //server is gone either way
        scheduleDispatch();
    }

    private void onParseEvent(ParseEvent event) {
        RequestState request = current;
        if(request == null) throw new InvalidResponseException("Received a response while no request was in flight");

        switch (event.getType()) {
            case HEADERS_COMPLETE:
                ParseEvent.HeadersComplete head = (ParseEvent.HeadersComplete) event;
                if(head.getStatusCode() >= 200) currentKeepAlive = head.isKeepAlive();
                request.headers(head.getStatusCode(), head.getHeaders(), RESUME);
                break;
            case BODY_CHUNK:
                request.pushBody(((ParseEvent.BodyChunk) event).getData());
                break;
            case MESSAGE_COMPLETE:
                current = null;
                request.setErrorListener(null);
                boolean reuse = currentKeepAlive && !request.isReset();
                if(sendingBody == request) { //server answered before the whole body was sent
                    sendingBody = null;
                    reuse = false;
                    StreamingBody body = request.getStreamingBody();
                    if(body != null) body.destroy(null);
                }
                if(reuse) state = State.READY;
                else disconnect();
                request.complete(((ParseEvent.MessageComplete) event).getTrailers());
                break;
        }
    }

    //response can't be matched to requests anymore: fail the one in flight and start over with a new transport
    private void onExchangeBroken(Transport source, RuntimeException e) {
        if(source != transport) return;
        if(current == null)
            System.err.println("Warning: dropping connection to " + endpoint + ": " + e.getMessage());
        disconnect();
        failCurrent(e);
    }

    private void onTransportError(Transport source, Exception e) {
        if(source != transport) return;
        disconnect();
        failCurrent(e);
        failQueued(new ConnectionClosedException("Connection to " + endpoint + " failed", e));
    }

    //the request in flight failed on its own (aborted, timed out, body failed)
    private void onRequestFailed(RequestState request) {
        if(request != current) return;
        current = null;
        disconnect();
        scheduleDispatch();
    }

    private void disconnect() {
        Transport closing = transport;
        transport = null;
        transportServername = null;
        sendingBody = null;
        parser.reset();
        if(state != State.CLOSED) state = State.DISCONNECTED;
        if(closing != null) {
            try {
                closing.close();
            } catch (IOException e) {
                System.err.println("Warning: failed to close connection to " + endpoint + ": " + e.getMessage());
            }
        }
    }

    private void failCurrent(Throwable error) {
        RequestState request = current;
        current = null;
        if(request != null) fail(request, error);
    }

    private void failQueued(Throwable error) {
        RequestState request;
        while((request = queue.poll()) != null) fail(request, error);
    }

    private void fail(RequestState request, Throwable error) {
        try {
            request.error(error);
        } catch (RuntimeException e) {
            System.err.println("Warning: callback for " + request + " threw an exception: " + e);
        }
    }

    private void runOnLoop(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) { //closed; whatever is left to do is cleanup
            task.run();
        }
    }

    /**
     * Close the connection. Request in flight and all queued requests fail with {@link ConnectionClosedException}.
     * Requests submitted afterwards fail the same way. If called from a callback, connection is closed before this
     * method returns; otherwise, this method waits until it is.
     */
    @Override
    public void close() {
        if(Thread.currentThread() == loopThread) {
            shutdown();
            return;
        }
        Future<?> done;
        try {
            done = loop.submit(this::shutdown);
        } catch (RejectedExecutionException e) {
            return; //already closed
        }
        try {
            done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            System.err.println("Warning: error while closing connection to " + endpoint + ": " + e.getCause());
        }
    }

    private void shutdown() {
        if(state == State.CLOSED) return;
        state = State.CLOSED;
        disconnect();
        ConnectionClosedException closed = new ConnectionClosedException("Connection has been closed");
        failCurrent(closed);
        failQueued(closed);
        timer.cancel();
        loop.shutdown();
    }

    public State getState() {
        return state;
    }
    public boolean isClosed() {
        return state == State.CLOSED;
    }
    public Endpoint getEndpoint() {
        return endpoint;
    }
}
