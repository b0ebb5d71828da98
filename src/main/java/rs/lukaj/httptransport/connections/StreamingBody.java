package rs.lukaj.httptransport.connections;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Request body produced while the request is being sent, backed by an {@link InputStream}. The connection copies
 * the stream to the server as it reads it. Nothing is added to the data: if the server needs to know the length,
 * the caller has to send Content-Length (or Transfer-Encoding: chunked and chunk the data itself).
 * <br/>
 * Whoever produces the data can report a failure using {@link #emitError(Throwable)}, which fails the request
 * it's attached to. Once the request fails, the body is destroyed with the same error and can't be read anymore.
 */
public class StreamingBody implements Closeable {
    private final InputStream source;
    private final List<Listener> errorListeners = new CopyOnWriteArrayList<>();
    private volatile boolean destroyed = false;
    private volatile Throwable destroyCause;

    /**
     * @param source stream containing body data
     */
    public StreamingBody(InputStream source) {
        if(source == null) throw new NullPointerException("Source can't be null!");
        this.source = source;
    }

    /**
     * Register a listener called when an error is emitted for this body.
     * @param listener error listener
     * @return subscription used to remove the listener
     */
    public Abortable.Subscription onError(Consumer<Throwable> listener) {
        Listener subscription = new Listener(listener);
        errorListeners.add(subscription);
        return subscription;
    }

    /**
     * Report that body data can't be produced. Every error listener is notified.
     * @param error cause of the failure
     */
    public void emitError(Throwable error) {
        for(Listener listener : errorListeners) listener.action.accept(error);
    }

    /**
     * Read up to buf.length bytes of body data. Blocks until some are available.
     * @param buf buffer to read into
     * @return number of bytes read, or -1 at the end of body
     * @throws IOException if the body has been destroyed or the source fails
     */
    public int read(byte[] buf) throws IOException {
        if(destroyed) throw new IOException("Body has been destroyed", destroyCause);
        return source.read(buf);
    }

    /**
     * Release the source and make the body unreadable. Only the first call has any effect.
     * @param cause why the body is destroyed (may be null)
     */
    public void destroy(Throwable cause) {
        if(destroyed) return;
        destroyCause = cause;
        destroyed = true;
        try {
            source.close();
        } catch (IOException e) {
            System.err.println("Warning: failed to close request body stream: " + e.getMessage());
        }
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * @return error the body was destroyed with, or null
     */
    public Throwable getDestroyCause() {
        return destroyCause;
    }

    /**
     * Same as {@link #destroy(Throwable)} without a cause.
     */
    @Override
    public void close() {
        destroy(null);
    }

    private class Listener implements Abortable.Subscription {
        private final Consumer<Throwable> action;

        private Listener(Consumer<Throwable> action) {
            this.action = action;
        }

        @Override
        public void unsubscribe() {
            errorListeners.remove(this);
        }
    }
}
