package rs.lukaj.httptransport.connections;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Tracing context of a request. Callbacks for a request run on the connection's thread, not on the thread
 * which submitted it, so the context is carried along explicitly: it's captured on submission (or given with
 * the request) and made {@link #current() current} for the duration of every callback and delivery-sink call.
 */
public final class RequestContext {
    private static final AtomicLong ids = new AtomicLong();
    private static final ThreadLocal<RequestContext> current = new ThreadLocal<>();

    private final long id;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    private RequestContext() {
        this.id = ids.incrementAndGet();
    }

    /**
     * @return a new context with a unique id and no attributes
     */
    public static RequestContext create() {
        return new RequestContext();
    }

    /**
     * @return context of the request whose callback is running on this thread, or null outside of callbacks
     * (unless set by {@link #run(Runnable)} higher up the stack)
     */
    public static RequestContext current() {
        return current.get();
    }

    /**
     * @return context current on this thread, or a new one if there's none
     */
    public static RequestContext currentOrCreate() {
        RequestContext context = current.get();
        return context == null ? create() : context;
    }

    public long getId() {
        return id;
    }

    /**
     * Attach an attribute, e.g. a trace id.
     * @param key attribute name
     * @param value attribute value, null removes it
     * @return this, to allow chaining
     */
    public RequestContext with(String key, Object value) {
        if(value == null) attributes.remove(key);
        else attributes.put(key, value);
        return this;
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    /**
     * Run the action with this context as current, restoring the previous one afterwards.
     * @param action action to run
     */
    public void run(Runnable action) {
        call(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Call the action with this context as current, restoring the previous one afterwards.
     * @param action action to call
     * @return result of the action
     */
    public <T> T call(Supplier<T> action) {
        RequestContext previous = current.get();
        current.set(this);
        try {
            return action.get();
        } finally {
            if(previous == null) current.remove();
            else current.set(previous);
        }
    }

    @Override
    public String toString() {
        return "RequestContext#" + id + attributes;
    }
}
