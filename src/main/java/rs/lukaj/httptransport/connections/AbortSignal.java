package rs.lukaj.httptransport.connections;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Abortable} which fires its {@link Abortable#ABORT} event once, when {@link #abort()} is called. One
 * signal can be shared by multiple requests to cancel them together.
 * <br/>
 * Subscribing to a signal which has already been aborted runs the handler right away, on the subscribing
 * thread.
 */
public class AbortSignal implements Abortable {
    private final List<Handler> handlers = new CopyOnWriteArrayList<>();
    private volatile boolean aborted = false;

    @Override
    public Subscription subscribe(String eventName, Runnable handler) {
        if(!ABORT.equals(eventName)) return () -> {}; //this signal doesn't fire anything else
        Handler subscription = new Handler(handler);
        handlers.add(subscription);
        if(aborted && handlers.remove(subscription)) handler.run();
        return subscription;
    }

    /**
     * Fire the abort event. Only the first call has any effect.
     */
    public void abort() {
        synchronized (this) {
            if(aborted) return;
            aborted = true;
        }
        for(Handler handler : handlers) {
            if(handlers.remove(handler)) handler.action.run(); //remove() guards against racing unsubscribe
        }
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * @return number of handlers still waiting for the event
     */
    public int getSubscriberCount() {
        return handlers.size();
    }

    private class Handler implements Subscription {
        private final Runnable action;

        private Handler(Runnable action) {
            this.action = action;
        }

        @Override
        public void unsubscribe() {
            handlers.remove(this);
        }
    }
}
