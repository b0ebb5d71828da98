package rs.lukaj.httptransport.connections;

/**
 * Anything a request can be cancelled through. A request subscribes to the {@link #ABORT} event when it's
 * created and unsubscribes once it's over; firing the event in between fails the request with
 * {@link RequestAbortedException}. {@link AbortSignal} is the stock implementation.
 */
public interface Abortable {
    /**
     * Name of the event fired when cancellation is requested.
     */
    String ABORT = "abort";

    /**
     * Register a handler for the named event. The handler may be called on any thread.
     * @param eventName event to listen for, usually {@link #ABORT}
     * @param handler called when the event fires
     * @return subscription which removes the handler when cancelled
     */
    Subscription subscribe(String eventName, Runnable handler);

    /**
     * Handle to a registered handler.
     */
    interface Subscription {
        /**
         * Remove the handler. Calling this more than once has no effect.
         */
        void unsubscribe();
    }
}
