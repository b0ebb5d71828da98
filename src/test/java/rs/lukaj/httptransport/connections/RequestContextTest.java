package rs.lukaj.httptransport.connections;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RequestContextTest {

    @Test
    public void nestedContextsAreRestored() {
        RequestContext outer = RequestContext.create().with("user", "alice");
        RequestContext inner = RequestContext.create();
        assertNotEquals(outer.getId(), inner.getId());
        assertNull(RequestContext.current());

        outer.run(() -> {
            assertSame(outer, RequestContext.current());
            assertSame(outer, RequestContext.currentOrCreate());
            String user = inner.call(() -> {
                assertSame(inner, RequestContext.current());
                return (String) outer.get("user");
            });
            assertEquals("alice", user);
            assertSame(outer, RequestContext.current());
        });
        assertNull(RequestContext.current());
    }

    @Test
    public void contextIsRestoredAfterException() {
        RequestContext context = RequestContext.create();
        assertThrows(IllegalStateException.class, () -> context.run(() -> {
            throw new IllegalStateException();
        }));
        assertNull(RequestContext.current());
    }
}
