package rs.lukaj.httptransport.connections;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.junit.jupiter.api.Assertions.*;

public class ResponseParserTest {
    private final ResponseParser parser = new ResponseParser();
    private final List<ParseEvent> events = new ArrayList<>();

    private void feed(String data) {
        byte[] bytes = data.getBytes(ISO_8859_1);
        parser.execute(bytes, 0, bytes.length, events::add);
    }

    //one byte at a time, to make sure no state is lost between pieces
    private void trickle(String data) {
        byte[] bytes = data.getBytes(ISO_8859_1);
        for(int i=0; i<bytes.length; i++) parser.execute(bytes, i, 1, events::add);
    }

    private ParseEvent.HeadersComplete head(int index) {
        return (ParseEvent.HeadersComplete) events.get(index);
    }

    private String body() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for(ParseEvent event : events) {
            if(event instanceof ParseEvent.BodyChunk) {
                byte[] data = ((ParseEvent.BodyChunk) event).getData();
                out.write(data, 0, data.length);
            }
        }
        return out.toString(ISO_8859_1);
    }

    private ParseEvent last() {
        return events.get(events.size() - 1);
    }

    @Test
    public void fixedLengthBody() {
        parser.expectResponse(true);
        trickle("HTTP/1.1 200 OK\r\nContent-Length: 5\r\nContent-Type: text/plain\r\n\r\nhello");

        assertEquals(200, head(0).getStatusCode());
        assertEquals("OK", head(0).getReasonPhrase());
        assertEquals("text/plain", head(0).getHeaders().getContentType());
        assertTrue(head(0).isKeepAlive());
        assertEquals("hello", body());
        assertEquals(ParseEvent.Type.MESSAGE_COMPLETE, last().getType());
        assertTrue(parser.isIdle());
    }

    @Test
    public void chunkedBodyWithTrailers() {
        parser.expectResponse(true);
        trickle("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n"
                + "5;name=value\r\nhello\r\n7\r\n, world\r\n0\r\nExpires: never\r\nX-Sum: 42\r\n\r\n");

        assertEquals("hello, world", body());
        ParseEvent.MessageComplete complete = (ParseEvent.MessageComplete) last();
        assertEquals(Arrays.asList("Expires", "never", "X-Sum", "42"), complete.getTrailers());
        assertTrue(parser.isIdle());
    }

    /**
     * Repeated headers turn into a list, whatever their name.
     */
    @Test
    public void repeatedHeadersAreFolded() {
        parser.expectResponse(true);
        feed("HTTP/1.1 200 OK\r\nSet-Cookie: a=1\r\nX-Single: one\r\nset-cookie: b=2\r\nContent-Length: 0\r\n\r\n");

        ResponseHeaders headers = head(0).getHeaders();
        assertEquals(Arrays.asList("a=1", "b=2"), headers.getValues("Set-Cookie"));
        assertTrue(headers.isRepeated("SET-COOKIE"));
        assertEquals("one", headers.getHeader("x-single"));
        assertFalse(headers.isRepeated("X-Single"));
        assertEquals(Arrays.asList("Set-Cookie", "a=1", "X-Single", "one", "set-cookie", "b=2", "Content-Length", "0"),
                headers.getRawPairs());
        assertTrue(parser.isIdle());
    }

    @Test
    public void informationalResponseBeforeFinal() {
        parser.expectResponse(true);
        feed("HTTP/1.1 100 Continue\r\n\r\nHTTP/1.1 201 Created\r\nContent-Length: 2\r\n\r\nok");

        assertEquals(100, head(0).getStatusCode());
        assertEquals(201, head(1).getStatusCode());
        assertEquals("ok", body());
        assertEquals(ParseEvent.Type.MESSAGE_COMPLETE, last().getType());
    }

    @Test
    public void switchingProtocolsIsRejected() {
        parser.expectResponse(true);
        assertThrows(InvalidResponseException.class,
                () -> feed("HTTP/1.1 101 Switching Protocols\r\nUpgrade: websocket\r\n\r\n"));
    }

    @Test
    public void headResponseHasNoBody() {
        parser.expectResponse(false);
        feed("HTTP/1.1 200 OK\r\nContent-Length: 1000\r\n\r\n");
        assertEquals(2, events.size());
        assertEquals(ParseEvent.Type.MESSAGE_COMPLETE, last().getType());
        assertTrue(parser.isIdle());
    }

    @Test
    public void noContentAndNotModified() {
        parser.expectResponse(true);
        feed("HTTP/1.1 204 No Content\r\n\r\n");
        assertTrue(parser.isIdle());
        parser.expectResponse(true);
        feed("HTTP/1.1 304 Not Modified\r\nContent-Length: 10\r\n\r\n");
        assertTrue(parser.isIdle());
        assertEquals(4, events.size());
    }

    /**
     * Without a length, body goes on until the server closes the connection.
     */
    @Test
    public void bodyUntilClose() {
        parser.expectResponse(true);
        feed("HTTP/1.1 200 OK\r\n\r\nsome");
        feed(" data");
        assertFalse(head(0).isKeepAlive());
        assertFalse(parser.isIdle());

        parser.finish(events::add);
        assertEquals("some data", body());
        assertEquals(ParseEvent.Type.MESSAGE_COMPLETE, last().getType());
    }

    @Test
    public void unknownTransferCodingReadsUntilClose() {
        parser.expectResponse(true);
        feed("HTTP/1.1 200 OK\r\nTransfer-Encoding: gzip\r\nContent-Length: 3\r\n\r\nabcdef");
        assertFalse(head(0).isKeepAlive());
        assertEquals("abcdef", body());
    }

    @Test
    public void closedMidBody() {
        parser.expectResponse(true);
        feed("HTTP/1.1 200 OK\r\nContent-Length: 10\r\n\r\nabc");
        assertThrows(InvalidResponseException.class, () -> parser.finish(events::add));
    }

    @Test
    public void finishWhileIdle() {
        parser.finish(events::add);
        assertTrue(events.isEmpty());
    }

    @Test
    public void dataWhileIdleIsViolation() {
        assertThrows(InvalidResponseException.class, () -> feed("HTTP/1.1 200 OK\r\n\r\n"));
    }

    /**
     * Extra bytes after a complete response don't belong to any request; events before them still arrive.
     */
    @Test
    public void dataAfterCompleteMessage() {
        parser.expectResponse(true);
        assertThrows(InvalidResponseException.class,
                () -> feed("HTTP/1.1 200 OK\r\nContent-Length: 2\r\n\r\nokHTTP/1.1 200 OK\r\n"));
        assertEquals("ok", body());
        assertEquals(ParseEvent.Type.MESSAGE_COMPLETE, last().getType());
    }

    @Test
    public void malformedResponses() {
        String[] malformed = {
                "FOO/1.1 200 OK\r\n\r\n",
                "HTTP/1.1 2000 OK\r\n\r\n",
                "HTTP/1.1 abc OK\r\n\r\n",
                "HTTP/1.1 200 OK\r\nNo colon here\r\n\r\n",
                "HTTP/1.1 200 OK\r\nContent-Length: 3\r\nContent-Length: 4\r\n\r\n",
                "HTTP/1.1 200 OK\r\nContent-Length: x\r\n\r\n",
                "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\nzz\r\n",
                "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n2\r\nokX\r\n",
        };
        for(String response : malformed) {
            ResponseParser fresh = new ResponseParser();
            fresh.expectResponse(true);
            byte[] bytes = response.getBytes(ISO_8859_1);
            assertThrows(InvalidResponseException.class, () -> fresh.execute(bytes, 0, bytes.length, e -> {}),
                    response);
        }
    }

    @Test
    public void headerSizeIsLimited() {
        ResponseParser small = new ResponseParser(64);
        small.expectResponse(true);
        StringBuilder response = new StringBuilder("HTTP/1.1 200 OK\r\n");
        for(int i=0; i<10; i++) response.append("X-Header-").append(i).append(": value\r\n");
        byte[] bytes = response.toString().getBytes(ISO_8859_1);
        assertThrows(InvalidResponseException.class, () -> small.execute(bytes, 0, bytes.length, e -> {}));
    }

    @Test
    public void bareLineFeeds() {
        parser.expectResponse(true);
        feed("HTTP/1.1 200 OK\nContent-Length: 2\n\nok");
        assertEquals("ok", body());
        assertTrue(parser.isIdle());
    }

    @Test
    public void keepAlive() {
        parser.expectResponse(true);
        feed("HTTP/1.1 200 OK\r\nConnection: close\r\nContent-Length: 0\r\n\r\n");
        assertFalse(head(0).isKeepAlive());

        parser.expectResponse(true);
        feed("HTTP/1.0 200 OK\r\nContent-Length: 0\r\n\r\n");
        assertFalse(head(2).isKeepAlive());

        parser.expectResponse(true);
        feed("HTTP/1.0 200 OK\r\nConnection: keep-alive\r\nContent-Length: 0\r\n\r\n");
        assertTrue(head(4).isKeepAlive());
    }

    @Test
    public void resetDropsPartialMessage() {
        parser.expectResponse(true);
        feed("HTTP/1.1 200 OK\r\nContent-Le");
        parser.reset();
        assertTrue(parser.isIdle());
        parser.expectResponse(true);
        feed("HTTP/1.1 404 Not Found\r\nContent-Length: 0\r\n\r\n");
        assertEquals(404, head(0).getStatusCode());
    }
}
