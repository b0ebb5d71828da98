package rs.lukaj.httptransport.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import rs.lukaj.httptransport.connections.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.MalformedURLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class HttpClientTest {
    private LocalServer server;
    private HttpClient client;

    @AfterEach
    public void shutdown() throws IOException {
        if(client != null) client.close();
        if(server != null) server.close();
    }

    private static String response(String status, String contentType, String body) {
        byte[] bytes = body.getBytes(UTF_8);
        return "HTTP/1.1 " + status + "\r\nContent-Type: " + contentType + "\r\nContent-Length: " + bytes.length
                + "\r\n\r\n" + new String(bytes, ISO_8859_1);
    }

    /**
     * Several requests over one connection, answered in order.
     */
    @Test
    public void requests() throws Exception {
        server = new LocalServer(line -> {
            if(line.startsWith("GET /hello ")) return response("200 OK", "text/plain; charset=utf-8", "здраво");
            if(line.startsWith("POST /echo ")) return response("201 Created", "text/plain", "created");
            return response("404 Not Found", "text/plain", "nope");
        });
        client = HttpClient.create(server.getUrl());

        HttpResponse hello = client.request(RequestDescriptor.builder().path("/hello").build())
                .get(5, TimeUnit.SECONDS);
        assertEquals(200, hello.getStatusCode());
        assertEquals("здраво", hello.getBodyString());
        assertFalse(hello.isError());

        HttpResponse created = client.request(RequestDescriptor.builder().method("POST").path("/echo")
                .header("Content-Length", "4").body("data").build()).get(5, TimeUnit.SECONDS);
        assertEquals(201, created.getStatusCode());
        assertEquals("created", created.getBodyString());

        HttpResponse missing = client.request(RequestDescriptor.builder().path("/missing").build())
                .get(5, TimeUnit.SECONDS);
        assertTrue(missing.isClientError());
        assertFalse(missing.isServerError());

        assertEquals(1, server.getConnectionCount());
        assertTrue(server.getRequests().get(1).endsWith("\r\n\r\ndata"));
        assertTrue(server.getRequests().get(0).contains("connection: keep-alive\r\n"));
    }

    @Test
    public void trailers() throws Exception {
        server = new LocalServer(line -> "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n"
                + "3\r\nabc\r\n0\r\nX-Checksum: 900150983cd24fb0\r\n\r\n");
        client = HttpClient.create(server.getUrl());

        HttpResponse response = client.request(RequestDescriptor.builder().build()).get(5, TimeUnit.SECONDS);
        assertEquals("abc", response.getBodyString());
        assertEquals(Arrays.asList("X-Checksum", "900150983cd24fb0"), response.getTrailers());
    }

    @Test
    public void streaming() throws Exception {
        server = new LocalServer(line -> "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n"
                + "5\r\nfirst\r\n6\r\nsecond\r\n0\r\n\r\n");
        client = HttpClient.create(server.getUrl());

        List<String> calls = new ArrayList<>();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        CountDownLatch done = new CountDownLatch(1);
        client.stream(RequestDescriptor.builder().opaque("token").build(), new HttpClient.StreamCallbacks() {
            @Override
            public void onResponse(StartResponse response) {
                calls.add("response " + response.getStatusCode() + " " + response.getOpaque());
            }

            @Override
            public void onChunkReceived(byte[] chunk) {
                body.write(chunk, 0, chunk.length);
            }

            @Override
            public void onEndTransfer(List<String> trailers) {
                calls.add("end " + trailers.size());
                done.countDown();
            }

            @Override
            public void onExceptionThrown(Throwable ex) {
                calls.add("error " + ex);
                done.countDown();
            }
        });
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(Arrays.asList("response 200 token", "end 0"), calls);
        assertEquals("firstsecond", body.toString(UTF_8));
    }

    @Test
    public void malformedResponseFailsFuture() throws Exception {
        server = new LocalServer(line -> "SPDY/3 200 OK\r\n\r\n");
        client = HttpClient.create(server.getUrl());

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> client.request(RequestDescriptor.builder().build()).get(5, TimeUnit.SECONDS));
        assertTrue(thrown.getCause() instanceof InvalidResponseException);
    }

    /**
     * Default timeout applies only to requests which don't have their own.
     */
    @Test
    public void defaultTimeout() throws Exception {
        server = new LocalServer(line -> null);
        HttpClient.Config config = new HttpClient.Config();
        config.setRequestTimeout(Duration.ofMillis(100));
        client = HttpClient.create(server.getUrl(), config);

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> client.request(RequestDescriptor.builder().build()).get(5, TimeUnit.SECONDS));
        assertTrue(thrown.getCause() instanceof RequestTimeoutException);
    }

    @Test
    public void abortedRequest() throws Exception {
        server = new LocalServer(line -> null);
        client = HttpClient.create(server.getUrl());
        AbortSignal signal = new AbortSignal();

        RequestDescriptor descriptor = RequestDescriptor.builder().signal(signal).build();
        CompletableFuture<HttpResponse> future = client.request(descriptor);
        signal.abort();
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertTrue(thrown.getCause() instanceof RequestAbortedException);
    }

    @Test
    public void closeFailsPendingRequest() throws Exception {
        server = new LocalServer(line -> null);
        client = HttpClient.create(server.getUrl());

        CompletableFuture<HttpResponse> future = client.request(RequestDescriptor.builder().build());
        client.close();
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertTrue(thrown.getCause() instanceof ConnectionClosedException);
    }

    @Test
    public void invalidRequestThrows() throws Exception {
        server = new LocalServer(line -> null);
        client = HttpClient.create(server.getUrl());
        assertThrows(NotSupportedException.class,
                () -> client.request(RequestDescriptor.builder().method("CONNECT").build()));
        assertThrows(InvalidArgumentException.class,
                () -> client.submit(RequestDescriptor.builder().path("relative").build()));
    }

    @Test
    public void badUrl() {
        assertThrows(MalformedURLException.class, () -> HttpClient.create("ftp://example.com"));
        assertThrows(MalformedURLException.class, () -> HttpClient.create("not a url"));
    }

    @Test
    public void config() {
        HttpClient.Config config = new HttpClient.Config();
        assertEquals(Duration.ZERO, config.getRequestTimeout());
        assertEquals(1, config.getPipelining());
        assertThrows(InvalidConfigException.class, () -> config.setRequestTimeout(Duration.ofSeconds(-1)));
        assertThrows(InvalidConfigException.class, () -> config.setConnectTimeout(Duration.ofMillis(-5)));
        assertThrows(InvalidConfigException.class, () -> config.setMaxHeaderSize(0));
        assertThrows(InvalidConfigException.class, () -> config.setPipelining(0));
        assertThrows(NotSupportedException.class, () -> config.setPipelining(2));
        config.setPipelining(1);
        config.setMaxHeaderSize(1024);
        assertEquals(1024, config.getMaxHeaderSize());
    }

    @Test
    public void responseHelpers() {
        ResponseHeaders headers = new ResponseHeaders();
        headers.add("Content-Type", "text/plain; charset=ISO-8859-1");
        HttpResponse response = new HttpResponse(503, headers, null, new byte[] {(byte) 0xE9}, null);
        assertEquals("é", response.getBodyString());
        assertTrue(response.isError());
        assertTrue(response.isServerError());
        assertFalse(response.isClientError());
        assertTrue(response.getTrailers().isEmpty());
    }
}
