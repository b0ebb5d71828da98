package rs.lukaj.httptransport.connections;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * In-memory transport. Tests play the server: they take what the client wrote and feed back responses.
 */
public class MockTransport implements Transport {
    private static final byte[] EOF = new byte[0];
    private static final long WAIT_SECONDS = 5;

    private final BlockingQueue<byte[]> written = new LinkedBlockingQueue<>();
    private final BlockingQueue<Object> incoming = new LinkedBlockingQueue<>();
    private volatile boolean closed = false;
    private byte[] pending;
    private int pendingOffset;

    @Override
    public void write(byte[] bytes) throws IOException {
        if(closed) throw new IOException("Transport closed");
        written.add(bytes.clone());
    }

    @Override
    public int read(byte[] buf) throws IOException {
        if(pending == null) {
            Object next;
            try {
                next = incoming.take();
            } catch (InterruptedException e) {
                throw new IOException(e);
            }
            if(closed) throw new IOException("Transport closed");
            if(next instanceof IOException) throw (IOException) next;
            if(next == EOF) return -1;
            pending = (byte[]) next;
            pendingOffset = 0;
        }
        int n = Math.min(buf.length, pending.length - pendingOffset);
        System.arraycopy(pending, pendingOffset, buf, 0, n);
        pendingOffset += n;
        if(pendingOffset == pending.length) pending = null;
        return n;
    }

    @Override
    public void close() {
        closed = true;
        incoming.add(EOF); //unblock the reader
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Send bytes to the client.
     */
    public void respond(String data) {
        incoming.add(data.getBytes(ISO_8859_1));
    }

    /**
     * Close the connection from the server's side.
     */
    public void serverClose() {
        incoming.add(EOF);
    }

    /**
     * Make the next read fail.
     */
    public void fail(IOException e) {
        incoming.add(e);
    }

    /**
     * @return next piece written by the client, or null if nothing is written in 5 seconds
     */
    public String nextWrite() throws InterruptedException {
        return nextWrite(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    public String nextWrite(long timeout, TimeUnit unit) throws InterruptedException {
        byte[] bytes = written.poll(timeout, unit);
        return bytes == null ? null : new String(bytes, ISO_8859_1);
    }

    /**
     * Opens mock transports and keeps them, so tests can get to them.
     */
    public static class Factory implements Transport.Factory {
        private final BlockingQueue<MockTransport> opened = new LinkedBlockingQueue<>();
        private final List<String> servernames = new CopyOnWriteArrayList<>();
        private volatile IOException connectFailure;
        private volatile int openCount = 0;

        @Override
        public Transport open(Endpoint endpoint) throws IOException {
            openCount++;
            if(connectFailure != null) throw connectFailure;
            MockTransport transport = new MockTransport();
            opened.add(transport);
            return transport;
        }

        @Override
        public Transport open(Endpoint endpoint, String servername) throws IOException {
            servernames.add(servername);
            return open(endpoint);
        }

        /**
         * @return next transport opened by the client, waiting up to 5 seconds
         */
        public MockTransport nextTransport() throws InterruptedException {
            return opened.poll(WAIT_SECONDS, TimeUnit.SECONDS);
        }

        /**
         * @param failure exception thrown by further attempts to connect, null to let them succeed
         */
        public void failConnecting(IOException failure) {
            this.connectFailure = failure;
        }

        public int getOpenCount() {
            return openCount;
        }

        /**
         * @return server names TLS transports were opened with, in order
         */
        public List<String> getServernames() {
            return servernames;
        }
    }
}
