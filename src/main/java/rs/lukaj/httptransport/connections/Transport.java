package rs.lukaj.httptransport.connections;

import java.io.Closeable;
import java.io.IOException;

/**
 * Byte stream to the server over which requests are written and responses read. Writes and reads happen on
 * different threads; closing the transport must unblock a pending read.
 */
public interface Transport extends Closeable {

    /**
     * Send all bytes to the server.
     * @param bytes data to send
     * @throws IOException if transport has been closed or writing fails
     */
    void write(byte[] bytes) throws IOException;

    /**
     * Read some bytes. Blocks until at least one byte is available.
     * @param buf buffer to read into
     * @return number of bytes read, or -1 if server has closed the connection
     * @throws IOException if reading fails or transport has been closed
     */
    int read(byte[] buf) throws IOException;

    /**
     * Opens transports to an endpoint.
     */
    interface Factory {
        Transport open(Endpoint endpoint) throws IOException;

        /**
         * Open a transport which checks the server's identity against the given name. Factories which don't do
         * TLS have nothing to check and can leave this as it is.
         * @param endpoint server to connect to
         * @param servername name for server name indication and certificate checks, null if server is addressed
         *                   by IP
         */
        default Transport open(Endpoint endpoint, String servername) throws IOException {
            return open(endpoint);
        }
    }
}
