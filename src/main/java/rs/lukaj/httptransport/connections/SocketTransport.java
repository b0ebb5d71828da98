package rs.lukaj.httptransport.connections;

import javax.net.SocketFactory;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Collections;

/**
 * Transport over a plain or TLS socket. TLS uses JVM's default certificates and configuration; server name
 * indication and hostname verification use the requested server name, which defaults to the endpoint's hostname.
 * If there's no name (server is addressed by IP), hostname isn't verified.
 */
public class SocketTransport implements Transport {
    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;

    /**
     * Connect a new socket to a given endpoint, checking TLS certificate against the endpoint's hostname.
     * @param endpoint endpoint for the socket
     * @param connectTimeout how long to wait for the connection to be established, zero means forever
     * @throws IOException if connecting or TLS handshake fails
     */
    public SocketTransport(Endpoint endpoint, Duration connectTimeout) throws IOException {
        this(endpoint, Endpoint.isIpLiteral(endpoint.getHost()) ? null : endpoint.getHost(), connectTimeout);
    }

    /**
     * Connect a new socket to a given endpoint.
     * @param endpoint endpoint for the socket
     * @param servername name sent in SNI and checked against the certificate; null skips both. Ignored for http.
     * @param connectTimeout how long to wait for the connection to be established, zero means forever
     * @throws IOException if connecting or TLS handshake fails
     */
    public SocketTransport(Endpoint endpoint, String servername, Duration connectTimeout) throws IOException {
        InetSocketAddress address = new InetSocketAddress(endpoint.getHost(), endpoint.getPort());
        Socket plain = SocketFactory.getDefault().createSocket();
        try {
            plain.connect(address, (int) connectTimeout.toMillis());
            if(!endpoint.isHttps()) {
                socket = plain;
            } else {
                String peerName = servername != null ? servername : endpoint.getHost();
                SSLSocket sslSocket = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
                        .createSocket(plain, peerName, endpoint.getPort(), true);
                if(servername != null) {
                    SSLParameters parameters = sslSocket.getSSLParameters();
                    parameters.setServerNames(Collections.singletonList(new SNIHostName(servername)));
                    parameters.setEndpointIdentificationAlgorithm("HTTPS");
                    sslSocket.setSSLParameters(parameters);
                }
                sslSocket.startHandshake();
                socket = sslSocket;
            }
        } catch (IOException | RuntimeException e) { //RuntimeException: servername isn't a valid hostname
            plain.close();
            throw e;
        }
        socket.setTcpNoDelay(true);
        input = socket.getInputStream();
        output = socket.getOutputStream();
    }

    /**
     * @param connectTimeout how long to wait for a connection, zero means forever
     * @return factory opening socket transports
     */
    public static Transport.Factory factory(Duration connectTimeout) {
        return new Transport.Factory() {
            @Override
            public Transport open(Endpoint endpoint) throws IOException {
                return new SocketTransport(endpoint, connectTimeout);
            }

            @Override
            public Transport open(Endpoint endpoint, String servername) throws IOException {
                return new SocketTransport(endpoint, servername, connectTimeout);
            }
        };
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        output.write(bytes);
        output.flush();
    }

    @Override
    public int read(byte[] buf) throws IOException {
        return input.read(buf);
    }

    /**
     * Returns whether the underlying socket is closed.
     * @return true if socket is closed, false otherwise
     */
    public boolean isClosed() {
        return socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
