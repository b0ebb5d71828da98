package rs.lukaj.httptransport.connections;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Objects;

/**
 * Endpoint to which a connection is connected. Consists of host and port. Hostname is resolved only when the
 * transport is opened.
 */
public class Endpoint {
    private final String host;
    private final int port;
    private final boolean https;

    /**
     * Create a new endpoint
     * @param host hostname of the server
     * @param port port on which to connect (e.g. 80 for HTTP, 443 for HTTPS)
     * @param isHttps should the connection be over TLS
     */
    public Endpoint(String host, int port, boolean isHttps) {
        if(host == null) throw new NullPointerException("Host can't be null!");
        if(port <= 0 || port > 65535) throw new IllegalArgumentException("Invalid port: " + port);
        this.host = host;
        this.port = port;
        this.https = isHttps;
    }

    /**
     * Create Endpoint from URL passed as string
     * @param urlAddress URL to which this endpoint should point
     * @return new Endpoint for the given address
     * @throws MalformedURLException if address is malformed
     */
    public static Endpoint fromUrl(String urlAddress) throws MalformedURLException {
        return fromUrl(new URL(urlAddress));
    }

    /**
     * Create Endpoint from URL passed. If not present, port will be inferred from protocol. Path and query are
     * ignored.
     * @param url URL to which this endpoint should point
     * @return new Endpoint for given address
     * @throws MalformedURLException if protocol is neither http nor https, or there's no host
     */
    public static Endpoint fromUrl(URL url) throws MalformedURLException {
        String protocol = url.getProtocol();
        if(!protocol.equals("http") && !protocol.equals("https"))
            throw new MalformedURLException("Unknown protocol: " + protocol);
        if(url.getHost() == null || url.getHost().isEmpty())
            throw new MalformedURLException("No host in " + url);
        int port = url.getPort();
        if(port == -1) port = protocol.equals("https") ? 443 : 80;
        String host = url.getHost();
        //URL keeps the brackets around IPv6 addresses, sockets don't want them
        if(host.startsWith("[") && host.endsWith("]")) host = host.substring(1, host.length() - 1);
        return new Endpoint(host, port, protocol.equals("https"));
    }

    /**
     * Remove the port from a Host-style authority. Brackets around IPv6 addresses are removed as well; an
     * unbracketed name with more than one colon is taken to be a bare IPv6 address and returned as-is.
     * @param authority hostname, possibly followed by ":port"
     * @return hostname only
     */
    public static String stripPort(String authority) {
        if(authority.startsWith("[")) {
            int end = authority.indexOf(']');
            return end < 0 ? authority.substring(1) : authority.substring(1, end);
        }
        int colon = authority.indexOf(':');
        if(colon < 0 || authority.indexOf(':', colon + 1) >= 0) return authority;
        return authority.substring(0, colon);
    }

    /**
     * Check whether the name is an IPv4 or IPv6 address rather than a hostname. Doesn't do any lookups.
     * @param name hostname, possibly with a port
     * @return true if the name is an IP address
     */
    public static boolean isIpLiteral(String name) {
        if(name.startsWith("[")) return true; //bracketed IPv6, possibly with a port
        int colons = 0;
        for(int i = 0; i < name.length(); i++)
            if(name.charAt(i) == ':') colons++;
        if(colons >= 2) return true;

        String address = colons == 1 ? name.substring(0, name.indexOf(':')) : name;
        String[] parts = address.split("\\.", -1);
        if(parts.length != 4) return false;
        for(String part : parts) {
            if(part.isEmpty() || part.length() > 3) return false;
            for(int i = 0; i < part.length(); i++)
                if(!Character.isDigit(part.charAt(i))) return false;
            if(Integer.parseInt(part) > 255) return false;
        }
        return true;
    }

    public int getPort() {
        return port;
    }
    public String getHost() {
        return host;
    }
    public boolean isHttps() {
        return https;
    }

    /**
     * @return value for the Host header: hostname, with port if it isn't the default one for the protocol
     */
    public String getAuthority() {
        String name = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
        if(port == (https ? 443 : 80)) return name;
        return name + ":" + port;
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof Endpoint)) return false;
        Endpoint other = (Endpoint)obj;
        return port == other.port && https == other.https && host.equalsIgnoreCase(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host.toLowerCase(), port, https);
    }

    @Override
    public String toString() {
        return (https ? "https://" : "http://") + getAuthority();
    }
}
