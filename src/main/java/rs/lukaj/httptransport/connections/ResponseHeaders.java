package rs.lukaj.httptransport.connections;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Headers which are received from server (or trailers following a chunked body). Keeps the raw, ordered
 * name/value pairs as well as a folded view: the first occurrence of a name holds a single value, and every
 * repeated occurrence turns it into an ordered list. Folding is the same for every header name; joining or
 * splitting values is left to whoever knows what the header means. Names are case-insensitive.
 */
public class ResponseHeaders {
    private final List<String> raw = new ArrayList<>();
    private final Map<String, List<String>> folded = new LinkedHashMap<>();

    public ResponseHeaders() {
    }

    /**
     * Build headers from alternating name/value entries, e.g. {@code ["Host", "a", "Accept", "b"]}.
     * @param pairs alternating names and values
     * @return folded headers
     */
    public static ResponseHeaders fromPairs(List<String> pairs) {
        if(pairs.size() % 2 != 0) throw new IllegalArgumentException("Header pairs must have even length");
        ResponseHeaders headers = new ResponseHeaders();
        for(int i=0; i<pairs.size(); i+=2)
            headers.add(pairs.get(i), pairs.get(i+1));
        return headers;
    }

    /**
     * Append a header, applying the fold rule.
     * @param name header name, as received
     * @param value header value
     */
    public void add(String name, String value) {
        raw.add(name);
        raw.add(value);
        folded.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>(1)).add(value);
    }

    /**
     * @param name header name
     * @return first value of the header, or null if it wasn't received
     */
    public String getHeader(String name) {
        List<String> values = folded.get(name.toLowerCase(Locale.ROOT));
        return values == null ? null : values.get(0);
    }

    /**
     * @param name header name
     * @return every value of the header in order of arrival; empty if it wasn't received
     */
    public List<String> getValues(String name) {
        List<String> values = folded.get(name.toLowerCase(Locale.ROOT));
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    /**
     * @param name header name
     * @return whether the header was received more than once (i.e. its folded value is a list)
     */
    public boolean isRepeated(String name) {
        return getValues(name).size() > 1;
    }

    public boolean hasHeader(String name) {
        return folded.containsKey(name.toLowerCase(Locale.ROOT));
    }

    /**
     * @return lowercase names of received headers, in order of first arrival
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(folded.keySet());
    }

    /**
     * @return alternating name/value entries exactly as received
     */
    public List<String> getRawPairs() {
        return Collections.unmodifiableList(raw);
    }

    public int size() {
        return raw.size() / 2;
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }

    public String getConnection() {
        return getHeader("Connection");
    }
    public String getContentLength() {
        return getHeader("Content-Length");
    }
    public String getTransferEncoding() {
        return getHeader("Transfer-Encoding");
    }
    public String getContentType() {
        return getHeader("Content-Type");
    }
    public String getContentEncoding() {
        return getHeader("Content-Encoding");
    }
    public String getLocation() {
        return getHeader("Location");
    }
    public String getCharset() {
        String contentType = getContentType();
        if(contentType == null) return null;
        String[] tokens = contentType.split("(?i)charset=", 2);
        if(tokens.length == 1) return null;
        return tokens[1].split("[;\\s]")[0].replace("\"", "");
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof ResponseHeaders)) return false;
        return raw.equals(((ResponseHeaders) o).raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    /**
     * Returns headers in the same format they were received, with trailing CRLF.
     * @return String representation of headers
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(raw.size() * 16);
        for(int i=0; i<raw.size(); i+=2) {
            builder.append(raw.get(i)).append(": ").append(raw.get(i+1)).append("\r\n");
        }
        return builder.toString();
    }
}
