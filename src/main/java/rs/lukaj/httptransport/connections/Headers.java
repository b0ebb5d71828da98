package rs.lukaj.httptransport.connections;

import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Headers which are sent as a part of the request. Names are kept exactly as given, because they're written to
 * the wire verbatim, and iteration follows insertion order. Lookups through the helper methods are
 * case-insensitive.
 */
public class Headers extends LinkedHashMap<String, String> { //inheriting from a collection, again

    public Headers() {
    }

    public Headers(Map<String, String> headers) {
        if(headers != null) {
            for(Map.Entry<String, String> header : headers.entrySet())
                setHeader(header.getKey(), header.getValue());
        }
    }

    /**
     * Get value of the header identified by the name passed, ignoring case.
     * @param header name of the header
     * @return value of the header, or null if it doesn't exist
     */
    public String getHeader(String header) {
        String key = findKey(header);
        return key == null ? null : get(key);
    }

    /**
     * Put a new header, replacing the existing one with the same (case-insensitive) name if it exists. The
     * replaced header keeps its position, but takes the new name.
     * @param header name of the header
     * @param value value of the header
     * @return previous value of the header, or null if it didn't exist
     */
    public String setHeader(String header, String value) {
        String key = findKey(header);
        if(key == null || key.equals(header)) return super.put(header, value);

        //rebuild to keep ordering, renaming the key in place
        Map<String, String> copy = new LinkedHashMap<>(this);
        clear();
        String previous = null;
        for(Map.Entry<String, String> entry : copy.entrySet()) {
            if(entry.getKey().equals(key)) {
                previous = entry.getValue();
                super.put(header, value);
            } else {
                super.put(entry.getKey(), entry.getValue());
            }
        }
        return previous;
    }

    /**
     * Remove a header if it exists, ignoring case.
     * @param header header name
     * @return previous value of the header, or null if it didn't exist
     */
    public String removeHeader(String header) {
        String key = findKey(header);
        return key == null ? null : remove(key);
    }

    /**
     * Check whether header exists, ignoring case.
     * @param header header name
     * @return true if it exists, false otherwise
     */
    public boolean hasHeader(String header) {
        return findKey(header) != null;
    }

    private String findKey(String header) {
        if(header == null) return null;
        if(containsKey(header)) return header;
        for(String key : keySet()) {
            if(key.equalsIgnoreCase(header)) return key;
        }
        return null;
    }

    /**
     * Returns headers in format appropriate for sending, with trailing CRLF.
     * @return String representation of headers
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(size() * 32);
        for(Map.Entry<String, String> header : entrySet()) {
            builder.append(header.getKey()).append(": ").append(header.getValue()).append("\r\n");
        }
        return builder.toString();
    }
}
