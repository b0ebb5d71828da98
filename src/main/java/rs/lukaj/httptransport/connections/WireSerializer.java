package rs.lukaj.httptransport.connections;

import java.io.ByteArrayOutputStream;
import java.util.Map;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Turns requests into bytes which are written to the transport. Doesn't do any I/O.
 * <br/>
 * Content-Length is never computed from the body: it's only sent if the caller supplied it. Framing the body
 * correctly is caller's job.
 */
public class WireSerializer {
    private static final String CRLF = "\r\n";

    private WireSerializer() {
    }

    /**
     * Synthesized request line and headers, without the terminating blank line and without Content-Length, which
     * is kept separately. Immutable.
     */
    public static final class HeaderBlock {
        private final byte[] bytes;
        private final Long contentLength;

        private HeaderBlock(byte[] bytes, Long contentLength) {
            this.bytes = bytes;
            this.contentLength = contentLength;
        }

        /**
         * @return copy of the block bytes
         */
        public byte[] getBytes() {
            return bytes.clone();
        }

        /**
         * @return value of the Content-Length header if supplied, null otherwise
         */
        public Long getContentLength() {
            return contentLength;
        }

        public int length() {
            return bytes.length;
        }

        private void writeTo(ByteArrayOutputStream out) {
            out.write(bytes, 0, bytes.length);
        }

        @Override
        public String toString() {
            return new String(bytes, UTF_8);
        }
    }

    /**
     * Build request line and header lines. Headers are written in iteration order, exactly as given, except
     * Content-Length, which is parsed and stored. If there's no Host header, one is added using the hostname.
     * Connection: keep-alive is always added.
     * @param method request method
     * @param path request target
     * @param headers headers to send, can be null
     * @param hostname hostname of the server, used if there's no Host header
     * @return header block
     * @throws InvalidArgumentException if Content-Length isn't a non-negative integer, if it's given twice with
     * different values, or if a header contains a line break
     */
    public static HeaderBlock headerBlock(String method, String path, Map<String, String> headers, String hostname) {
        StringBuilder block = new StringBuilder(64 + (headers == null ? 0 : headers.size() * 32));
        block.append(method).append(' ').append(path).append(" HTTP/1.1").append(CRLF);

        Long contentLength = null;
        boolean hasHost = false;
        if(headers != null) {
            for(Map.Entry<String, String> header : headers.entrySet()) {
                String name = header.getKey();
                String value = header.getValue();
                checkHeader(name, value);

                if("content-length".equalsIgnoreCase(name)) {
                    long length = parseContentLength(value);
                    if(contentLength != null && contentLength != length)
                        throw new InvalidArgumentException("Conflicting content-length values: " + contentLength
                                + " and " + length);
                    contentLength = length;
                } else {
                    if("host".equalsIgnoreCase(name)) hasHost = true;
                    block.append(name).append(": ").append(value).append(CRLF);
                }
            }
        }
        if(!hasHost) block.append("host: ").append(hostname).append(CRLF);
        block.append("connection: keep-alive").append(CRLF);

        return new HeaderBlock(block.toString().getBytes(ISO_8859_1), contentLength);
    }

    /**
     * Produce everything written for a request before any streamed body data: header block, Content-Length
     * if one was supplied, blank line and buffered body, if any.
     * @param request request to serialize
     * @return bytes to write
     */
    public static byte[] serialize(RequestState request) {
        HeaderBlock block = request.getHeaderBlock();
        byte[] body = request.getBufferedBody();
        ByteArrayOutputStream out = new ByteArrayOutputStream(block.length() + 32 + (body == null ? 0 : body.length));
        block.writeTo(out);
        if(block.getContentLength() != null)
            writeAscii(out, "content-length: " + block.getContentLength() + CRLF);
        writeAscii(out, CRLF);
        if(body != null) out.write(body, 0, body.length);
        return out.toByteArray();
    }

    private static void writeAscii(ByteArrayOutputStream out, String text) {
        byte[] bytes = text.getBytes(ISO_8859_1);
        out.write(bytes, 0, bytes.length);
    }

    private static void checkHeader(String name, String value) {
        if(name == null || name.isEmpty())
            throw new InvalidArgumentException("Header name can't be empty");
        if(value == null)
            throw new InvalidArgumentException("Value of header " + name + " can't be null");
        if(hasLineBreak(name) || hasLineBreak(value))
            throw new InvalidArgumentException("Header " + name + " contains a line break");
    }

    private static boolean hasLineBreak(String text) {
        return text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0;
    }

    private static long parseContentLength(String value) {
        long length;
        try {
            length = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid content-length: " + value, e);
        }
        if(length < 0) throw new InvalidArgumentException("Invalid content-length: " + value);
        return length;
    }
}
