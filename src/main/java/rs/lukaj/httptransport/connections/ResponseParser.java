package rs.lukaj.httptransport.connections;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Incremental HTTP/1.x response parser. Bytes are fed as they arrive, in pieces of any size, and recognised
 * {@link ParseEvent}s are pushed to the listener immediately, so events preceding a malformed part of the
 * stream are still delivered before the exception is thrown.
 * <br/>
 * The parser handles one message at a time: {@link #expectResponse(boolean)} arms it, and after
 * {@link ParseEvent.MessageComplete} it goes back to idle. Receiving bytes while idle is a protocol violation,
 * because no request is waiting for them.
 */
public class ResponseParser {
    public static final int DEFAULT_MAX_HEADER_SIZE = 16 * 1024;

    private enum State {
        IDLE,
        STATUS_LINE,
        HEADERS,
        BODY_FIXED,
        BODY_UNTIL_CLOSE,
        CHUNK_SIZE,
        CHUNK_DATA,
        CHUNK_DATA_END,
        TRAILERS
    }

    private final int maxHeaderSize;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(128);

    private State state = State.IDLE;
    private boolean hasBody = true;
    private int headerBytes;
    private Http.Version version;
    private int statusCode;
    private String reasonPhrase;
    private ResponseHeaders headers;
    private List<String> trailers;
    private long remaining;

    public ResponseParser() {
        this(DEFAULT_MAX_HEADER_SIZE);
    }

    /**
     * @param maxHeaderSize maximum size of a response head (status line and headers) or trailer section, in bytes
     */
    public ResponseParser(int maxHeaderSize) {
        if(maxHeaderSize < 1) throw new InvalidConfigException("maxHeaderSize must be positive!");
        this.maxHeaderSize = maxHeaderSize;
    }

    /**
     * Prepare for the response to a request which has just been sent.
     * @param hasBody false if the response can't have a body no matter what its headers say (i.e. response to HEAD)
     */
    public void expectResponse(boolean hasBody) {
        reset();
        this.hasBody = hasBody;
        state = State.STATUS_LINE;
    }

    /**
     * Drop whatever was parsed so far and go idle.
     */
    public void reset() {
        state = State.IDLE;
        line.reset();
        hasBody = true;
        headerBytes = 0;
        version = null;
        statusCode = 0;
        reasonPhrase = null;
        headers = null;
        trailers = null;
        remaining = 0;
    }

    /**
     * @return true if no message is expected or in progress
     */
    public boolean isIdle() {
        return state == State.IDLE;
    }

    /**
     * Parse a piece of the response stream.
     * @param data buffer holding the bytes
     * @param offset index of the first byte
     * @param length number of bytes
     * @param listener receives events in the order they're recognised
     * @throws InvalidResponseException if the stream is malformed, or data arrives while idle
     */
    public void execute(byte[] data, int offset, int length, Consumer<ParseEvent> listener) {
        int pos = offset;
        int end = offset + length;
        while(pos < end) {
            switch (state) {
                case IDLE:
                    throw new InvalidResponseException("Received " + (end - pos)
                            + " bytes of response data while no response was expected");
                case BODY_FIXED:
                case CHUNK_DATA: {
                    int n = (int) Math.min(remaining, end - pos);
                    listener.accept(new ParseEvent.BodyChunk(Arrays.copyOfRange(data, pos, pos + n)));
                    pos += n;
                    remaining -= n;
                    if(remaining == 0) {
                        if(state == State.BODY_FIXED) completeMessage(listener);
                        else state = State.CHUNK_DATA_END;
                    }
                    break;
                }
                case BODY_UNTIL_CLOSE:
                    listener.accept(new ParseEvent.BodyChunk(Arrays.copyOfRange(data, pos, end)));
                    pos = end;
                    break;
                default: //line-oriented states
                    pos = readLine(data, pos, end, listener);
            }
        }
    }

    /**
     * Signal that the connection has been closed by the server.
     * @param listener receives the final event, if the body was delimited by connection close
     * @throws InvalidResponseException if a message was expected or in progress and isn't complete
     */
    public void finish(Consumer<ParseEvent> listener) {
        switch (state) {
            case IDLE:
                return;
            case BODY_UNTIL_CLOSE:
                completeMessage(listener);
                return;
            case STATUS_LINE:
                if(headers == null && line.size() == 0)
                    throw new InvalidResponseException("Connection closed before response was received");
                //fall through: we're in the middle of a status line
            default:
                throw new InvalidResponseException("Connection closed before response was complete");
        }
    }

    //consumes at most one line, returns the index of the first unconsumed byte
    private int readLine(byte[] data, int pos, int end, Consumer<ParseEvent> listener) {
        int lf = pos;
        while(lf < end && data[lf] != '\n') lf++;
        int taken = (lf < end ? lf + 1 : end) - pos;
        if(countsTowardsHead()) {
            headerBytes += taken;
            if(headerBytes > maxHeaderSize)
                throw new InvalidResponseException("Response header section larger than " + maxHeaderSize + " bytes");
        } else if(line.size() + taken > maxHeaderSize) {
            throw new InvalidResponseException("Chunk size line too long");
        }

        if(lf == end) {
            line.write(data, pos, end - pos);
            return end;
        }
        line.write(data, pos, lf - pos);
        //lines end with CRLF, but we're tolerating bare LF as well
        byte[] bytes = line.toByteArray();
        int len = bytes.length;
        if(len > 0 && bytes[len - 1] == '\r') len--;
        line.reset();
        onLine(new String(bytes, 0, len, UTF_8), listener);
        return lf + 1;
    }

    private boolean countsTowardsHead() {
        return state == State.STATUS_LINE || state == State.HEADERS || state == State.TRAILERS;
    }

    private void onLine(String text, Consumer<ParseEvent> listener) {
        switch (state) {
            case STATUS_LINE:
                if(text.isEmpty()) return; //stray CRLF before the status line is allowed
                parseStatusLine(text);
                headers = new ResponseHeaders();
                state = State.HEADERS;
                break;
            case HEADERS:
                if(text.isEmpty()) headersDone(listener);
                else {
                    String[] header = parseHeaderLine(text);
                    headers.add(header[0], header[1]);
                }
                break;
            case CHUNK_SIZE:
                long size = parseChunkSize(text);
                if(size == 0) {
                    trailers = new ArrayList<>();
                    headerBytes = 0;
                    state = State.TRAILERS;
                } else {
                    remaining = size;
                    state = State.CHUNK_DATA;
                }
                break;
            case CHUNK_DATA_END:
                if(!text.isEmpty()) throw new InvalidResponseException("Ill-formed chunk: no CRLF at the end");
                state = State.CHUNK_SIZE;
                break;
            case TRAILERS:
                if(text.isEmpty()) completeMessage(listener);
                else {
                    String[] trailer = parseHeaderLine(text);
                    trailers.add(trailer[0]);
                    trailers.add(trailer[1]);
                }
                break;
            default:
                throw new IllegalStateException("Not expecting a line in state " + state);
        }
    }

    private void parseStatusLine(String text) {
        String[] tokens = text.split(" ", 3);
        if(tokens.length < 2) throw new InvalidResponseException("Malformed status line: " + text);
        if(!tokens[0].startsWith("HTTP/")) throw new InvalidResponseException("Invalid HTTP version: " + tokens[0]);
        version = Http.Version.of(tokens[0]);
        if(version == null) throw new InvalidResponseException("Unsupported HTTP version: " + tokens[0]);
        if(!version.isSupported())
            System.err.println("Warning: invalid HTTP version returned by server: " + version);
        if(tokens[1].length() != 3) throw new InvalidResponseException("Invalid status code: " + tokens[1]);
        try {
            statusCode = Integer.parseInt(tokens[1]);
        } catch (NumberFormatException e) {
            throw new InvalidResponseException("Invalid status code: " + tokens[1], e);
        }
        if(statusCode < 100) throw new InvalidResponseException("Invalid status code: " + tokens[1]);
        reasonPhrase = tokens.length == 3 ? tokens[2] : "";
    }

    private static String[] parseHeaderLine(String text) {
        if(text.charAt(0) == ' ' || text.charAt(0) == '\t')
            throw new InvalidResponseException("Obsolete header line folding is not supported");
        int colon = text.indexOf(':');
        if(colon <= 0) throw new InvalidResponseException("Malformed header line: " + text);
        String name = text.substring(0, colon);
        for(int i=0; i<name.length(); i++) {
            if(Character.isWhitespace(name.charAt(i)))
                throw new InvalidResponseException("Whitespace in header name: " + name);
        }
        return new String[] {name, text.substring(colon + 1).trim()};
    }

    private static long parseChunkSize(String text) {
        int semicolon = text.indexOf(';'); //chunk extensions are ignored
        String size = (semicolon >= 0 ? text.substring(0, semicolon) : text).trim();
        if(size.isEmpty() || size.length() > 15 || size.charAt(0) == '-' || size.charAt(0) == '+')
            throw new InvalidResponseException("Invalid chunk size: " + text);
        try {
            return Long.parseLong(size, 16);
        } catch (NumberFormatException e) {
            throw new InvalidResponseException("Invalid chunk size: " + text, e);
        }
    }

    private void headersDone(Consumer<ParseEvent> listener) {
        if(statusCode < 200) {
            if(statusCode == 101) throw new InvalidResponseException("Protocol upgrade (101) is not supported");
            //informational response, the real one follows
            ResponseHeaders informational = headers;
            headers = null;
            headerBytes = 0;
            state = State.STATUS_LINE;
            listener.accept(new ParseEvent.HeadersComplete(statusCode, reasonPhrase, informational, true));
            return;
        }

        boolean keepAlive = isKeepAlive();
        if(!hasBody || statusCode == 204 || statusCode == 304) {
            listener.accept(new ParseEvent.HeadersComplete(statusCode, reasonPhrase, headers, keepAlive));
            completeMessage(listener);
            return;
        }

        List<String> codings = headers.getValues("Transfer-Encoding");
        if(!codings.isEmpty()) {
            String all = String.join(",", codings).toLowerCase(Locale.ROOT);
            String[] tokens = all.split(",");
            if(tokens[tokens.length - 1].trim().equals("chunked")) {
                state = State.CHUNK_SIZE;
            } else { //length is unknown, server has to close the connection
                keepAlive = false;
                state = State.BODY_UNTIL_CLOSE;
            }
            listener.accept(new ParseEvent.HeadersComplete(statusCode, reasonPhrase, headers, keepAlive));
            return;
        }

        long contentLength = parseContentLength();
        if(contentLength < 0) {
            keepAlive = false;
            state = State.BODY_UNTIL_CLOSE;
            listener.accept(new ParseEvent.HeadersComplete(statusCode, reasonPhrase, headers, keepAlive));
        } else {
            listener.accept(new ParseEvent.HeadersComplete(statusCode, reasonPhrase, headers, keepAlive));
            if(contentLength == 0) {
                completeMessage(listener);
            } else {
                remaining = contentLength;
                state = State.BODY_FIXED;
            }
        }
    }

    private boolean isKeepAlive() {
        String connection = String.join(",", headers.getValues("Connection")).toLowerCase(Locale.ROOT);
        if(connection.contains("close")) return false;
        return version != Http.Version.HTTP10 || connection.contains("keep-alive");
    }

    //-1 if not present
    private long parseContentLength() {
        long length = -1;
        for(String value : headers.getValues("Content-Length")) {
            for(String token : value.split(",")) {
                long parsed;
                try {
                    parsed = Long.parseLong(token.trim());
                } catch (NumberFormatException e) {
                    throw new InvalidResponseException("Invalid Content-Length: " + value, e);
                }
                if(parsed < 0) throw new InvalidResponseException("Invalid Content-Length: " + value);
                if(length != -1 && length != parsed)
                    throw new InvalidResponseException("Conflicting Content-Length values");
                length = parsed;
            }
        }
        return length;
    }

    private void completeMessage(Consumer<ParseEvent> listener) {
        List<String> messageTrailers = trailers;
        reset();
        listener.accept(new ParseEvent.MessageComplete(messageTrailers));
    }
}
