/**
 * This package implements low-level communication with server.
 * More high-level (i.e. usable) stuff is located inside the client package.
 *
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.httptransport.connections.Transport} (implemented as
 * {@link rs.lukaj.httptransport.connections.SocketTransport}) moves raw bytes to and from the server. Doesn't
 * actually implement any HTTP.
 * <br/>
 * {@link rs.lukaj.httptransport.connections.WireSerializer} turns requests into bytes and
 * {@link rs.lukaj.httptransport.connections.ResponseParser} turns bytes back into responses, piece by piece.
 * <br/>
 * {@link rs.lukaj.httptransport.connections.RequestState} follows a single request from submission to the last
 * byte of its response, including timeouts and cancellation, and makes sure the caller hears about the outcome
 * exactly once.
 * <br/>
 * {@link rs.lukaj.httptransport.connections.Connection} queues requests and sends them over one transport, one
 * at a time, matching responses to requests in order.
 */
package rs.lukaj.httptransport.connections;
