/**
 * Classes meant to be used by the programmer to make requests.
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.httptransport.client.HttpClient} owns a connection to one server. Requests can be submitted
 * with a raw callback, made with the response read into a {@link rs.lukaj.httptransport.client.HttpResponse},
 * or streamed using {@link rs.lukaj.httptransport.client.HttpClient.StreamCallbacks}.
 */
package rs.lukaj.httptransport.client;
