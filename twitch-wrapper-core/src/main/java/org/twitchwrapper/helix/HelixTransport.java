package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Interface for the HTTP capability used by the request executor.
 *
 * <p>
 * Performs exactly one request and reports whatever status the server returned.
 * Status interpretation belongs to {@link HelixRequestExecutor}, which keeps
 * implementations swappable for tests and decorators ({@link RetryingHelixTransport}).
 */
public interface HelixTransport {

	/**
	 * Perform a single HTTP request.
	 * @param method the HTTP method
	 * @param url the absolute URL without query string
	 * @param headers request headers to attach
	 * @param query query pairs, appended in order
	 * @return status code and body of the response
	 * @throws HelixApiException of kind {@link HelixErrorKind#REQUEST_FAILED} if no
	 * response could be obtained
	 */
	TransportResponse send(HttpMethod method, String url, Map<String, String> headers, List<QueryParam> query);

	/**
	 * Get the rate limit information from the most recent response. Returns null if no
	 * rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
