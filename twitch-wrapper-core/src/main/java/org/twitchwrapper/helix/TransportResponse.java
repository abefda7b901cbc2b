package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;

/**
 * Raw outcome of one HTTP round trip.
 *
 * @param statusCode the HTTP status code
 * @param body the response body decoded as UTF-8 text
 * @param rateLimit rate limit headers of the response, or null if absent
 */
public record TransportResponse(int statusCode, String body, @Nullable RateLimitInfo rateLimit) {

	public TransportResponse(int statusCode, String body) {
		this(statusCode, body, null);
	}

	public boolean isSuccess() {
		return statusCode >= 200 && statusCode < 300;
	}

}
