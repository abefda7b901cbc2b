package org.twitchwrapper.helix;

import java.time.Instant;

/**
 * Rate limit information from the {@code Ratelimit-*} headers of a Helix response.
 *
 * @param limit the size of the token bucket
 * @param remaining the number of points left in the bucket
 * @param reset when the bucket is refilled (epoch seconds)
 */
public record RateLimitInfo(int limit, int remaining, long reset) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the bucket is empty.
	 * @return true if no points remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
