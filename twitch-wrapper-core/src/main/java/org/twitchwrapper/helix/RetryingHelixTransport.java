package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Decorator that adds retry with backoff to a {@link HelixTransport}.
 *
 * <p>
 * Never installed by default; callers opt in through
 * {@link HelixClientBuilder#transport(HelixTransport)}. Retried:
 * <ul>
 * <li>transport failures ({@link HelixErrorKind#REQUEST_FAILED}), with exponential
 * backoff</li>
 * <li>5xx responses, with exponential backoff</li>
 * <li>429 Too Many Requests, waiting until {@code Ratelimit-Reset} when the header is
 * present</li>
 * </ul>
 * Any other response is handed back unchanged. When retries run out the last response is
 * returned (or the last failure rethrown) so the executor classifies it as usual.
 *
 * <pre>
 * {@code
 * HelixTransport transport = RetryingHelixTransport.builder()
 *     .wrapping(new JdkHelixTransport())
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofMillis(500))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingHelixTransport implements HelixTransport {

	private static final Logger logger = LoggerFactory.getLogger(RetryingHelixTransport.class);

	/**
	 * Longest wait for a rate limit reset. Helix refills its bucket every minute, so a
	 * larger value means a bogus header and exponential backoff is used instead.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 120;

	private final HelixTransport delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingHelixTransport(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	/**
	 * Create a new builder for RetryingHelixTransport.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	@Override
	public TransportResponse send(HttpMethod method, String url, Map<String, String> headers,
			List<QueryParam> query) {
		String description = method + " " + url;
		long delay = initialDelayMs;
		int attempt = 0;

		while (true) {
			TransportResponse response;
			try {
				response = delegate.send(method, url, headers, query);
			}
			catch (HelixApiException e) {
				if (e.getKind() != HelixErrorKind.REQUEST_FAILED) {
					throw e;
				}
				if (attempt >= maxRetries) {
					logger.error("{} failed after {} attempts", description, attempt + 1);
					throw e;
				}
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), delay);
				sleep(delay);
				delay *= 2;
				attempt++;
				continue;
			}

			if (!isRetryableStatus(response.statusCode())) {
				return response;
			}
			if (attempt >= maxRetries) {
				logger.error("{} returned {} after {} attempts", description, response.statusCode(), attempt + 1);
				return response;
			}
			long waitMs = computeWaitTime(response, delay);
			logger.warn("{} returned {} (attempt {}/{}). Waiting {}ms...", description, response.statusCode(),
					attempt + 1, maxRetries + 1, waitMs);
			sleep(waitMs);
			delay *= 2;
			attempt++;
		}
	}

	static boolean isRetryableStatus(int statusCode) {
		return statusCode == 429 || (statusCode >= 500 && statusCode < 600);
	}

	/**
	 * Wait until the bucket resets (+1s) for a 429 with a usable reset header, otherwise
	 * the current backoff delay.
	 */
	private long computeWaitTime(TransportResponse response, long defaultDelay) {
		RateLimitInfo rateLimit = response.rateLimit();
		if (response.statusCode() == 429 && rateLimit != null && rateLimit.reset() > 0) {
			long waitSeconds = rateLimit.reset() - Instant.now().getEpochSecond() + 1;
			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						rateLimit.reset());
				return waitSeconds * 1000;
			}
		}
		return defaultDelay;
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new HelixApiException(HelixErrorKind.REQUEST_FAILED, "Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingHelixTransport}.
	 *
	 * <p>
	 * Defaults: 3 retries, 1 second initial delay.
	 */
	public static class Builder {

		private @Nullable HelixTransport delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the transport to wrap with retry logic.
		 * @param transport the transport to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(HelixTransport transport) {
			this.delegate = transport;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between retries in milliseconds.
		 * @param delayMs initial delay (doubles on each retry, default: 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingHelixTransport.
		 * @return configured RetryingHelixTransport
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingHelixTransport build() {
			if (delegate == null) {
				throw new IllegalStateException("A HelixTransport to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingHelixTransport(this);
		}

	}

}
