package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link HelixTransport} backed by the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Extracts the Helix rate limit headers from every response and makes them available via
 * {@link #getLastRateLimitInfo()}.
 */
public class JdkHelixTransport implements HelixTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHelixTransport.class);

	public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private static final int LOW_RATE_LIMIT_THRESHOLD = 20;

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public JdkHelixTransport() {
		this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
	}

	public JdkHelixTransport(Duration connectTimeout, Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public TransportResponse send(HttpMethod method, String url, Map<String, String> headers,
			List<QueryParam> query) {
		URI uri;
		HttpRequest.Builder builder;
		try {
			uri = buildUri(url, query);
			builder = HttpRequest.newBuilder()
				.uri(uri)
				.timeout(requestTimeout)
				.header("Accept", "application/json")
				.method(method.name(), HttpRequest.BodyPublishers.noBody());
		}
		catch (IllegalArgumentException e) {
			throw new HelixApiException(HelixErrorKind.REQUEST_FAILED,
					"Cannot build request URI from " + url + ": " + e.getMessage(), e);
		}
		headers.forEach(builder::header);

		logger.debug("{} {}", method, uri);
		long start = System.currentTimeMillis();
		try {
			HttpResponse<String> response = httpClient.send(builder.build(),
					HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
			RateLimitInfo rateLimit = extractRateLimit(response);
			logger.debug("{} {} -> {} in {}ms ({} bytes)", method, uri, response.statusCode(),
					System.currentTimeMillis() - start, response.body().length());
			return new TransportResponse(response.statusCode(), response.body(), rateLimit);
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", method, uri, System.currentTimeMillis() - start,
					e.getMessage());
			throw new HelixApiException(HelixErrorKind.REQUEST_FAILED, "HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new HelixApiException(HelixErrorKind.REQUEST_FAILED, "HTTP request interrupted", e);
		}
	}

	/**
	 * Append the query pairs to the URL in order, URL-escaping keys and values.
	 */
	static URI buildUri(String url, List<QueryParam> query) {
		if (query.isEmpty()) {
			return URI.create(url);
		}
		StringBuilder sb = new StringBuilder(url);
		sb.append(url.indexOf('?') >= 0 ? '&' : '?');
		for (int i = 0; i < query.size(); i++) {
			QueryParam param = query.get(i);
			if (i > 0) {
				sb.append('&');
			}
			sb.append(URLEncoder.encode(param.key(), StandardCharsets.UTF_8))
				.append('=')
				.append(URLEncoder.encode(param.value(), StandardCharsets.UTF_8));
		}
		return URI.create(sb.toString());
	}

	private @Nullable RateLimitInfo extractRateLimit(HttpResponse<?> response) {
		int remaining = parseIntHeader(response, "Ratelimit-Remaining", -1);
		if (remaining < 0) {
			return null;
		}
		int limit = parseIntHeader(response, "Ratelimit-Limit", -1);
		long reset = parseLongHeader(response, "Ratelimit-Reset", -1);
		RateLimitInfo info = new RateLimitInfo(limit, remaining, reset);
		this.lastRateLimitInfo = info;
		if (remaining < LOW_RATE_LIMIT_THRESHOLD) {
			logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
		}
		return info;
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
