package org.twitchwrapper.helix;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Entry point for the Twitch Helix API.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * HelixClient twitch = HelixClient.create("my-client-id");
 * List<StreamInfo> top = twitch.getStreams(3);
 *
 * // Any paginated endpoint
 * List<MyItem> items = twitch.queryPaginated("GET", "videos",
 *     List.of(QueryParam.of("user_id", "1234")), 100, 250, MyItem.class);
 * }
 * </pre>
 *
 * <p>
 * Instances are immutable and may be shared between threads; each call blocks until it
 * completes or fails.
 */
public class HelixClient {

	/**
	 * Production Helix base URL.
	 */
	public static final String DEFAULT_BASE_URL = "https://api.twitch.tv/helix";

	/**
	 * Maximum page size of {@code GET /streams}.
	 */
	public static final int STREAMS_MAXIMUM = 100;

	private final HelixRequestExecutor executor;

	private final PageAggregator aggregator;

	private final ObjectMapper objectMapper;

	private final HelixTransport transport;

	HelixClient(HelixRequestExecutor executor, PageAggregator aggregator, ObjectMapper objectMapper,
			HelixTransport transport) {
		this.executor = executor;
		this.aggregator = aggregator;
		this.objectMapper = objectMapper;
		this.transport = transport;
	}

	/**
	 * Create a client for the production API with default settings.
	 * @param clientId the client id from the Twitch developer console
	 * @return ready-to-use client
	 * @throws HelixApiException of kind {@link HelixErrorKind#INVALID_HEADER_VALUE} if the
	 * id cannot be sent as a header
	 */
	public static HelixClient create(String clientId) {
		return builder().clientId(clientId).build();
	}

	/**
	 * Create a new builder instance.
	 * @return new HelixClientBuilder
	 */
	public static HelixClientBuilder builder() {
		return HelixClientBuilder.create();
	}

	/**
	 * Get the top live streams, most viewers first.
	 * @param count number of streams to return
	 * @return exactly {@code count} streams
	 */
	public List<StreamInfo> getStreams(long count) {
		return queryPaginated("GET", "streams", null, STREAMS_MAXIMUM, count, StreamInfo.class);
	}

	/**
	 * Issue a single request and decode the body.
	 * @param method HTTP method name, case-insensitive
	 * @param endpoint endpoint path, e.g. "users"
	 * @param query query pairs, or null
	 * @param type the body type
	 * @return decoded body
	 */
	public <T> T query(String method, String endpoint, @Nullable List<QueryParam> query, Class<T> type) {
		return executor.execute(method, endpoint, query, type);
	}

	/**
	 * Issue a single request and decode the body into a generic type, e.g.
	 * {@code new TypeReference<Page<StreamInfo>>() {}}.
	 */
	public <T> T query(String method, String endpoint, @Nullable List<QueryParam> query, TypeReference<T> type) {
		return executor.execute(method, endpoint, query, type);
	}

	/**
	 * Collect exactly {@code count} items from a paginated endpoint.
	 * @param method HTTP method name, case-insensitive
	 * @param endpoint endpoint path
	 * @param query base query pairs without {@code first}/{@code after}, or null
	 * @param endpointMaximum the endpoint's per-page maximum
	 * @param count number of items wanted (0 to {@link Integer#MAX_VALUE})
	 * @param itemType type of one item
	 * @return items in page order
	 */
	public <T> List<T> queryPaginated(String method, String endpoint, @Nullable List<QueryParam> query,
			int endpointMaximum, long count, Class<T> itemType) {
		return aggregator.aggregate(method, endpoint, query, endpointMaximum, count,
				objectMapper.constructType(itemType));
	}

	/**
	 * Collect exactly {@code count} items of a generic item type from a paginated endpoint.
	 */
	public <T> List<T> queryPaginated(String method, String endpoint, @Nullable List<QueryParam> query,
			int endpointMaximum, long count, TypeReference<T> itemType) {
		JavaType javaType = objectMapper.constructType(itemType);
		return aggregator.aggregate(method, endpoint, query, endpointMaximum, count, javaType);
	}

	/**
	 * Rate limit headers of the most recent response, or null if none were seen.
	 */
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return transport.getLastRateLimitInfo();
	}

	/**
	 * Base URL requests are resolved against, without trailing slash.
	 */
	public String getBaseUrl() {
		return executor.getBaseUrl();
	}

}
