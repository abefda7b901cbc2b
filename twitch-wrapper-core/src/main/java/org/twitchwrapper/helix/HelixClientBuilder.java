package org.twitchwrapper.helix;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Builder for {@link HelixClient}.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // CLIENT_ID from .env or the environment
 * HelixClient twitch = HelixClientBuilder.create()
 *     .clientIdFromEnv()
 *     .build();
 *
 * // Against a local mock server, retrying transient failures
 * HelixClient twitch = HelixClientBuilder.create()
 *     .clientId("test-id")
 *     .baseUrl("http://localhost:8080/helix")
 *     .transport(RetryingHelixTransport.builder().wrapping(new JdkHelixTransport()).build())
 *     .build();
 * }
 * </pre>
 */
public class HelixClientBuilder {

	/**
	 * Variable holding the client id for {@link #clientIdFromEnv()}.
	 */
	public static final String CLIENT_ID_VARIABLE = "CLIENT_ID";

	private @Nullable String clientId;

	private @Nullable String accessToken;

	private String baseUrl = HelixClient.DEFAULT_BASE_URL;

	private @Nullable HelixTransport transport;

	private @Nullable ObjectMapper objectMapper;

	private Duration connectTimeout = JdkHelixTransport.DEFAULT_CONNECT_TIMEOUT;

	private Duration requestTimeout = JdkHelixTransport.DEFAULT_REQUEST_TIMEOUT;

	private HelixClientBuilder() {
	}

	/**
	 * Create a new builder instance.
	 * @return new HelixClientBuilder
	 */
	public static HelixClientBuilder create() {
		return new HelixClientBuilder();
	}

	/**
	 * Set the client id directly.
	 * @param clientId client id from the Twitch developer console
	 * @return this builder
	 */
	public HelixClientBuilder clientId(String clientId) {
		this.clientId = clientId;
		return this;
	}

	/**
	 * Read the client id from the {@value #CLIENT_ID_VARIABLE} variable.
	 * @return this builder
	 * @throws IllegalStateException if {@value #CLIENT_ID_VARIABLE} is not set
	 */
	public HelixClientBuilder clientIdFromEnv() {
		String value = EnvironmentSupport.get(CLIENT_ID_VARIABLE);
		if (value == null) {
			throw new IllegalStateException("CLIENT_ID environment variable is required. "
					+ "Register an application at https://dev.twitch.tv/console/apps to get one.");
		}
		this.clientId = value;
		return this;
	}

	/**
	 * Set an OAuth access token sent as {@code authorization: Bearer <token>}.
	 * @param accessToken app or user access token (null to send the client id only)
	 * @return this builder
	 */
	public HelixClientBuilder accessToken(@Nullable String accessToken) {
		this.accessToken = accessToken;
		return this;
	}

	/**
	 * Set the base URL requests are resolved against.
	 * @param baseUrl absolute URL, e.g. a mock server (default:
	 * {@value HelixClient#DEFAULT_BASE_URL})
	 * @return this builder
	 */
	public HelixClientBuilder baseUrl(String baseUrl) {
		this.baseUrl = baseUrl;
		return this;
	}

	/**
	 * Set a custom transport. Useful for testing or for decorators such as
	 * {@link RetryingHelixTransport}. Timeouts set on this builder do not apply to a
	 * custom transport.
	 * @param transport custom transport (null to use {@link JdkHelixTransport})
	 * @return this builder
	 */
	public HelixClientBuilder transport(@Nullable HelixTransport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use {@link ObjectMapperFactory})
	 * @return this builder
	 */
	public HelixClientBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the connect timeout of the default transport.
	 * @param connectTimeout connect timeout (default: 30 seconds)
	 * @return this builder
	 */
	public HelixClientBuilder connectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
		return this;
	}

	/**
	 * Set the per-request timeout of the default transport.
	 * @param requestTimeout request timeout (default: 30 seconds)
	 * @return this builder
	 */
	public HelixClientBuilder requestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
		return this;
	}

	/**
	 * Build the client.
	 * @return configured HelixClient
	 * @throws IllegalStateException if no client id was set
	 * @throws IllegalArgumentException if the base URL is not an absolute http(s) URL
	 * @throws HelixApiException of kind {@link HelixErrorKind#INVALID_HEADER_VALUE} if the
	 * client id or access token cannot be sent as a header
	 */
	public HelixClient build() {
		String id = this.clientId;
		if (id == null || id.trim().isEmpty()) {
			throw new IllegalStateException("Client id is required. Call clientId() or clientIdFromEnv() first.");
		}
		validateBaseUrl();

		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		HelixTransport httpTransport = this.transport != null ? this.transport
				: new JdkHelixTransport(connectTimeout, requestTimeout);

		HelixRequestExecutor executor = new HelixRequestExecutor(httpTransport, mapper, baseUrl,
				HelixHeaders.build(id, accessToken));
		PageAggregator aggregator = new PageAggregator(executor, mapper);
		return new HelixClient(executor, aggregator, mapper, httpTransport);
	}

	private void validateBaseUrl() {
		URI uri = URI.create(baseUrl);
		if (!uri.isAbsolute() || uri.getHost() == null) {
			throw new IllegalArgumentException("Base URL must be absolute: " + baseUrl);
		}
		String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
		if (!scheme.equals("http") && !scheme.equals("https")) {
			throw new IllegalArgumentException("Base URL must use http or https: " + baseUrl);
		}
	}

}
