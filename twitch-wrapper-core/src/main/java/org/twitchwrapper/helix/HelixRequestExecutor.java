package org.twitchwrapper.helix;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Performs exactly one Helix request and decodes the body into a caller-specified type.
 *
 * <p>
 * Stateless between calls: the base URL and header set are fixed at construction. No
 * retries happen here; wrap the transport with {@link RetryingHelixTransport} for that.
 */
public class HelixRequestExecutor {

	private static final Logger logger = LoggerFactory.getLogger(HelixRequestExecutor.class);

	private final HelixTransport transport;

	private final ObjectMapper objectMapper;

	private final String baseUrl;

	private final Map<String, String> headers;

	public HelixRequestExecutor(HelixTransport transport, ObjectMapper objectMapper, String baseUrl,
			Map<String, String> headers) {
		this.transport = transport;
		this.objectMapper = objectMapper;
		this.baseUrl = stripTrailingSlash(baseUrl);
		this.headers = Map.copyOf(headers);
	}

	public <T> T execute(String method, String endpoint, @Nullable List<QueryParam> query, Class<T> targetType) {
		return execute(method, endpoint, query, objectMapper.constructType(targetType));
	}

	public <T> T execute(String method, String endpoint, @Nullable List<QueryParam> query,
			TypeReference<T> targetType) {
		return execute(method, endpoint, query, objectMapper.constructType(targetType));
	}

	/**
	 * Execute one request and decode the response.
	 * @param method HTTP method name, case-insensitive
	 * @param endpoint endpoint path relative to the base URL, without leading slash
	 * @param query query pairs, or null for none
	 * @param targetType type to decode the body into
	 * @return the decoded body
	 * @throws HelixApiException on invalid method, transport failure, non-2xx status or
	 * undecodable body
	 */
	public <T> T execute(String method, String endpoint, @Nullable List<QueryParam> query, JavaType targetType) {
		HttpMethod httpMethod = HttpMethod.parse(method);
		String url = resolve(endpoint);
		List<QueryParam> params = query != null ? query : List.of();

		TransportResponse response = transport.send(httpMethod, url, headers, params);
		if (!response.isSuccess()) {
			logger.debug("{} {} returned status {}", httpMethod, url, response.statusCode());
			throw HelixApiException.unsuccessfulStatus(response.statusCode(), url, response.body());
		}

		try {
			return objectMapper.readValue(response.body(), targetType);
		}
		catch (JsonProcessingException e) {
			throw new HelixApiException(HelixErrorKind.DESERIALIZATION_FAILED,
					"Failed to decode response of " + url + " as " + targetType.toCanonical() + ": "
							+ e.getOriginalMessage(),
					e);
		}
	}

	/**
	 * Execute one request and return the body as an untyped JSON tree.
	 */
	public JsonNode executeForTree(String method, String endpoint, @Nullable List<QueryParam> query) {
		return execute(method, endpoint, query, JsonNode.class);
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	String resolve(String endpoint) {
		String path = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
		return baseUrl + "/" + path;
	}

	private static String stripTrailingSlash(String url) {
		String result = url;
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

}
