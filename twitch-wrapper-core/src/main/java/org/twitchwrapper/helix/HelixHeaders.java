package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the header set attached to every Helix request.
 */
public final class HelixHeaders {

	/**
	 * Header carrying the application's client id.
	 */
	public static final String CLIENT_ID = "client-id";

	/**
	 * Header carrying the optional OAuth access token.
	 */
	public static final String AUTHORIZATION = "authorization";

	private HelixHeaders() {
	}

	/**
	 * Headers for a client id alone.
	 * @param clientId the developer application's client id
	 * @return unmodifiable header map containing {@value #CLIENT_ID}
	 * @throws HelixApiException of kind {@link HelixErrorKind#INVALID_HEADER_VALUE} if the
	 * id contains characters that cannot appear in a header value
	 */
	public static Map<String, String> forClientId(String clientId) {
		return build(clientId, null);
	}

	/**
	 * Headers for a client id and, when present, a bearer access token.
	 * @param clientId the developer application's client id
	 * @param accessToken OAuth token, or null to send the client id only
	 * @return unmodifiable header map, client id first
	 * @throws HelixApiException of kind {@link HelixErrorKind#INVALID_HEADER_VALUE} if a
	 * value contains characters that cannot appear in a header value
	 */
	public static Map<String, String> build(String clientId, @Nullable String accessToken) {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put(CLIENT_ID, requireValidValue(CLIENT_ID, clientId));
		if (accessToken != null) {
			headers.put(AUTHORIZATION, "Bearer " + requireValidValue(AUTHORIZATION, accessToken));
		}
		return Collections.unmodifiableMap(headers);
	}

	// RFC 9110 field-value: visible ASCII, space, tab and obs-text (0x80-0xFF)
	static String requireValidValue(String name, String value) {
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			boolean control = (c < 0x20 && c != '\t') || c == 0x7F;
			if (control || c > 0xFF) {
				throw new HelixApiException(HelixErrorKind.INVALID_HEADER_VALUE, String
					.format("Invalid character 0x%02X at index %d in value for header '%s'", (int) c, i, name));
			}
		}
		return value;
	}

}
