package org.twitchwrapper.helix;

/**
 * Classification of failures reported through {@link HelixApiException}.
 */
public enum HelixErrorKind {

	/**
	 * The HTTP method string is not a recognized verb. Raised before any network call.
	 */
	INVALID_METHOD,

	/**
	 * The client id or access token cannot be sent as an HTTP header value.
	 */
	INVALID_HEADER_VALUE,

	/**
	 * The transport could not complete the call (DNS, connection, timeout, interrupt).
	 */
	REQUEST_FAILED,

	/**
	 * The server answered with a status outside the 2xx range.
	 */
	UNSUCCESSFUL_STATUS,

	/**
	 * The body is not valid JSON or does not match the requested type.
	 */
	DESERIALIZATION_FAILED,

	/**
	 * The {@code data} array or the {@code pagination.cursor} string is missing or has
	 * the wrong type.
	 */
	MALFORMED_PAGINATION_ENVELOPE,

	/**
	 * The upstream resource ran out of items before the requested count was reached.
	 */
	PAGINATION_EXHAUSTED

}
