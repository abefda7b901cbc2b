package org.twitchwrapper.helix;

import java.util.Locale;

/**
 * HTTP verbs accepted by the request executor.
 */
public enum HttpMethod {

	GET, HEAD, POST, PUT, PATCH, DELETE, OPTIONS, TRACE;

	/**
	 * Parse a method name, ignoring case and surrounding whitespace.
	 * @param method the method name, e.g. "get" or "GET"
	 * @return the matching HttpMethod
	 * @throws HelixApiException of kind {@link HelixErrorKind#INVALID_METHOD} if the name
	 * is not a known verb
	 */
	public static HttpMethod parse(String method) {
		String normalized = method.trim().toUpperCase(Locale.ROOT);
		for (HttpMethod candidate : values()) {
			if (candidate.name().equals(normalized)) {
				return candidate;
			}
		}
		throw new HelixApiException(HelixErrorKind.INVALID_METHOD, "Invalid HTTP method: '" + method + "'");
	}

}
