package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a Helix API call fails.
 *
 * <p>
 * Every failure carries a {@link HelixErrorKind}. Non-2xx responses additionally carry
 * the status code and the raw response body, which is never decoded.
 */
public class HelixApiException extends RuntimeException {

	private final HelixErrorKind kind;

	private final int statusCode;

	@Nullable
	private final String responseBody;

	public HelixApiException(HelixErrorKind kind, String message) {
		super(message);
		this.kind = kind;
		this.statusCode = -1;
		this.responseBody = null;
	}

	public HelixApiException(HelixErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = -1;
		this.responseBody = null;
	}

	private HelixApiException(int statusCode, String message, String responseBody) {
		super(message);
		this.kind = HelixErrorKind.UNSUCCESSFUL_STATUS;
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	/**
	 * Create an exception for a response whose status is outside the 2xx range.
	 * @param statusCode the HTTP status code
	 * @param url the requested URL, used in the message
	 * @param responseBody the undecoded response body
	 * @return new HelixApiException of kind {@link HelixErrorKind#UNSUCCESSFUL_STATUS}
	 */
	public static HelixApiException unsuccessfulStatus(int statusCode, String url, String responseBody) {
		return new HelixApiException(statusCode, "Received error status code from API: " + statusCode + " (" + url + ")",
				responseBody);
	}

	public HelixErrorKind getKind() {
		return kind;
	}

	/**
	 * Returns the HTTP status code, or -1 when the failure did not come from a response.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public boolean isRateLimitError() {
		return statusCode == 429;
	}

}
