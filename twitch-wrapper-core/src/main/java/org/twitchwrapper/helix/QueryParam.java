package org.twitchwrapper.helix;

/**
 * A single query string pair. Order of pairs is preserved on the wire and repeated keys
 * are allowed (Helix uses them for filters such as {@code user_login}).
 *
 * @param key the parameter name
 * @param value the parameter value, sent verbatim apart from URL escaping
 */
public record QueryParam(String key, String value) {

	public static QueryParam of(String key, String value) {
		return new QueryParam(key, value);
	}

	@Override
	public String toString() {
		return key + "=" + value;
	}

}
