package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;

/**
 * The {@code pagination} block of a Helix list response.
 *
 * @param cursor continuation token for the next page; null or empty when Helix has no
 * more data
 */
public record Pagination(@Nullable String cursor) {

	public boolean hasNext() {
		return cursor != null && !cursor.isEmpty();
	}

}
