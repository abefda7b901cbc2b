package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a Helix list response: {@code {"data": [...], "pagination": {...}}}.
 *
 * <p>
 * Use with {@link HelixClient#query}
 * to read a single page; {@link HelixClient#queryPaginated} reads many.
 *
 * @param <T> the item type
 * @param data items of this page in upstream order
 * @param pagination pagination block (null if the response omitted it)
 */
public record Page<T>(List<T> data, @Nullable Pagination pagination) {

	/**
	 * Returns the cursor for the next page, or null if there is none.
	 * @return the next cursor
	 */
	public @Nullable String nextCursor() {
		return pagination != null && pagination.hasNext() ? pagination.cursor() : null;
	}

}
