package org.twitchwrapper.helix;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects an exact number of items from a cursor-paginated Helix endpoint.
 *
 * <p>
 * The number of pages is fixed up front as {@code ceil(count / endpointMaximum)}. Every
 * page but the last asks for {@code endpointMaximum} items; the last asks for the
 * remainder. Pages are fetched strictly in sequence because the {@code after} cursor of
 * page <i>i+1</i> is the {@code pagination.cursor} of page <i>i</i>.
 *
 * <p>
 * Each envelope is first read as an untyped tree so the cursor and the raw {@code data}
 * array can be taken out independently; only the array is then decoded into the item
 * type.
 *
 * <p>
 * Aggregation is all-or-nothing: the first failure is thrown and items of earlier pages
 * are discarded.
 */
public class PageAggregator {

	private static final Logger logger = LoggerFactory.getLogger(PageAggregator.class);

	static final String PAGE_SIZE_PARAM = "first";

	static final String CURSOR_PARAM = "after";

	private final HelixRequestExecutor executor;

	private final ObjectMapper objectMapper;

	public PageAggregator(HelixRequestExecutor executor, ObjectMapper objectMapper) {
		this.executor = executor;
		this.objectMapper = objectMapper;
	}

	/**
	 * Fetch exactly {@code count} items.
	 * @param method HTTP method name, case-insensitive
	 * @param endpoint endpoint path relative to the base URL
	 * @param query base query pairs, or null; must not contain {@code first} or
	 * {@code after}
	 * @param endpointMaximum the endpoint's per-page maximum (must be positive)
	 * @param count number of items to return (0 to {@link Integer#MAX_VALUE})
	 * @param itemType type of a single item
	 * @return unmodifiable list of {@code count} items in page order
	 * @throws HelixApiException if any page fails, is malformed, or the upstream data runs
	 * out before {@code count} items
	 */
	public <T> List<T> aggregate(String method, String endpoint, @Nullable List<QueryParam> query,
			int endpointMaximum, long count, JavaType itemType) {
		if (endpointMaximum <= 0) {
			throw new IllegalArgumentException("endpointMaximum must be positive: " + endpointMaximum);
		}
		if (count < 0) {
			throw new IllegalArgumentException("count must not be negative: " + count);
		}
		if (count > Integer.MAX_VALUE) {
			throw new IllegalArgumentException("count must not exceed " + Integer.MAX_VALUE + ": " + count);
		}

		long pages = pagesToRequest(count, endpointMaximum);
		if (pages == 0) {
			return List.of();
		}

		JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, itemType);
		List<QueryParam> baseQuery = query != null ? query : List.of();
		List<T> accumulated = new ArrayList<>();
		String cursor = "";

		for (long page = 0; page < pages; page++) {
			boolean lastPage = page == pages - 1;
			int pageSize = (int) Math.min(endpointMaximum, count - accumulated.size());

			List<QueryParam> pageQuery = new ArrayList<>(baseQuery.size() + 2);
			pageQuery.addAll(baseQuery);
			pageQuery.add(new QueryParam(PAGE_SIZE_PARAM, Integer.toString(pageSize)));
			pageQuery.add(new QueryParam(CURSOR_PARAM, cursor));

			logger.debug("{} page {}/{} (first={}, after='{}')", endpoint, page + 1, pages, pageSize, cursor);
			JsonNode envelope = executor.executeForTree(method, endpoint, pageQuery);
			if (envelope == null || !envelope.isObject()) {
				throw malformed(endpoint, page, "response is not a JSON object");
			}

			List<T> items = decodeItems(envelope, listType, endpoint, page);
			accumulated.addAll(items.size() > pageSize ? items.subList(0, pageSize) : items);

			if (!lastPage) {
				cursor = extractCursor(envelope, endpoint, page);
				if (cursor.isEmpty()) {
					throw exhausted(endpoint, accumulated.size(), count);
				}
			}
		}

		if (accumulated.size() < count) {
			throw exhausted(endpoint, accumulated.size(), count);
		}
		logger.debug("{}: collected {} items in {} pages", endpoint, accumulated.size(), pages);
		return Collections.unmodifiableList(accumulated);
	}

	/**
	 * Number of requests needed for {@code count} items at {@code endpointMaximum} per
	 * page.
	 */
	static long pagesToRequest(long count, int endpointMaximum) {
		return count == 0 ? 0 : (count - 1) / endpointMaximum + 1;
	}

	private <T> List<T> decodeItems(JsonNode envelope, JavaType listType, String endpoint, long page) {
		JsonNode data = envelope.get("data");
		if (data == null || !data.isArray()) {
			throw malformed(endpoint, page, "'data' is missing or not an array");
		}
		try {
			List<T> items = objectMapper.readerFor(listType).readValue(data);
			return items;
		}
		catch (IOException e) {
			throw new HelixApiException(HelixErrorKind.DESERIALIZATION_FAILED, "Failed to decode 'data' of " + endpoint
					+ " page " + (page + 1) + " as " + listType.toCanonical() + ": " + e.getMessage(), e);
		}
	}

	private String extractCursor(JsonNode envelope, String endpoint, long page) {
		JsonNode pagination = envelope.get("pagination");
		if (pagination == null || !pagination.isObject()) {
			throw malformed(endpoint, page, "'pagination' is missing or not an object");
		}
		JsonNode cursor = pagination.get("cursor");
		if (cursor == null || !cursor.isTextual()) {
			throw malformed(endpoint, page, "'pagination.cursor' is missing or not a string");
		}
		return cursor.textValue();
	}

	private static HelixApiException malformed(String endpoint, long page, String detail) {
		return new HelixApiException(HelixErrorKind.MALFORMED_PAGINATION_ENVELOPE,
				"Malformed pagination envelope from " + endpoint + " page " + (page + 1) + ": " + detail);
	}

	private static HelixApiException exhausted(String endpoint, int collected, long count) {
		return new HelixApiException(HelixErrorKind.PAGINATION_EXHAUSTED,
				endpoint + " ran out of data after " + collected + " of " + count + " requested items");
	}

}
