package org.twitchwrapper.helix;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PageAggregator}: page arithmetic, cursor threading, ordering and
 * failure handling.
 */
@DisplayName("PageAggregator Tests")
@ExtendWith(MockitoExtension.class)
class PageAggregatorTest {

	private static final String BASE_URL = "https://api.test/helix";

	@Mock
	private HelixTransport mockTransport;

	@Captor
	private ArgumentCaptor<List<QueryParam>> queryCaptor;

	private ObjectMapper mapper;

	private JavaType itemType;

	private PageAggregator aggregator;

	record Item(String id) {
	}

	@BeforeEach
	void setUp() {
		mapper = ObjectMapperFactory.create();
		itemType = mapper.constructType(Item.class);
		aggregator = newAggregator(mockTransport);
	}

	private PageAggregator newAggregator(HelixTransport transport) {
		HelixRequestExecutor executor = new HelixRequestExecutor(transport, mapper, BASE_URL,
				HelixHeaders.forClientId("cid"));
		return new PageAggregator(executor, mapper);
	}

	private static TransportResponse page(String cursor, String... ids) {
		return new TransportResponse(200, "{\"data\":" + items(ids) + ",\"pagination\":{\"cursor\":\"" + cursor + "\"}}");
	}

	private static String items(String... ids) {
		List<String> objects = new ArrayList<>();
		for (String id : ids) {
			objects.add("{\"id\":\"" + id + "\",\"ignored\":true}");
		}
		return "[" + String.join(",", objects) + "]";
	}

	private static List<Item> ids(String... ids) {
		List<Item> result = new ArrayList<>();
		for (String id : ids) {
			result.add(new Item(id));
		}
		return result;
	}

	private static String param(List<QueryParam> query, String key) {
		return query.stream()
			.filter(p -> p.key().equals(key))
			.map(QueryParam::value)
			.findFirst()
			.orElseThrow(() -> new AssertionError("missing query parameter " + key));
	}

	@Nested
	@DisplayName("Page Arithmetic and Cursor Threading")
	class CursorThreadingTest {

		@Test
		@DisplayName("Should issue first=2,2,1 with cursors threaded from each previous page")
		void shouldThreadCursorsAcrossPages() {
			when(mockTransport.send(eq(HttpMethod.GET), eq(BASE_URL + "/streams"), anyMap(), anyList()))
				.thenReturn(page("abc", "A", "B"), page("def", "C", "D"), page("ghi", "E"));

			List<Item> result = aggregator.aggregate("GET", "streams", null, 2, 5, itemType);

			verify(mockTransport, times(3)).send(eq(HttpMethod.GET), eq(BASE_URL + "/streams"), anyMap(),
					queryCaptor.capture());
			assertThat(queryCaptor.getAllValues()).containsExactly(
					List.of(QueryParam.of("first", "2"), QueryParam.of("after", "")),
					List.of(QueryParam.of("first", "2"), QueryParam.of("after", "abc")),
					List.of(QueryParam.of("first", "1"), QueryParam.of("after", "def")));
			assertThat(result).containsExactlyElementsOf(ids("A", "B", "C", "D", "E"));
		}

		@Test
		@DisplayName("Should keep base query parameters ahead of first and after")
		void shouldPrependBaseQuery() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("c1", "A"));

			aggregator.aggregate("GET", "streams", List.of(QueryParam.of("language", "en")), 100, 1, itemType);

			verify(mockTransport).send(any(), anyString(), anyMap(), queryCaptor.capture());
			assertThat(queryCaptor.getValue()).containsExactly(QueryParam.of("language", "en"),
					QueryParam.of("first", "1"), QueryParam.of("after", ""));
		}

		@Test
		@DisplayName("Should return an empty list without any request when count is zero")
		void shouldNotCallForZeroCount() {
			List<Item> result = aggregator.aggregate("GET", "streams", null, 100, 0, itemType);

			assertThat(result).isEmpty();
			verifyNoInteractions(mockTransport);
		}

		@Test
		@DisplayName("Should request a single exact-size page when count fits in one page")
		void shouldRequestSinglePage() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("c1", "A", "B", "C"));

			List<Item> result = aggregator.aggregate("GET", "streams", null, 100, 3, itemType);

			verify(mockTransport).send(any(), anyString(), anyMap(), queryCaptor.capture());
			assertThat(param(queryCaptor.getValue(), "first")).isEqualTo("3");
			assertThat(result).hasSize(3);
		}

		@ParameterizedTest(name = "count={0}, max={1}")
		@CsvSource({ "0, 1", "1, 1", "5, 2", "6, 2", "7, 3", "99, 100", "100, 100", "101, 100", "250, 100",
				"17, 1" })
		@DisplayName("Should return exactly count items in upstream order for full pages")
		void shouldReturnExactCount(long count, int endpointMaximum) {
			List<List<QueryParam>> sent = new ArrayList<>();
			HelixTransport fullPages = (method, url, headers, query) -> {
				sent.add(query);
				int first = Integer.parseInt(param(query, "first"));
				String after = param(query, "after");
				int offset = after.isEmpty() ? 0 : Integer.parseInt(after.substring(1));
				String[] pageIds = IntStream.range(offset, offset + first)
					.mapToObj(String::valueOf)
					.toArray(String[]::new);
				return page("c" + (offset + first), pageIds);
			};

			List<Item> result = newAggregator(fullPages).aggregate("GET", "streams", null, endpointMaximum, count,
					itemType);

			assertThat(result).hasSize((int) count);
			assertThat(result.stream().map(Item::id).collect(Collectors.toList()))
				.isEqualTo(IntStream.range(0, (int) count).mapToObj(String::valueOf).collect(Collectors.toList()));
			assertThat(sent).hasSize((int) PageAggregator.pagesToRequest(count, endpointMaximum));
			assertThat(sent).allSatisfy(
					query -> assertThat(Integer.parseInt(param(query, "first"))).isBetween(1, endpointMaximum));
		}

		@Test
		@DisplayName("Should compute ceil(count / max) pages")
		void shouldComputePageCount() {
			assertThat(PageAggregator.pagesToRequest(0, 2)).isZero();
			assertThat(PageAggregator.pagesToRequest(5, 2)).isEqualTo(3);
			assertThat(PageAggregator.pagesToRequest(4, 2)).isEqualTo(2);
			assertThat(PageAggregator.pagesToRequest(1, 100)).isEqualTo(1);
			assertThat(PageAggregator.pagesToRequest(Long.MAX_VALUE, 100)).isEqualTo(92233720368547759L);
			assertThat(PageAggregator.pagesToRequest(Long.MAX_VALUE, 1)).isEqualTo(Long.MAX_VALUE);
		}

		@Test
		@DisplayName("Should trim a page that returns more items than requested")
		void shouldTrimOversizedPage() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("abc", "A", "B"),
					page("def", "C", "D", "E"));

			List<Item> result = aggregator.aggregate("GET", "streams", null, 2, 3, itemType);

			assertThat(result).containsExactlyElementsOf(ids("A", "B", "C"));
		}

		@Test
		@DisplayName("Should not require a cursor on the last page")
		void shouldAllowMissingCursorOnLastPage() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("abc", "A", "B"),
					new TransportResponse(200, "{\"data\":" + items("C") + ",\"pagination\":{}}"));

			List<Item> result = aggregator.aggregate("GET", "streams", null, 2, 3, itemType);

			assertThat(result).containsExactlyElementsOf(ids("A", "B", "C"));
		}

		@Test
		@DisplayName("Should return an unmodifiable list")
		void shouldReturnUnmodifiableList() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("abc", "A"));

			List<Item> result = aggregator.aggregate("GET", "streams", null, 2, 1, itemType);

			assertThatThrownBy(() -> result.add(new Item("X"))).isInstanceOf(UnsupportedOperationException.class);
		}

	}

	@Nested
	@DisplayName("Failure Handling")
	class FailureHandlingTest {

		@Test
		@DisplayName("Should abort with UNSUCCESSFUL_STATUS when the second page fails")
		void shouldAbortOnSecondPageFailure() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("abc", "A", "B"),
					new TransportResponse(500, "{\"error\":\"Internal Server Error\"}"));

			assertThatThrownBy(() -> aggregator.aggregate("GET", "streams", null, 2, 5, itemType))
				.isInstanceOfSatisfying(HelixApiException.class, e -> {
					assertThat(e.getKind()).isEqualTo(HelixErrorKind.UNSUCCESSFUL_STATUS);
					assertThat(e.getStatusCode()).isEqualTo(500);
				});
			verify(mockTransport, times(2)).send(any(), anyString(), anyMap(), anyList());
		}

		@Test
		@DisplayName("Should abort on transport failure without retrying the page")
		void shouldAbortOnTransportFailure() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("abc", "A", "B"))
				.thenThrow(new HelixApiException(HelixErrorKind.REQUEST_FAILED, "timeout"));

			assertThatThrownBy(() -> aggregator.aggregate("GET", "streams", null, 2, 4, itemType))
				.isInstanceOfSatisfying(HelixApiException.class,
						e -> assertThat(e.getKind()).isEqualTo(HelixErrorKind.REQUEST_FAILED));
			verify(mockTransport, times(2)).send(any(), anyString(), anyMap(), anyList());
		}

		@Test
		@DisplayName("Should reject an envelope whose data is not an array")
		void shouldRejectNonArrayData() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList()))
				.thenReturn(new TransportResponse(200, "{\"data\":{},\"pagination\":{\"cursor\":\"abc\"}}"));

			assertMalformed(() -> aggregator.aggregate("GET", "streams", null, 2, 2, itemType));
		}

		@Test
		@DisplayName("Should reject an envelope without data")
		void shouldRejectMissingData() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList()))
				.thenReturn(new TransportResponse(200, "{\"pagination\":{\"cursor\":\"abc\"}}"));

			assertMalformed(() -> aggregator.aggregate("GET", "streams", null, 2, 2, itemType));
		}

		@Test
		@DisplayName("Should reject a body that is not a JSON object")
		void shouldRejectNonObjectEnvelope() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList()))
				.thenReturn(new TransportResponse(200, "[]"));

			assertMalformed(() -> aggregator.aggregate("GET", "streams", null, 2, 2, itemType));
		}

		@Test
		@DisplayName("Should reject a missing cursor when more pages remain")
		void shouldRejectMissingCursor() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList()))
				.thenReturn(new TransportResponse(200, "{\"data\":" + items("A", "B") + ",\"pagination\":{}}"));

			assertMalformed(() -> aggregator.aggregate("GET", "streams", null, 2, 3, itemType));
		}

		@Test
		@DisplayName("Should reject a missing pagination block when more pages remain")
		void shouldRejectMissingPagination() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList()))
				.thenReturn(new TransportResponse(200, "{\"data\":" + items("A", "B") + "}"));

			assertMalformed(() -> aggregator.aggregate("GET", "streams", null, 2, 3, itemType));
		}

		@Test
		@DisplayName("Should reject a non-string cursor when more pages remain")
		void shouldRejectNonStringCursor() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList()))
				.thenReturn(new TransportResponse(200, "{\"data\":" + items("A", "B") + ",\"pagination\":{\"cursor\":42}}"));

			assertMalformed(() -> aggregator.aggregate("GET", "streams", null, 2, 3, itemType));
		}

		@Test
		@DisplayName("Should fail with PAGINATION_EXHAUSTED on an empty cursor before count is reached")
		void shouldFailWhenCursorSignalsEnd() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("", "A", "B"));

			assertThatThrownBy(() -> aggregator.aggregate("GET", "streams", null, 2, 5, itemType))
				.isInstanceOfSatisfying(HelixApiException.class,
						e -> assertThat(e.getKind()).isEqualTo(HelixErrorKind.PAGINATION_EXHAUSTED))
				.hasMessageContaining("2 of 5");
			verify(mockTransport, times(1)).send(any(), anyString(), anyMap(), anyList());
		}

		@Test
		@DisplayName("Should fail with PAGINATION_EXHAUSTED when pages come back short")
		void shouldFailOnShortPages() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList())).thenReturn(page("abc", "A"),
					page("def", "B"));

			assertThatThrownBy(() -> aggregator.aggregate("GET", "streams", null, 2, 4, itemType))
				.isInstanceOfSatisfying(HelixApiException.class,
						e -> assertThat(e.getKind()).isEqualTo(HelixErrorKind.PAGINATION_EXHAUSTED));
		}

		@Test
		@DisplayName("Should fail with DESERIALIZATION_FAILED when items do not match the type")
		void shouldFailOnItemShapeMismatch() {
			when(mockTransport.send(any(), anyString(), anyMap(), anyList()))
				.thenReturn(new TransportResponse(200, "{\"data\":[[1,2]],\"pagination\":{\"cursor\":\"abc\"}}"));

			assertThatThrownBy(() -> aggregator.aggregate("GET", "streams", null, 2, 1, itemType))
				.isInstanceOfSatisfying(HelixApiException.class,
						e -> assertThat(e.getKind()).isEqualTo(HelixErrorKind.DESERIALIZATION_FAILED));
		}

		@Test
		@DisplayName("Should reject a non-positive endpoint maximum")
		void shouldRejectNonPositiveMaximum() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> aggregator.aggregate("GET", "streams", null, 0, 5, itemType));
			verifyNoInteractions(mockTransport);
		}

		@Test
		@DisplayName("Should reject a negative count")
		void shouldRejectNegativeCount() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> aggregator.aggregate("GET", "streams", null, 10, -1, itemType));
		}

		@ParameterizedTest
		@CsvSource({ "2147483648", "9223372036854775807" })
		@DisplayName("Should reject a count too large for one list before any request")
		void shouldRejectCountBeyondListCapacity(long count) {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> aggregator.aggregate("GET", "streams", null, 100, count, itemType))
				.withMessageContaining(Long.toString(count));
			verifyNoInteractions(mockTransport);
		}

		private void assertMalformed(ThrowingCallable call) {
			assertThatThrownBy(call).isInstanceOfSatisfying(HelixApiException.class,
					e -> assertThat(e.getKind()).isEqualTo(HelixErrorKind.MALFORMED_PAGINATION_ENVELOPE));
		}

	}

}
