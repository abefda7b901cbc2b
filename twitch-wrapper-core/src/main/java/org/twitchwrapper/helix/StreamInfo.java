package org.twitchwrapper.helix;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A live stream as returned by {@code GET /helix/streams}.
 *
 * @param id the stream id
 * @param userId id of the broadcaster
 * @param userLogin login name of the broadcaster
 * @param userName display name of the broadcaster
 * @param gameId id of the category being played
 * @param gameName name of the category being played
 * @param type stream type, "live" or empty on error
 * @param title the stream title
 * @param viewerCount current number of viewers
 * @param startedAt when the broadcast started
 * @param language ISO 639-1 broadcast language
 * @param thumbnailUrl thumbnail template with {width} and {height} placeholders
 * @param tagIds deprecated tag ids, still sent by some responses
 * @param tags free-form tags applied to the stream
 */
public record StreamInfo(String id, String userId, @Nullable String userLogin, String userName, String gameId,
		@Nullable String gameName, String type, String title, long viewerCount, Instant startedAt, String language,
		String thumbnailUrl, @Nullable List<String> tagIds, @Nullable List<String> tags) {
}
