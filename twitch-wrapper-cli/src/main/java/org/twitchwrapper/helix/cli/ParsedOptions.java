package org.twitchwrapper.helix.cli;

import org.twitchwrapper.helix.HelixClient;

/**
 * Parsed options result from command-line arguments.
 */
public class ParsedOptions {

	public static final int DEFAULT_COUNT = 3;

	// Number of top streams to print
	public int count = DEFAULT_COUNT;

	public String baseUrl = HelixClient.DEFAULT_BASE_URL;

	public boolean helpRequested = false;

	@Override
	public String toString() {
		return "ParsedOptions{count=" + count + ", baseUrl='" + baseUrl + "', helpRequested=" + helpRequested + "}";
	}

}
