package org.twitchwrapper.helix.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twitchwrapper.helix.EnvironmentSupport;
import org.twitchwrapper.helix.HelixApiException;
import org.twitchwrapper.helix.HelixClient;
import org.twitchwrapper.helix.HelixClientBuilder;
import org.twitchwrapper.helix.ObjectMapperFactory;
import org.twitchwrapper.helix.StreamInfo;

import java.io.PrintStream;
import java.util.List;
import java.util.function.Function;

/**
 * Twitch Wrapper CLI Application
 *
 * Plain Java command-line application that prints the current top live streams as pretty
 * JSON on stdout. Logging goes to stderr.
 *
 * Usage: java -jar twitch-wrapper-cli.jar [OPTIONS]
 *
 * Environment Variables: CLIENT_ID - Twitch application client id, TWITCH_ACCESS_TOKEN -
 * optional access token
 *
 * Exit codes: 0 success, 1 invalid arguments or configuration, 2 Helix API failure.
 */
public class TwitchWrapperCli {

	private static final Logger logger = LoggerFactory.getLogger(TwitchWrapperCli.class);

	static final String ACCESS_TOKEN_VARIABLE = "TWITCH_ACCESS_TOKEN";

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args, PrintStream out) {
		return run(args, out, TwitchWrapperCli::createClient);
	}

	static int run(String[] args, PrintStream out, Function<ParsedOptions, HelixClient> clientFactory) {
		ArgumentParser argumentParser = new ArgumentParser();

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedOptions options;
		HelixClient client;
		try {
			options = argumentParser.parseAndValidate(args);
			logger.debug("Options: {}", options);
			client = clientFactory.apply(options);
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			logger.error(e.getMessage());
			out.println(argumentParser.generateHelpText());
			return 1;
		}
		catch (HelixApiException e) {
			// client id or access token unusable as a header
			logger.error("Invalid configuration ({}): {}", e.getKind(), e.getMessage());
			out.println(argumentParser.generateHelpText());
			return 1;
		}

		try {
			List<StreamInfo> streams = client.getStreams(options.count);
			logger.info("Fetched {} streams from {}", streams.size(), client.getBaseUrl());
			out.println(ObjectMapperFactory.create().writerWithDefaultPrettyPrinter().writeValueAsString(streams));
			return 0;
		}
		catch (HelixApiException e) {
			if (e.getStatusCode() > 0) {
				logger.error("Helix request failed ({}, HTTP {}): {}", e.getKind(), e.getStatusCode(), e.getMessage());
			}
			else {
				logger.error("Helix request failed ({}): {}", e.getKind(), e.getMessage());
			}
			return 2;
		}
		catch (JsonProcessingException e) {
			logger.error("Could not render streams as JSON: {}", e.getOriginalMessage());
			return 2;
		}
	}

	static HelixClient createClient(ParsedOptions options) {
		return HelixClientBuilder.create()
			.clientIdFromEnv()
			.accessToken(EnvironmentSupport.get(ACCESS_TOKEN_VARIABLE))
			.baseUrl(options.baseUrl)
			.build();
	}

}
