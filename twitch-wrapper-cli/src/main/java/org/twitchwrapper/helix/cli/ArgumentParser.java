package org.twitchwrapper.helix.cli;

/**
 * Command-line argument parser for the top streams tool. Pure Java implementation with
 * no framework dependencies.
 */
public class ArgumentParser {

	/**
	 * Parse command-line arguments and return options.
	 * @param args Command-line arguments
	 * @return Parsed options object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedOptions parseAndValidate(String[] args) {
		ParsedOptions options = new ParsedOptions();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-n", "--count":
					String countStr = getRequiredValue(args, i, "count");
					try {
						options.count = Integer.parseInt(countStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid count '" + countStr + "': must be a positive integer");
					}
					if (options.count <= 0) {
						throw new IllegalArgumentException("Count must be positive: " + options.count);
					}
					i++; // Skip next argument since we consumed it
					break;

				case "--base-url":
					options.baseUrl = getRequiredValue(args, i, "base-url");
					i++;
					break;

				case "-h", "--help":
					options.helpRequested = true;
					break;

				default:
					throw new IllegalArgumentException(
							arg.startsWith("-") ? "Unknown option: " + arg : "Unexpected argument: " + arg);
			}
		}

		return options;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: java -jar twitch-wrapper-cli.jar [OPTIONS]\n");
		help.append("\n");
		help.append("Print the current top live streams on Twitch as JSON.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -n, --count <n>         Number of streams to print (default: ")
			.append(ParsedOptions.DEFAULT_COUNT)
			.append(")\n");
		help.append("    --base-url <url>        Helix base URL (default: ")
			.append(new ParsedOptions().baseUrl)
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    CLIENT_ID              Twitch application client id (required)\n");
		help.append("    TWITCH_ACCESS_TOKEN    App or user access token sent as Bearer (optional)\n");
		help.append("    Both may also be set in a .env file in the working or home directory\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    java -jar twitch-wrapper-cli.jar\n");
		help.append("    java -jar twitch-wrapper-cli.jar --count 150\n");
		help.append("    java -jar twitch-wrapper-cli.jar --base-url http://localhost:8080/mock\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

}
