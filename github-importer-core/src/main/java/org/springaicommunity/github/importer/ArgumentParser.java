package org.springaicommunity.github.importer;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Command-line argument parser for the Trello to GitHub importer. Pure Java
 * implementation with no framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private final ImporterProperties defaultProperties;

	public ArgumentParser(ImporterProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-m", "--map":
					config.mapFile = getRequiredValue(args, i, "map");
					i++; // Skip next argument since we consumed it
					break;

				case "--trello-export":
					config.trelloExport = getRequiredValue(args, i, "trello-export");
					i++;
					break;

				case "--trello-url":
					config.trelloUrl = getRequiredValue(args, i, "trello-url");
					i++;
					break;

				case "--github-token":
					config.githubToken = getRequiredValue(args, i, "github-token");
					i++;
					break;

				case "--keep-closed":
					config.keepClosed = true;
					break;

				case "--keep-closed-lists":
					config.keepClosedLists = true;
					break;

				case "--dry-run":
					config.dryRun = true;
					break;

				case "-y", "--yes":
					config.assumeYes = true;
					break;

				case "--report":
					config.reportFile = getRequiredValue(args, i, "report");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
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
		help.append("Usage: github-importer [OPTIONS]\n");
		help.append("\n");
		help.append("Import the cards of a Trello board as GitHub issues, optionally placing them on a\n");
		help.append("GitHub project with a status matching their Trello list.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -m, --map FILE            Mapping file, TOML (default: ")
			.append(defaultProperties.getDefaultMapFile())
			.append(")\n");
		help.append("    --trello-export FILE      Trello board export (.json)\n");
		help.append("    --trello-url URL          Public Trello board URL (https://trello.com/b/<id>)\n");
		help.append("    --github-token TOKEN      GitHub token (default: GITHUB_TOKEN or PAT)\n");
		help.append("    --keep-closed             Also import archived cards\n");
		help.append("    --keep-closed-lists       Also import cards of archived lists\n");
		help.append("    --dry-run                 Resolve and validate the mapping without writing to GitHub\n");
		help.append("    -y, --yes                 Continue past warnings without asking\n");
		help.append("    --report FILE             Write the validation report or import summary as JSON\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("\n");
		help.append("Exactly one of --trello-export and --trello-url is required.\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN              GitHub personal access token\n");
		help.append("    PAT                       Used when GITHUB_TOKEN is not set\n");
		help.append("    Both may also be defined in a .env file\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  import completed, or dry run passed\n");
		help.append("    1  failure\n");
		help.append("    2  mapping rejected by validation\n");
		help.append("    3  cancelled at a confirmation prompt\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-importer --trello-export board.json --dry-run\n");
		help.append("    github-importer -m map.toml --trello-url https://trello.com/b/abc123/roadmap --yes\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Resolve the GitHub token: the command-line value, else {@code GITHUB_TOKEN}, else
	 * {@code PAT}.
	 * @param config parsed configuration
	 * @return the token
	 * @throws IllegalStateException if no token is available
	 */
	public String resolveToken(ParsedConfiguration config) {
		String token = config.githubToken;
		if (token != null && !token.isBlank()) {
			return token.trim();
		}
		token = EnvironmentSupport.githubToken();
		if (token == null) {
			throw new IllegalStateException(
					"A GitHub token is required. Pass --github-token or export GITHUB_TOKEN=your_token_here");
		}
		return token;
	}

	/**
	 * Board ID of a Trello board URL.
	 * @param url a URL such as {@code https://trello.com/b/abc123/roadmap}
	 * @return the board ID, or {@code null} if the URL is not a Trello board URL
	 */
	@Nullable
	public static String trelloBoardId(String url) {
		URI uri;
		try {
			uri = new URI(url);
		}
		catch (URISyntaxException e) {
			return null;
		}
		if (!"trello.com".equals(uri.getHost()) || uri.getPath() == null) {
			return null;
		}
		String[] segments = uri.getPath().split("/");
		if (segments.length < 3 || !"b".equals(segments[1]) || segments[2].isEmpty()) {
			return null;
		}
		return segments[2];
	}

	/**
	 * Export URL of a Trello board URL.
	 * @param url a board URL such as {@code https://trello.com/b/abc123/roadmap}
	 * @return {@code https://trello.com/b/abc123.json}
	 * @throws IllegalArgumentException if the URL is not a Trello board URL
	 */
	public static URI trelloExportUrl(String url) {
		String boardId = trelloBoardId(url);
		if (boardId == null) {
			throw new IllegalArgumentException("Invalid Trello board URL: " + url);
		}
		if (boardId.endsWith(".json")) {
			boardId = boardId.substring(0, boardId.length() - ".json".length());
		}
		return URI.create("https://trello.com/b/" + boardId + ".json");
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (!config.mapFile.endsWith(".toml")) {
			errors.add("The mapping file must be a TOML file (got: " + config.mapFile + ")");
		}
		else if (!Files.isRegularFile(Path.of(config.mapFile))) {
			errors.add("The path " + config.mapFile + " does not exist");
		}

		if (config.trelloExport == null && config.trelloUrl == null) {
			errors.add("Either --trello-export or --trello-url is required");
		}
		else if (config.trelloExport != null && config.trelloUrl != null) {
			errors.add("--trello-export and --trello-url cannot be used together");
		}

		if (config.trelloExport != null) {
			if (!config.trelloExport.endsWith(".json")) {
				errors.add("The Trello export must be a JSON file (got: " + config.trelloExport + ")");
			}
			else if (!Files.isRegularFile(Path.of(config.trelloExport))) {
				errors.add("The path " + config.trelloExport + " does not exist");
			}
		}

		if (config.trelloUrl != null && trelloBoardId(config.trelloUrl) == null) {
			errors.add("Invalid Trello board URL: " + config.trelloUrl + " (expected https://trello.com/b/<id>)");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
