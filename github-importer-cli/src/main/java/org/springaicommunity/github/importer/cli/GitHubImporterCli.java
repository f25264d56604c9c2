package org.springaicommunity.github.importer.cli;

import java.nio.file.Path;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.importer.ArgumentParser;
import org.springaicommunity.github.importer.BoardImportService;
import org.springaicommunity.github.importer.ConfirmationPrompt;
import org.springaicommunity.github.importer.GitHubClient;
import org.springaicommunity.github.importer.GitHubImporterBuilder;
import org.springaicommunity.github.importer.ImportMapping;
import org.springaicommunity.github.importer.ImportOutcome;
import org.springaicommunity.github.importer.ImportSummary;
import org.springaicommunity.github.importer.ImporterProperties;
import org.springaicommunity.github.importer.MappingReader;
import org.springaicommunity.github.importer.ObjectMapperFactory;
import org.springaicommunity.github.importer.ParsedConfiguration;
import org.springaicommunity.github.importer.TrelloBoard;

/**
 * Trello to GitHub importer CLI Application
 *
 * Plain Java command-line application that imports the cards of a Trello board as GitHub
 * issues. Uses GitHubImporterBuilder for service wiring.
 *
 * Usage: java -jar github-importer-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN (or PAT) - GitHub personal access token for
 * authentication
 *
 * Examples: java -jar github-importer-cli.jar --trello-export board.json --dry-run java
 * -jar github-importer-cli.jar -m map.toml --trello-url https://trello.com/b/abc123 --yes
 */
public class GitHubImporterCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubImporterCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_REJECTED = 2;

	static final int EXIT_CANCELLED = 3;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != EXIT_OK) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Import failed: {}", e.getMessage());
			System.exit(EXIT_FAILURE);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, null);
	}

	/**
	 * Run the importer.
	 * @param args command-line arguments
	 * @param httpClient client to use instead of one built from the token, or
	 * {@code null}
	 * @return the process exit code
	 * @throws Exception if reading inputs or calling GitHub fails
	 */
	static int run(String[] args, @Nullable GitHubClient httpClient) throws Exception {
		ImporterProperties properties = new ImporterProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		if (config.verbose) {
			((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("org.springaicommunity.github.importer"))
				.setLevel(Level.DEBUG);
		}
		logConfiguration(config);

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		ConfirmationPrompt prompt = config.assumeYes ? ConfirmationPrompt.alwaysContinue()
				: new ConsoleConfirmationPrompt();
		GitHubImporterBuilder builder = GitHubImporterBuilder.create()
			.properties(properties)
			.objectMapper(objectMapper)
			.confirmationPrompt(prompt);
		if (httpClient != null) {
			builder.httpClient(httpClient);
		}
		else {
			builder.token(argumentParser.resolveToken(config));
		}

		TrelloBoard board = readBoard(builder, config);
		ImportMapping mapping = new MappingReader().readFile(Path.of(config.mapFile));
		logger.info("Importing board '{}' into {}", board.name(), mapping.repo().fullName());

		BoardImportService importer = builder.buildImportService();
		ImportOutcome outcome = importer.planAndRun(board, mapping, config.toImportOptions());

		if (config.reportFile != null) {
			objectMapper.writerWithDefaultPrettyPrinter()
				.writeValue(Path.of(config.reportFile).toFile(), RunReport.of(outcome));
			logger.info("Report written to {}", config.reportFile);
		}

		return switch (outcome.kind()) {
			case REJECTED -> {
				logger.error("The mapping has problems; nothing was imported");
				yield EXIT_REJECTED;
			}
			case CANCELLED -> {
				logger.warn("Import cancelled: {}", ((ImportOutcome.Cancelled) outcome).reason());
				yield EXIT_CANCELLED;
			}
			case DRY_RUN -> {
				logger.info("Dry run passed: {} cards would be imported",
						((ImportOutcome.DryRun) outcome).cardCount());
				yield EXIT_OK;
			}
			case COMPLETED -> {
				logSummary(((ImportOutcome.Completed) outcome).summary());
				yield EXIT_OK;
			}
		};
	}

	private static TrelloBoard readBoard(GitHubImporterBuilder builder, ParsedConfiguration config) throws Exception {
		if (config.trelloUrl != null) {
			return builder.buildBoardReader().readUrl(ArgumentParser.trelloExportUrl(config.trelloUrl));
		}
		return builder.buildBoardReader().readFile(Path.of(String.valueOf(config.trelloExport)));
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Mapping file: {}", config.mapFile);
		logger.info("  Trello source: {}", config.trelloUrl != null ? config.trelloUrl : config.trelloExport);
		logger.info("  Keep closed cards: {}", config.keepClosed);
		logger.info("  Keep closed lists: {}", config.keepClosedLists);
		logger.info("  Dry run: {}", config.dryRun);
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logSummary(ImportSummary summary) {
		logger.info("Import completed:");
		logger.info("  Labels created: {} ({} already existed)", summary.labelsCreated(),
				summary.labelsAlreadyExisting());
		logger.info("  Existing project items updated: {} (skipped {})", summary.existingItemsUpdated(),
				summary.existingItemsSkipped());
		logger.info("  Issues created: {}", summary.issuesCreated());
		logger.info("  Comments created: {}", summary.commentsCreated());
		logger.info("  Items added to project: {}", summary.itemsAddedToProject());
		logger.info("  Statuses set: {}", summary.statusesSet());
	}

}
