package org.springaicommunity.github.importer;

import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for creating importer services.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * BoardImportService importer = GitHubImporterBuilder.create()
 *     .token(token)
 *     .buildImportService();
 *
 * TrelloBoard board = GitHubImporterBuilder.create().buildBoardReader().readFile(Path.of("board.json"));
 * ImportMapping mapping = new MappingReader().readFile(Path.of("map.toml"));
 * ImportOutcome outcome = importer.planAndRun(board, mapping, ImportOptions.defaults());
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * BoardImportService testImporter = GitHubImporterBuilder.create()
 *     .httpClient(mockClient)
 *     .buildImportService();
 * }
 * </pre>
 */
public class GitHubImporterBuilder {

	private @Nullable String token;

	private ImporterProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private ConfirmationPrompt prompt = ConfirmationPrompt.alwaysContinue();

	private GitHubImporterBuilder() {
		this.properties = new ImporterProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubImporterBuilder
	 */
	public static GitHubImporterBuilder create() {
		return new GitHubImporterBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubImporterBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Set importer properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubImporterBuilder properties(@Nullable ImporterProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubImporterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubImporterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the prompt consulted before continuing past warnings.
	 * @param prompt the prompt (null to always continue)
	 * @return this builder
	 */
	public GitHubImporterBuilder confirmationPrompt(@Nullable ConfirmationPrompt prompt) {
		this.prompt = prompt != null ? prompt : ConfirmationPrompt.alwaysContinue();
		return this;
	}

	/**
	 * Build a BoardImportService.
	 * @return configured BoardImportService
	 */
	public BoardImportService buildImportService() {
		validateToken();
		Components components = buildComponents();
		return new BoardImportService(components.restService, components.graphQLService, properties, prompt);
	}

	/**
	 * Build a reader for Trello board exports. Needs no token.
	 * @return configured BoardReader
	 */
	public BoardReader buildBoardReader() {
		return new BoardReader(mapper());
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or httpClient() first.");
		}
	}

	private ObjectMapper mapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private Components buildComponents() {
		ObjectMapper mapper = mapper();
		GitHubClient client = this.httpClient != null ? this.httpClient
				: new GitHubHttpClient(Objects.requireNonNull(token), properties);

		GitHubRestService restService = new GitHubRestService(client, mapper);
		GitHubGraphQLService graphQLService = new GitHubGraphQLService(client, mapper);

		return new Components(restService, graphQLService);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(RestService restService, GraphQLService graphQLService) {
	}

}
