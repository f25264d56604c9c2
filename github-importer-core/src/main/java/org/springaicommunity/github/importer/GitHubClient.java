package org.springaicommunity.github.importer;

/**
 * Interface for GitHub API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitHub REST and GraphQL APIs, enabling testability and
 * decorator implementations (logging, recording).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo/labels") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a POST request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo/issues")
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String post(String path, String body);

	/**
	 * Execute a POST request to the GitHub GraphQL API.
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String postGraphQL(String body);

}
