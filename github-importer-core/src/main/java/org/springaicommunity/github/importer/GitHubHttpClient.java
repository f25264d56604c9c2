package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for GitHub API calls using the JDK {@link HttpClient}.
 *
 * <p>
 * Every call is a single synchronous round-trip. Failures are reported as
 * {@link GitHubApiException} and are never retried here; callers decide which status
 * codes they tolerate.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private final HttpClient httpClient;

	private final String token;

	private final ImporterProperties properties;

	public GitHubHttpClient(String token) {
		this(token, new ImporterProperties());
	}

	public GitHubHttpClient(String token, ImporterProperties properties) {
		this.token = token;
		this.properties = properties;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String path) {
		String url = resolve(path);
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = restRequest(url).GET().build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String post(String path, String body) {
		String url = resolve(path);
		logger.debug("POST {} ({} bytes)", url, body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = restRequest(url).header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("POST {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("POST {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	@Override
	public String postGraphQL(String body) {
		logger.debug("POST GraphQL ({} bytes)", body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(properties.getGraphQLEndpoint()))
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", properties.getUserAgent())
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("POST GraphQL completed in {}ms ({} bytes)", System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("POST GraphQL failed after {}ms: {}", System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private String resolve(String path) {
		return path.startsWith("http") ? path : properties.getApiBaseUrl() + path;
	}

	private HttpRequest.Builder restRequest(String url) {
		return HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "token " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", properties.getApiVersion())
			.header("User-Agent", properties.getUserAgent());
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			if (remaining >= 0 && remaining < 100) {
				logger.info("Rate limit low: {} requests remaining, resets at epoch {}", remaining,
						response.headers().firstValue("X-RateLimit-Reset").orElse("?"));
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GitHub token.", statusCode,
						response.body());
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded", statusCode, response.body());
				}
				throw new GitHubApiException("Forbidden: " + response.body(), statusCode, response.body());
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body());
			}
			else if (statusCode == 422) {
				throw new GitHubApiException("Validation failed: " + response.body(), statusCode, response.body());
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body());
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * A status code of {@code -1} means the request never produced an HTTP response
	 * (transport failure) or the failure was reported inside a GraphQL payload.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public boolean isNotFound() {
			return statusCode == 404;
		}

	}

}
