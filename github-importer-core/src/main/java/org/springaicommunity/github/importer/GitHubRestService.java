package org.springaicommunity.github.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private static final int PAGE_SIZE = 100;

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public List<GitHubLabel> listLabels(RepositoryTarget repo) {
		List<GitHubLabel> labels = listAll(repo.apiPath() + "/labels?", this::parseLabel);
		logger.debug("Found {} labels in {}", labels.size(), repo.fullName());
		return labels;
	}

	@Override
	public List<GitHubMilestone> listMilestones(RepositoryTarget repo) {
		List<GitHubMilestone> milestones = listAll(repo.apiPath() + "/milestones?state=open&",
				node -> new GitHubMilestone(node.path("id").asLong(), node.path("number").asLong(),
						node.path("title").asText("")));
		logger.debug("Found {} milestones in {}", milestones.size(), repo.fullName());
		return milestones;
	}

	@Override
	public GitHubLabel createLabel(RepositoryTarget repo, String name, @Nullable String color) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("name", name);
		String normalizedColor = normalizeColor(color);
		if (normalizedColor != null) {
			body.put("color", normalizedColor);
		}

		try {
			return parseLabel(readTree(httpClient.post(repo.apiPath() + "/labels", writeJson(body))));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.getStatusCode() == 422) {
				throw new LabelAlreadyExistsException(name, String.valueOf(e.getResponseBody()));
			}
			throw e;
		}
	}

	@Override
	public Optional<GitHubUser> findUser(String login) {
		try {
			JsonNode node = readTree(httpClient.get("/users/" + encode(login)));
			return Optional.of(new GitHubUser(node.path("id").asLong(), node.path("login").asText(login),
					node.path("name").asText(null)));
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isNotFound()) {
				logger.debug("GitHub user @{} does not exist", login);
				return Optional.empty();
			}
			throw e;
		}
	}

	@Override
	public CreatedIssue createIssue(RepositoryTarget repo, IssueDraft draft) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("title", draft.title());
		body.put("body", draft.body());
		body.put("labels", draft.labels());
		body.put("assignees", draft.assignees());
		if (draft.milestone() != null) {
			body.put("milestone", draft.milestone());
		}

		JsonNode node = readTree(httpClient.post(repo.apiPath() + "/issues", writeJson(body)));
		return new CreatedIssue(node.path("number").asInt(), node.path("node_id").asText(""),
				node.path("html_url").asText(""));
	}

	@Override
	public void addComment(RepositoryTarget repo, int issueNumber, String body) {
		httpClient.post(repo.apiPath() + "/issues/" + issueNumber + "/comments", writeJson(Map.of("body", body)));
	}

	/**
	 * Strip whitespace and a leading {@code #} from a hex color.
	 * @param color raw color from the mapping file
	 * @return color as expected by the labels API, or {@code null}
	 */
	static @Nullable String normalizeColor(@Nullable String color) {
		if (color == null) {
			return null;
		}
		String trimmed = color.trim();
		return trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
	}

	// ========== JSON Helpers ==========

	private <T> List<T> listAll(String pathWithQuery, Function<JsonNode, T> parser) {
		List<T> result = new ArrayList<>();
		int page = 1;
		while (true) {
			JsonNode nodes = readTree(httpClient.get(pathWithQuery + "per_page=" + PAGE_SIZE + "&page=" + page));
			if (!nodes.isArray()) {
				throw new GitHubHttpClient.GitHubApiException("Expected a JSON array from " + pathWithQuery, -1,
						nodes.toString());
			}
			for (JsonNode node : nodes) {
				result.add(parser.apply(node));
			}
			// a short page is the last one
			if (nodes.size() < PAGE_SIZE) {
				return result;
			}
			page++;
		}
	}

	private GitHubLabel parseLabel(JsonNode node) {
		return new GitHubLabel(node.path("id").asLong(), node.path("name").asText(""), node.path("color").asText(null),
				node.path("description").asText(null));
	}

	private JsonNode readTree(String response) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed GitHub response: " + e.getOriginalMessage(), e);
		}
	}

	private String writeJson(Object body) {
		try {
			return objectMapper.writeValueAsString(body);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize request body", e);
		}
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
