package org.springaicommunity.github.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for GitHub GraphQL API operations on Projects (v2).
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary,
 * encapsulating all JSON parsing logic here.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubGraphQLService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public ProjectInfo getProject(RepositoryTarget owner, int projectNumber, String statusFieldName) {
		String root = owner.ownerType().graphQLField();
		String query = """
				query($login: String!, $number: Int!) {
				    %s(login: $login) {
				        projectV2(number: $number) {
				            id
				            title
				            fields(first: 100) {
				                nodes {
				                    ... on ProjectV2FieldCommon {
				                        id
				                        name
				                    }
				                    ... on ProjectV2SingleSelectField {
				                        options {
				                            id
				                            name
				                            color
				                        }
				                    }
				                }
				            }
				        }
				    }
				}
				""".formatted(root);

		JsonNode project = executeGraphQL(query, Map.of("login", owner.owner(), "number", projectNumber))
			.path("data")
			.path(root)
			.path("projectV2");
		if (project.isMissingNode() || project.isNull()) {
			throw new GitHubHttpClient.GitHubApiException(
					"Project #" + projectNumber + " not found for " + root + " " + owner.owner(), 404, null);
		}

		for (JsonNode field : project.path("fields").path("nodes")) {
			if (statusFieldName.equals(field.path("name").asText(null)) && field.path("options").isArray()) {
				List<StatusOption> options = new ArrayList<>();
				for (JsonNode option : field.path("options")) {
					options.add(new StatusOption(option.path("id").asText(""), option.path("name").asText(""),
							option.path("color").asText(null)));
				}
				logger.debug("Project '{}' has {} {} options", project.path("title").asText(), options.size(),
						statusFieldName);
				return new ProjectInfo(project.path("id").asText(""), projectNumber, project.path("title").asText(""),
						field.path("id").asText(""), statusFieldName, options);
			}
		}
		throw new IllegalStateException("Project '" + project.path("title").asText() + "' has no single-select field '"
				+ statusFieldName + "'");
	}

	@Override
	public PageResult<ProjectItem> listProjectItems(RepositoryTarget owner, int projectNumber,
			String statusFieldName, int first, @Nullable String after) {
		String root = owner.ownerType().graphQLField();
		String query = """
				query($login: String!, $number: Int!, $first: Int!, $after: String, $field: String!) {
				    %s(login: $login) {
				        projectV2(number: $number) {
				            items(first: $first, after: $after) {
				                pageInfo {
				                    hasNextPage
				                    endCursor
				                }
				                nodes {
				                    id
				                    content {
				                        ... on Issue {
				                            number
				                            title
				                        }
				                    }
				                    fieldValueByName(name: $field) {
				                        ... on ProjectV2ItemFieldSingleSelectValue {
				                            name
				                        }
				                    }
				                }
				            }
				        }
				    }
				}
				""".formatted(root);

		Map<String, Object> variables = new HashMap<>();
		variables.put("login", owner.owner());
		variables.put("number", projectNumber);
		variables.put("first", first);
		variables.put("after", after);
		variables.put("field", statusFieldName);

		JsonNode items = executeGraphQL(query, variables).path("data").path(root).path("projectV2").path("items");

		List<ProjectItem> result = new ArrayList<>();
		for (JsonNode node : items.path("nodes")) {
			JsonNode content = node.path("content");
			// draft issues and pull requests carry no issue number
			if (!content.hasNonNull("number")) {
				continue;
			}
			result.add(new ProjectItem(node.path("id").asText(""), content.path("number").asInt(),
					content.path("title").asText(""), node.path("fieldValueByName").path("name").asText(null)));
		}

		JsonNode pageInfo = items.path("pageInfo");
		boolean hasMore = pageInfo.path("hasNextPage").asBoolean(false);
		String nextCursor = hasMore ? pageInfo.path("endCursor").asText(null) : null;
		return new PageResult<>(result, nextCursor, hasMore);
	}

	@Override
	public String addItemToProject(String projectId, String contentId) {
		String mutation = """
				mutation($projectId: ID!, $contentId: ID!) {
				    addProjectV2ItemById(input: {projectId: $projectId, contentId: $contentId}) {
				        item {
				            id
				        }
				    }
				}
				""";

		JsonNode item = executeGraphQL(mutation, Map.of("projectId", projectId, "contentId", contentId))
			.path("data")
			.path("addProjectV2ItemById")
			.path("item");
		String itemId = item.path("id").asText(null);
		if (itemId == null) {
			throw new GitHubHttpClient.GitHubApiException("No project item returned for " + contentId, -1,
					item.toString());
		}
		return itemId;
	}

	@Override
	public @Nullable String setItemStatus(ProjectInfo project, String itemId, StatusOption option) {
		String mutation = """
				mutation($projectId: ID!, $itemId: ID!, $fieldId: ID!, $optionId: String!, $field: String!) {
				    updateProjectV2ItemFieldValue(
				        input: {projectId: $projectId, itemId: $itemId, fieldId: $fieldId, value: {singleSelectOptionId: $optionId}}
				    ) {
				        projectV2Item {
				            id
				            fieldValueByName(name: $field) {
				                ... on ProjectV2ItemFieldSingleSelectValue {
				                    name
				                }
				            }
				        }
				    }
				}
				""";

		JsonNode result = executeGraphQL(mutation, Map.of("projectId", project.projectId(), "itemId", itemId,
				"fieldId", project.statusFieldId(), "optionId", option.id(), "field", project.statusFieldName()));
		return result.path("data")
			.path("updateProjectV2ItemFieldValue")
			.path("projectV2Item")
			.path("fieldValueByName")
			.path("name")
			.asText(null);
	}

	// ========== Internal GraphQL Execution ==========

	private JsonNode executeGraphQL(String query, Map<String, ?> variables) {
		String requestBody;
		try {
			requestBody = objectMapper.writeValueAsString(Map.of("query", query, "variables", variables));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize GraphQL request", e);
		}

		String response = httpClient.postGraphQL(requestBody);

		JsonNode result;
		try {
			result = objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed GraphQL response: " + e.getOriginalMessage(), e);
		}

		JsonNode errors = result.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			List<String> messages = new ArrayList<>();
			for (JsonNode error : errors) {
				messages.add(error.path("message").asText(error.toString()));
			}
			logger.error("GraphQL request failed: {}", messages);
			throw new GitHubHttpClient.GitHubApiException("GraphQL error: " + String.join("; ", messages), -1,
					response);
		}
		return result;
	}

}
