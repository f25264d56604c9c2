package org.springaicommunity.github.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.github.importer.Fixtures.*;

/**
 * Tests for the GitHub services with a mocked HTTP client. NO real GitHub API calls.
 */
@DisplayName("GitHub Services Tests - Mocked HTTP Client")
@ExtendWith(MockitoExtension.class)
class GitHubServicesTest {

	@Mock
	private GitHubClient mockHttpClient;

	private ObjectMapper realObjectMapper;

	@BeforeEach
	void setUp() {
		realObjectMapper = ObjectMapperFactory.create();
	}

	@Nested
	@DisplayName("GitHubRestService Tests")
	class GitHubRestServiceTest {

		private GitHubRestService gitHubRestService;

		@BeforeEach
		void setUp() {
			gitHubRestService = new GitHubRestService(mockHttpClient, realObjectMapper);
		}

		@Test
		@DisplayName("Should page through labels until a short page")
		void shouldPageThroughLabels() {
			String fullPage = IntStream.rangeClosed(1, 100)
				.mapToObj(i -> "{\"id\":" + i + ",\"name\":\"label-" + i + "\",\"color\":\"ededed\"}")
				.collect(Collectors.joining(",", "[", "]"));
			when(mockHttpClient.get("/repos/acme/roadmap/labels?per_page=100&page=1")).thenReturn(fullPage);
			when(mockHttpClient.get("/repos/acme/roadmap/labels?per_page=100&page=2")).thenReturn("""
					[{"id": 101, "name": "bug", "color": "d73a4a", "description": "Something isn't working"}]
					""");

			List<GitHubLabel> labels = gitHubRestService.listLabels(REPO);

			assertThat(labels).hasSize(101);
			assertThat(labels.get(100)).isEqualTo(new GitHubLabel(101, "bug", "d73a4a", "Something isn't working"));
			verify(mockHttpClient, times(2)).get(anyString());
		}

		@Test
		@DisplayName("Should list open milestones")
		void shouldListOpenMilestones() {
			when(mockHttpClient.get("/repos/acme/roadmap/milestones?state=open&per_page=100&page=1")).thenReturn("""
					[{"id": 9001, "number": 3, "title": "v1.0", "state": "open"}]
					""");

			assertThat(gitHubRestService.listMilestones(REPO)).containsExactly(new GitHubMilestone(9001, 3, "v1.0"));
		}

		@Test
		@DisplayName("Should reject a listing that is not an array")
		void shouldRejectNonArrayListing() {
			when(mockHttpClient.get(anyString())).thenReturn("{\"message\":\"Moved Permanently\"}");

			assertThatThrownBy(() -> gitHubRestService.listLabels(REPO))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class)
				.hasMessageContaining("Expected a JSON array");
		}

		@Test
		@DisplayName("Should create a label with a normalized color")
		void shouldCreateLabel() throws Exception {
			when(mockHttpClient.post(eq("/repos/acme/roadmap/labels"), anyString()))
				.thenReturn("{\"id\": 7, \"name\": \"design\", \"color\": \"c5def5\"}");

			GitHubLabel label = gitHubRestService.createLabel(REPO, "design", " #c5def5");

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(mockHttpClient).post(eq("/repos/acme/roadmap/labels"), body.capture());
			JsonNode sent = realObjectMapper.readTree(body.getValue());
			assertThat(sent.path("name").asText()).isEqualTo("design");
			assertThat(sent.path("color").asText()).isEqualTo("c5def5");
			assertThat(label.name()).isEqualTo("design");
		}

		@Test
		@DisplayName("Should omit the color when none is given")
		void shouldOmitMissingColor() throws Exception {
			when(mockHttpClient.post(anyString(), anyString())).thenReturn("{\"id\": 7, \"name\": \"design\"}");

			gitHubRestService.createLabel(REPO, "design", null);

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(mockHttpClient).post(anyString(), body.capture());
			assertThat(realObjectMapper.readTree(body.getValue()).has("color")).isFalse();
		}

		@Test
		@DisplayName("Should signal an existing label on 422")
		void shouldSignalExistingLabel() {
			when(mockHttpClient.post(anyString(), anyString())).thenThrow(new GitHubHttpClient.GitHubApiException(
					"Validation failed", 422, "{\"errors\":[{\"code\":\"already_exists\"}]}"));

			assertThatThrownBy(() -> gitHubRestService.createLabel(REPO, "bug", null))
				.isInstanceOfSatisfying(LabelAlreadyExistsException.class,
						ex -> assertThat(ex.getLabelName()).isEqualTo("bug"));
		}

		@Test
		@DisplayName("Should propagate other label creation failures")
		void shouldPropagateOtherLabelFailures() {
			when(mockHttpClient.post(anyString(), anyString()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Forbidden", 403, "{}"));

			assertThatThrownBy(() -> gitHubRestService.createLabel(REPO, "bug", null))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class)
				.isNotInstanceOf(LabelAlreadyExistsException.class);
		}

		@Test
		@DisplayName("Should find an existing user")
		void shouldFindUser() {
			when(mockHttpClient.get("/users/octocat"))
				.thenReturn("{\"id\": 583231, \"login\": \"octocat\", \"name\": \"The Octocat\"}");

			assertThat(gitHubRestService.findUser("octocat"))
				.contains(new GitHubUser(583231, "octocat", "The Octocat"));
		}

		@Test
		@DisplayName("Should return empty for an unknown user")
		void shouldReturnEmptyForUnknownUser() {
			when(mockHttpClient.get("/users/ghost-account"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Not found", 404, "{}"));

			assertThat(gitHubRestService.findUser("ghost-account")).isEqualTo(Optional.empty());
		}

		@Test
		@DisplayName("Should propagate user lookup failures other than 404")
		void shouldPropagateUserLookupFailures() {
			when(mockHttpClient.get(anyString()))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Unauthorized", 401, "{}"));

			assertThatThrownBy(() -> gitHubRestService.findUser("octocat"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class)
				.hasMessage("Unauthorized");
		}

		@Test
		@DisplayName("Should create an issue from a draft")
		void shouldCreateIssue() throws Exception {
			when(mockHttpClient.post(eq("/repos/acme/roadmap/issues"), anyString())).thenReturn("""
					{"number": 42, "node_id": "I_kwDO42", "html_url": "https://github.com/acme/roadmap/issues/42"}
					""");
			IssueDraft draft = new IssueDraft("Fix login", "Body", List.of("bug"), List.of("octocat"), 3L,
					List.of("ignored comment"));

			CreatedIssue issue = gitHubRestService.createIssue(REPO, draft);

			assertThat(issue).isEqualTo(new CreatedIssue(42, "I_kwDO42", "https://github.com/acme/roadmap/issues/42"));
			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(mockHttpClient).post(eq("/repos/acme/roadmap/issues"), body.capture());
			JsonNode sent = realObjectMapper.readTree(body.getValue());
			assertThat(sent.path("title").asText()).isEqualTo("Fix login");
			assertThat(sent.path("labels").get(0).asText()).isEqualTo("bug");
			assertThat(sent.path("assignees").get(0).asText()).isEqualTo("octocat");
			assertThat(sent.path("milestone").asLong()).isEqualTo(3L);
			assertThat(sent.has("comments")).isFalse();
		}

		@Test
		@DisplayName("Should post a comment")
		void shouldPostComment() {
			when(mockHttpClient.post(anyString(), anyString())).thenReturn("{}");

			gitHubRestService.addComment(REPO, 42, "## @octocat • 2024-01-01\nHello");

			verify(mockHttpClient).post(eq("/repos/acme/roadmap/issues/42/comments"), contains("Hello"));
		}

		@ParameterizedTest
		@CsvSource({ "'#ff0000', ff0000", "' abc ', abc", "c5def5, c5def5" })
		@DisplayName("Should normalize label colors")
		void shouldNormalizeColors(String input, String expected) {
			assertThat(GitHubRestService.normalizeColor(input)).isEqualTo(expected);
		}

	}

	@Nested
	@DisplayName("GitHubGraphQLService Tests")
	class GitHubGraphQLServiceTest {

		private GitHubGraphQLService gitHubGraphQLService;

		@BeforeEach
		void setUp() {
			gitHubGraphQLService = new GitHubGraphQLService(mockHttpClient, realObjectMapper);
		}

		@Test
		@DisplayName("Should read the project and its status options")
		void shouldReadProject() {
			when(mockHttpClient.postGraphQL(anyString())).thenReturn("""
					{
					    "data": {
					        "organization": {
					            "projectV2": {
					                "id": "PVT_1",
					                "title": "Roadmap",
					                "fields": {
					                    "nodes": [
					                        {"id": "PVTF_title", "name": "Title"},
					                        {
					                            "id": "PVTSSF_status",
					                            "name": "Status",
					                            "options": [
					                                {"id": "opt-todo", "name": "Todo", "color": "GRAY"},
					                                {"id": "opt-done", "name": "Done", "color": "GRAY"}
					                            ]
					                        }
					                    ]
					                }
					            }
					        }
					    }
					}
					""");

			ProjectInfo project = gitHubGraphQLService.getProject(REPO, 7, "Status");

			assertThat(project).isEqualTo(project(option("opt-todo", "Todo"), option("opt-done", "Done")));
			verify(mockHttpClient).postGraphQL(contains("organization(login: $login)"));
		}

		@Test
		@DisplayName("Should report a missing project as not found")
		void shouldReportMissingProject() {
			when(mockHttpClient.postGraphQL(anyString()))
				.thenReturn("{\"data\": {\"organization\": {\"projectV2\": null}}}");

			assertThatThrownBy(() -> gitHubGraphQLService.getProject(REPO, 7, "Status"))
				.isInstanceOfSatisfying(GitHubHttpClient.GitHubApiException.class,
						ex -> assertThat(ex.isNotFound()).isTrue());
		}

		@Test
		@DisplayName("Should fail when the project has no such status field")
		void shouldFailWithoutStatusField() {
			when(mockHttpClient.postGraphQL(anyString())).thenReturn("""
					{"data": {"organization": {"projectV2": {"id": "PVT_1", "title": "Roadmap",
					    "fields": {"nodes": [{"id": "PVTF_title", "name": "Title"}]}}}}}
					""");

			assertThatThrownBy(() -> gitHubGraphQLService.getProject(REPO, 7, "Status"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("'Status'");
		}

		@Test
		@DisplayName("Should raise GraphQL errors")
		void shouldRaiseGraphQLErrors() {
			when(mockHttpClient.postGraphQL(anyString())).thenReturn("""
					{"data": null, "errors": [{"message": "Could not resolve to a ProjectV2 with the number 7."}]}
					""");

			assertThatThrownBy(() -> gitHubGraphQLService.getProject(REPO, 7, "Status"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class)
				.hasMessageContaining("Could not resolve to a ProjectV2");
		}

		@Test
		@DisplayName("Should list issue items and skip other content")
		void shouldListIssueItems() {
			when(mockHttpClient.postGraphQL(anyString())).thenReturn("""
					{"data": {"organization": {"projectV2": {"items": {
					    "pageInfo": {"hasNextPage": true, "endCursor": "Y3Vyc29y"},
					    "nodes": [
					        {"id": "PVTI_1", "content": {"number": 1, "title": "Fix login"},
					            "fieldValueByName": {"name": "Todo"}},
					        {"id": "PVTI_2", "content": {}, "fieldValueByName": null},
					        {"id": "PVTI_3", "content": {"number": 3, "title": "Write docs"}, "fieldValueByName": null}
					    ]
					}}}}}
					""");

			PageResult<ProjectItem> page = gitHubGraphQLService.listProjectItems(REPO, 7, "Status", 100, null);

			assertThat(page.items()).containsExactly(new ProjectItem("PVTI_1", 1, "Fix login", "Todo"),
					new ProjectItem("PVTI_3", 3, "Write docs", null));
			assertThat(page.hasMore()).isTrue();
			assertThat(page.nextCursor()).isEqualTo("Y3Vyc29y");
		}

		@Test
		@DisplayName("Should add an issue to the project")
		void shouldAddItemToProject() {
			when(mockHttpClient.postGraphQL(anyString()))
				.thenReturn("{\"data\": {\"addProjectV2ItemById\": {\"item\": {\"id\": \"PVTI_9\"}}}}");

			assertThat(gitHubGraphQLService.addItemToProject("PVT_1", "I_42")).isEqualTo("PVTI_9");
			verify(mockHttpClient).postGraphQL(contains("\"contentId\":\"I_42\""));
		}

		@Test
		@DisplayName("Should set the status option of an item")
		void shouldSetItemStatus() {
			when(mockHttpClient.postGraphQL(anyString())).thenReturn("""
					{"data": {"updateProjectV2ItemFieldValue": {"projectV2Item": {"id": "PVTI_9",
					    "fieldValueByName": {"name": "Done"}}}}}
					""");

			String status = gitHubGraphQLService.setItemStatus(project(option("opt-done", "Done")), "PVTI_9",
					option("opt-done", "Done"));

			assertThat(status).isEqualTo("Done");
			verify(mockHttpClient).postGraphQL(contains("\"optionId\":\"opt-done\""));
		}

	}

}
