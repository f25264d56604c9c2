package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * Interface for the GitHub GraphQL operations on Projects (v2).
 *
 * <p>
 * Extracted to enable mocking in tests. Every failure, including errors reported inside
 * a GraphQL response, is raised as {@link GitHubHttpClient.GitHubApiException}.
 */
public interface GraphQLService {

	/**
	 * Fetch a project's identity, its status field and the field's options.
	 * @param owner repository whose owner holds the project
	 * @param projectNumber project number within the owner
	 * @param statusFieldName name of the single-select status field
	 * @return project information
	 * @throws IllegalStateException if the project has no single-select field of that
	 * name
	 */
	ProjectInfo getProject(RepositoryTarget owner, int projectNumber, String statusFieldName);

	/**
	 * Fetch one page of project items that are linked to issues.
	 * @param owner repository whose owner holds the project
	 * @param projectNumber project number within the owner
	 * @param statusFieldName name of the status field to read
	 * @param first page size
	 * @param after cursor of the previous page, or {@code null} for the first page
	 * @return items of the page and the cursor of the next one
	 */
	PageResult<ProjectItem> listProjectItems(RepositoryTarget owner, int projectNumber, String statusFieldName,
			int first, @Nullable String after);

	/**
	 * Add an issue to a project.
	 * @param projectId the project's node ID
	 * @param contentId the issue's node ID
	 * @return node ID of the new project item
	 */
	String addItemToProject(String projectId, String contentId);

	/**
	 * Set the status field of a project item.
	 * @param project the project
	 * @param itemId node ID of the project item
	 * @param option the option to select
	 * @return status name reported back by GitHub, or {@code null} if none was returned
	 */
	@Nullable
	String setItemStatus(ProjectInfo project, String itemId, StatusOption option);

}
