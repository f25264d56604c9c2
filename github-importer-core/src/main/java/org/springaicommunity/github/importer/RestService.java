package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the GitHub REST API operations used by an import.
 *
 * <p>
 * Returns strongly-typed DTOs instead of raw JSON. Every failure other than the two
 * documented signals is reported as {@link GitHubHttpClient.GitHubApiException}.
 */
public interface RestService {

	/**
	 * List all labels of a repository.
	 * @param repo the repository
	 * @return labels in API order
	 */
	List<GitHubLabel> listLabels(RepositoryTarget repo);

	/**
	 * List the open milestones of a repository.
	 * @param repo the repository
	 * @return milestones in API order
	 */
	List<GitHubMilestone> listMilestones(RepositoryTarget repo);

	/**
	 * Create a label.
	 * @param repo the repository
	 * @param name label name
	 * @param color hex color, with or without leading {@code #}, or {@code null} to let
	 * GitHub pick one
	 * @return the created label
	 * @throws LabelAlreadyExistsException if a label with that name already exists
	 */
	GitHubLabel createLabel(RepositoryTarget repo, String name, @Nullable String color);

	/**
	 * Look up a user by login.
	 * @param login the GitHub login
	 * @return the user, or empty if no such user exists
	 */
	Optional<GitHubUser> findUser(String login);

	/**
	 * Create an issue from a draft. Comments of the draft are not posted.
	 * @param repo the repository
	 * @param draft issue fields
	 * @return number and node ID of the new issue
	 */
	CreatedIssue createIssue(RepositoryTarget repo, IssueDraft draft);

	/**
	 * Add a comment to an issue.
	 * @param repo the repository
	 * @param issueNumber the issue number
	 * @param body comment body (Markdown)
	 */
	void addComment(RepositoryTarget repo, int issueNumber, String body);

}
