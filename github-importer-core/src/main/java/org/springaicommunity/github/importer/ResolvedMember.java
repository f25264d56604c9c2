package org.springaicommunity.github.importer;

/**
 * Outcome of resolving one user rule against GitHub.
 */
public sealed interface ResolvedMember {

	/**
	 * Trello ID, username or full name used in the mapping file.
	 * @return the source name
	 */
	String sourceName();

	/**
	 * The GitHub login exists.
	 */
	record Verified(String sourceName, GitHubUser user) implements ResolvedMember {

		public String login() {
			return user.login();
		}

	}

	/**
	 * The GitHub login does not exist.
	 */
	record Unverified(String sourceName, String attemptedLogin) implements ResolvedMember {
	}

}
