package org.springaicommunity.github.importer;

/**
 * A member of the source board.
 *
 * @param id the Trello member ID
 * @param fullName the display name
 * @param username the Trello username
 */
public record TrelloMember(String id, String fullName, String username) {

	/**
	 * Whether a user mapping entry names this member by ID, username or full name.
	 * @param sourceName the name used in the mapping file
	 * @return true if the name identifies this member
	 */
	public boolean isNamed(String sourceName) {
		return id.equals(sourceName) || username.equals(sourceName) || fullName.equals(sourceName);
	}

}
