package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * A list (column) of the source board.
 *
 * @param id the Trello list ID
 * @param name the list name
 * @param closed whether the list is archived
 */
public record TrelloList(String id, String name, boolean closed) implements Identifiable {

	@Override
	public @Nullable String key() {
		return id;
	}

}
