package org.springaicommunity.github.importer;

/**
 * A list rule reference that matched no target entity.
 *
 * @param list the Trello list the rule belongs to
 * @param reference the unmatched reference
 */
public record UnresolvedReference(TrelloList list, EntityReference reference) {

	@Override
	public String toString() {
		return reference + " (list " + list.name() + ")";
	}

}
