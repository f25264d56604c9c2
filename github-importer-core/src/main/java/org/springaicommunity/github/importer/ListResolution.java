package org.springaicommunity.github.importer;

import java.util.List;

/**
 * Trello list references of a mapping, resolved against the board.
 *
 * @param rules list rules whose list exists
 * @param skippedLists lists named by {@code skip.lists}
 * @param invalidLists references from list rules or {@code skip.lists} that name no list
 */
public record ListResolution(List<ResolvedListRule> rules, List<TrelloList> skippedLists, List<String> invalidLists) {

	public ListResolution {
		rules = List.copyOf(rules);
		skippedLists = List.copyOf(skippedLists);
		invalidLists = List.copyOf(invalidLists);
	}

}
