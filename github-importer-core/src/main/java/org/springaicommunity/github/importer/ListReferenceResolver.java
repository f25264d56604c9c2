package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the Trello list references of a mapping ({@code lists[].list} and
 * {@code skip.lists[]}) by list ID or name.
 */
public class ListReferenceResolver {

	public ListResolution resolve(TrelloBoard board, ImportMapping mapping) {
		List<ResolvedListRule> rules = new ArrayList<>();
		List<TrelloList> skipped = new ArrayList<>();
		List<String> invalid = new ArrayList<>();

		for (ListRule rule : mapping.lists()) {
			Optional<TrelloList> list = IdentityMatcher.find(rule.list(), board.lists());
			if (list.isPresent()) {
				rules.add(new ResolvedListRule(list.get(), rule));
			}
			else {
				invalid.add(rule.list());
			}
		}

		for (String reference : mapping.skipLists()) {
			Optional<TrelloList> list = IdentityMatcher.find(reference, board.lists());
			if (list.isPresent()) {
				skipped.add(list.get());
			}
			else {
				invalid.add(reference);
			}
		}

		return new ListResolution(rules, skipped, invalid);
	}

}
