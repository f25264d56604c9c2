package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * User intent for an import, as declared in the mapping file.
 *
 * @param repo the target repository
 * @param project number of the project to add issues to, or {@code null}
 * @param labels label rules
 * @param users user rules
 * @param lists list rules
 * @param skipLists Trello list IDs or names whose cards are not imported
 */
public record ImportMapping(RepositoryTarget repo, @Nullable Integer project, List<LabelRule> labels,
		List<UserRule> users, List<ListRule> lists, List<String> skipLists) {

	public ImportMapping {
		labels = List.copyOf(labels);
		users = List.copyOf(users);
		lists = List.copyOf(lists);
		skipLists = List.copyOf(skipLists);
	}

}
