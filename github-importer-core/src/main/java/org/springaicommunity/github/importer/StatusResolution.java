package org.springaicommunity.github.importer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Project statuses resolved for list rules.
 *
 * @param byListId status option for the cards of each Trello list, keyed by list ID
 * @param pending options that must be created by hand before importing
 * @param missing status references that matched no option and were not marked for
 * creation
 * @param listsWithoutProject lists whose rule sets a status while no project is
 * configured
 */
public record StatusResolution(Map<String, StatusOption> byListId, List<PendingStatus> pending,
		List<UnresolvedReference> missing, List<TrelloList> listsWithoutProject) {

	public StatusResolution {
		byListId = Collections.unmodifiableMap(new LinkedHashMap<>(byListId));
		pending = List.copyOf(pending);
		missing = List.copyOf(missing);
		listsWithoutProject = List.copyOf(listsWithoutProject);
	}

	public boolean usedWithoutProject() {
		return !listsWithoutProject.isEmpty();
	}

}
