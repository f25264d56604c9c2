package org.springaicommunity.github.importer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Milestones resolved for list rules.
 *
 * @param byListId milestone assigned to the cards of each Trello list, keyed by list ID
 * @param missing milestone references that matched no open milestone
 */
public record MilestoneResolution(Map<String, GitHubMilestone> byListId, List<UnresolvedReference> missing) {

	public MilestoneResolution {
		byListId = Collections.unmodifiableMap(new LinkedHashMap<>(byListId));
		missing = List.copyOf(missing);
	}

}
