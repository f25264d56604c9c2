package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the milestone reference of each list rule against the open milestones of the
 * target repository. A numeric reference matches the milestone's ID or number, a string
 * matches its title.
 */
public class MilestoneResolver {

	public MilestoneResolution resolve(List<ResolvedListRule> listRules, List<GitHubMilestone> milestones) {
		Map<String, GitHubMilestone> byListId = new LinkedHashMap<>();
		List<UnresolvedReference> missing = new ArrayList<>();

		for (ResolvedListRule listRule : listRules) {
			EntityReference reference = listRule.rule().milestone();
			if (reference == null) {
				continue;
			}
			Optional<GitHubMilestone> milestone = IdentityMatcher.find(reference, milestones);
			if (milestone.isPresent()) {
				byListId.put(listRule.list().id(), milestone.get());
			}
			else {
				missing.add(new UnresolvedReference(listRule.list(), reference));
			}
		}

		return new MilestoneResolution(byListId, missing);
	}

}
