package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Resolves the status reference of each list rule against the options of the project's
 * status field.
 *
 * <p>
 * An existing option always wins, whatever the rule's {@code create} flag says. A string
 * reference with {@code create = true} that matches nothing becomes a
 * {@link PendingStatus}. Any other miss is reported as missing.
 */
public class StatusResolver {

	/**
	 * @param listRules list rules whose list resolved
	 * @param project the target project, or {@code null} if the mapping configures none
	 * @return the resolution
	 */
	public StatusResolution resolve(List<ResolvedListRule> listRules, @Nullable ProjectInfo project) {
		Map<String, StatusOption> byListId = new LinkedHashMap<>();
		List<PendingStatus> pending = new ArrayList<>();
		List<UnresolvedReference> missing = new ArrayList<>();
		List<TrelloList> withoutProject = new ArrayList<>();

		for (ResolvedListRule listRule : listRules) {
			ListRule rule = listRule.rule();
			EntityReference reference = rule.status();
			if (reference == null) {
				continue;
			}
			if (project == null) {
				withoutProject.add(listRule.list());
				continue;
			}
			Optional<StatusOption> option = IdentityMatcher.find(reference, project.statusOptions());
			if (option.isPresent()) {
				byListId.put(listRule.list().id(), option.get());
			}
			else if (rule.create() && !reference.isNumeric()) {
				pending.add(new PendingStatus(listRule.list().id(), reference.requireName()));
			}
			else {
				missing.add(new UnresolvedReference(listRule.list(), reference));
			}
		}

		return new StatusResolution(byListId, pending, missing, withoutProject);
	}

}
