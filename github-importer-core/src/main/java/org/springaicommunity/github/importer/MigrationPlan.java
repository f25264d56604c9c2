package org.springaicommunity.github.importer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Everything resolved for one import run against a single snapshot of the target.
 *
 * @param mapping the mapping as read
 * @param board the board with archived and skipped cards already removed
 * @param project the target project, or {@code null} if the mapping configures none
 * @param labels resolved labels, source labels first
 * @param members resolved user rules
 * @param milestones milestone per Trello list ID
 * @param statuses status option per Trello list ID
 * @param report the validation verdict
 */
public record MigrationPlan(ImportMapping mapping, TrelloBoard board, @Nullable ProjectInfo project,
		List<ResolvedLabel> labels, List<ResolvedMember> members, Map<String, GitHubMilestone> milestones,
		Map<String, StatusOption> statuses, ValidationReport report) {

	public MigrationPlan {
		labels = List.copyOf(labels);
		members = List.copyOf(members);
		milestones = Collections.unmodifiableMap(new LinkedHashMap<>(milestones));
		statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
	}

	public boolean isValid() {
		return report.isValid();
	}

	public RepositoryTarget repo() {
		return mapping.repo();
	}

	public List<ResolvedLabel.ToCreate> labelsToCreate() {
		return labels.stream()
			.filter(ResolvedLabel.ToCreate.class::isInstance)
			.map(ResolvedLabel.ToCreate.class::cast)
			.toList();
	}

}
