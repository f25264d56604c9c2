package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Aggregates the output of all resolvers into one {@link ValidationReport}.
 *
 * <p>
 * Every independent failure is collected; validation never stops at the first one so
 * that a mapping can be fixed in a single round.
 */
public class MigrationPlanValidator {

	public ValidationReport validate(RepositoryTarget repo, @Nullable ProjectInfo project, List<ResolvedLabel> labels,
			ListResolution lists, MilestoneResolution milestones, StatusResolution statuses,
			List<ResolvedMember> members, List<GitHubLabel> targetLabels) {
		List<ResolvedLabel.Missing> missingLabels = new ArrayList<>();
		List<ResolvedLabel.MissingList> missingListLabels = new ArrayList<>();
		List<TrelloLabel> skippedLabels = new ArrayList<>();
		List<ResolvedLabel.ToCreate> existingLabelsToCreate = new ArrayList<>();

		for (ResolvedLabel label : labels) {
			switch (label.kind()) {
				case MISSING -> missingLabels.add((ResolvedLabel.Missing) label);
				case MISSING_LIST -> missingListLabels.add((ResolvedLabel.MissingList) label);
				case SKIPPED -> skippedLabels.add(((ResolvedLabel.Skipped) label).source());
				case TO_CREATE -> {
					ResolvedLabel.ToCreate toCreate = (ResolvedLabel.ToCreate) label;
					if (targetLabels.stream().anyMatch(target -> target.name().equals(toCreate.name()))) {
						existingLabelsToCreate.add(toCreate);
					}
				}
				case MAPPED, LIST_MAPPED -> {
				}
			}
		}

		List<ResolvedMember.Unverified> unverified = members.stream()
			.filter(ResolvedMember.Unverified.class::isInstance)
			.map(ResolvedMember.Unverified.class::cast)
			.toList();

		String settingsUrl = project != null ? projectSettingsUrl(repo, project.number()) : null;

		return new ValidationReport(missingLabels, missingListLabels, lists.invalidLists(), milestones.missing(),
				statuses.missing(), statuses.pending(), statuses.listsWithoutProject(), unverified, skippedLabels,
				existingLabelsToCreate, settingsUrl);
	}

	/**
	 * Settings page of a project, where status options are added by hand.
	 * @param owner repository whose owner holds the project
	 * @param projectNumber the project number
	 * @return the URL
	 */
	public static String projectSettingsUrl(RepositoryTarget owner, int projectNumber) {
		return "https://github.com/" + owner.ownerType().urlSegment() + "/" + owner.owner() + "/projects/"
				+ projectNumber + "/settings";
	}

}
