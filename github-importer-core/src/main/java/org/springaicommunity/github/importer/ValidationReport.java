package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/**
 * Every problem found while resolving a mapping, collected in a single pass.
 *
 * <p>
 * Problems make the plan invalid. Warnings never do; they are surfaced to the operator,
 * who may decline to continue.
 *
 * @param missingLabels label rules whose reference matched no target label
 * @param missingListLabels list label rules whose reference matched no target label
 * @param invalidLists list references (from list rules or {@code skip.lists}) that name
 * no Trello list
 * @param missingMilestones milestone references that matched no open milestone
 * @param missingStatuses status references that matched no option
 * @param pendingStatuses status options to create by hand before re-running
 * @param statusListsWithoutProject lists with a status rule while no project is set
 * @param unverifiedMembers user rules naming a GitHub login that does not exist
 * @param skippedLabels Trello labels no rule mentions (warning)
 * @param existingLabelsToCreate labels marked for creation that already exist (warning)
 * @param projectSettingsUrl settings page of the target project, or {@code null}
 */
public record ValidationReport(List<ResolvedLabel.Missing> missingLabels,
		List<ResolvedLabel.MissingList> missingListLabels, List<String> invalidLists,
		List<UnresolvedReference> missingMilestones, List<UnresolvedReference> missingStatuses,
		List<PendingStatus> pendingStatuses, List<TrelloList> statusListsWithoutProject,
		List<ResolvedMember.Unverified> unverifiedMembers, List<TrelloLabel> skippedLabels,
		List<ResolvedLabel.ToCreate> existingLabelsToCreate, @Nullable String projectSettingsUrl) {

	public ValidationReport {
		missingLabels = List.copyOf(missingLabels);
		missingListLabels = List.copyOf(missingListLabels);
		invalidLists = List.copyOf(invalidLists);
		missingMilestones = List.copyOf(missingMilestones);
		missingStatuses = List.copyOf(missingStatuses);
		pendingStatuses = List.copyOf(pendingStatuses);
		statusListsWithoutProject = List.copyOf(statusListsWithoutProject);
		unverifiedMembers = List.copyOf(unverifiedMembers);
		skippedLabels = List.copyOf(skippedLabels);
		existingLabelsToCreate = List.copyOf(existingLabelsToCreate);
	}

	/**
	 * Returns true if no problem was found. Warnings do not count.
	 */
	public boolean isValid() {
		return missingLabels.isEmpty() && missingListLabels.isEmpty() && invalidLists.isEmpty()
				&& missingMilestones.isEmpty() && missingStatuses.isEmpty() && pendingStatuses.isEmpty()
				&& statusListsWithoutProject.isEmpty() && unverifiedMembers.isEmpty();
	}

	public boolean hasWarnings() {
		return !skippedLabels.isEmpty() || !existingLabelsToCreate.isEmpty();
	}

	/**
	 * Problems as operator-facing messages, one per problem class.
	 * @return messages in a fixed order, empty when the plan is valid
	 */
	public List<Problem> problems() {
		List<Problem> problems = new ArrayList<>();
		if (!missingLabels.isEmpty() || !missingListLabels.isEmpty()) {
			List<String> labels = new ArrayList<>();
			missingLabels.forEach(label -> labels.add(label.source().name() + " (" + label.lookup() + ")"));
			missingListLabels
				.forEach(label -> labels.add("(From list " + label.list().name() + ") - " + label.lookup()));
			problems.add(new Problem(Category.RESOLUTION, "Could not find labels in GitHub: " + join(labels)));
		}
		if (!invalidLists.isEmpty()) {
			problems.add(new Problem(Category.RESOLUTION,
					"These lists (see lists[].list or skip.lists[]) do not exist in Trello: " + join(invalidLists)));
		}
		if (!missingMilestones.isEmpty()) {
			problems.add(new Problem(Category.RESOLUTION,
					"These milestones (see lists[].milestone) do not exist in GitHub: " + join(missingMilestones)));
		}
		if (!missingStatuses.isEmpty()) {
			problems.add(new Problem(Category.RESOLUTION,
					"These status fields (see lists[].status) do not exist in the project: " + join(missingStatuses)));
		}
		if (!pendingStatuses.isEmpty()) {
			String names = join(pendingStatuses.stream().map(PendingStatus::name).toList());
			String message = "These status fields need to be created manually (create = true): " + names;
			if (projectSettingsUrl != null) {
				message += ". Create them at " + projectSettingsUrl + " and re-run.";
			}
			problems.add(new Problem(Category.PENDING_MANUAL_CREATION, message));
		}
		if (!statusListsWithoutProject.isEmpty()) {
			problems.add(new Problem(Category.CONFIGURATION,
					"The lists[].status option can only be used if project is set (lists: "
							+ join(statusListsWithoutProject.stream().map(TrelloList::name).toList()) + ")"));
		}
		if (!unverifiedMembers.isEmpty()) {
			problems.add(new Problem(Category.RESOLUTION, "The following Trello users are not GitHub users: "
					+ join(unverifiedMembers.stream().map(m -> "@" + m.sourceName() + " (@" + m.attemptedLogin() + ")")
						.toList())));
		}
		return problems;
	}

	/**
	 * Warnings as operator-facing messages.
	 * @return messages, empty when there is nothing to confirm
	 */
	public List<String> warnings() {
		List<String> warnings = new ArrayList<>();
		if (!skippedLabels.isEmpty()) {
			warnings.add("These labels will not be transferred: "
					+ join(skippedLabels.stream().map(TrelloLabel::name).toList()));
		}
		if (!existingLabelsToCreate.isEmpty()) {
			warnings.add("These labels already exist in GitHub: "
					+ join(existingLabelsToCreate.stream().map(ResolvedLabel.ToCreate::name).toList()));
		}
		return warnings;
	}

	private static String join(List<?> values) {
		return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
	}

	/**
	 * Kind of a validation problem.
	 */
	public enum Category {

		/**
		 * A reference to a Trello or GitHub entity did not resolve.
		 */
		RESOLUTION,

		/**
		 * The mapping combines options that cannot be used together.
		 */
		CONFIGURATION,

		/**
		 * A project status option has to be created by hand before importing.
		 */
		PENDING_MANUAL_CREATION

	}

	/**
	 * @param category the kind of problem
	 * @param message operator-facing description
	 */
	public record Problem(Category category, String message) {
	}

}
