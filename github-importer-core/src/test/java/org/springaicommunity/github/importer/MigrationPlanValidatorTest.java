package org.springaicommunity.github.importer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.importer.Fixtures.*;

@DisplayName("MigrationPlanValidator Tests")
class MigrationPlanValidatorTest {

	private final MigrationPlanValidator validator = new MigrationPlanValidator();

	private final TrelloList todo = list("l-todo", "Todo");

	private final TrelloList done = list("l-done", "Done");

	private final ListResolution noLists = new ListResolution(List.of(), List.of(), List.of());

	private final MilestoneResolution noMilestones = new MilestoneResolution(Map.of(), List.of());

	private final StatusResolution noStatuses = new StatusResolution(Map.of(), List.of(), List.of(), List.of());

	@Test
	@DisplayName("Should accept a plan without problems")
	void shouldAcceptCleanPlan() {
		List<ResolvedLabel> labels = List.of(new ResolvedLabel.Mapped(label("Bug"), githubLabel(1, "bug")));
		List<ResolvedMember> members = List.of(new ResolvedMember.Verified("jdoe", user(5, "jdoe-gh")));

		ValidationReport report = validator.validate(REPO, null, labels, noLists, noMilestones, noStatuses, members,
				List.of(githubLabel(1, "bug")));

		assertThat(report.isValid()).isTrue();
		assertThat(report.problems()).isEmpty();
		assertThat(report.hasWarnings()).isFalse();
	}

	@Test
	@DisplayName("Should report every independent problem in one pass")
	void shouldReportEveryProblem() {
		List<ResolvedLabel> labels = List.of(new ResolvedLabel.Missing(label("Bug"), EntityReference.ofName("Bug")),
				new ResolvedLabel.Missing(label("UX"), EntityReference.ofId(404)),
				new ResolvedLabel.MissingList(done, EntityReference.ofName("shipped")));
		ListResolution lists = new ListResolution(List.of(), List.of(), List.of("Doing", "Icebox"));
		MilestoneResolution milestones = new MilestoneResolution(Map.of(),
				List.of(new UnresolvedReference(done, EntityReference.ofName("v9"))));
		StatusResolution statuses = new StatusResolution(Map.of(), List.of(new PendingStatus("l-todo", "Review")),
				List.of(new UnresolvedReference(todo, EntityReference.ofName("Todo"))), List.of());
		List<ResolvedMember> members = List.of(new ResolvedMember.Unverified("jdoe", "nobody-here"));

		ValidationReport report = validator.validate(REPO, project(), labels, lists, milestones, statuses, members,
				List.of());

		assertThat(report.isValid()).isFalse();
		assertThat(report.missingLabels()).hasSize(2);
		assertThat(report.missingListLabels()).hasSize(1);
		assertThat(report.invalidLists()).containsExactly("Doing", "Icebox");
		assertThat(report.missingMilestones()).hasSize(1);
		assertThat(report.missingStatuses()).hasSize(1);
		assertThat(report.pendingStatuses()).hasSize(1);
		assertThat(report.unverifiedMembers()).hasSize(1);
		assertThat(report.problems()).extracting(ValidationReport.Problem::category)
			.containsExactly(ValidationReport.Category.RESOLUTION, ValidationReport.Category.RESOLUTION,
					ValidationReport.Category.RESOLUTION, ValidationReport.Category.RESOLUTION,
					ValidationReport.Category.PENDING_MANUAL_CREATION, ValidationReport.Category.RESOLUTION);
		assertThat(report.problems().get(0).message()).contains("Bug (Bug)", "UX (404)", "(From list Done) - shipped");
	}

	@Test
	@DisplayName("Should point pending statuses to the project settings page")
	void shouldLinkProjectSettings() {
		StatusResolution statuses = new StatusResolution(Map.of(), List.of(new PendingStatus("l-todo", "Review")),
				List.of(), List.of());

		ValidationReport report = validator.validate(REPO, project(), List.of(), noLists, noMilestones, statuses,
				List.of(), List.of());

		assertThat(report.projectSettingsUrl()).isEqualTo("https://github.com/orgs/acme/projects/7/settings");
		assertThat(report.problems()).singleElement()
			.extracting(ValidationReport.Problem::message)
			.asString()
			.contains("Review", "https://github.com/orgs/acme/projects/7/settings");
	}

	@Test
	@DisplayName("Should build user project URLs for user owners")
	void shouldBuildUserProjectUrl() {
		RepositoryTarget userRepo = new RepositoryTarget("jdoe", OwnerType.USER, "notes");

		assertThat(MigrationPlanValidator.projectSettingsUrl(userRepo, 3))
			.isEqualTo("https://github.com/users/jdoe/projects/3/settings");
	}

	@Test
	@DisplayName("Should treat status rules without project as a configuration problem")
	void shouldReportStatusWithoutProject() {
		StatusResolution statuses = new StatusResolution(Map.of(), List.of(), List.of(), List.of(todo));

		ValidationReport report = validator.validate(REPO, null, List.of(), noLists, noMilestones, statuses,
				List.of(), List.of());

		assertThat(report.isValid()).isFalse();
		assertThat(report.problems()).extracting(ValidationReport.Problem::category)
			.containsExactly(ValidationReport.Category.CONFIGURATION);
	}

	@Test
	@DisplayName("Should keep skipped and already existing labels as warnings")
	void shouldKeepConflictsAsWarnings() {
		List<ResolvedLabel> labels = List.of(new ResolvedLabel.Skipped(label("Chore")),
				new ResolvedLabel.ToCreate(label("Bug"), "bug", null),
				new ResolvedLabel.ToCreate(label("Design"), "design", "c5def5"));

		ValidationReport report = validator.validate(REPO, null, labels, noLists, noMilestones, noStatuses, List.of(),
				List.of(githubLabel(1, "bug")));

		assertThat(report.isValid()).isTrue();
		assertThat(report.skippedLabels()).containsExactly(label("Chore"));
		assertThat(report.existingLabelsToCreate()).extracting(ResolvedLabel.ToCreate::name).containsExactly("bug");
		assertThat(report.warnings()).containsExactly("These labels will not be transferred: Chore",
				"These labels already exist in GitHub: bug");
	}

}
