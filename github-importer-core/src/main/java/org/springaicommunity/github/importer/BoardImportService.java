package org.springaicommunity.github.importer;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Imports a Trello board into GitHub issues and, optionally, a GitHub project.
 *
 * <p>
 * Runs strictly in sequence: resolve and validate, create labels, reconcile the status of
 * items already on the project, then for every card create the issue, post its comments,
 * add it to the project and set its status. Nothing is written unless the plan is valid.
 * Any GitHub failure during the write phase aborts the run and leaves what was already
 * created in place.
 */
public class BoardImportService {

	private static final Logger logger = LoggerFactory.getLogger(BoardImportService.class);

	private final RestService restService;

	private final GraphQLService graphQLService;

	private final MigrationPlanner planner;

	private final StatusSynchronizer synchronizer;

	private final ConfirmationPrompt prompt;

	public BoardImportService(RestService restService, GraphQLService graphQLService, ImporterProperties properties,
			ConfirmationPrompt prompt) {
		this.restService = restService;
		this.graphQLService = graphQLService;
		this.planner = new MigrationPlanner(restService, graphQLService, properties);
		this.synchronizer = new StatusSynchronizer(graphQLService, properties);
		this.prompt = prompt;
	}

	/**
	 * Resolve the mapping against the board and GitHub without writing anything.
	 * @param board the Trello board
	 * @param mapping the mapping
	 * @param options run options
	 * @return the plan and its validation report
	 */
	public MigrationPlan plan(TrelloBoard board, ImportMapping mapping, ImportOptions options) {
		return planner.plan(board, mapping, options);
	}

	/**
	 * Plan the import and, when the plan is valid, run it.
	 * @param board the Trello board
	 * @param mapping the mapping
	 * @param options run options
	 * @return the outcome
	 * @throws GitHubHttpClient.GitHubApiException if a GitHub call fails
	 */
	public ImportOutcome planAndRun(TrelloBoard board, ImportMapping mapping, ImportOptions options) {
		MigrationPlan plan = plan(board, mapping, options);
		ValidationReport report = plan.report();
		logPlan(plan);

		if (!report.isValid()) {
			report.problems().forEach(problem -> logger.error(problem.message()));
			return new ImportOutcome.Rejected(report);
		}
		report.warnings().forEach(logger::warn);

		if (options.dryRun()) {
			logger.info("Dry run: {} issues and {} labels would be created", plan.board().cards().size(),
					plan.labelsToCreate().size());
			return new ImportOutcome.DryRun(report, plan.board().cards().size(), plan.labelsToCreate().size());
		}

		if (!report.skippedLabels().isEmpty()
				&& !prompt.confirm("Some labels will not be transferred. Would you like to continue?")) {
			return new ImportOutcome.Cancelled("Skipped labels were not confirmed");
		}
		if (!report.existingLabelsToCreate().isEmpty()
				&& !prompt.confirm("Some labels already exist. Are you sure you would like to continue creating them?")) {
			return new ImportOutcome.Cancelled("Creating existing labels was not confirmed");
		}

		return new ImportOutcome.Completed(run(plan));
	}

	private ImportSummary run(MigrationPlan plan) {
		Counts counts = new Counts();
		createLabels(plan, counts);

		SyncResult sync = synchronizer.synchronize(plan);
		counts.existingItemsUpdated = sync.updated();
		counts.existingItemsSkipped = sync.skipped();

		List<TrelloCard> cards = plan.board().cards();
		CardTransformer transformer = new CardTransformer(plan);
		logger.info("Creating {} issues", cards.size());
		for (int i = 0; i < cards.size(); i++) {
			importCard(plan, transformer, cards.get(i), counts);
			logger.debug("Created issue {}/{}", i + 1, cards.size());
		}
		logger.info("Created {} issues", counts.issuesCreated);

		return counts.toSummary();
	}

	private void createLabels(MigrationPlan plan, Counts counts) {
		List<ResolvedLabel.ToCreate> labels = plan.labelsToCreate();
		if (labels.isEmpty()) {
			return;
		}
		for (ResolvedLabel.ToCreate label : labels) {
			try {
				restService.createLabel(plan.repo(), label.name(), label.color());
				counts.labelsCreated++;
			}
			catch (LabelAlreadyExistsException ex) {
				logger.warn("Label {} already exists, skipping...", ex.getLabelName());
				counts.labelsAlreadyExisting++;
			}
		}
		logger.info("Created {} labels, skipped {} existing labels", counts.labelsCreated,
				counts.labelsAlreadyExisting);
	}

	private void importCard(MigrationPlan plan, CardTransformer transformer, TrelloCard card, Counts counts) {
		IssueDraft draft = transformer.transform(card);
		CreatedIssue issue = restService.createIssue(plan.repo(), draft);
		counts.issuesCreated++;

		for (String comment : draft.comments()) {
			restService.addComment(plan.repo(), issue.number(), comment);
			counts.commentsCreated++;
		}

		ProjectInfo project = plan.project();
		if (project == null) {
			return;
		}
		String itemId = graphQLService.addItemToProject(project.projectId(), issue.nodeId());
		counts.itemsAddedToProject++;

		StatusOption status = plan.statuses().get(card.listId());
		if (status == null) {
			logger.debug("No status mapping for card \"{}\" in list {}", card.name(), card.listId());
			return;
		}
		logger.info("Setting \"{}\" to status {}", card.name(), status.name());
		String reported = graphQLService.setItemStatus(project, itemId, status);
		if (reported != null) {
			logger.debug("Status of #{} is now {}", issue.number(), reported);
		}
		counts.statusesSet++;
	}

	private void logPlan(MigrationPlan plan) {
		for (ResolvedLabel label : plan.labels()) {
			String line = switch (label.kind()) {
				case MAPPED -> {
					ResolvedLabel.Mapped mapped = (ResolvedLabel.Mapped) label;
					yield mapped.source().name() + " -> " + mapped.target().name();
				}
				case TO_CREATE -> {
					ResolvedLabel.ToCreate toCreate = (ResolvedLabel.ToCreate) label;
					yield toCreate.source().name() + " -> " + toCreate.name() + " (new)";
				}
				case LIST_MAPPED -> {
					ResolvedLabel.ListMapped listMapped = (ResolvedLabel.ListMapped) label;
					yield "From list " + listMapped.list().name() + " -> " + listMapped.target().name();
				}
				case SKIPPED, MISSING, MISSING_LIST -> null;
			};
			if (line != null) {
				logger.info("Mapping label {}", line);
			}
		}
		for (Map.Entry<String, StatusOption> entry : plan.statuses().entrySet()) {
			String listName = plan.board().findList(entry.getKey()).map(TrelloList::name).orElse(entry.getKey());
			logger.info("Mapping column {} -> {}", listName, entry.getValue().name());
		}
		for (Map.Entry<String, GitHubMilestone> entry : plan.milestones().entrySet()) {
			String listName = plan.board().findList(entry.getKey()).map(TrelloList::name).orElse(entry.getKey());
			logger.info("Mapping milestone {} -> {}", listName, entry.getValue().title());
		}
	}

	private static class Counts {

		int labelsCreated;

		int labelsAlreadyExisting;

		int existingItemsUpdated;

		int existingItemsSkipped;

		int issuesCreated;

		int commentsCreated;

		int itemsAddedToProject;

		int statusesSet;

		ImportSummary toSummary() {
			return new ImportSummary(labelsCreated, labelsAlreadyExisting, existingItemsUpdated, existingItemsSkipped,
					issuesCreated, commentsCreated, itemsAddedToProject, statusesSet);
		}

	}

}
