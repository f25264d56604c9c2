package org.springaicommunity.github.importer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link MigrationPlan}: fetches the target snapshot once, filters the board and
 * runs every resolver and the validator. Performs no write.
 */
public class MigrationPlanner {

	private static final Logger logger = LoggerFactory.getLogger(MigrationPlanner.class);

	private final RestService restService;

	private final GraphQLService graphQLService;

	private final ImporterProperties properties;

	private final ListReferenceResolver listResolver = new ListReferenceResolver();

	private final LabelResolver labelResolver = new LabelResolver();

	private final MilestoneResolver milestoneResolver = new MilestoneResolver();

	private final StatusResolver statusResolver = new StatusResolver();

	private final MigrationPlanValidator validator = new MigrationPlanValidator();

	public MigrationPlanner(RestService restService, GraphQLService graphQLService, ImporterProperties properties) {
		this.restService = restService;
		this.graphQLService = graphQLService;
		this.properties = properties;
	}

	public MigrationPlan plan(TrelloBoard board, ImportMapping mapping, ImportOptions options) {
		RepositoryTarget repo = mapping.repo();

		logger.info("Fetching labels and milestones of {}", repo.fullName());
		List<GitHubLabel> targetLabels = restService.listLabels(repo);
		List<GitHubMilestone> targetMilestones = restService.listMilestones(repo);
		logger.debug("Found {} labels and {} open milestones", targetLabels.size(), targetMilestones.size());

		List<ResolvedMember> members = new MemberResolver(restService).resolve(mapping.users());

		ProjectInfo project = fetchProject(mapping);

		TrelloBoard filtered = removeArchived(board, options);
		ListResolution lists = listResolver.resolve(filtered, mapping);
		Set<String> skippedListIds = new HashSet<>();
		lists.skippedLists().forEach(list -> skippedListIds.add(list.id()));
		filtered = filtered.withoutCardsInLists(skippedListIds);
		logger.info("{} of {} cards selected for import", filtered.cards().size(), board.cards().size());

		List<ResolvedLabel> labels = labelResolver.resolve(filtered.labels(), mapping.labels(), lists.rules(),
				targetLabels);
		MilestoneResolution milestones = milestoneResolver.resolve(lists.rules(), targetMilestones);
		StatusResolution statuses = statusResolver.resolve(lists.rules(), project);

		ValidationReport report = validator.validate(repo, project, labels, lists, milestones, statuses, members,
				targetLabels);

		return new MigrationPlan(mapping, filtered, project, labels, members, milestones.byListId(),
				statuses.byListId(), report);
	}

	@Nullable
	private ProjectInfo fetchProject(ImportMapping mapping) {
		Integer number = mapping.project();
		if (number == null) {
			return null;
		}
		logger.info("Fetching project #{} of {}", number, mapping.repo().owner());
		return graphQLService.getProject(mapping.repo(), number, properties.getStatusFieldName());
	}

	static TrelloBoard removeArchived(TrelloBoard board, ImportOptions options) {
		Set<String> closedLists = new HashSet<>();
		if (!options.keepClosedLists()) {
			board.lists().stream().filter(TrelloList::closed).forEach(list -> closedLists.add(list.id()));
		}
		return board.withCards(card -> (options.keepClosed() || !card.closed()) && !closedLists.contains(card.listId()));
	}

}
