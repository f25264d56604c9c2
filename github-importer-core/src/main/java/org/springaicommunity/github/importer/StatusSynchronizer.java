package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the status of issues already on the project in line with the Trello list of the
 * card they came from.
 *
 * <p>
 * Items are matched to cards by exact title. Only items whose current status differs from
 * the expected one are updated, so running it twice against an unchanged project performs
 * no update the second time.
 */
public class StatusSynchronizer {

	private static final Logger logger = LoggerFactory.getLogger(StatusSynchronizer.class);

	private final GraphQLService graphQLService;

	private final ImporterProperties properties;

	public StatusSynchronizer(GraphQLService graphQLService, ImporterProperties properties) {
		this.graphQLService = graphQLService;
		this.properties = properties;
	}

	/**
	 * Reconcile existing project items. Does nothing when the plan has no project or no
	 * list with a status.
	 * @param plan a valid plan
	 * @return counts of updated and skipped items
	 */
	public SyncResult synchronize(MigrationPlan plan) {
		ProjectInfo project = plan.project();
		Integer projectNumber = plan.mapping().project();
		if (project == null || projectNumber == null || plan.statuses().isEmpty()) {
			return SyncResult.none();
		}

		List<ProjectItem> items = fetchItems(plan.repo(), projectNumber, project.statusFieldName());
		logger.info("Found {} existing items in project {}", items.size(), project.title());

		int updated = 0;
		int skipped = 0;
		for (ProjectItem item : items) {
			Optional<StatusOption> expected = expectedStatus(plan, item);
			if (expected.isEmpty() || Objects.equals(item.currentStatus(), expected.get().name())) {
				skipped++;
				continue;
			}
			logger.info("Updating issue #{} \"{}\" from {} to {}", item.issueNumber(), item.issueTitle(),
					item.currentStatus() != null ? item.currentStatus() : "no status", expected.get().name());
			graphQLService.setItemStatus(project, item.id(), expected.get());
			updated++;
		}

		logger.info("Updated {} existing items, skipped {} items", updated, skipped);
		return new SyncResult(items.size(), updated, skipped);
	}

	private Optional<StatusOption> expectedStatus(MigrationPlan plan, ProjectItem item) {
		return plan.board()
			.cards()
			.stream()
			.filter(card -> card.name().equals(item.issueTitle()))
			.findFirst()
			.flatMap(card -> Optional.ofNullable(plan.statuses().get(card.listId())));
	}

	List<ProjectItem> fetchItems(RepositoryTarget owner, int projectNumber, String statusFieldName) {
		List<ProjectItem> items = new ArrayList<>();
		@Nullable
		String cursor = null;
		boolean hasMore = true;
		while (hasMore) {
			PageResult<ProjectItem> page = graphQLService.listProjectItems(owner, projectNumber, statusFieldName,
					properties.getProjectItemsPageSize(), cursor);
			items.addAll(page.items());
			cursor = page.nextCursor();
			hasMore = page.hasMore() && cursor != null;
		}
		return items;
	}

}
